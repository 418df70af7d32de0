package cz.vut.fit.resolverradar.analyzer.whois;

import com.google.common.util.concurrent.RateLimiter;
import cz.vut.fit.resolverradar.analyzer.storage.ResultStore;
import cz.vut.fit.resolverradar.models.WhoisInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CachedWhoisLookupTest {
    private static final WhoisInfo QUAD9 = new WhoisInfo("Quad9", "19281", "QUAD9-AS-1, CH", "CH");

    @Mock
    private LiveWhoisSource _live;
    @Mock
    private ResultStore _store;

    private CachedWhoisLookup _lookup;

    @BeforeEach
    void setUp() {
        _lookup = new CachedWhoisLookup(_live, RateLimiter.create(1000), 2);
        _lookup.startCycle();
    }

    @Test
    void cachedDataIsServedWithoutALiveLookup() throws Exception {
        when(_store.findWhois("9.9.9.9")).thenReturn(Optional.of(QUAD9));

        assertEquals(QUAD9, _lookup.lookup(_store, "9.9.9.9"));
        verifyNoInteractions(_live);
        assertEquals(0, _lookup.lookupsInCycle());
    }

    @Test
    void liveResultIsCached() throws Exception {
        when(_store.findWhois("9.9.9.9")).thenReturn(Optional.empty());
        when(_live.fetch("9.9.9.9")).thenReturn(QUAD9);

        assertEquals(QUAD9, _lookup.boundTo(_store).lookup("9.9.9.9"));
        verify(_store).saveWhois("9.9.9.9", QUAD9);
        assertEquals(1, _lookup.lookupsInCycle());
    }

    @Test
    void privateAddressIsNeverLookedUp() throws Exception {
        when(_store.findWhois("192.168.1.1")).thenReturn(Optional.empty());

        assertEquals(WhoisInfo.privateNetwork(), _lookup.lookup(_store, "192.168.1.1"));
        verifyNoInteractions(_live);
        verify(_store, never()).saveWhois(anyString(), any());
    }

    @Test
    void budgetLimitsLiveLookups() throws Exception {
        when(_store.findWhois(anyString())).thenReturn(Optional.empty());
        when(_live.fetch(anyString())).thenReturn(QUAD9);

        _lookup.lookup(_store, "9.9.9.9");
        _lookup.lookup(_store, "149.112.112.112");
        final var third = _lookup.lookup(_store, "8.8.8.8");

        assertEquals(WhoisInfo.notAvailable(), third);
        verify(_live, never()).fetch("8.8.8.8");

        _lookup.startCycle();
        assertEquals(QUAD9, _lookup.lookup(_store, "8.8.8.8"));
    }

    @Test
    void failedLookupIsNotCached() throws Exception {
        when(_store.findWhois("9.9.9.9")).thenReturn(Optional.empty());
        when(_live.fetch("9.9.9.9")).thenThrow(new IOException("HTTP 429"));

        assertEquals(WhoisInfo.lookupFailed(), _lookup.lookup(_store, "9.9.9.9"));
        verify(_store, never()).saveWhois(anyString(), any());
        assertEquals(1, _lookup.lookupsInCycle());
    }

    @Test
    void unreadableCacheFallsBackToALiveLookup() throws Exception {
        when(_store.findWhois("9.9.9.9")).thenThrow(new IOException("Connection reset"));
        when(_live.fetch("9.9.9.9")).thenReturn(QUAD9);

        assertEquals(QUAD9, _lookup.lookup(_store, "9.9.9.9"));
    }

    @Test
    void cacheWriteFailureStillReturnsTheData() throws Exception {
        when(_store.findWhois("9.9.9.9")).thenReturn(Optional.empty());
        when(_live.fetch("9.9.9.9")).thenReturn(QUAD9);
        doThrow(new IOException("Connection reset")).when(_store).saveWhois("9.9.9.9", QUAD9);

        assertEquals(QUAD9, _lookup.lookup(_store, "9.9.9.9"));
    }

    @Test
    void liveLookupIgnoresTheBudget() throws Exception {
        when(_live.fetch(anyString())).thenReturn(QUAD9);
        final var lookup = new CachedWhoisLookup(_live, RateLimiter.create(1000), 0);

        assertEquals(QUAD9, lookup.lookupLive("9.9.9.9"));
        assertEquals(0, lookup.lookupsInCycle());
    }

    @Test
    void backfillStoresTheSuccessfulLookups() throws Exception {
        when(_store.addressesWithoutWhois(10)).thenReturn(List.of("9.9.9.9", "10.0.0.1", "192.0.2.1"));
        when(_live.fetch("9.9.9.9")).thenReturn(QUAD9);
        when(_live.fetch("192.0.2.1")).thenThrow(new IOException("Not found"));

        assertEquals(2, _lookup.backfill(_store, 10));
        verify(_store).saveWhois("9.9.9.9", QUAD9);
        verify(_store).saveWhois("10.0.0.1", WhoisInfo.privateNetwork());
        verify(_store, never()).saveWhois(eq("192.0.2.1"), any());
        verify(_live, never()).fetch("10.0.0.1");
    }
}

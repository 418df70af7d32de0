package cz.vut.fit.resolverradar.analyzer.probe;

import cz.vut.fit.resolverradar.analyzer.AnalyzerSettings;
import cz.vut.fit.resolverradar.models.TestType;
import org.junit.jupiter.api.Test;
import org.xbill.DNS.Flags;
import org.xbill.DNS.Type;

import static org.junit.jupiter.api.Assertions.*;

class ProbeRequestTest {
    private final AnalyzerSettings _settings = AnalyzerSettings.defaults();

    @Test
    void probesUseTheConfiguredDomains() {
        assertEquals("google.com", ProbeRequest.recursion(_settings).queryName());
        assertEquals("google.com", ProbeRequest.latency(_settings).queryName());
        assertEquals("iifon.org", ProbeRequest.dnssec(_settings).queryName());
        assertEquals("008k.com", ProbeRequest.malicious(_settings).queryName());
        assertEquals("isc.org", ProbeRequest.cacheTtl(_settings).queryName());
        assertEquals(TestType.CACHE_TTL, ProbeRequest.cacheTtl(_settings).testType());
    }

    @Test
    void flagsDescribeTheRequest() {
        assertEquals("RD", ProbeRequest.latency(_settings).flags());
        assertEquals("RD|DO", ProbeRequest.dnssec(_settings).flags());
        assertEquals("NONE", new ProbeRequest(TestType.LATENCY, "isc.org", Type.A, false, false).flags());
    }

    @Test
    void plainQueryHasNoOptRecord() throws Exception {
        final var query = ProbeRequest.recursion(_settings).toQuery(1232);

        assertNull(query.getOPT());
        assertTrue(query.getHeader().getFlag(Flags.RD));
        assertEquals(Type.A, query.getQuestion().getType());
        assertEquals("google.com.", query.getQuestion().getName().toString());
    }

    @Test
    void queryWithoutRecursionDesired() throws Exception {
        final var query = new ProbeRequest(TestType.LATENCY, "isc.org", Type.AAAA, false, false).toQuery(1232);

        assertFalse(query.getHeader().getFlag(Flags.RD));
        assertEquals("AAAA", new ProbeRequest(TestType.LATENCY, "isc.org", Type.AAAA, false, false).queryTypeName());
    }
}

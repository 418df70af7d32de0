package cz.vut.fit.resolverradar.analyzer.whois;

import com.google.common.util.concurrent.RateLimiter;
import cz.vut.fit.resolverradar.analyzer.Addresses;
import cz.vut.fit.resolverradar.analyzer.AnalyzerSettings;
import cz.vut.fit.resolverradar.analyzer.storage.ResultStore;
import cz.vut.fit.resolverradar.models.WhoisInfo;
import org.jetbrains.annotations.NotNull;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Resolves registration data through the WHOIS cache of a {@link ResultStore}, falling back to a rate-limited
 * live lookup. The number of live lookups in one analysis cycle is capped; beyond the cap, uncached
 * addresses get the {@code N/A} placeholders.
 */
public class CachedWhoisLookup {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(CachedWhoisLookup.class);

    private final LiveWhoisSource _live;
    private final RateLimiter _rateLimiter;
    private final int _maxLookupsPerCycle;
    private int _lookupsInCycle = 0;

    public CachedWhoisLookup(@NotNull LiveWhoisSource live, @NotNull AnalyzerSettings settings) {
        this(live, RateLimiter.create(settings.whoisRate()), settings.whoisMaxLookupsPerCycle());
    }

    public CachedWhoisLookup(@NotNull LiveWhoisSource live, @NotNull RateLimiter rateLimiter, int maxLookupsPerCycle) {
        _live = live;
        _rateLimiter = rateLimiter;
        _maxLookupsPerCycle = maxLookupsPerCycle;
    }

    /**
     * Resets the live lookup budget.
     */
    public void startCycle() {
        _lookupsInCycle = 0;
    }

    public int lookupsInCycle() {
        return _lookupsInCycle;
    }

    /**
     * Returns a {@link WhoisLookup} that uses the cache of the given store.
     */
    public @NotNull WhoisLookup boundTo(@NotNull ResultStore store) {
        return address -> lookup(store, address);
    }

    /**
     * Resolves the registration data of an address. The cache is checked first; private addresses are never
     * looked up; a successful live lookup is stored in the cache.
     */
    public @NotNull WhoisInfo lookup(@NotNull ResultStore store, @NotNull String address)
            throws InterruptedException {
        try {
            final var cached = store.findWhois(address);
            if (cached.isPresent()) {
                Logger.debug("WHOIS {} served from the cache", address);
                return cached.get();
            }
        } catch (IOException e) {
            Logger.warn("Cannot read the WHOIS cache for {}: {}", address, e.getMessage());
        }

        if (Addresses.isPrivate(address))
            return WhoisInfo.privateNetwork();

        if (_lookupsInCycle >= _maxLookupsPerCycle) {
            Logger.debug("WHOIS lookup budget of {} exhausted, skipping {}", _maxLookupsPerCycle, address);
            return WhoisInfo.notAvailable();
        }

        _lookupsInCycle++;
        final var info = lookupLive(address);
        if (!info.equals(WhoisInfo.lookupFailed())) {
            try {
                store.saveWhois(address, info);
            } catch (IOException e) {
                Logger.warn("Cannot store the WHOIS data of {}: {}", address, e.getMessage());
            }
        }

        return info;
    }

    /**
     * Performs a rate-limited live lookup that bypasses the cache and the budget.
     *
     * @return The registration data, or {@link WhoisInfo#lookupFailed()} if the lookup failed.
     */
    public @NotNull WhoisInfo lookupLive(@NotNull String address) throws InterruptedException {
        _rateLimiter.acquire();
        try {
            return _live.fetch(address);
        } catch (IOException | RuntimeException e) {
            Logger.warn("WHOIS lookup of {} failed: {}", address, e.getMessage());
            return WhoisInfo.lookupFailed();
        }
    }

    /**
     * Fills the cache for analyzed addresses that have no WHOIS data yet.
     *
     * @param store The store to read the addresses from and to write the data to.
     * @param limit The maximum number of addresses to look up.
     * @return The number of addresses whose data was stored.
     * @throws IOException If the store cannot be read or written.
     */
    public int backfill(@NotNull ResultStore store, int limit) throws IOException, InterruptedException {
        final var addresses = store.addressesWithoutWhois(limit);
        Logger.info("Looking up WHOIS data for {} addresses", addresses.size());

        var stored = 0;
        for (var address : addresses) {
            final var info = Addresses.isPrivate(address) ? WhoisInfo.privateNetwork() : lookupLive(address);
            if (info.equals(WhoisInfo.lookupFailed()))
                continue;

            store.saveWhois(address, info);
            stored++;
        }

        Logger.info("Stored WHOIS data for {} of {} addresses", stored, addresses.size());
        return stored;
    }
}

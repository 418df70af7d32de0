package cz.vut.fit.resolverradar.analyzer;

import com.google.common.base.Ticker;
import cz.vut.fit.resolverradar.analyzer.discovery.ResolverDiscovery;
import cz.vut.fit.resolverradar.analyzer.discovery.ResolverListLoader;
import cz.vut.fit.resolverradar.analyzer.host.HostIdentity;
import cz.vut.fit.resolverradar.analyzer.storage.ResultStoreFactory;
import cz.vut.fit.resolverradar.analyzer.whois.CachedWhoisLookup;
import cz.vut.fit.resolverradar.models.MeasurementHost;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Runs one analysis cycle over a list of resolvers.
 * <p>
 * Each resolver is analyzed with its own freshly opened {@link cz.vut.fit.resolverradar.analyzer.storage.ResultStore}
 * that is closed afterwards. A failure while analyzing or storing one resolver is logged and counted, and the
 * cycle goes on with the next one. An interrupt ends the cycle.
 */
public class AnalysisCycle {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(AnalysisCycle.class);

    private final ResolverAnalyzer _analyzer;
    private final ResultStoreFactory _storeFactory;
    private final CachedWhoisLookup _whois;
    private final ResolverDiscovery _discovery;
    private final HostIdentity _host;
    private final AnalyzerSettings _settings;
    private final Pacer _pacer;
    private final Ticker _ticker;

    public AnalysisCycle(@NotNull ResolverAnalyzer analyzer, @NotNull ResultStoreFactory storeFactory,
                         @NotNull CachedWhoisLookup whois, @NotNull ResolverDiscovery discovery,
                         @NotNull HostIdentity host, @NotNull AnalyzerSettings settings,
                         @NotNull Pacer pacer, @NotNull Ticker ticker) {
        _analyzer = analyzer;
        _storeFactory = storeFactory;
        _whois = whois;
        _discovery = discovery;
        _host = host;
        _settings = settings;
        _pacer = pacer;
        _ticker = ticker;
    }

    /**
     * Runs the cycle.
     *
     * @param loadedResolvers The resolver addresses loaded from the resolver list.
     * @return The tally of the cycle.
     * @throws InterruptedException If interrupted; the remaining resolvers are not analyzed.
     */
    public @NotNull CycleSummary run(@NotNull List<String> loadedResolvers) throws InterruptedException {
        final var hostname = _host.hostname();
        final var publicIp = _host.publicIp().orElse(null);

        final var systemResolvers = _discovery.systemResolvers();
        final var dhcpServers = _discovery.dhcpServers();
        final var ispRelated = new TreeSet<>(systemResolvers);
        ispRelated.addAll(dhcpServers);

        _whois.startCycle();
        recordHostIdentity(hostname, publicIp);
        logWhoisStats();

        final var resolvers = ResolverListLoader.assemble(loadedResolvers, systemResolvers, dhcpServers,
                _settings.excludedAddresses());

        Logger.info("Cycle started on {} ({}): {} resolvers, {} related to the network provider",
                hostname, publicIp == null ? "public address unknown" : publicIp, resolvers.size(), ispRelated.size());
        if (!systemResolvers.isEmpty())
            Logger.info("System resolvers: {}", String.join(", ", systemResolvers));
        if (!dhcpServers.isEmpty())
            Logger.info("DHCP servers: {}", String.join(", ", dhcpServers));

        final long start = _ticker.read();
        final var total = resolvers.size();
        var successful = 0;
        var failed = 0;

        for (var i = 0; i < total; i++) {
            final var address = resolvers.get(i);
            if (analyzeOne(address, ispRelated, hostname, publicIp)) {
                successful++;
            } else {
                failed++;
            }

            final var done = i + 1;
            if (done % _settings.progressInterval() == 0 || done == total) {
                final var elapsed = Duration.ofNanos(_ticker.read() - start);
                final var eta = elapsed.multipliedBy(total - done).dividedBy(done);
                Logger.info("Progress: {}/{} | Success: {} | Failed: {} | ETA: {}s",
                        done, total, successful, failed, eta.toSeconds());
            }

            if (done < total) {
                _pacer.pause(_settings.resolverDelay());
            }
        }

        final var summary = new CycleSummary(total, successful, failed, Duration.ofNanos(_ticker.read() - start));
        Logger.info("Cycle complete: {}/{} successful, {} failed, took {} ms",
                summary.successful(), summary.total(), summary.failed(), summary.elapsed().toMillis());
        return summary;
    }

    private boolean analyzeOne(String address, Set<String> ispRelated, String hostname, @Nullable String publicIp)
            throws InterruptedException {
        final var ispAssigned = ispRelated.contains(address);
        try (var store = _storeFactory.open()) {
            final var result = _analyzer.analyze(address, ispAssigned, hostname, publicIp, _whois.boundTo(store));
            store.logQueries(result.queryLogs());
            store.saveServerResult(result);
            return true;
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            Logger.error("Error analyzing {}", address, e);
            return false;
        }
    }

    private void recordHostIdentity(String hostname, @Nullable String publicIp) throws InterruptedException {
        if (publicIp == null) {
            Logger.warn("Public address unknown, not recording the measurement host");
            return;
        }

        final var whois = _whois.lookupLive(publicIp);
        try (var store = _storeFactory.open()) {
            store.upsertMeasurementHost(new MeasurementHost(hostname, publicIp, whois));
            Logger.debug("Recorded measurement host {} ({})", hostname, publicIp);
        } catch (IOException | RuntimeException e) {
            Logger.warn("Cannot record the measurement host: {}", e.getMessage());
        }
    }

    private void logWhoisStats() {
        try (var store = _storeFactory.open()) {
            final var stats = store.whoisStats();
            Logger.info("WHOIS cache: {} addresses, {} cached, {} missing",
                    stats.totalAddresses(), stats.cachedAddresses(), stats.missingAddresses());
            if (stats.missingAddresses() > 0) {
                Logger.info("Run with --whois-batch <n> to fill in the missing WHOIS data");
            }
        } catch (IOException | RuntimeException e) {
            Logger.warn("Cannot read the WHOIS cache statistics: {}", e.getMessage());
        }
    }
}

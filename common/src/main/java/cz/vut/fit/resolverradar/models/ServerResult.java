package cz.vut.fit.resolverradar.models;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * The complete result of analyzing one resolver in one cycle.
 *
 * @param serverIp          The resolver address.
 * @param systemHostname    The host name of the measuring machine.
 * @param publicIp          The public address of the measuring machine, nullable if unknown.
 * @param timestamp         The time the analysis finished.
 * @param isRecursive       True if the resolver answered the recursion probe with RA set, a non-empty answer
 *                          and NOERROR.
 * @param raFlagSet         True if the recursion probe response had the RA flag set.
 * @param latencyMs         The round-trip time of the latency probe, nullable.
 * @param organization      The WHOIS organization (or a placeholder).
 * @param asn               The WHOIS autonomous system number (or a placeholder).
 * @param asnDescription    The WHOIS autonomous system description (or a placeholder).
 * @param country           The WHOIS country (or a placeholder).
 * @param dnssecEnabled     True if the resolver validates DNSSEC; null if it cannot be determined.
 * @param adFlagSet         True if the DNSSEC probe response had the AD flag set.
 * @param dnssecRcode       The response code of the DNSSEC probe.
 * @param maliciousBlocking True if the resolver filters the malicious test domain; null if it cannot be
 *                          determined.
 * @param maliciousRcode    The response code of the malicious-domain probe.
 * @param isIspAssigned     True if the resolver is one of this host's system resolvers or DHCP servers.
 * @param serverResponsive  True if the latency probe was answered with NOERROR.
 * @param testReliability   The health classification derived from the latency probe.
 * @param failureReason     A human-readable reason if the resolver is not reliable, nullable.
 * @param tracerouteStatus  The status of the traceroute towards the resolver, null if not run.
 * @param cacheTtl          The last TTL observed by the cache TTL probe, null if not run or not observed.
 * @param cacheTtlRcode     The last response code observed by the cache TTL probe, null if not run.
 * @param queryLogs         The exchanges made while analyzing the resolver, in order.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ServerResult(@NotNull String serverIp,
                           @NotNull String systemHostname,
                           @Nullable String publicIp,
                           @NotNull OffsetDateTime timestamp,
                           boolean isRecursive,
                           boolean raFlagSet,
                           @Nullable Double latencyMs,
                           @NotNull String organization,
                           @NotNull String asn,
                           @NotNull String asnDescription,
                           @NotNull String country,
                           @Nullable Boolean dnssecEnabled,
                           boolean adFlagSet,
                           @NotNull String dnssecRcode,
                           @Nullable Boolean maliciousBlocking,
                           @NotNull String maliciousRcode,
                           boolean isIspAssigned,
                           boolean serverResponsive,
                           @NotNull TestReliability testReliability,
                           @Nullable String failureReason,
                           @Nullable String tracerouteStatus,
                           @Nullable Long cacheTtl,
                           @Nullable String cacheTtlRcode,
                           @NotNull List<QueryLogEntry> queryLogs) {
    public ServerResult {
        queryLogs = List.copyOf(queryLogs);
    }
}

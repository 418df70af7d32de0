package cz.vut.fit.resolverradar.analyzer.checks;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The result of the cache TTL sampling of one resolver.
 *
 * @param lastTtl      The TTL of the first answer record of the last probe, null if it had none.
 * @param lastRcode    The response code of the last probe, or a sentinel.
 * @param probesSent   The number of probes sent in both phases.
 * @param fineSampling True if the second sampling phase ran.
 */
public record CacheTtlObservation(@Nullable Long lastTtl,
                                  @NotNull String lastRcode,
                                  int probesSent,
                                  boolean fineSampling) {
}

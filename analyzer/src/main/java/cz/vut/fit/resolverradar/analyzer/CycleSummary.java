package cz.vut.fit.resolverradar.analyzer;

import java.time.Duration;

/**
 * The tally of one analysis cycle.
 *
 * @param total      The number of resolvers in the cycle.
 * @param successful The number of resolvers analyzed and stored.
 * @param failed     The number of resolvers whose analysis or storage failed.
 * @param elapsed    The duration of the cycle.
 */
public record CycleSummary(int total, int successful, int failed, Duration elapsed) {
}

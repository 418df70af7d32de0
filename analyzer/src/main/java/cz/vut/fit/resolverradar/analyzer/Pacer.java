package cz.vut.fit.resolverradar.analyzer;

import org.jetbrains.annotations.NotNull;

import java.time.Duration;

/**
 * Blocks the analysis thread for a given time. Used for all the fixed pauses of the analysis
 * (between cache TTL probes, between resolvers and between cycles).
 */
@FunctionalInterface
public interface Pacer {
    /**
     * A pacer backed by {@link Thread#sleep(long)}.
     */
    Pacer SLEEP = duration -> {
        if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis());
        }
    };

    /**
     * Blocks for the given time.
     *
     * @param duration The time to block for. Zero or negative durations return immediately.
     * @throws InterruptedException If the thread is interrupted while waiting.
     */
    void pause(@NotNull Duration duration) throws InterruptedException;
}

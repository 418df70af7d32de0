package cz.vut.fit.resolverradar.analyzer.checks;

import org.jetbrains.annotations.NotNull;

/**
 * The result of one traceroute run.
 *
 * @param success   True if the utility exited with status zero.
 * @param status    {@code OK}, {@code EXIT_n}, {@code NO_TRACEROUTE}, {@code TIMEOUT} or {@code ERROR}.
 * @param output    The standard output of the utility, or its error output if the former is empty,
 *                  or a description of the failure.
 * @param elapsedMs The run time in milliseconds.
 */
public record TracerouteResult(boolean success, @NotNull String status, @NotNull String output, double elapsedMs) {
    public static final String STATUS_OK = "OK";
    public static final String STATUS_EXIT_PREFIX = "EXIT_";
    public static final String STATUS_NOT_FOUND = "NO_TRACEROUTE";
    public static final String STATUS_TIMEOUT = "TIMEOUT";
    public static final String STATUS_ERROR = "ERROR";
}

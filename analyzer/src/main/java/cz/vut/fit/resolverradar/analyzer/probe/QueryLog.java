package cz.vut.fit.resolverradar.analyzer.probe;

import cz.vut.fit.resolverradar.models.QueryLogEntry;
import cz.vut.fit.resolverradar.models.ResponseCodes;
import cz.vut.fit.resolverradar.models.TestType;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * The ordered, append-only record of the exchanges made with one resolver during one analysis.
 */
public class QueryLog {
    public static final String TRACE_QUERY_TYPE = "TRACE";
    public static final String TRACE_FLAGS = "TRACEROUTE";

    private final String _serverIp;
    private final String _systemHostname;
    private final Clock _clock;
    private final List<QueryLogEntry> _entries = new ArrayList<>();

    public QueryLog(@NotNull String serverIp, @NotNull String systemHostname, @NotNull Clock clock) {
        _serverIp = serverIp;
        _systemHostname = systemHostname;
        _clock = clock;
    }

    /**
     * Appends the entry describing a probe exchange.
     *
     * @param request The probe that was sent.
     * @param outcome The outcome of the exchange.
     * @return The appended entry.
     */
    public @NotNull QueryLogEntry record(@NotNull ProbeRequest request, @NotNull ProbeOutcome outcome) {
        final QueryLogEntry entry;
        if (outcome instanceof ProbeOutcome.Answered answered) {
            final var response = answered.response();
            entry = entry(request.queryTypeName(), request.queryName(), request.testType(), request.flags(),
                    answered.rcode(), DnsMessages.flags(response), DnsMessages.answerText(response),
                    DnsMessages.firstAnswerTtl(response), answered.rttMs());
        } else if (outcome instanceof ProbeOutcome.TimedOut timedOut) {
            entry = entry(request.queryTypeName(), request.queryName(), request.testType(), request.flags(),
                    ResponseCodes.TIMEOUT, ResponseCodes.NOT_AVAILABLE, null, null, timedOut.waitedMs());
        } else {
            entry = entry(request.queryTypeName(), request.queryName(), request.testType(), request.flags(),
                    ResponseCodes.ERROR, ResponseCodes.NOT_AVAILABLE, null, null, null);
        }

        _entries.add(entry);
        return entry;
    }

    /**
     * Appends the entry describing a traceroute run towards the resolver.
     *
     * @param status    The traceroute status, e.g. {@code OK} or {@code EXIT_1}.
     * @param output    The output of the utility.
     * @param elapsedMs The run time in milliseconds.
     * @return The appended entry.
     */
    public @NotNull QueryLogEntry recordTraceroute(@NotNull String status, @NotNull String output, double elapsedMs) {
        final var entry = entry(TRACE_QUERY_TYPE, _serverIp, TestType.TRACEROUTE, TRACE_FLAGS,
                status, "", output, null, elapsedMs);
        _entries.add(entry);
        return entry;
    }

    /**
     * Returns an immutable snapshot of the entries recorded so far, in order.
     */
    public @NotNull List<QueryLogEntry> entries() {
        return List.copyOf(_entries);
    }

    public @NotNull String serverIp() {
        return _serverIp;
    }

    private QueryLogEntry entry(String queryType, String queryName, TestType testType, String flags,
                                String rcode, String responseFlags, @Nullable String answer,
                                @Nullable Long ttl, @Nullable Double rttMs) {
        return new QueryLogEntry(_serverIp, _systemHostname, queryType, queryName, testType, flags, rcode,
                responseFlags, answer, ttl, rttMs == null ? null : round(rttMs), OffsetDateTime.now(_clock));
    }

    private static double round(double millis) {
        return Math.round(millis * 1000.0) / 1000.0;
    }
}

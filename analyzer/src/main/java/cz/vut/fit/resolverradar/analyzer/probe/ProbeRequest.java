package cz.vut.fit.resolverradar.analyzer.probe;

import cz.vut.fit.resolverradar.analyzer.AnalyzerSettings;
import cz.vut.fit.resolverradar.models.TestType;
import org.jetbrains.annotations.NotNull;
import org.xbill.DNS.*;
import org.xbill.DNS.Record;

import java.util.ArrayList;

/**
 * Describes a single probe query.
 *
 * @param testType         The test the query belongs to.
 * @param queryName        The name to query.
 * @param queryType        The record type to query (a {@link Type} constant).
 * @param recursionDesired Whether to set the RD flag.
 * @param dnssecOk         Whether to add an EDNS0 OPT record with the DO flag.
 */
public record ProbeRequest(@NotNull TestType testType,
                           @NotNull String queryName,
                           int queryType,
                           boolean recursionDesired,
                           boolean dnssecOk) {

    public static ProbeRequest recursion(@NotNull AnalyzerSettings settings) {
        return new ProbeRequest(TestType.RECURSION, settings.recursionDomain(), Type.A, true, false);
    }

    public static ProbeRequest latency(@NotNull AnalyzerSettings settings) {
        return new ProbeRequest(TestType.LATENCY, settings.latencyDomain(), Type.A, true, false);
    }

    public static ProbeRequest dnssec(@NotNull AnalyzerSettings settings) {
        return new ProbeRequest(TestType.DNSSEC, settings.dnssecDomain(), Type.A, true, true);
    }

    public static ProbeRequest malicious(@NotNull AnalyzerSettings settings) {
        return new ProbeRequest(TestType.MALICIOUS, settings.maliciousDomain(), Type.A, true, false);
    }

    public static ProbeRequest cacheTtl(@NotNull AnalyzerSettings settings) {
        return new ProbeRequest(TestType.CACHE_TTL, settings.cacheTtlDomain(), Type.A, true, false);
    }

    /**
     * Builds the wire query.
     *
     * @param udpPayloadSize The UDP payload size to advertise if {@link #dnssecOk()} is set.
     * @return A new query message with a random ID.
     * @throws TextParseException If the query name is not a valid domain name.
     */
    public @NotNull Message toQuery(int udpPayloadSize) throws TextParseException {
        final var name = Name.fromString(queryName, Name.root);
        final var query = new Message();
        query.getHeader().setOpcode(Opcode.QUERY);
        if (recursionDesired) {
            query.getHeader().setFlag(Flags.RD);
        }

        query.addRecord(Record.newRecord(name, queryType, DClass.IN), Section.QUESTION);
        if (dnssecOk) {
            query.addRecord(new OPTRecord(udpPayloadSize, 0, 0, ExtendedFlags.DO), Section.ADDITIONAL);
        }

        return query;
    }

    /**
     * Returns the mnemonic of the queried record type, e.g. {@code A}.
     */
    public @NotNull String queryTypeName() {
        return Type.string(queryType);
    }

    /**
     * Returns the request flags in the form stored in the query log, e.g. {@code RD|DO}.
     */
    public @NotNull String flags() {
        final var flags = new ArrayList<String>(2);
        if (recursionDesired)
            flags.add("RD");
        if (dnssecOk)
            flags.add("DO");

        return flags.isEmpty() ? "NONE" : String.join("|", flags);
    }
}

package cz.vut.fit.resolverradar.models;

import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.NotNull;

/**
 * The logical test a logged exchange belongs to.
 */
public enum TestType {
    RECURSION("recursion"),
    LATENCY("latency"),
    DNSSEC("dnssec"),
    MALICIOUS("malicious"),
    CACHE_TTL("cache_ttl"),
    TRACEROUTE("traceroute");

    private final String _tag;

    TestType(String tag) {
        _tag = tag;
    }

    /**
     * Returns the tag under which the entries of this test are stored.
     *
     * @return The lower-case tag, e.g. {@code cache_ttl}.
     */
    @JsonValue
    public @NotNull String tag() {
        return _tag;
    }

    @Override
    public String toString() {
        return _tag;
    }
}

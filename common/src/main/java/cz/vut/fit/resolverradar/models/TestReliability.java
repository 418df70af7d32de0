package cz.vut.fit.resolverradar.models;

/**
 * The health classification of a resolver in one cycle. Anything other than {@link #RELIABLE} means
 * that the results of the DNSSEC and malicious-domain probes cannot be interpreted.
 */
public enum TestReliability {
    RELIABLE,
    UNRELIABLE_TIMEOUT,
    UNRELIABLE_REFUSED,
    UNRELIABLE_SERVER_DOWN
}

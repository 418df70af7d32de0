package cz.vut.fit.resolverradar.analyzer.storage;

/**
 * The coverage of the WHOIS cache.
 *
 * @param totalAddresses  The number of distinct analyzed resolver addresses.
 * @param cachedAddresses The number of those that have cached WHOIS data.
 * @param missingAddresses The number of those that do not.
 */
public record WhoisStats(long totalAddresses, long cachedAddresses, long missingAddresses) {
    public static WhoisStats empty() {
        return new WhoisStats(0, 0, 0);
    }
}

package cz.vut.fit.resolverradar.models;

/**
 * Sentinel values stored in place of a DNS response code or other missing values.
 */
public final class ResponseCodes {
    private ResponseCodes() {
    }

    /**
     * No response arrived within the probe timeout.
     */
    public static final String TIMEOUT = "TIMEOUT";

    /**
     * The exchange failed without producing a parsed response.
     */
    public static final String ERROR = "ERROR";

    /**
     * The value is not available.
     */
    public static final String NOT_AVAILABLE = "N/A";
}

package cz.vut.fit.resolverradar.models;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * The registration data of an IP address.
 *
 * @param organization   The name of the organization holding the network.
 * @param asn            The autonomous system number, as a string.
 * @param asnDescription The description of the autonomous system.
 * @param country        The country code of the autonomous system.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WhoisInfo(@NotNull String organization,
                        @NotNull String asn,
                        @NotNull String asnDescription,
                        @NotNull String country) {
    public static final String PRIVATE_NETWORK = "Private Network";
    public static final String LOOKUP_FAILED = "Lookup Failed";

    public WhoisInfo {
        organization = Objects.requireNonNullElse(organization, ResponseCodes.NOT_AVAILABLE);
        asn = Objects.requireNonNullElse(asn, ResponseCodes.NOT_AVAILABLE);
        asnDescription = Objects.requireNonNullElse(asnDescription, ResponseCodes.NOT_AVAILABLE);
        country = Objects.requireNonNullElse(country, ResponseCodes.NOT_AVAILABLE);
    }

    public static WhoisInfo notAvailable() {
        return new WhoisInfo(ResponseCodes.NOT_AVAILABLE, ResponseCodes.NOT_AVAILABLE,
                ResponseCodes.NOT_AVAILABLE, ResponseCodes.NOT_AVAILABLE);
    }

    public static WhoisInfo privateNetwork() {
        return new WhoisInfo(PRIVATE_NETWORK, ResponseCodes.NOT_AVAILABLE,
                ResponseCodes.NOT_AVAILABLE, ResponseCodes.NOT_AVAILABLE);
    }

    public static WhoisInfo lookupFailed() {
        return new WhoisInfo(LOOKUP_FAILED, ResponseCodes.NOT_AVAILABLE,
                ResponseCodes.NOT_AVAILABLE, ResponseCodes.NOT_AVAILABLE);
    }
}

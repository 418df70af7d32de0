package cz.vut.fit.resolverradar.models;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.jetbrains.annotations.NotNull;

/**
 * The identity of the host the measurements are taken from.
 *
 * @param systemHostname The host name of the measuring machine.
 * @param publicIp       The public address the measuring machine is seen under.
 * @param whois          The registration data of the public address.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MeasurementHost(@NotNull String systemHostname,
                              @NotNull String publicIp,
                              @JsonUnwrapped @NotNull WhoisInfo whois) {
}

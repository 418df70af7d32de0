package cz.vut.fit.resolverradar.models;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.OffsetDateTime;

/**
 * A record of a single exchange with a resolver (or of a single traceroute run towards it).
 *
 * @param serverIp       The resolver address.
 * @param systemHostname The host name of the measuring machine.
 * @param queryType      The query record type mnemonic ({@code A}), or {@code TRACE} for traceroute entries.
 * @param queryName      The queried name, or the traced address.
 * @param testType       The test the exchange belongs to.
 * @param queryFlags     The request flags, e.g. {@code RD|DO}.
 * @param responseRcode  The response code mnemonic, or one of the {@link ResponseCodes} sentinels.
 *                       For traceroute entries, the traceroute status.
 * @param responseFlags  The response header flags, e.g. {@code 0x8180 (RD|RA)}; {@code N/A} without a response.
 * @param responseAnswer The answer section in presentation format, one record per line, nullable.
 * @param responseTtl    The TTL of the first answer record, nullable.
 * @param responseTimeMs The round-trip time in milliseconds, nullable.
 * @param timestamp      The time the entry was created.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QueryLogEntry(@NotNull String serverIp,
                            @NotNull String systemHostname,
                            @NotNull String queryType,
                            @NotNull String queryName,
                            @NotNull TestType testType,
                            @NotNull String queryFlags,
                            @NotNull String responseRcode,
                            @NotNull String responseFlags,
                            @Nullable String responseAnswer,
                            @Nullable Long responseTtl,
                            @Nullable Double responseTimeMs,
                            @NotNull OffsetDateTime timestamp) {
}

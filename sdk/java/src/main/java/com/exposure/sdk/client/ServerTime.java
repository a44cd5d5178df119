package com.exposure.sdk.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Server clock as reported by the time endpoint.
 *
 * @param epochMillis server time in epoch millis
 * @param iso8601     the same instant as an ISO-8601 string, may be {@code null}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ServerTime(@JsonProperty("epochMillis") Long epochMillis,
                         @JsonProperty("iso8601") String iso8601) {
}

package com.exposure.sdk.entitlement;

import com.exposure.sdk.client.ExposureException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Lenient decoder for entitlement responses.
 *
 * <p>Absent or mistyped fields decode to {@code null}. Decoding only fails when the top level
 * value is not a JSON object.
 */
public final class EntitlementDecoder {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private EntitlementDecoder() {
    }

    public static PlaybackEntitlement decode(String json) {
        if (json == null) {
            return decode((JsonNode) null);
        }
        try {
            return decode(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new ExposureException(ExposureException.Kind.PARSE_FAILURE, "Entitlement is not valid JSON", e);
        }
    }

    public static PlaybackEntitlement decode(byte[] json) {
        if (json == null) {
            return decode((JsonNode) null);
        }
        try {
            return decode(MAPPER.readTree(json));
        } catch (IOException e) {
            throw new ExposureException(ExposureException.Kind.PARSE_FAILURE, "Entitlement is not valid JSON", e);
        }
    }

    public static PlaybackEntitlement decode(JsonNode json) {
        if (json == null || !json.isObject()) {
            String found = json == null ? "nothing" : json.getNodeType().toString();
            throw new ExposureException(ExposureException.Kind.PARSE_FAILURE,
                    "Entitlement must be a JSON object, found " + found);
        }
        return new PlaybackEntitlement(
                JsonFields.text(json, "playToken"),
                EdrmConfiguration.fromJson(json.get("edrmConfig")),
                FairplayConfiguration.fromJson(json.get("fairplayConfig")),
                JsonFields.text(json, "mediaLocator"),
                JsonFields.text(json, "licenseExpiration"),
                ExpirationReason.fromString(JsonFields.text(json, "licenseExpirationReason")),
                JsonFields.text(json, "licenseActivation"),
                JsonFields.text(json, "playTokenExpiration"),
                EntitlementType.fromString(JsonFields.text(json, "entitlementType")),
                JsonFields.bool(json, "live"),
                JsonFields.text(json, "playSessionId"),
                JsonFields.bool(json, "ffEnabled"),
                JsonFields.bool(json, "timeshiftEnabled"),
                JsonFields.bool(json, "rwEnabled"),
                JsonFields.integer(json, "minBitrate"),
                JsonFields.integer(json, "maxBitrate"),
                JsonFields.integer(json, "maxResHeight"),
                JsonFields.bool(json, "airplayBlocked"),
                JsonFields.text(json, "mdnRequestRouterUrl")
        );
    }
}

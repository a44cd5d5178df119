package com.exposure.sdk.entitlement;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Fairplay specific part of an entitlement.
 *
 * @param secondaryMediaLocator optional alternative media locator
 * @param certificateUrl        where the application certificate is fetched
 * @param licenseAcquisitionUrl where the server playback context is exchanged for a key
 */
public record FairplayConfiguration(String secondaryMediaLocator,
                                    String certificateUrl,
                                    String licenseAcquisitionUrl) {

    /**
     * @return {@code null} unless {@code node} is an object carrying both URLs
     */
    public static FairplayConfiguration fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        String certificateUrl = JsonFields.text(node, "certificateUrl");
        String licenseAcquisitionUrl = JsonFields.text(node, "licenseAcquisitionUrl");
        if (certificateUrl == null || licenseAcquisitionUrl == null) {
            return null;
        }
        return new FairplayConfiguration(
                JsonFields.text(node, "secondaryMediaLocator"),
                certificateUrl,
                licenseAcquisitionUrl
        );
    }
}

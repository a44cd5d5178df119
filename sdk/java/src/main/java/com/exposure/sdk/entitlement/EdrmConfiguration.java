package com.exposure.sdk.entitlement;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * EDRM specific part of an entitlement. {@code adParameter} is optional.
 */
public record EdrmConfiguration(String ownerId,
                                String userToken,
                                String requestUrl,
                                String adParameter) {

    public static EdrmConfiguration fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        String ownerId = JsonFields.text(node, "ownerId");
        String userToken = JsonFields.text(node, "userToken");
        String requestUrl = JsonFields.text(node, "requestUrl");
        if (ownerId == null || userToken == null || requestUrl == null) {
            return null;
        }
        return new EdrmConfiguration(ownerId, userToken, requestUrl, JsonFields.text(node, "adParameter"));
    }
}

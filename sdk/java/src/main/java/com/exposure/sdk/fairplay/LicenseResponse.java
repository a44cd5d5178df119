package com.exposure.sdk.fairplay;

/**
 * Status and raw body of a license server response.
 */
public record LicenseResponse(int statusCode, byte[] body) {
    public LicenseResponse {
        body = body == null ? new byte[0] : body;
    }

    public boolean isSuccessful() {
        return statusCode / 100 == 2;
    }
}

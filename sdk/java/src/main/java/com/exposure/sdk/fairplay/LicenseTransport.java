package com.exposure.sdk.fairplay;

import java.net.URI;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous HTTP used by the license handshake. Transport level failures complete the returned
 * future exceptionally; any HTTP status completes it normally.
 */
public interface LicenseTransport {
    CompletableFuture<LicenseResponse> get(URI uri);

    CompletableFuture<LicenseResponse> post(URI uri, Map<String, String> headers, byte[] body);
}

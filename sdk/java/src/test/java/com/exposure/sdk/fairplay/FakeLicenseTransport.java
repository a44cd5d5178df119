package com.exposure.sdk.fairplay;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

final class FakeLicenseTransport implements LicenseTransport {
    final List<URI> gets = new CopyOnWriteArrayList<>();
    final List<URI> posts = new CopyOnWriteArrayList<>();
    volatile Map<String, String> postHeaders;
    volatile byte[] postBody;
    volatile CompletableFuture<LicenseResponse> certificateResponse;
    volatile CompletableFuture<LicenseResponse> keyResponse;

    FakeLicenseTransport() {
        respondToCertificate(200, FairplayEnvelopeTest.CERTIFICATE_RESPONSE);
        respondToKeyRequest(200, FairplayEnvelopeTest.CONTENT_KEY_RESPONSE);
    }

    FakeLicenseTransport respondToCertificate(int status, String body) {
        certificateResponse = CompletableFuture.completedFuture(
                new LicenseResponse(status, body.getBytes(StandardCharsets.UTF_8)));
        return this;
    }

    FakeLicenseTransport respondToKeyRequest(int status, String body) {
        keyResponse = CompletableFuture.completedFuture(
                new LicenseResponse(status, body.getBytes(StandardCharsets.UTF_8)));
        return this;
    }

    int calls() {
        return gets.size() + posts.size();
    }

    @Override
    public CompletableFuture<LicenseResponse> get(URI uri) {
        gets.add(uri);
        return certificateResponse;
    }

    @Override
    public CompletableFuture<LicenseResponse> post(URI uri, Map<String, String> headers, byte[] body) {
        posts.add(uri);
        postHeaders = headers;
        postBody = body;
        return keyResponse;
    }
}

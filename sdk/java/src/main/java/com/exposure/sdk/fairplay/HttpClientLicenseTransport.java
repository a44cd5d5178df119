package com.exposure.sdk.fairplay;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * {@link LicenseTransport} backed by the JDK {@link HttpClient}. Timeouts and connection handling
 * are the client's defaults.
 */
public final class HttpClientLicenseTransport implements LicenseTransport {
    private final HttpClient httpClient;

    public HttpClientLicenseTransport() {
        this(HttpClient.newHttpClient());
    }

    public HttpClientLicenseTransport(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    @Override
    public CompletableFuture<LicenseResponse> get(URI uri) {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .GET()
                .build();
        return send(request);
    }

    @Override
    public CompletableFuture<LicenseResponse> post(URI uri, Map<String, String> headers, byte[] body) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .POST(HttpRequest.BodyPublishers.ofByteArray(body));
        headers.forEach(builder::header);
        return send(builder.build());
    }

    private CompletableFuture<LicenseResponse> send(HttpRequest request) {
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
                .thenApply(response -> new LicenseResponse(response.statusCode(), response.body()));
    }
}

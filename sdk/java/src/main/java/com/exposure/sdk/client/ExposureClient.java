package com.exposure.sdk.client;

import com.exposure.sdk.analytics.AnalyticsBatch;
import com.exposure.sdk.entitlement.EntitlementDecoder;
import com.exposure.sdk.entitlement.PlaybackEntitlement;
import com.exposure.sdk.fairplay.FairplayRequester;
import com.exposure.sdk.fairplay.HttpClientLicenseTransport;
import com.exposure.sdk.fairplay.LicenseTransport;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * High-level facade over the Exposure REST API: entitlements, analytics dispatch and the Fairplay
 * requester used by the player.
 */
public final class ExposureClient {
    private static final Logger LOGGER = Logger.getLogger(ExposureClient.class.getName());
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final ExposureClientConfig config;
    private final HttpClient httpClient;
    private final LicenseTransport licenseTransport;
    private final Clock clock;

    public ExposureClient(ExposureClientConfig config) {
        this(config, HttpClient.newHttpClient());
    }

    public ExposureClient(ExposureClientConfig config, HttpClient httpClient) {
        this(config, httpClient, Clock.systemUTC());
    }

    ExposureClient(ExposureClientConfig config, HttpClient httpClient, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.licenseTransport = new HttpClientLicenseTransport(httpClient);
    }

    public ExposureClientConfig getConfig() {
        return config;
    }

    /**
     * Requests a playback entitlement for {@code assetId}.
     */
    public CompletableFuture<PlaybackEntitlement> fetchEntitlement(String assetId) {
        URI uri = URI.create(config.getApiUrl() + "/entitlement/" + encodePath(assetId) + "/play");
        HttpRequest request = HttpRequest.newBuilder(uri)
                .header("Accept", "application/json")
                .header("Authorization", config.getSessionToken().authorizationHeader())
                .GET()
                .build();
        return send(request, EntitlementDecoder::decode);
    }

    /**
     * Posts an analytics batch to the event sink. No response body is expected.
     */
    public CompletableFuture<Void> sendAnalytics(AnalyticsBatch batch) {
        URI uri = URI.create(config.getApiUrl() + "/eventsink/send");
        HttpRequest request = HttpRequest.newBuilder(uri)
                .header("Content-Type", "application/json")
                .header("Authorization", config.getSessionToken().authorizationHeader())
                .POST(HttpRequest.BodyPublishers.ofByteArray(batch.toJson()))
                .build();
        LOGGER.fine(() -> "Dispatching " + batch.getPayload().size() + " analytics events");
        return send(request, body -> null);
    }

    /**
     * Fetches the server clock from {@code {apiUrl}/time}.
     */
    public CompletableFuture<ServerTime> fetchServerTime() {
        HttpRequest request = HttpRequest.newBuilder(URI.create(config.getApiUrl() + "/time"))
                .header("Accept", "application/json")
                .GET()
                .build();
        return send(request, ExposureClient::decodeServerTime);
    }

    /**
     * Estimates the offset between the device clock and the server clock, in millis, for use as
     * {@link AnalyticsBatch#getClockOffset()}. Positive when the device is ahead of the server.
     * The device time is taken halfway through the round trip.
     */
    public CompletableFuture<Long> synchronizeClock() {
        long sentAt = clock.millis();
        return fetchServerTime().thenApply(serverTime -> {
            long receivedAt = clock.millis();
            long deviceTime = sentAt + (receivedAt - sentAt) / 2;
            long offset = deviceTime - serverTime.epochMillis();
            LOGGER.fine(() -> "Clock offset to server is " + offset + " ms");
            return offset;
        });
    }

    /**
     * Requester that services Fairplay key requests for media played under {@code entitlement}.
     */
    public FairplayRequester fairplayRequester(PlaybackEntitlement entitlement) {
        return new FairplayRequester(entitlement, licenseTransport,
                config.getFairplayScheme(), config.getPlayTokenHeader());
    }

    private <T> CompletableFuture<T> send(HttpRequest request, Function<byte[], T> decoder) {
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
                .handle((response, error) -> {
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause() : error;
                        throw new ExposureException(ExposureException.Kind.NETWORK_FAILURE,
                                "Request to " + request.uri().getPath() + " failed", cause);
                    }
                    if (response.statusCode() / 100 != 2) {
                        throw statusError(response);
                    }
                    return decoder.apply(response.body());
                });
    }

    static ExposureException statusError(HttpResponse<byte[]> response) {
        ResponseMessage message = null;
        byte[] body = response.body();
        if (body != null && body.length > 0) {
            try {
                message = OBJECT_MAPPER.readValue(body, ResponseMessage.class);
            } catch (IOException e) {
                LOGGER.fine(() -> "Error body is not an Exposure response message: " + e.getMessage());
            }
        }
        if (message != null && message.message != null) {
            int code = message.httpCode != null ? message.httpCode : response.statusCode();
            return ExposureException.serverError(code, message.message);
        }
        return new ExposureException(ExposureException.Kind.NETWORK_FAILURE, response.statusCode(),
                "Unacceptable status code " + response.statusCode(), null);
    }

    private static ServerTime decodeServerTime(byte[] body) {
        ServerTime serverTime;
        try {
            serverTime = OBJECT_MAPPER.readValue(body, ServerTime.class);
        } catch (IOException e) {
            throw new ExposureException(ExposureException.Kind.PARSE_FAILURE, "Server time is not valid JSON", e);
        }
        if (serverTime == null || serverTime.epochMillis() == null) {
            throw new ExposureException(ExposureException.Kind.PARSE_FAILURE, "Server time without epochMillis");
        }
        return serverTime;
    }

    private static String encodePath(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static final class ResponseMessage {
        @JsonProperty("httpCode")
        private Integer httpCode;

        @JsonProperty("message")
        private String message;
    }
}

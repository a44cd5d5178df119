package com.exposure.sdk.client;

import com.exposure.sdk.analytics.AnalyticsBatch;
import com.exposure.sdk.analytics.PersistedAnalyticsPayload;
import com.exposure.sdk.entitlement.PlaybackEntitlement;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.fail;

class ExposureClientTest {
    private static final String API_PATH = "/v1/customer/cust/businessunit/bu";

    private HttpServer server;
    private ExposureClient client;
    private final AtomicReference<String> requestPath = new AtomicReference<>();
    private final AtomicReference<String> authorization = new AtomicReference<>();
    private final AtomicReference<byte[]> requestBody = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String responseBody = "{}";

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
        client = new ExposureClient(ExposureClientConfig.builder()
                .baseUri(URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/"))
                .customer("cust")
                .businessUnit("bu")
                .sessionToken(new SessionToken("crm|account|user"))
                .build());
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void fetchesEntitlement() throws Exception {
        responseBody = "{\"playToken\":\"token\",\"mediaLocator\":\"https://cdn.example.com/master.m3u8\","
                + "\"entitlementType\":\"SVOD\",\"fairplayConfig\":{\"certificateUrl\":\"c\",\"licenseAcquisitionUrl\":\"l\"}}";

        PlaybackEntitlement entitlement = client.fetchEntitlement("asset-1").get(5, TimeUnit.SECONDS);

        assertThat(requestPath.get()).isEqualTo(API_PATH + "/entitlement/asset-1/play");
        assertThat(authorization.get()).isEqualTo("Bearer crm|account|user");
        assertThat(entitlement.playToken()).isEqualTo("token");
        assertThat(entitlement.fairplay().certificateUrl()).isEqualTo("c");
    }

    @Test
    void structuredErrorIsServerError() throws Exception {
        status = 401;
        responseBody = "{\"httpCode\":401,\"message\":\"INVALID_SESSION_TOKEN\"}";

        ExposureException error = failure(client.fetchEntitlement("asset-1"));

        assertThat(error.getKind()).isEqualTo(ExposureException.Kind.SERVER_ERROR);
        assertThat(error.getCode()).isEqualTo(401);
        assertThat(error.getMessage()).isEqualTo("INVALID_SESSION_TOKEN");
    }

    @Test
    void unstructuredErrorIsNetworkFailure() throws Exception {
        status = 500;
        responseBody = "Internal Server Error";

        ExposureException error = failure(client.fetchEntitlement("asset-1"));

        assertThat(error.getKind()).isEqualTo(ExposureException.Kind.NETWORK_FAILURE);
        assertThat(error.getCode()).isEqualTo(500);
    }

    @Test
    void nonObjectEntitlementIsParseFailure() throws Exception {
        responseBody = "[]";

        ExposureException error = failure(client.fetchEntitlement("asset-1"));

        assertThat(error.getKind()).isEqualTo(ExposureException.Kind.PARSE_FAILURE);
    }

    @Test
    void unreachableServerIsNetworkFailure() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        ExposureClient unreachable = new ExposureClient(ExposureClientConfig.builder()
                .baseUri(URI.create("http://127.0.0.1:" + closedPort))
                .customer("cust")
                .businessUnit("bu")
                .sessionToken(new SessionToken("crm|account|user"))
                .build());

        ExposureException error = failure(unreachable.fetchEntitlement("asset-1"));

        assertThat(error.getKind()).isEqualTo(ExposureException.Kind.NETWORK_FAILURE);
        assertThat(error.getCause()).isInstanceOf(IOException.class);
    }

    @Test
    void sendsAnalyticsBatch() throws Exception {
        status = 200;
        responseBody = "";
        AnalyticsBatch batch = new AnalyticsBatch("cust", "bu", "session", 2000L, null, List.of(
                new PersistedAnalyticsPayload(Map.of("EventType", "Playback.Started", "timestamp", 1500L)),
                new PersistedAnalyticsPayload(Map.of("EventType", "Playback.Created", "timestamp", 1000L))));

        client.sendAnalytics(batch).get(5, TimeUnit.SECONDS);

        assertThat(requestPath.get()).isEqualTo(API_PATH + "/eventsink/send");
        JsonNode sent = new ObjectMapper().readTree(requestBody.get());
        assertThat(sent.get("playToken").asText()).isEqualTo("session");
        assertThat(sent.has("clockOffset")).isFalse();
        assertThat(sent.get("payload").get(0).get("EventType").asText()).isEqualTo("Playback.Created");
    }

    @Test
    void synchronizesClockWithServer() throws Exception {
        responseBody = "{\"epochMillis\":40000,\"iso8601\":\"1970-01-01T00:00:40Z\"}";
        ExposureClient fixedClock = new ExposureClient(client.getConfig(), HttpClient.newHttpClient(),
                Clock.fixed(Instant.ofEpochMilli(100_000L), ZoneOffset.UTC));

        long offset = fixedClock.synchronizeClock().get(5, TimeUnit.SECONDS);

        assertThat(requestPath.get()).isEqualTo(API_PATH + "/time");
        assertThat(offset).isEqualTo(60_000L);
    }

    @Test
    void clockSyncForwardsServerError() throws Exception {
        status = 503;
        responseBody = "{\"httpCode\":503,\"message\":\"SERVICE_UNAVAILABLE\"}";

        ExposureException error = failure(client.synchronizeClock());

        assertThat(error.getKind()).isEqualTo(ExposureException.Kind.SERVER_ERROR);
        assertThat(error.getCode()).isEqualTo(503);
    }

    @Test
    void serverTimeWithoutEpochMillisIsParseFailure() throws Exception {
        responseBody = "{\"iso8601\":\"2017-12-01T12:40:40Z\"}";

        ExposureException error = failure(client.fetchServerTime());

        assertThat(error.getKind()).isEqualTo(ExposureException.Kind.PARSE_FAILURE);
    }

    @Test
    void requiresConfiguration() {
        assertThatThrownBy(() -> new ExposureClient(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("config");
    }

    @Test
    void fairplayRequesterUsesClientConfiguration() throws Exception {
        responseBody = "{\"playToken\":\"token\"}";
        PlaybackEntitlement entitlement = client.fetchEntitlement("asset-1").get(5, TimeUnit.SECONDS);

        assertThat(client.fairplayRequester(entitlement).getEntitlement()).isSameAs(entitlement);
    }

    private void handle(HttpExchange exchange) throws IOException {
        requestPath.set(exchange.getRequestURI().getPath());
        authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
        requestBody.set(exchange.getRequestBody().readAllBytes());
        byte[] body = responseBody.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, body.length == 0 ? -1 : body.length);
        if (body.length > 0) {
            exchange.getResponseBody().write(body);
        }
        exchange.close();
    }

    private static ExposureException failure(CompletableFuture<?> future) throws Exception {
        try {
            future.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            assertThat(e.getCause()).isInstanceOf(ExposureException.class);
            return (ExposureException) e.getCause();
        }
        return fail("Request completed without an error");
    }
}

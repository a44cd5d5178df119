package com.exposure.sdk.fairplay;

import com.exposure.sdk.client.ExposureClient;
import com.exposure.sdk.client.ExposureClientConfig;
import com.exposure.sdk.client.SessionToken;
import com.exposure.sdk.entitlement.PlaybackEntitlement;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class FairplayEndToEndTest {
    private HttpServer server;
    private String baseUrl;
    private final AtomicReference<String> playToken = new AtomicReference<>();
    private final AtomicReference<byte[]> spc = new AtomicReference<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
        server.createContext("/v1/customer/cust/businessunit/bu/entitlement/", exchange -> respond(exchange, 200,
                "{\"playToken\":\"play-token\",\"mediaLocator\":\"" + baseUrl + "/master.m3u8\","
                        + "\"fairplayConfig\":{\"certificateUrl\":\"" + baseUrl + "/fps/certificate\","
                        + "\"licenseAcquisitionUrl\":\"" + baseUrl + "/fps/license\"}}"));
        server.createContext("/fps/certificate", exchange ->
                respond(exchange, 200, FairplayEnvelopeTest.CERTIFICATE_RESPONSE));
        server.createContext("/fps/license", exchange -> {
            playToken.set(exchange.getRequestHeaders().getFirst("AzukiApp"));
            spc.set(exchange.getRequestBody().readAllBytes());
            respond(exchange, 200, FairplayEnvelopeTest.CONTENT_KEY_RESPONSE);
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void acquiresLicenseForEntitlement() throws Exception {
        ExposureClient client = new ExposureClient(ExposureClientConfig.builder()
                .baseUri(URI.create(baseUrl))
                .customer("cust")
                .businessUnit("bu")
                .sessionToken(new SessionToken("crm|account|user"))
                .build());
        PlaybackEntitlement entitlement = client.fetchEntitlement("asset-1").get(5, TimeUnit.SECONDS);
        FakeContentKeyRequest request = new FakeContentKeyRequest("skd://asset-1");

        LicenseHandshake handshake = client.fairplayRequester(entitlement).claim(request);

        assertThat(handshake.result().get(5, TimeUnit.SECONDS)).isEqualTo("CKC".getBytes(StandardCharsets.UTF_8));
        assertThat(request.awaitFinished()).isTrue();
        assertThat(request.errors).isEmpty();
        assertThat(playToken.get()).isEqualTo("play-token");
        assertThat(Base64.getDecoder().decode(spc.get())).isEqualTo(FakeContentKeyRequest.SPC);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        exchange.getResponseBody().write(bytes);
        exchange.close();
    }
}

package com.exposure.sdk.samples;

import com.exposure.sdk.client.ExposureClient;
import com.exposure.sdk.client.ExposureClientConfig;
import com.exposure.sdk.client.SessionToken;
import com.exposure.sdk.entitlement.PlaybackEntitlement;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fetches an entitlement and prints what a player would need to start playback.
 */
public final class Main {
    public static void main(String[] args) throws Exception {
        String baseUrl = System.getenv().getOrDefault("EXPOSURE_BASE_URL", "https://exposure.example.com");
        String customer = System.getenv().getOrDefault("EXPOSURE_CUSTOMER", "customer");
        String businessUnit = System.getenv().getOrDefault("EXPOSURE_BUSINESS_UNIT", "businessunit");
        String assetId = args.length > 0 ? args[0] : System.getenv("EXPOSURE_ASSET_ID");
        if (assetId == null || assetId.isBlank()) {
            System.err.println("Usage: Main <assetId>  (or set EXPOSURE_ASSET_ID)");
            System.exit(1);
        }

        ExposureClientConfig config = ExposureClientConfig.builder()
                .baseUri(URI.create(baseUrl))
                .customer(customer)
                .businessUnit(businessUnit)
                .sessionToken(resolveSessionToken())
                .build();
        ExposureClient client = new ExposureClient(config);

        PlaybackEntitlement entitlement = fetch(client, assetId);
        System.out.printf("Media locator: %s%n", entitlement.mediaLocator());
        System.out.printf("Play session: %s%n", entitlement.playSessionId());
        System.out.printf("Entitlement type: %s%n", entitlement.entitlementType());
        System.out.printf("License expiration: %s (%s)%n",
                entitlement.licenseExpiration(), entitlement.licenseExpirationReason());
        if (entitlement.fairplay() != null) {
            System.out.printf("Fairplay certificate: %s%n", entitlement.fairplay().certificateUrl());
            System.out.printf("Fairplay license: %s%n", entitlement.fairplay().licenseAcquisitionUrl());
        } else {
            System.out.println("No Fairplay configuration in entitlement");
        }
    }

    private static PlaybackEntitlement fetch(ExposureClient client, String assetId) {
        try {
            return client.fetchEntitlement(assetId).get(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while fetching entitlement", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("Failed to fetch entitlement for " + assetId, e);
        }
    }

    private static SessionToken resolveSessionToken() {
        String token = System.getenv("EXPOSURE_SESSION_TOKEN");
        if (token == null || token.isBlank()) {
            token = readTokenFromFile();
        }
        if (token == null || token.isBlank()) {
            throw new IllegalStateException("Set EXPOSURE_SESSION_TOKEN or write a token to ~/.exposure/token");
        }
        return new SessionToken(token);
    }

    private static String readTokenFromFile() {
        Path tokenPath = Path.of(System.getProperty("user.home"), ".exposure", "token");
        if (!Files.isRegularFile(tokenPath)) {
            return null;
        }
        try {
            return Files.readString(tokenPath).trim();
        } catch (IOException e) {
            System.err.printf("Failed to read token file %s: %s%n", tokenPath, e.getMessage());
            return null;
        }
    }
}

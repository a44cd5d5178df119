package com.exposure.sdk.client;

import java.net.URI;
import java.util.Objects;

public final class ExposureClientConfig {
    public static final String DEFAULT_FAIRPLAY_SCHEME = "skd";
    public static final String DEFAULT_PLAY_TOKEN_HEADER = "AzukiApp";

    private final URI baseUri;
    private final String customer;
    private final String businessUnit;
    private final SessionToken sessionToken;
    private final String fairplayScheme;
    private final String playTokenHeader;

    private ExposureClientConfig(Builder builder) {
        this.baseUri = builder.baseUri;
        this.customer = builder.customer;
        this.businessUnit = builder.businessUnit;
        this.sessionToken = builder.sessionToken;
        this.fairplayScheme = builder.fairplayScheme;
        this.playTokenHeader = builder.playTokenHeader;
    }

    public URI getBaseUri() {
        return baseUri;
    }

    public String getCustomer() {
        return customer;
    }

    public String getBusinessUnit() {
        return businessUnit;
    }

    public SessionToken getSessionToken() {
        return sessionToken;
    }

    public String getFairplayScheme() {
        return fairplayScheme;
    }

    public String getPlayTokenHeader() {
        return playTokenHeader;
    }

    /**
     * Customer and business unit scoped API root, {@code {base}/v1/customer/{c}/businessunit/{bu}}.
     */
    public String getApiUrl() {
        String normalized = baseUri.toString();
        if (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized + "/v1/customer/" + customer + "/businessunit/" + businessUnit;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private URI baseUri;
        private String customer;
        private String businessUnit;
        private SessionToken sessionToken;
        private String fairplayScheme = DEFAULT_FAIRPLAY_SCHEME;
        private String playTokenHeader = DEFAULT_PLAY_TOKEN_HEADER;

        public Builder baseUri(URI uri) {
            this.baseUri = uri;
            return this;
        }

        public Builder customer(String customer) {
            this.customer = customer;
            return this;
        }

        public Builder businessUnit(String businessUnit) {
            this.businessUnit = businessUnit;
            return this;
        }

        public Builder sessionToken(SessionToken sessionToken) {
            this.sessionToken = sessionToken;
            return this;
        }

        public Builder fairplayScheme(String fairplayScheme) {
            this.fairplayScheme = fairplayScheme;
            return this;
        }

        public Builder playTokenHeader(String playTokenHeader) {
            this.playTokenHeader = playTokenHeader;
            return this;
        }

        public ExposureClientConfig build() {
            Objects.requireNonNull(baseUri, "baseUri");
            Objects.requireNonNull(customer, "customer");
            Objects.requireNonNull(businessUnit, "businessUnit");
            Objects.requireNonNull(sessionToken, "sessionToken");
            Objects.requireNonNull(fairplayScheme, "fairplayScheme");
            Objects.requireNonNull(playTokenHeader, "playTokenHeader");
            return new ExposureClientConfig(this);
        }
    }
}

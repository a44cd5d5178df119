package com.exposure.sdk.client;

import java.util.Objects;

/**
 * Token identifying an authenticated Exposure session.
 *
 * <p>The value is a pipe separated string, {@code crmToken|accountId|userId|...}.
 */
public record SessionToken(String value) {
    public SessionToken {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Session token must not be blank");
        }
    }

    public String authorizationHeader() {
        return "Bearer " + value;
    }

    /**
     * @return the account id field, or {@code null} if the token does not carry one
     */
    public String accountId() {
        String[] parts = value.split("\\|");
        if (parts.length < 2 || parts[1].isBlank()) {
            return null;
        }
        return parts[1];
    }

    @Override
    public String toString() {
        return "SessionToken[***]";
    }
}

package com.exposure.sdk.entitlement;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reason code attached to a license expiration.
 *
 * <p>Codes unknown to this SDK decode to {@link Kind#OTHER} and keep the server's raw string, so
 * callers can branch on codes added server side.
 */
public final class ExpirationReason {
    public enum Kind {
        SUCCESS,
        NOT_ENTITLED,
        GEO_BLOCKED,
        DOWNLOAD_BLOCKED,
        DEVICE_BLOCKED,
        LICENSE_EXPIRED,
        NOT_AVAILABLE_IN_FORMAT,
        CONCURRENT_STREAMS_LIMIT_REACHED,
        NOT_ENABLED,
        GAP_IN_EPG,
        EPG_PLAY_MAX_HOURS,
        OTHER
    }

    private static final Map<String, ExpirationReason> KNOWN_BY_CODE = new HashMap<>();
    private static final Map<Kind, ExpirationReason> KNOWN_BY_KIND = new EnumMap<>(Kind.class);

    static {
        for (Kind kind : Kind.values()) {
            if (kind != Kind.OTHER) {
                ExpirationReason reason = new ExpirationReason(kind, kind.name());
                KNOWN_BY_CODE.put(kind.name(), reason);
                KNOWN_BY_KIND.put(kind, reason);
            }
        }
    }

    private final Kind kind;
    private final String rawValue;

    private ExpirationReason(Kind kind, String rawValue) {
        this.kind = kind;
        this.rawValue = rawValue;
    }

    /**
     * Maps a server code to a reason. Never throws.
     *
     * @return {@code null} when {@code value} is {@code null}
     */
    public static ExpirationReason fromString(String value) {
        if (value == null) {
            return null;
        }
        ExpirationReason known = KNOWN_BY_CODE.get(value);
        return known != null ? known : new ExpirationReason(Kind.OTHER, value);
    }

    public static ExpirationReason of(Kind kind) {
        if (kind == Kind.OTHER) {
            throw new IllegalArgumentException("Use other(String) for unknown reasons");
        }
        return KNOWN_BY_KIND.get(Objects.requireNonNull(kind, "kind"));
    }

    public static ExpirationReason other(String reason) {
        return new ExpirationReason(Kind.OTHER, Objects.requireNonNull(reason, "reason"));
    }

    public Kind getKind() {
        return kind;
    }

    public String rawValue() {
        return rawValue;
    }

    public boolean isOther() {
        return kind == Kind.OTHER;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExpirationReason)) {
            return false;
        }
        ExpirationReason that = (ExpirationReason) o;
        return kind == that.kind && rawValue.equals(that.rawValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, rawValue);
    }

    @Override
    public String toString() {
        return kind == Kind.OTHER ? "OTHER(" + rawValue + ")" : kind.name();
    }
}

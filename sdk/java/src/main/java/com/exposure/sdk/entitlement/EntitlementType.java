package com.exposure.sdk.entitlement;

import java.util.Objects;

/**
 * Kind of entitlement that granted a play. Unknown types are kept as {@link Kind#OTHER}.
 */
public final class EntitlementType {
    public enum Kind {
        TVOD,
        SVOD,
        FVOD,
        OTHER
    }

    public static final EntitlementType TVOD = new EntitlementType(Kind.TVOD, "TVOD");
    public static final EntitlementType SVOD = new EntitlementType(Kind.SVOD, "SVOD");
    public static final EntitlementType FVOD = new EntitlementType(Kind.FVOD, "FVOD");

    private final Kind kind;
    private final String rawValue;

    private EntitlementType(Kind kind, String rawValue) {
        this.kind = kind;
        this.rawValue = rawValue;
    }

    /**
     * @return {@code null} when {@code value} is {@code null}
     */
    public static EntitlementType fromString(String value) {
        if (value == null) {
            return null;
        }
        switch (value) {
            case "TVOD":
                return TVOD;
            case "SVOD":
                return SVOD;
            case "FVOD":
                return FVOD;
            default:
                return new EntitlementType(Kind.OTHER, value);
        }
    }

    public static EntitlementType other(String type) {
        return new EntitlementType(Kind.OTHER, Objects.requireNonNull(type, "type"));
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
        if (!(o instanceof EntitlementType)) {
            return false;
        }
        EntitlementType that = (EntitlementType) o;
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

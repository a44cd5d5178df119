package com.exposure.sdk.analytics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Analytics event restored from its persisted JSON form.
 */
public final class PersistedAnalyticsPayload implements AnalyticsPayload {
    private final Map<String, Object> jsonRepresentation;

    public PersistedAnalyticsPayload(Map<String, Object> jsonRepresentation) {
        Objects.requireNonNull(jsonRepresentation, "jsonRepresentation");
        this.jsonRepresentation = Collections.unmodifiableMap(new LinkedHashMap<>(jsonRepresentation));
    }

    @Override
    public Map<String, Object> jsonPayload() {
        return jsonRepresentation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PersistedAnalyticsPayload)) {
            return false;
        }
        return jsonRepresentation.equals(((PersistedAnalyticsPayload) o).jsonRepresentation);
    }

    @Override
    public int hashCode() {
        return jsonRepresentation.hashCode();
    }

    @Override
    public String toString() {
        return "PersistedAnalyticsPayload" + jsonRepresentation;
    }
}

package com.exposure.sdk.analytics;

import java.util.Map;

/**
 * A single analytics event as sent to the event sink. The event taxonomy itself lives with the
 * player integration; the SDK only transports the JSON object.
 */
@FunctionalInterface
public interface AnalyticsPayload {
    /**
     * JSON object representation of the event. Events carrying a numeric {@code timestamp} are
     * ordered by it inside a batch.
     */
    Map<String, Object> jsonPayload();
}

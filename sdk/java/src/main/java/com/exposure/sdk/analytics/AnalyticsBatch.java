package com.exposure.sdk.analytics;

import com.exposure.sdk.client.ExposureException;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Batch of analytics events for one playback session, as posted to the event sink.
 */
public final class AnalyticsBatch {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };

    private final String customer;
    private final String businessUnit;
    private final String playToken;
    private final long dispatchTime;
    private final Long clockOffset;
    private final List<AnalyticsPayload> payload;

    /**
     * @param playToken    id uniquely identifying the playback session
     * @param dispatchTime device clock, epoch millis, when the batch is sent
     * @param clockOffset  estimated device minus server clock in millis, {@code null} if unknown
     * @param payload      events, reordered by {@code timestamp}
     */
    public AnalyticsBatch(String customer,
                          String businessUnit,
                          String playToken,
                          long dispatchTime,
                          Long clockOffset,
                          List<? extends AnalyticsPayload> payload) {
        this.customer = Objects.requireNonNull(customer, "customer");
        this.businessUnit = Objects.requireNonNull(businessUnit, "businessUnit");
        this.playToken = Objects.requireNonNull(playToken, "playToken");
        this.dispatchTime = dispatchTime;
        this.clockOffset = clockOffset;
        List<AnalyticsPayload> sorted = new ArrayList<>(Objects.requireNonNull(payload, "payload"));
        sorted.sort(Comparator.comparing(AnalyticsBatch::timestampOf,
                Comparator.nullsLast(Comparator.naturalOrder())));
        this.payload = Collections.unmodifiableList(sorted);
    }

    public String getCustomer() {
        return customer;
    }

    public String getBusinessUnit() {
        return businessUnit;
    }

    public String getPlayToken() {
        return playToken;
    }

    public long getDispatchTime() {
        return dispatchTime;
    }

    public Long getClockOffset() {
        return clockOffset;
    }

    public List<AnalyticsPayload> getPayload() {
        return payload;
    }

    public byte[] toJson() {
        Map<String, Object> batch = new LinkedHashMap<>();
        batch.put("dispatchTime", dispatchTime);
        batch.put("clockOffset", clockOffset);
        batch.put("customer", customer);
        batch.put("businessUnit", businessUnit);
        batch.put("playToken", playToken);
        List<Map<String, Object>> events = new ArrayList<>(payload.size());
        for (AnalyticsPayload event : payload) {
            events.add(event.jsonPayload());
        }
        batch.put("payload", events);
        try {
            return MAPPER.writeValueAsBytes(batch);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize analytics batch", e);
        }
    }

    /**
     * Restores a batch written by {@link #toJson()}; events come back as {@link PersistedAnalyticsPayload}.
     */
    public static AnalyticsBatch fromJson(byte[] json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (IOException e) {
            throw new ExposureException(ExposureException.Kind.PARSE_FAILURE, "Analytics batch is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ExposureException(ExposureException.Kind.PARSE_FAILURE, "Analytics batch must be a JSON object");
        }
        String customer = requiredText(root, "customer");
        String businessUnit = requiredText(root, "businessUnit");
        String playToken = requiredText(root, "playToken");
        JsonNode dispatchTime = root.get("dispatchTime");
        if (dispatchTime == null || !dispatchTime.canConvertToLong()) {
            throw new ExposureException(ExposureException.Kind.PARSE_FAILURE, "Analytics batch missing dispatchTime");
        }
        JsonNode clockOffset = root.get("clockOffset");

        List<AnalyticsPayload> events = new ArrayList<>();
        JsonNode payload = root.get("payload");
        if (payload != null && payload.isArray()) {
            for (JsonNode event : payload) {
                if (event.isObject()) {
                    events.add(new PersistedAnalyticsPayload(MAPPER.convertValue(event, JSON_OBJECT)));
                }
            }
        }
        return new AnalyticsBatch(customer, businessUnit, playToken, dispatchTime.longValue(),
                clockOffset != null && clockOffset.canConvertToLong() ? clockOffset.longValue() : null,
                events);
    }

    private static String requiredText(JsonNode root, String field) {
        JsonNode value = root.get(field);
        if (value == null || !value.isTextual()) {
            throw new ExposureException(ExposureException.Kind.PARSE_FAILURE, "Analytics batch missing " + field);
        }
        return value.textValue();
    }

    private static Long timestampOf(AnalyticsPayload event) {
        Object timestamp = event.jsonPayload().get("timestamp");
        return timestamp instanceof Number ? ((Number) timestamp).longValue() : null;
    }
}

package com.entity.reconciliation.health;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of a component or of the whole service, with free-form details.
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    /**
     * Ordered from best to worst.
     */
    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        message = message != null ? message : "";
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static HealthStatus up() {
        return new HealthStatus(Status.UP, "OK", Map.of());
    }

    public static HealthStatus up(String message) {
        return new HealthStatus(Status.UP, message, Map.of());
    }

    public static HealthStatus down(String reason) {
        return new HealthStatus(Status.DOWN, reason, Map.of());
    }

    public static HealthStatus degraded(String reason) {
        return new HealthStatus(Status.DEGRADED, reason, Map.of());
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> newDetails = new LinkedHashMap<>(this.details);
        newDetails.put(key, value);
        return new HealthStatus(this.status, this.message, newDetails);
    }

    @JsonIgnore
    public boolean isUp() {
        return status == Status.UP;
    }

    @JsonIgnore
    public boolean isDown() {
        return status == Status.DOWN;
    }
}

package com.sitesmith.core.health;

import java.util.Map;

/**
 * Result of probing one dependency.
 *
 * @param component dependency name, e.g. {@code store} or {@code object-store}
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DOWN, DEGRADED }

    public static HealthStatus up(String component, String detail) {
        return new HealthStatus(component, Status.UP, detail, Map.of());
    }

    public static HealthStatus down(String component, String detail) {
        return new HealthStatus(component, Status.DOWN, detail, Map.of());
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }
}

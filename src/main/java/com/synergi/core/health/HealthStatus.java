package com.synergi.core.health;

import java.util.Map;

/**
 * Result of checking one synergi component (registry, ledger, planner or settlement).
 *
 * @param component component name as reported by {@code GET /api/v1/health}
 * @param status UP, DEGRADED (usable with gaps, e.g. a category without active workers) or DOWN
 * @param detail one-line explanation for operators
 * @param metadata extra key/value facts, such as worker count or settlement network
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DOWN, DEGRADED }

    public HealthStatus {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    public static HealthStatus degraded(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DEGRADED, detail, metadata);
    }

    public static HealthStatus down(String component, String detail) {
        return new HealthStatus(component, Status.DOWN, detail, Map.of());
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }
}

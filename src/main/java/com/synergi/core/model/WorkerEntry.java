package com.synergi.core.model;

import java.io.Serializable;
import java.math.BigDecimal;

/**
 * Point-in-time view of a registered worker.
 *
 * @param id unique worker identifier (e.g., "weather")
 * @param name display name
 * @param category capability class the worker serves (e.g., "data", "math")
 * @param endpoint where the worker is invoked: {@code local:<capability>} or an http(s) URL
 * @param address settlement address the worker is paid at
 * @param price price per call
 * @param reputation score from 0 to 100
 * @param jobsCompleted successful paid calls
 * @param jobsFailed failed calls
 * @param totalEarned sum of settlements received
 * @param active inactive workers are never hired
 * @param registrationOrder position in the registry, used as the final ranking tie-breaker
 * @param efficiency reputation-to-price score computed when this view was taken
 */
public record WorkerEntry(
    String id,
    String name,
    String category,
    String endpoint,
    String address,
    BigDecimal price,
    int reputation,
    int jobsCompleted,
    int jobsFailed,
    BigDecimal totalEarned,
    boolean active,
    int registrationOrder,
    double efficiency
) implements Serializable {
}

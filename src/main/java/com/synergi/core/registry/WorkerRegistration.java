package com.synergi.core.registry;

import java.math.BigDecimal;

/**
 * Input for adding a worker to the registry.
 */
public record WorkerRegistration(
    String id,
    String name,
    String category,
    String endpoint,
    String address,
    BigDecimal price,
    int reputation,
    boolean active
) {

    public WorkerRegistration(String id, String name, String category, BigDecimal price, int reputation) {
        this(id, name, category, "local:" + category, null, price, reputation, true);
    }
}

package com.synergi.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * One planned call against the marketplace.
 *
 * @param capabilityId capability category the step needs
 * @param parameters opaque parameters passed through to the worker
 */
public record PlannedStep(
    String capabilityId,
    Map<String, Object> parameters
) implements Serializable {

    public PlannedStep {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    public String parameter(String key) {
        Object value = parameters.get(key);
        return value != null ? value.toString() : null;
    }
}

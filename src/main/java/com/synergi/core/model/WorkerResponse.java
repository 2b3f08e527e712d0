package com.synergi.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Decoded worker reply.
 *
 * @param result typed result for the step
 * @param nestedHires sub-hires the worker reports having made
 */
public record WorkerResponse(
    StepResult result,
    List<NestedHire> nestedHires
) implements Serializable {

    public WorkerResponse {
        nestedHires = nestedHires == null ? List.of() : List.copyOf(nestedHires);
    }
}

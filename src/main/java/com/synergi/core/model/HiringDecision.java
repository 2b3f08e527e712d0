package com.synergi.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Ranked outcome of a hiring evaluation for one step.
 *
 * @param chosen the top-ranked worker
 * @param rationale human-readable justification
 * @param alternatives remaining active workers, best first
 */
public record HiringDecision(
    WorkerEntry chosen,
    String rationale,
    List<WorkerEntry> alternatives
) implements Serializable {

    public String chosenWorkerId() {
        return chosen.id();
    }
}

package com.synergi.core.execution;

import com.synergi.core.model.FailureKind;
import com.synergi.core.model.PlannedStep;
import com.synergi.core.model.StepOutcome;
import com.synergi.core.model.StepResult;
import com.synergi.core.model.StepStatus;
import com.synergi.core.model.WorkerEntry;

import java.util.List;

final class Outcomes {

    private Outcomes() {}

    static StepOutcome success(int index, PlannedStep step, AttemptResult attempt, String rationale,
                               String originalWorkerId, int attempts, long latencyMs) {
        boolean healed = originalWorkerId != null;
        return new StepOutcome(index, step.capabilityId(), attempt.worker().id(), attempt.worker().name(),
                StepStatus.SUCCESS, null, attempt.response().result(), null, rationale,
                attempt.settlement(), attempt.nestedHires(), attempt.refusedHires(),
                healed, originalWorkerId, false, attempts, latencyMs);
    }

    static StepOutcome degraded(int index, PlannedStep step, WorkerEntry original, StepResult placeholder,
                                FailureKind lastFailure, String lastError, String rationale,
                                int attempts, long latencyMs) {
        return new StepOutcome(index, step.capabilityId(), null, null, StepStatus.DEGRADED, lastFailure,
                placeholder, lastError, rationale, null, List.of(), List.of(),
                false, original.id(), true, attempts, latencyMs);
    }
}

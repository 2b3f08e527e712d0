package com.synergi.core.model;

import java.io.Serializable;
import java.math.BigDecimal;
import java.util.List;

/**
 * What happened to one planned step.
 *
 * @param index position of the step in the plan (0-based)
 * @param capabilityId capability the step asked for
 * @param workerId worker that produced the result; null when none was hired
 * @param workerName display name of that worker
 * @param status final disposition
 * @param failureKind why the step did not succeed normally; null on a clean success
 * @param result typed result; present for SUCCESS and DEGRADED
 * @param error failure description; present for REJECTED and ERROR, and for DEGRADED as the last failure
 * @param rationale hiring rationale, or the self-heal trail
 * @param settlement requester-paid settlement; present only for SUCCESS
 * @param nestedHires delegated settlements appended beneath {@code settlement}
 * @param refusedHires nested hires reported by the worker but refused (cycle or depth)
 * @param selfHealed true when an alternative worker replaced the chosen one
 * @param originalWorkerId the worker first chosen for the step, when it was replaced
 * @param degraded true when the result is a local placeholder
 * @param attempts worker calls made for this step
 * @param latencyMs wall-clock time spent on the step
 */
public record StepOutcome(
    int index,
    String capabilityId,
    String workerId,
    String workerName,
    StepStatus status,
    FailureKind failureKind,
    StepResult result,
    String error,
    String rationale,
    SettlementRecord settlement,
    List<SettlementRecord> nestedHires,
    List<String> refusedHires,
    boolean selfHealed,
    String originalWorkerId,
    boolean degraded,
    int attempts,
    long latencyMs
) implements Serializable {

    public StepOutcome {
        nestedHires = nestedHires == null ? List.of() : List.copyOf(nestedHires);
        refusedHires = refusedHires == null ? List.of() : List.copyOf(refusedHires);
    }

    public BigDecimal settledAmount() {
        return settlement != null ? settlement.amount() : BigDecimal.ZERO;
    }

    public BigDecimal delegatedAmount() {
        return nestedHires.stream()
                .map(SettlementRecord::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public static StepOutcome rejected(int index, String capabilityId, WorkerEntry chosen,
                                       String rationale, String error) {
        return new StepOutcome(index, capabilityId, chosen.id(), chosen.name(), StepStatus.REJECTED,
                FailureKind.BUDGET_EXCEEDED, null, error, rationale, null, List.of(), List.of(),
                false, null, false, 0, 0L);
    }

    public static StepOutcome error(int index, String capabilityId, FailureKind kind, String error) {
        return new StepOutcome(index, capabilityId, null, null, StepStatus.ERROR, kind, null, error,
                null, null, List.of(), List.of(), false, null, false, 0, 0L);
    }
}

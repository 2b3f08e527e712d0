package com.synergi.core.model;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Full record of one task's execution.
 *
 * @param taskId task identifier
 * @param requesterId party that paid for depth-0 settlements
 * @param budgetLimit spending cap for requester-paid settlements
 * @param outcomes one entry per planned step, in plan order
 * @param cumulativeCost sum of requester-paid settlements
 * @param delegatedCost sum of settlements paid by workers to sub-workers
 * @param maxDepth deepest settlement observed (0 when nothing was delegated)
 * @param cancelled true when the task was cancelled before all steps ran
 * @param startedAt execution start
 * @param completedAt execution end
 */
public record ExecutionTrace(
    String taskId,
    String requesterId,
    BigDecimal budgetLimit,
    List<StepOutcome> outcomes,
    BigDecimal cumulativeCost,
    BigDecimal delegatedCost,
    int maxDepth,
    boolean cancelled,
    Instant startedAt,
    Instant completedAt
) implements Serializable {

    public ExecutionTrace {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public List<StepOutcome> successfulOutcomes() {
        return outcomes.stream()
                .filter(o -> o.status() == StepStatus.SUCCESS)
                .toList();
    }

    public long count(StepStatus status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }
}

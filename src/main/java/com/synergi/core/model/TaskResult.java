package com.synergi.core.model;

import java.io.Serializable;

/**
 * Outcome of a complete task run.
 *
 * @param trace execution trace
 * @param finalAnswer synthesized answer, never empty
 * @param planReasoning the planner's explanation of the chosen steps
 * @param plannedBy "llm" or "rules"
 */
public record TaskResult(
    ExecutionTrace trace,
    String finalAnswer,
    String planReasoning,
    String plannedBy
) implements Serializable {
}

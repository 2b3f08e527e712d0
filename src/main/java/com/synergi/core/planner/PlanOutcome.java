package com.synergi.core.planner;

import com.synergi.core.model.PlannedStep;

import java.util.List;

/**
 * @param steps ordered steps to execute
 * @param reasoning why these steps were chosen
 * @param plannedBy "llm" or "rules"
 */
public record PlanOutcome(List<PlannedStep> steps, String reasoning, String plannedBy) {

    public static final String LLM = "llm";
    public static final String RULES = "rules";

    public PlanOutcome {
        steps = List.copyOf(steps);
    }
}

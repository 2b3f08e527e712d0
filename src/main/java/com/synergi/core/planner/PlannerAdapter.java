package com.synergi.core.planner;

import com.synergi.core.config.SynergiProperties;
import com.synergi.core.execution.CallGuard;
import com.synergi.core.execution.CancellationToken;
import com.synergi.core.execution.TaskCancelledException;
import com.synergi.core.model.PlannedStep;
import com.synergi.core.model.TaskPlan;
import com.synergi.core.registry.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns task text into ordered steps.
 * <p>
 * Asks the planning collaborator first (when enabled) under the planner deadline. A failure,
 * malformed plan or timeout falls through to the {@link KeywordPlanner}, so planning only
 * fails if the task itself is cancelled.
 */
@Service
public class PlannerAdapter {

    private static final Logger log = LoggerFactory.getLogger(PlannerAdapter.class);

    private final PlanningCollaborator collaborator;
    private final KeywordPlanner keywordPlanner;
    private final WorkerRegistry registry;
    private final CallGuard callGuard;
    private final boolean llmEnabled;
    private final Duration timeout;

    public PlannerAdapter(PlanningCollaborator collaborator, KeywordPlanner keywordPlanner,
                          WorkerRegistry registry, CallGuard callGuard, SynergiProperties properties) {
        this.collaborator = collaborator;
        this.keywordPlanner = keywordPlanner;
        this.registry = registry;
        this.callGuard = callGuard;
        this.llmEnabled = properties.getPlanner().isLlmEnabled();
        this.timeout = properties.getOrchestration().getTimeouts().getPlanner();
    }

    public PlanOutcome plan(String taskText, CancellationToken token) {
        if (llmEnabled) {
            try {
                TaskPlan plan = callGuard.call("planner", timeout, token,
                        t -> collaborator.plan(taskText, registry.categories()));
                return toOutcome(plan);
            } catch (TaskCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("LLM planning failed, using rule-based fallback: {}", e.getMessage());
            }
        }
        PlanOutcome fallback = keywordPlanner.plan(taskText);
        log.info("Rule-based plan: {}", fallback.steps().stream().map(PlannedStep::capabilityId).toList());
        return fallback;
    }

    private static PlanOutcome toOutcome(TaskPlan plan) {
        List<PlannedStep> steps = plan.steps().stream()
                .map(s -> new PlannedStep(s.capability().trim(), toObjectMap(s.parameters())))
                .toList();
        String reasoning = plan.reasoning() != null ? plan.reasoning() : "Planned by language model.";
        return new PlanOutcome(steps, reasoning, PlanOutcome.LLM);
    }

    private static Map<String, Object> toObjectMap(Map<String, String> parameters) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (parameters != null) {
            parameters.forEach((k, v) -> {
                if (k != null && v != null) {
                    result.put(k, v);
                }
            });
        }
        return result;
    }
}

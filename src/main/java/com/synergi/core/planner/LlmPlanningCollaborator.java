package com.synergi.core.planner;

import com.synergi.core.llm.LlmService;
import com.synergi.core.model.TaskPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Plans a task with the language model.
 */
@Component
public class LlmPlanningCollaborator implements PlanningCollaborator {

    private static final Logger log = LoggerFactory.getLogger(LlmPlanningCollaborator.class);

    static final String SYSTEM_PROMPT = """
            You plan work for a marketplace of paid specialist workers.
            Break the user's task into the smallest ordered list of capability calls that answers it.
            Use only the capability categories you are given, at most once each, and only when the task
            needs them. Give each call the parameters the worker needs:
            data: city; summarization: text, maxLength; math: expression; sentiment: text;
            research: query; translation: text, targetLang; code: spec.
            Explain your choice briefly in "reasoning".
            """;

    private final LlmService llmService;

    public LlmPlanningCollaborator(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public TaskPlan plan(String taskText, Set<String> categories) {
        String userPrompt = "Available capability categories: " + String.join(", ", categories)
                + "\n\nTask: " + taskText;
        TaskPlan plan;
        try {
            plan = llmService.structuredCall(SYSTEM_PROMPT, userPrompt, TaskPlan.class);
        } catch (RuntimeException e) {
            throw new PlanningFailureException("Planner call failed: " + e.getMessage(), e);
        }
        if (plan == null || plan.steps() == null || plan.steps().isEmpty()) {
            throw new PlanningFailureException("Planner returned no steps");
        }
        for (TaskPlan.Step step : plan.steps()) {
            if (step == null || step.capability() == null || step.capability().isBlank()) {
                throw new PlanningFailureException("Planner returned a step without a capability");
            }
        }
        log.info("LLM planned {} step(s)", plan.steps().size());
        return plan;
    }
}

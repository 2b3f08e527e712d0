package com.synergi.core.synthesis;

import com.synergi.core.llm.LlmService;
import com.synergi.core.model.StepOutcome;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Summarizes step results with the language model.
 */
@Component
public class LlmSummarizer implements SummarizerCollaborator {

    static final String SYSTEM_PROMPT = """
            You write the final answer for a task that was split across specialist workers.
            Answer the user's task directly using the worker results provided.
            Ignore any result that is irrelevant to the task. Results marked (degraded) are
            placeholders; mention that the information was unavailable instead of inventing it.
            """;

    private final LlmService llmService;

    public LlmSummarizer(LlmService llmService) {
        this.llmService = llmService;
    }

    @Override
    public String summarize(String taskText, List<StepOutcome> outcomes) {
        StringBuilder prompt = new StringBuilder("Task: ").append(taskText).append("\n\nWorker results:\n");
        for (StepOutcome outcome : outcomes) {
            prompt.append("- [").append(outcome.capabilityId()).append("] ")
                    .append(ResponseSynthesizer.label(outcome)).append(": ")
                    .append(outcome.result().render());
            if (outcome.degraded()) {
                prompt.append(" (degraded)");
            }
            prompt.append('\n');
        }
        try {
            return llmService.textCall(SYSTEM_PROMPT, prompt.toString());
        } catch (RuntimeException e) {
            throw new SynthesisFailureException("Summarizer call failed: " + e.getMessage(), e);
        }
    }
}

package com.synergi.core.synthesis;

import com.synergi.core.config.SynergiProperties;
import com.synergi.core.execution.CallGuard;
import com.synergi.core.execution.CancellationToken;
import com.synergi.core.model.ExecutionTrace;
import com.synergi.core.model.StepOutcome;
import com.synergi.core.model.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Merges the usable step results of a trace into one answer. Never returns an empty string.
 * <p>
 * Usable means SUCCESS or DEGRADED. With the summarizer enabled the answer comes from the
 * {@link SummarizerCollaborator}; otherwise, or when it fails, each result is listed under its
 * worker's name.
 */
@Service
public class ResponseSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(ResponseSynthesizer.class);

    public static final String NO_RESULTS =
            "No relevant results: every step failed or was rejected, so there is nothing to report.";

    private final SummarizerCollaborator summarizer;
    private final CallGuard callGuard;
    private final boolean llmEnabled;
    private final Duration timeout;

    public ResponseSynthesizer(SummarizerCollaborator summarizer, CallGuard callGuard,
                               SynergiProperties properties) {
        this.summarizer = summarizer;
        this.callGuard = callGuard;
        this.llmEnabled = properties.getSynthesis().isLlmEnabled();
        this.timeout = properties.getOrchestration().getTimeouts().getSummarizer();
    }

    public String synthesize(String taskText, ExecutionTrace trace) {
        List<StepOutcome> usable = trace.outcomes().stream()
                .filter(o -> o.status() == StepStatus.SUCCESS || o.status() == StepStatus.DEGRADED)
                .filter(o -> o.result() != null)
                .toList();
        if (usable.isEmpty()) {
            return NO_RESULTS;
        }

        if (llmEnabled) {
            try {
                String answer = callGuard.call("summarizer", timeout, CancellationToken.create(),
                        t -> summarizer.summarize(taskText, usable));
                if (answer != null && !answer.isBlank()) {
                    return answer;
                }
                log.warn("Summarizer returned an empty answer, concatenating results");
            } catch (RuntimeException e) {
                log.warn("Summarizer failed, concatenating results: {}", e.getMessage());
            }
        }
        return concatenate(usable);
    }

    static String concatenate(List<StepOutcome> outcomes) {
        return outcomes.stream()
                .map(o -> "**" + label(o) + "**: " + o.result().render() + (o.degraded() ? " _(degraded)_" : ""))
                .collect(Collectors.joining("\n\n"));
    }

    static String label(StepOutcome outcome) {
        if (outcome.workerName() != null) {
            return outcome.selfHealed()
                    ? outcome.workerName() + " (healed from " + outcome.originalWorkerId() + ")"
                    : outcome.workerName();
        }
        return outcome.capabilityId();
    }
}

package com.synergi.core.execution;

import com.synergi.core.model.PlannedStep;
import com.synergi.core.model.StepResult;
import org.springframework.stereotype.Component;

/**
 * Builds the deterministic placeholder returned when no worker could serve a step.
 */
@Component
public class DegradedResultFactory {

    private static final int EXCERPT_LENGTH = 100;

    public StepResult.Placeholder placeholder(PlannedStep step) {
        String text = switch (step.capabilityId()) {
            case "data", "weather" -> "Live weather for " + orElse(step.parameter("city"), "the requested city")
                    + " is unavailable right now; no reading could be obtained.";
            case "summarization" -> "Summary unavailable. Opening of the source text: "
                    + excerpt(orElse(step.parameter("text"), ""));
            case "math" -> "Could not evaluate " + orElse(step.parameter("expression"), "the expression")
                    + " right now.";
            case "translation" -> "Translation unavailable; original text: "
                    + excerpt(orElse(step.parameter("text"), ""));
            default -> "No worker could complete the " + step.capabilityId() + " step; please retry later.";
        };
        return new StepResult.Placeholder(text);
    }

    private static String excerpt(String text) {
        return text.length() <= EXCERPT_LENGTH ? text : text.substring(0, EXCERPT_LENGTH - 3) + "...";
    }

    private static String orElse(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }
}

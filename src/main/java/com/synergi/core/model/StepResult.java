package com.synergi.core.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.io.Serializable;
import java.util.List;

/**
 * Typed result of a step, one variant per capability family.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StepResult.WeatherReport.class, name = "weather"),
        @JsonSubTypes.Type(value = StepResult.Summary.class, name = "summary"),
        @JsonSubTypes.Type(value = StepResult.MathSolution.class, name = "math"),
        @JsonSubTypes.Type(value = StepResult.TextAnswer.class, name = "text"),
        @JsonSubTypes.Type(value = StepResult.Placeholder.class, name = "placeholder")
})
public sealed interface StepResult extends Serializable {

    /**
     * Plain-text rendering used in answers and console output.
     */
    String render();

    record WeatherReport(String city, double temperatureC, String condition, int humidity, String wind)
            implements StepResult {
        @Override
        public String render() {
            return String.format("%s: %.0f°C, %s, humidity %d%%, wind %s",
                    city, temperatureC, condition, humidity, wind);
        }
    }

    record Summary(String text, int originalLength) implements StepResult {
        @Override
        public String render() {
            return text;
        }
    }

    record MathSolution(String expression, double value, List<String> steps) implements StepResult {
        public MathSolution {
            steps = steps == null ? List.of() : List.copyOf(steps);
        }

        @Override
        public String render() {
            return expression + " = " + formatValue(value);
        }

        private static String formatValue(double v) {
            if (v == Math.rint(v) && !Double.isInfinite(v) && Math.abs(v) < 1e15) {
                return String.valueOf((long) v);
            }
            return String.valueOf(v);
        }
    }

    record TextAnswer(String text) implements StepResult {
        @Override
        public String render() {
            return text;
        }
    }

    /** Locally synthesized stand-in used when no worker could serve the step. */
    record Placeholder(String text) implements StepResult {
        @Override
        public String render() {
            return text;
        }
    }
}

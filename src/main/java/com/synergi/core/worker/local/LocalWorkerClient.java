package com.synergi.core.worker.local;

import com.synergi.core.execution.CancellationToken;
import com.synergi.core.model.PlannedStep;
import com.synergi.core.model.WorkerEntry;
import com.synergi.core.worker.WorkerCallException;
import com.synergi.core.worker.WorkerClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Built-in demo capabilities served in-process, addressed as {@code local:<capability>}.
 * <p>
 * Replies use the same JSON shapes a remote worker would return. The research capability
 * reports the sub-hires it made, so delegation can be exercised without any remote workers.
 * {@code local:unavailable} always fails.
 */
@Component
public class LocalWorkerClient implements WorkerClient {

    private static final Logger log = LoggerFactory.getLogger(LocalWorkerClient.class);

    static final String PREFIX = "local:";

    @Override
    public boolean supports(String endpoint) {
        return endpoint != null && endpoint.startsWith(PREFIX);
    }

    @Override
    public Map<String, Object> invoke(WorkerEntry worker, PlannedStep step, CancellationToken token) {
        token.throwIfCancelled();
        String capability = worker.endpoint().substring(PREFIX.length());
        log.debug("Local capability {} serving worker {}", capability, worker.id());
        try {
            return switch (capability) {
                case "weather" -> weather(step);
                case "summarize" -> summarize(step);
                case "math" -> math(step);
                case "sentiment" -> sentiment(step);
                case "research" -> research(worker, step);
                case "translate" -> translate(step);
                case "code" -> code(step);
                case "unavailable" -> throw new WorkerCallException(
                        "Worker " + worker.id() + " is unavailable", 503, null);
                default -> throw new WorkerCallException("Unknown local capability: " + capability);
            };
        } catch (IllegalArgumentException e) {
            throw new WorkerCallException("Worker " + worker.id() + " rejected the request: " + e.getMessage(),
                    400, e);
        }
    }

    private Map<String, Object> weather(PlannedStep step) {
        String city = valueOr(step.parameter("city"), "New York");
        WeatherTable.Reading reading = WeatherTable.lookup(city);
        Map<String, Object> weather = new LinkedHashMap<>();
        weather.put("temp", reading.temp());
        weather.put("condition", reading.condition());
        weather.put("humidity", reading.humidity());
        weather.put("wind", reading.wind());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("city", WeatherTable.displayName(city));
        body.put("weather", weather);
        return body;
    }

    private Map<String, Object> summarize(PlannedStep step) {
        String text = requireParameter(step, "text");
        int maxLength = parseInt(step.parameter("maxLength"), 150);
        String summary = TextSummarizer.summarize(text, maxLength);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("summary", summary);
        body.put("original_length", text.length());
        body.put("summary_length", summary.length());
        return body;
    }

    private Map<String, Object> math(PlannedStep step) {
        String expression = requireParameter(step, "expression");
        MathExpressionEvaluator.Evaluation evaluation = MathExpressionEvaluator.evaluate(expression);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("expression", expression);
        body.put("result", evaluation.value());
        body.put("steps", evaluation.steps());
        return body;
    }

    private Map<String, Object> sentiment(PlannedStep step) {
        SentimentScorer.Score score = SentimentScorer.score(requireParameter(step, "text"));
        return Map.of("answer", "Sentiment: " + score.label() + " (score " + score.score() + ")");
    }

    /**
     * Answers from a canned brief and reports hiring a summarizer, which in turn hired a sentiment scorer.
     */
    private Map<String, Object> research(WorkerEntry worker, PlannedStep step) {
        String query = valueOr(step.parameter("query"), valueOr(step.parameter("text"), "the topic"));
        Map<String, Object> sentimentHire = new LinkedHashMap<>();
        sentimentHire.put("workerId", "sentiment");
        sentimentHire.put("capability", "sentiment");
        sentimentHire.put("amount", "0.002");

        Map<String, Object> summaryHire = new LinkedHashMap<>();
        summaryHire.put("workerId", "summarize");
        summaryHire.put("capability", "summarization");
        summaryHire.put("amount", "0.003");
        summaryHire.put("hires", List.of(sentimentHire));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("answer", worker.name() + " brief on \"" + query + "\": sources agree on the main points; "
                + "a condensed digest and tone check were commissioned from specialist workers.");
        body.put("subAgentHires", List.of(summaryHire));
        return body;
    }

    private Map<String, Object> translate(PlannedStep step) {
        String text = requireParameter(step, "text");
        String target = valueOr(step.parameter("targetLang"), "Spanish");
        return Map.of("answer", "[" + target + "] " + text);
    }

    private Map<String, Object> code(PlannedStep step) {
        String spec = valueOr(step.parameter("spec"), step.parameter("code"));
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("Request must include a \"spec\" or \"code\" field");
        }
        String name = spec.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_").replaceAll("^_+|_+$", "");
        if (name.length() > 32) {
            name = name.substring(0, 32);
        }
        return Map.of("answer", "def " + (name.isEmpty() ? "task" : name) + "():\n    # " + spec + "\n    pass");
    }

    private static String requireParameter(PlannedStep step, String key) {
        String value = step.parameter(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Request must include a \"" + key + "\" field");
        }
        return value;
    }

    private static String valueOr(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }

    private static int parseInt(String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}

package com.synergi.core.worker;

import com.synergi.core.model.NestedHire;
import com.synergi.core.model.StepResult;
import com.synergi.core.model.WorkerResponse;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns a worker's raw JSON body into a {@link WorkerResponse}.
 * <p>
 * The result variant is chosen by capability category. Weather, summary and math replies must
 * carry their family's fields; any other category reads a free-text answer. Nested hires are
 * read from {@code subAgentHires}, each of which may carry its own {@code hires}.
 */
@Component
public class StepResultDecoder {

    public WorkerResponse decode(String category, Map<String, Object> body) {
        if (body == null) {
            throw new WorkerCallException("Worker returned an empty body for " + category);
        }
        StepResult result = switch (category) {
            case "data", "weather" -> decodeWeather(body);
            case "summarization" -> decodeSummary(body);
            case "math" -> decodeMath(body);
            default -> decodeText(body);
        };
        return new WorkerResponse(result, decodeHires(body.get("subAgentHires")));
    }

    private StepResult decodeWeather(Map<String, Object> body) {
        Map<String, Object> weather = asMap(body.get("weather"), "weather");
        return new StepResult.WeatherReport(
                requireString(body, "city"),
                requireNumber(weather, "temp").doubleValue(),
                requireString(weather, "condition"),
                requireNumber(weather, "humidity").intValue(),
                String.valueOf(weather.getOrDefault("wind", "calm")));
    }

    private StepResult decodeSummary(Map<String, Object> body) {
        String summary = requireString(body, "summary");
        Object original = body.get("original_length");
        int originalLength = original instanceof Number n ? n.intValue() : summary.length();
        return new StepResult.Summary(summary, originalLength);
    }

    private StepResult decodeMath(Map<String, Object> body) {
        Object steps = body.get("steps");
        List<String> stepList = new ArrayList<>();
        if (steps instanceof List<?> list) {
            list.forEach(s -> stepList.add(String.valueOf(s)));
        }
        return new StepResult.MathSolution(
                requireString(body, "expression"),
                requireNumber(body, "result").doubleValue(),
                stepList);
    }

    private StepResult decodeText(Map<String, Object> body) {
        for (String key : List.of("answer", "result", "text", "output")) {
            Object value = body.get(key);
            if (value != null && !value.toString().isBlank()) {
                return new StepResult.TextAnswer(value.toString());
            }
        }
        throw new WorkerCallException("Worker response has no answer field: " + body.keySet());
    }

    private List<NestedHire> decodeHires(Object raw) {
        if (raw == null) {
            return List.of();
        }
        if (!(raw instanceof List<?> list)) {
            throw new WorkerCallException("subAgentHires must be a list");
        }
        List<NestedHire> hires = new ArrayList<>();
        for (Object item : list) {
            Map<String, Object> hire = asMap(item, "subAgentHires entry");
            String workerId = firstString(hire, "workerId", "agent");
            if (workerId == null) {
                throw new WorkerCallException("Nested hire without a worker id: " + hire);
            }
            Object amount = hire.containsKey("amount") ? hire.get("amount") : hire.get("cost");
            hires.add(new NestedHire(
                    workerId,
                    firstString(hire, "capability", "task"),
                    toAmount(amount),
                    firstString(hire, "transaction", "transactionId"),
                    decodeHires(hire.get("hires"))));
        }
        return hires;
    }

    private static BigDecimal toAmount(Object value) {
        if (value == null) {
            throw new WorkerCallException("Nested hire without an amount");
        }
        BigDecimal amount;
        try {
            amount = new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new WorkerCallException("Invalid nested hire amount: " + value, e);
        }
        if (amount.signum() < 0) {
            throw new WorkerCallException("Negative nested hire amount: " + value);
        }
        return amount;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String what) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw new WorkerCallException("Malformed worker response: " + what + " is not an object");
    }

    private static String requireString(Map<String, Object> body, String key) {
        Object value = body.get(key);
        if (value == null || value.toString().isBlank()) {
            throw new WorkerCallException("Malformed worker response: missing " + key);
        }
        return value.toString();
    }

    private static Number requireNumber(Map<String, Object> body, String key) {
        Object value = body.get(key);
        if (value instanceof Number n) {
            return n;
        }
        throw new WorkerCallException("Malformed worker response: " + key + " is not a number");
    }

    private static String firstString(Map<String, Object> body, String... keys) {
        for (String key : keys) {
            Object value = body.get(key);
            if (value != null) {
                return value.toString();
            }
        }
        return null;
    }
}

package com.synergi.core.worker.local;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent evaluator for arithmetic expressions.
 * <p>
 * Supports {@code + - * / %}, {@code ^} (right-associative power), unary minus and parentheses.
 * Characters outside that set are stripped before evaluation. Results are rounded to ten
 * decimal places.
 */
public final class MathExpressionEvaluator {

    public record Evaluation(String sanitized, double value, List<String> steps) {}

    private final String input;
    private int pos;

    private MathExpressionEvaluator(String input) {
        this.input = input;
    }

    /**
     * @throws IllegalArgumentException if the expression is empty, malformed, or not finite
     */
    public static Evaluation evaluate(String expression) {
        if (expression == null) {
            throw new IllegalArgumentException("Expression is required");
        }
        String sanitized = expression.replaceAll("[^0-9+\\-*/().^ %]", "").trim();
        if (sanitized.isEmpty()) {
            throw new IllegalArgumentException("No valid math tokens found in: " + expression);
        }
        List<String> steps = new ArrayList<>();
        steps.add("Input: " + expression);
        steps.add("Sanitized: " + sanitized);

        var parser = new MathExpressionEvaluator(sanitized.replace(" ", ""));
        double value = parser.parseExpression();
        if (parser.pos != parser.input.length()) {
            throw new IllegalArgumentException("Unexpected '" + parser.input.charAt(parser.pos)
                    + "' at position " + parser.pos);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Result is not a finite number");
        }
        double rounded = Math.round(value * 1e10) / 1e10;
        steps.add("Result: " + rounded);
        return new Evaluation(sanitized, rounded, steps);
    }

    private double parseExpression() {
        double value = parseTerm();
        while (pos < input.length()) {
            char op = input.charAt(pos);
            if (op == '+') {
                pos++;
                value += parseTerm();
            } else if (op == '-') {
                pos++;
                value -= parseTerm();
            } else {
                break;
            }
        }
        return value;
    }

    private double parseTerm() {
        double value = parseFactor();
        while (pos < input.length()) {
            char op = input.charAt(pos);
            if (op == '*') {
                pos++;
                value *= parseFactor();
            } else if (op == '/') {
                pos++;
                double divisor = parseFactor();
                if (divisor == 0) {
                    throw new IllegalArgumentException("Division by zero");
                }
                value /= divisor;
            } else if (op == '%') {
                pos++;
                value %= parseFactor();
            } else {
                break;
            }
        }
        return value;
    }

    private double parseFactor() {
        double base = parseUnary();
        if (pos < input.length() && input.charAt(pos) == '^') {
            pos++;
            return Math.pow(base, parseFactor());
        }
        return base;
    }

    private double parseUnary() {
        if (pos < input.length() && input.charAt(pos) == '-') {
            pos++;
            return -parseUnary();
        }
        if (pos < input.length() && input.charAt(pos) == '+') {
            pos++;
            return parseUnary();
        }
        return parsePrimary();
    }

    private double parsePrimary() {
        if (pos >= input.length()) {
            throw new IllegalArgumentException("Unexpected end of expression");
        }
        char c = input.charAt(pos);
        if (c == '(') {
            pos++;
            double value = parseExpression();
            if (pos >= input.length() || input.charAt(pos) != ')') {
                throw new IllegalArgumentException("Missing closing parenthesis");
            }
            pos++;
            return value;
        }
        int start = pos;
        while (pos < input.length() && (Character.isDigit(input.charAt(pos)) || input.charAt(pos) == '.')) {
            pos++;
        }
        if (start == pos) {
            throw new IllegalArgumentException("Unexpected '" + c + "' at position " + pos);
        }
        try {
            return Double.parseDouble(input.substring(start, pos));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number: " + input.substring(start, pos), e);
        }
    }
}

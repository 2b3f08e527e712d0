package com.synergi.core.planner;

import com.synergi.core.config.SynergiProperties;
import com.synergi.core.config.SynergiProperties.KeywordRule;
import com.synergi.core.model.PlannedStep;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic rule-based planner used when the planning collaborator is unavailable.
 * <p>
 * Each rule names a category, a set of keywords, and optionally a regex. A category is planned
 * once, in rule order, when any keyword (or the regex) matches the lower-cased task text.
 * Nothing matching yields a single step for the default category. Never throws for non-null input.
 */
@Component
public class KeywordPlanner {

    static final String REASONING = "Rule-based planning (LLM unavailable).";
    static final String DEFAULT_NOTE = " No specific intent detected, defaulting to ";

    private static final Pattern CITY = Pattern.compile("weather\\s+(?:in\\s+|for\\s+)?([a-z]+)");
    private static final Pattern EXPRESSION = Pattern.compile("[\\d(][\\d+\\-*/().^ %]*[\\d)]");
    private static final Pattern TARGET_LANGUAGE = Pattern.compile("\\b(?:to|into)\\s+([a-z]+)");

    private final List<CompiledRule> rules;
    private final String defaultCategory;

    @Autowired
    public KeywordPlanner(SynergiProperties properties) {
        this(properties.getPlanner().getRules().isEmpty() ? defaultRules() : properties.getPlanner().getRules(),
                properties.getPlanner().getDefaultCategory());
    }

    public KeywordPlanner(List<KeywordRule> rules, String defaultCategory) {
        this.rules = rules.stream().map(CompiledRule::new).toList();
        this.defaultCategory = defaultCategory;
    }

    public PlanOutcome plan(String taskText) {
        String text = taskText == null ? "" : taskText;
        String lower = text.toLowerCase(Locale.ROOT);

        Set<String> matched = new LinkedHashSet<>();
        for (CompiledRule rule : rules) {
            if (rule.matches(lower)) {
                matched.add(rule.category);
            }
        }

        String reasoning = REASONING;
        if (matched.isEmpty()) {
            matched.add(defaultCategory);
            reasoning += DEFAULT_NOTE + defaultCategory + ".";
        }

        List<PlannedStep> steps = new ArrayList<>();
        for (String category : matched) {
            steps.add(new PlannedStep(category, parametersFor(category, text, lower)));
        }
        return new PlanOutcome(steps, reasoning, PlanOutcome.RULES);
    }

    static Map<String, Object> parametersFor(String category, String text, String lower) {
        Map<String, Object> params = new LinkedHashMap<>();
        switch (category) {
            case "data" -> {
                Matcher m = CITY.matcher(lower);
                params.put("city", m.find() ? m.group(1) : "New York");
            }
            case "summarization" -> {
                params.put("text", text);
                params.put("maxLength", 100);
            }
            case "math" -> {
                Matcher m = EXPRESSION.matcher(lower);
                params.put("expression", m.find() ? m.group().trim() : text);
            }
            case "research" -> params.put("query", text);
            case "translation" -> {
                Matcher m = TARGET_LANGUAGE.matcher(lower);
                params.put("text", text);
                params.put("targetLang", m.find() ? capitalize(m.group(1)) : "Spanish");
            }
            case "code" -> params.put("spec", text);
            default -> params.put("text", text);
        }
        return params;
    }

    static List<KeywordRule> defaultRules() {
        return List.of(
                new KeywordRule("data", List.of("weather"), null),
                new KeywordRule("summarization", List.of("summarize", "summary"), null),
                new KeywordRule("sentiment", List.of("sentiment", "feeling", "tone"), null),
                new KeywordRule("math", List.of("calculate", "math"), "\\d+\\s*[+\\-*/^]\\s*\\d+"),
                new KeywordRule("code", List.of("code+explain", "write", "generate", "create"), null),
                new KeywordRule("research", List.of("research", "find out", "what is"), null),
                new KeywordRule("translation", List.of("translate"), null));
    }

    private static String capitalize(String word) {
        return Character.toUpperCase(word.charAt(0)) + word.substring(1);
    }

    private static final class CompiledRule {
        final String category;
        final List<String[]> keywords;
        final Pattern pattern;

        CompiledRule(KeywordRule rule) {
            this.category = rule.getCategory();
            this.keywords = rule.getKeywords().stream()
                    .map(k -> k.toLowerCase(Locale.ROOT).split("\\+"))
                    .toList();
            this.pattern = rule.getPattern() != null && !rule.getPattern().isBlank()
                    ? Pattern.compile(rule.getPattern())
                    : null;
        }

        boolean matches(String lower) {
            for (String[] parts : keywords) {
                boolean all = true;
                for (String part : parts) {
                    if (!lower.contains(part.trim())) {
                        all = false;
                        break;
                    }
                }
                if (all) {
                    return true;
                }
            }
            return pattern != null && pattern.matcher(lower).find();
        }
    }
}

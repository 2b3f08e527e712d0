package com.synergi.core.model;

import java.util.List;
import java.util.Map;

/**
 * Structured plan returned by the language model planner.
 *
 * @param reasoning why these capabilities were picked
 * @param steps ordered capability calls
 */
public record TaskPlan(
    String reasoning,
    List<Step> steps
) {

    /**
     * @param capability capability category, one of the categories offered in the prompt
     * @param parameters string parameters for the worker
     */
    public record Step(String capability, Map<String, String> parameters) {}
}

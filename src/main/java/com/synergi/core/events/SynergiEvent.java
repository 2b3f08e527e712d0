package com.synergi.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Event emitted while a task runs.
 *
 * @param eventType one of {@code step}, {@code payment}, {@code delegated-hire}, {@code done}, {@code error}
 * @param taskId task the event belongs to
 * @param stepIndex plan position of the step involved, null for task-level events
 * @param payload event-specific data
 * @param timestamp when the event was created
 */
public record SynergiEvent(
    String eventType,
    String taskId,
    Integer stepIndex,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String STEP = "step";
    public static final String PAYMENT = "payment";
    public static final String DELEGATED_HIRE = "delegated-hire";
    public static final String DONE = "done";
    public static final String ERROR = "error";

    public static SynergiEvent of(String eventType, String taskId, Integer stepIndex, Map<String, Object> payload) {
        return new SynergiEvent(eventType, taskId, stepIndex, payload, Instant.now());
    }
}

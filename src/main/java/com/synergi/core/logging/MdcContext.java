package com.synergi.core.logging;

import org.slf4j.MDC;

/**
 * Manages the task-scoped MDC keys printed by the log pattern.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId) {
        MDC.put("taskId", taskId);
    }

    public static void setStep(String taskId, int stepIndex, String capability) {
        MDC.put("taskId", taskId);
        MDC.put("stepIndex", String.valueOf(stepIndex));
        MDC.put("capability", capability);
    }

    public static void clearStep() {
        MDC.remove("stepIndex");
        MDC.remove("capability");
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("stepIndex");
        MDC.remove("capability");
    }
}

package com.synergi.core.execution;

import com.synergi.core.model.FailureKind;

/**
 * One attempt at a step failed in a way self-healing can recover from.
 */
public class StepFailureException extends RuntimeException {

    private final FailureKind kind;
    private final String workerId;

    public StepFailureException(FailureKind kind, String workerId, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.workerId = workerId;
    }

    public FailureKind getKind() {
        return kind;
    }

    public String getWorkerId() {
        return workerId;
    }
}

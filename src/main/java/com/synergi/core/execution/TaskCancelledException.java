package com.synergi.core.execution;

/**
 * Thrown at a suspension point when the running task has been cancelled.
 */
public class TaskCancelledException extends RuntimeException {

    public TaskCancelledException(String reason) {
        super("Task cancelled" + (reason != null ? ": " + reason : ""));
    }
}

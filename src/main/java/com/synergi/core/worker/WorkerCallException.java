package com.synergi.core.worker;

/**
 * A worker could not be reached, answered with an error, or returned an unusable body.
 */
public class WorkerCallException extends RuntimeException {

    private final int statusCode;

    public WorkerCallException(String message) {
        this(message, -1, null);
    }

    public WorkerCallException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public WorkerCallException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /** HTTP status, or -1 when the failure was not an HTTP response. */
    public int getStatusCode() {
        return statusCode;
    }
}

package com.synergi.core.engine;

/**
 * The task request was rejected before planning (blank text, negative budget, duplicate id).
 */
public class InvalidTaskException extends RuntimeException {

    public InvalidTaskException(String message) {
        super(message);
    }
}

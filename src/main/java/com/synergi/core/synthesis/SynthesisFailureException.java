package com.synergi.core.synthesis;

/**
 * The summarization collaborator could not produce an answer.
 */
public class SynthesisFailureException extends RuntimeException {

    public SynthesisFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.synergi.core.execution;

import java.time.Duration;

/**
 * Thrown when an external collaborator does not answer before its deadline.
 */
public class CollaboratorTimeoutException extends RuntimeException {

    private final String collaborator;

    public CollaboratorTimeoutException(String collaborator, Duration timeout) {
        super(collaborator + " did not respond within " + timeout.toMillis() + "ms");
        this.collaborator = collaborator;
    }

    public String getCollaborator() {
        return collaborator;
    }
}

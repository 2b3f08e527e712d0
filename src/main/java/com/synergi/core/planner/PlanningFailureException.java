package com.synergi.core.planner;

/**
 * The planning collaborator failed or produced an unusable plan.
 */
public class PlanningFailureException extends RuntimeException {

    public PlanningFailureException(String message) {
        super(message);
    }

    public PlanningFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}

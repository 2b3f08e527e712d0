package com.synergi.core.planner;

import com.synergi.core.model.TaskPlan;

import java.util.Set;

/**
 * External planner that turns task text into capability calls.
 */
public interface PlanningCollaborator {

    /**
     * @param taskText   the requester's task
     * @param categories capability categories currently in the registry
     * @throws PlanningFailureException on any failure or malformed output
     */
    TaskPlan plan(String taskText, Set<String> categories);
}

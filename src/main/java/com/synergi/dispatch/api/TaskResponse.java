package com.synergi.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.synergi.core.model.ExecutionTrace;
import com.synergi.core.model.TaskResult;

/**
 * Task state as returned by the REST API. Only {@code task_id} and {@code status} are
 * present while the task is still running.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
    @JsonProperty("task_id") String taskId,
    @JsonProperty("status") String status,
    @JsonProperty("final_answer") String finalAnswer,
    @JsonProperty("plan_reasoning") String planReasoning,
    @JsonProperty("planned_by") String plannedBy,
    @JsonProperty("cumulative_cost") String cumulativeCost,
    @JsonProperty("delegated_cost") String delegatedCost,
    @JsonProperty("max_depth") Integer maxDepth,
    @JsonProperty("error") String error,
    @JsonProperty("trace") ExecutionTrace trace
) {

    public static final String RUNNING = "RUNNING";
    public static final String COMPLETED = "COMPLETED";
    public static final String CANCELLED = "CANCELLED";
    public static final String FAILED = "FAILED";

    public static TaskResponse from(TaskResult result) {
        ExecutionTrace trace = result.trace();
        return new TaskResponse(
                trace.taskId(),
                trace.cancelled() ? CANCELLED : COMPLETED,
                result.finalAnswer(),
                result.planReasoning(),
                result.plannedBy(),
                trace.cumulativeCost().toPlainString(),
                trace.delegatedCost().toPlainString(),
                trace.maxDepth(),
                null,
                trace);
    }

    public static TaskResponse running(String taskId) {
        return new TaskResponse(taskId, RUNNING, null, null, null, null, null, null, null, null);
    }

    public static TaskResponse failed(String taskId, String error) {
        return new TaskResponse(taskId, FAILED, null, null, null, null, null, null, error, null);
    }
}

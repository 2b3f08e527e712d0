package com.synergi.core.worker;

import com.synergi.core.execution.CancellationToken;
import com.synergi.core.model.PlannedStep;
import com.synergi.core.model.WorkerEntry;

import java.util.Map;

/**
 * Transport for invoking a worker endpoint.
 */
public interface WorkerClient {

    boolean supports(String endpoint);

    /**
     * Invokes the worker with the step's parameters and returns its raw JSON body as a map.
     *
     * @throws WorkerCallException on any transport or worker-side failure
     */
    Map<String, Object> invoke(WorkerEntry worker, PlannedStep step, CancellationToken token);
}

package com.synergi.core.worker;

import com.synergi.core.execution.CancellationToken;
import com.synergi.core.model.PlannedStep;
import com.synergi.core.model.WorkerEntry;
import com.synergi.core.model.WorkerResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Calls a worker through the client that handles its endpoint and decodes the reply.
 */
@Service
public class WorkerInvoker {

    private static final Logger log = LoggerFactory.getLogger(WorkerInvoker.class);

    private final List<WorkerClient> clients;
    private final StepResultDecoder decoder;

    public WorkerInvoker(List<WorkerClient> clients, StepResultDecoder decoder) {
        this.clients = clients;
        this.decoder = decoder;
    }

    /**
     * @throws WorkerCallException if no client handles the endpoint, the call fails, or the body is malformed
     */
    public WorkerResponse call(WorkerEntry worker, PlannedStep step, CancellationToken token) {
        WorkerClient client = clients.stream()
                .filter(c -> c.supports(worker.endpoint()))
                .findFirst()
                .orElseThrow(() -> new WorkerCallException(
                        "No client for endpoint " + worker.endpoint() + " of worker " + worker.id()));
        log.debug("Calling worker {} at {}", worker.id(), worker.endpoint());
        Map<String, Object> body = client.invoke(worker, step, token);
        return decoder.decode(step.capabilityId(), body);
    }
}

package com.synergi.core.engine;

import com.synergi.core.config.SynergiProperties;
import com.synergi.core.events.EventBus;
import com.synergi.core.events.SynergiEvent;
import com.synergi.core.execution.CancellationToken;
import com.synergi.core.execution.ExecutionCoordinator;
import com.synergi.core.execution.TaskCancelledException;
import com.synergi.core.logging.MdcContext;
import com.synergi.core.metrics.SynergiMetrics;
import com.synergi.core.model.ExecutionTrace;
import com.synergi.core.model.StepStatus;
import com.synergi.core.model.TaskResult;
import com.synergi.core.planner.PlanOutcome;
import com.synergi.core.planner.PlannerAdapter;
import com.synergi.core.synthesis.ResponseSynthesizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.Year;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a task end to end: plan, execute under budget, synthesize the answer.
 * <p>
 * Shared by the CLI and the REST API. Each running task holds a cancellation token that
 * {@link #cancel(String)} can trip from another thread. Callers that start a task on another
 * thread reserve its token with {@link #prepare(String)} first, so the task is cancellable from
 * the moment it is accepted.
 */
@Service
public class TaskEngine {

    private static final Logger log = LoggerFactory.getLogger(TaskEngine.class);
    private static final AtomicInteger taskCounter = new AtomicInteger(0);

    public static final String ANONYMOUS = "anonymous";

    private final PlannerAdapter planner;
    private final ExecutionCoordinator coordinator;
    private final ResponseSynthesizer synthesizer;
    private final EventBus eventBus;
    private final SynergiMetrics metrics;
    private final BigDecimal defaultBudget;

    private final ConcurrentHashMap<String, CancellationToken> running = new ConcurrentHashMap<>();
    /** Ids reserved by {@link #prepare(String)} whose {@code runTask} has not started yet. */
    private final Set<String> prepared = ConcurrentHashMap.newKeySet();

    public TaskEngine(PlannerAdapter planner, ExecutionCoordinator coordinator, ResponseSynthesizer synthesizer,
                      EventBus eventBus, SynergiMetrics metrics, SynergiProperties properties) {
        this.planner = planner;
        this.coordinator = coordinator;
        this.synthesizer = synthesizer;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.defaultBudget = properties.getOrchestration().getDefaultBudget();
    }

    public String generateTaskId() {
        return String.format("SYN-%d-%04d", Year.now().getValue(), taskCounter.incrementAndGet());
    }

    public TaskResult runTask(String text, BigDecimal budgetLimit, String requesterId) {
        return runTask(generateTaskId(), text, budgetLimit, requesterId);
    }

    /**
     * @param budgetLimit spending cap; null uses the configured default
     * @param requesterId payer of depth-0 settlements; blank means {@value #ANONYMOUS}
     * @throws InvalidTaskException if the text is blank, the budget negative, or the id already running
     */
    public TaskResult runTask(String taskId, String text, BigDecimal budgetLimit, String requesterId) {
        try {
            validate(text, budgetLimit);
        } catch (InvalidTaskException e) {
            if (prepared.remove(taskId)) {
                running.remove(taskId);
            }
            throw e;
        }
        BigDecimal budget = budgetLimit != null ? budgetLimit : defaultBudget;
        String requester = requesterId != null && !requesterId.isBlank() ? requesterId : ANONYMOUS;

        CancellationToken token = claim(taskId);

        MdcContext.setTask(taskId);
        long start = System.currentTimeMillis();
        try {
            log.info("Task {} accepted from {} with budget {}", taskId, requester, budget);

            long planStart = System.currentTimeMillis();
            PlanOutcome plan = planner.plan(text, token);
            metrics.recordPlanningDuration(System.currentTimeMillis() - planStart, plan.plannedBy());
            log.info("Planned {} step(s) via {}: {}", plan.steps().size(), plan.plannedBy(), plan.reasoning());

            ExecutionTrace trace = coordinator.execute(taskId, plan.steps(), budget, requester, token);
            String answer = synthesizer.synthesize(text, trace);

            String status = trace.cancelled() ? "cancelled" : "completed";
            metrics.recordTaskResult(status, System.currentTimeMillis() - start);
            eventBus.publish(SynergiEvent.of(SynergiEvent.DONE, taskId, null, donePayload(trace, answer, status)));
            log.info("Task {} {}: cost {} (delegated {}), {} succeeded, {} degraded, {} rejected, {} errors",
                    taskId, status, trace.cumulativeCost(), trace.delegatedCost(),
                    trace.count(StepStatus.SUCCESS), trace.count(StepStatus.DEGRADED),
                    trace.count(StepStatus.REJECTED), trace.count(StepStatus.ERROR));
            return new TaskResult(trace, answer, plan.reasoning(), plan.plannedBy());
        } catch (TaskCancelledException e) {
            // cancelled before any step ran, so there is nothing to execute or pay for
            log.info("Task {} cancelled during planning: {}", taskId, e.getMessage());
            Instant now = Instant.now();
            ExecutionTrace trace = new ExecutionTrace(taskId, requester, budget, List.of(), BigDecimal.ZERO,
                    BigDecimal.ZERO, 0, true, now, now);
            String answer = synthesizer.synthesize(text, trace);
            metrics.recordTaskResult("cancelled", System.currentTimeMillis() - start);
            eventBus.publish(SynergiEvent.of(SynergiEvent.DONE, taskId, null, donePayload(trace, answer, "cancelled")));
            return new TaskResult(trace, answer, "Cancelled before a plan was made.", PlanOutcome.LLM);
        } catch (RuntimeException e) {
            log.error("Task {} failed: {}", taskId, e.getMessage(), e);
            metrics.recordTaskResult("failed", System.currentTimeMillis() - start);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("message", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            eventBus.publish(SynergiEvent.of(SynergiEvent.ERROR, taskId, null, payload));
            throw e;
        } finally {
            running.remove(taskId);
            MdcContext.clear();
        }
    }

    /**
     * Reserves a cancellation token for a task that will be started on another thread.
     * The task counts as running, and can be cancelled, from this call on.
     *
     * @throws InvalidTaskException if the id is already running or reserved
     */
    public void prepare(String taskId) {
        if (running.putIfAbsent(taskId, CancellationToken.create()) != null) {
            throw new InvalidTaskException("Task " + taskId + " is already running");
        }
        prepared.add(taskId);
    }

    private CancellationToken claim(String taskId) {
        if (prepared.remove(taskId)) {
            return running.get(taskId);
        }
        CancellationToken token = CancellationToken.create();
        if (running.putIfAbsent(taskId, token) != null) {
            throw new InvalidTaskException("Task " + taskId + " is already running");
        }
        return token;
    }

    /**
     * Cancels a running task. Steps not yet finished are abandoned; payments already made stand.
     *
     * @return false if no task with that id is running
     */
    public boolean cancel(String taskId) {
        CancellationToken token = running.get(taskId);
        if (token == null) {
            return false;
        }
        log.info("Cancelling task {}", taskId);
        token.cancel("cancelled by requester");
        return true;
    }

    public boolean isRunning(String taskId) {
        return running.containsKey(taskId);
    }

    /**
     * Rejects blank text and negative budgets before a task is accepted.
     *
     * @throws InvalidTaskException on invalid input
     */
    public static void validate(String text, BigDecimal budgetLimit) {
        if (text == null || text.isBlank()) {
            throw new InvalidTaskException("Task text is required");
        }
        if (budgetLimit != null && budgetLimit.signum() < 0) {
            throw new InvalidTaskException("Budget limit must not be negative: " + budgetLimit);
        }
    }

    private static Map<String, Object> donePayload(ExecutionTrace trace, String answer, String status) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", status);
        payload.put("cumulativeCost", trace.cumulativeCost().toPlainString());
        payload.put("delegatedCost", trace.delegatedCost().toPlainString());
        payload.put("maxDepth", trace.maxDepth());
        payload.put("steps", trace.outcomes().size());
        payload.put("finalAnswer", answer);
        return payload;
    }
}

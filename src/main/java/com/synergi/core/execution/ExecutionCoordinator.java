package com.synergi.core.execution;

import com.synergi.core.config.SynergiProperties;
import com.synergi.core.events.EventBus;
import com.synergi.core.events.SynergiEvent;
import com.synergi.core.hiring.HiringDecisionEngine;
import com.synergi.core.logging.MdcContext;
import com.synergi.core.metrics.SynergiMetrics;
import com.synergi.core.model.ExecutionTrace;
import com.synergi.core.model.FailureKind;
import com.synergi.core.model.HiringDecision;
import com.synergi.core.model.PlannedStep;
import com.synergi.core.model.StepOutcome;
import com.synergi.core.model.WorkerEntry;
import com.synergi.core.registry.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs a plan step by step under a spending budget.
 * <p>
 * Steps run sequentially. For each one the coordinator resolves the capability, hires the
 * best-ranked worker, rejects the step if its price would take the requester's spend past the
 * budget, and otherwise calls and pays the worker, handing failures to the
 * {@link SelfHealingController}. No step failure stops the plan: every step ends as SUCCESS,
 * DEGRADED, REJECTED or ERROR. After cancellation the remaining steps are reported as ERROR
 * and settlements already made stand.
 */
@Service
public class ExecutionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ExecutionCoordinator.class);

    private final WorkerRegistry registry;
    private final HiringDecisionEngine hiringEngine;
    private final StepInvoker stepInvoker;
    private final SelfHealingController selfHealing;
    private final EventBus eventBus;
    private final SynergiMetrics metrics;
    private final int maxRetries;

    @Autowired
    public ExecutionCoordinator(WorkerRegistry registry, HiringDecisionEngine hiringEngine, StepInvoker stepInvoker,
                                SelfHealingController selfHealing, EventBus eventBus, SynergiMetrics metrics,
                                SynergiProperties properties) {
        this(registry, hiringEngine, stepInvoker, selfHealing, eventBus, metrics,
                properties.getOrchestration().getMaxRetries());
    }

    public ExecutionCoordinator(WorkerRegistry registry, HiringDecisionEngine hiringEngine, StepInvoker stepInvoker,
                                SelfHealingController selfHealing, EventBus eventBus, SynergiMetrics metrics,
                                int maxRetries) {
        this.registry = registry;
        this.hiringEngine = hiringEngine;
        this.stepInvoker = stepInvoker;
        this.selfHealing = selfHealing;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.maxRetries = maxRetries;
    }

    public ExecutionTrace execute(String taskId, List<PlannedStep> plan, BigDecimal budgetLimit,
                                  String requesterId, CancellationToken token) {
        var ctx = new ExecutionContext(taskId, requesterId, budgetLimit, token);
        Instant startedAt = Instant.now();
        List<StepOutcome> outcomes = new ArrayList<>();
        boolean cancelled = false;

        log.info("Executing {} step(s) with budget {}", plan.size(), budgetLimit);
        for (int i = 0; i < plan.size(); i++) {
            PlannedStep step = plan.get(i);
            if (cancelled || token.isCancelled()) {
                cancelled = true;
                outcomes.add(StepOutcome.error(i, step.capabilityId(), FailureKind.CANCELLED,
                        "cancelled before start: " + token.reason()));
                continue;
            }

            MdcContext.setStep(taskId, i, step.capabilityId());
            publishStep(taskId, i, started(step));
            StepOutcome outcome;
            try {
                outcome = runStep(ctx, i, step);
            } catch (TaskCancelledException e) {
                log.info("Step {} abandoned: {}", i, e.getMessage());
                cancelled = true;
                outcome = StepOutcome.error(i, step.capabilityId(), FailureKind.CANCELLED, e.getMessage());
            } finally {
                MdcContext.clearStep();
            }
            outcomes.add(outcome);
            metrics.recordStepOutcome(step.capabilityId(), outcome.status().name());
            publishStep(taskId, i, finished(outcome, ctx));
            log.info("Step {} ({}) -> {}{}", i, step.capabilityId(), outcome.status(),
                    outcome.error() != null ? ": " + outcome.error() : "");
        }

        log.info("Execution finished: cost {} of {}, delegated {}, max depth {}",
                ctx.cumulativeCost(), budgetLimit, ctx.delegatedCost(), ctx.maxDepth());
        return new ExecutionTrace(taskId, requesterId, budgetLimit, outcomes, ctx.cumulativeCost(),
                ctx.delegatedCost(), ctx.maxDepth(), cancelled, startedAt, Instant.now());
    }

    private StepOutcome runStep(ExecutionContext ctx, int index, PlannedStep step) {
        long start = System.nanoTime();
        String capability = step.capabilityId();

        if (!registry.knowsCategory(capability)) {
            return StepOutcome.error(index, capability, FailureKind.CAPABILITY_NOT_FOUND,
                    "Unknown capability: " + capability);
        }

        Optional<HiringDecision> found = hiringEngine.decide(capability, registry);
        if (found.isEmpty()) {
            return StepOutcome.error(index, capability, FailureKind.CAPABILITY_NOT_FOUND,
                    "No active worker for capability " + capability);
        }
        HiringDecision decision = found.get();
        WorkerEntry chosen = decision.chosen();

        if (!ctx.canAfford(chosen.price())) {
            metrics.recordBudgetRejection();
            return StepOutcome.rejected(index, capability, chosen, decision.rationale(),
                    "Budget exceeded: step costs " + chosen.price().toPlainString() + ", spent "
                            + ctx.cumulativeCost().toPlainString() + " of " + ctx.budgetLimit().toPlainString());
        }

        log.info("Hiring {}: {}", chosen.id(), decision.rationale());
        try {
            AttemptResult result = stepInvoker.attempt(ctx, step, chosen, null);
            return Outcomes.success(index, step, result, decision.rationale(), null, 1,
                    SelfHealingController.elapsedMs(start));
        } catch (StepFailureException e) {
            log.warn("Worker {} failed ({}), starting self-heal over {} alternative(s)",
                    chosen.id(), e.getKind(), decision.alternatives().size());
            return selfHealing.heal(ctx, index, step, decision, e, maxRetries, start);
        }
    }

    private void publishStep(String taskId, int index, Map<String, Object> payload) {
        eventBus.publish(SynergiEvent.of(SynergiEvent.STEP, taskId, index, payload));
    }

    private static Map<String, Object> started(PlannedStep step) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("phase", "started");
        payload.put("capability", step.capabilityId());
        return payload;
    }

    private static Map<String, Object> finished(StepOutcome outcome, ExecutionContext ctx) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("phase", "finished");
        payload.put("capability", outcome.capabilityId());
        payload.put("status", outcome.status().name());
        if (outcome.workerId() != null) {
            payload.put("workerId", outcome.workerId());
        }
        if (outcome.selfHealed()) {
            payload.put("selfHealed", true);
            payload.put("originalWorkerId", outcome.originalWorkerId());
        }
        if (outcome.error() != null) {
            payload.put("error", outcome.error());
        }
        payload.put("cumulativeCost", ctx.cumulativeCost().toPlainString());
        return payload;
    }
}

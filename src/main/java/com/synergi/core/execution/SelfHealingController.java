package com.synergi.core.execution;

import com.synergi.core.metrics.SynergiMetrics;
import com.synergi.core.model.FailureKind;
import com.synergi.core.model.HiringDecision;
import com.synergi.core.model.PlannedStep;
import com.synergi.core.model.StepOutcome;
import com.synergi.core.model.WorkerEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces a failed worker with the next-ranked alternatives.
 * <p>
 * At most {@code maxRetries} alternatives are attempted, in ranking order. Alternatives the
 * remaining budget cannot cover are passed over without counting as an attempt. The first
 * success is recorded as self-healed against the originally chosen worker; if none succeeds
 * the step gets a degraded placeholder and no payment is made.
 */
@Component
public class SelfHealingController {

    private static final Logger log = LoggerFactory.getLogger(SelfHealingController.class);

    private final StepInvoker stepInvoker;
    private final DegradedResultFactory degradedResults;
    private final SynergiMetrics metrics;

    public SelfHealingController(StepInvoker stepInvoker, DegradedResultFactory degradedResults,
                                 SynergiMetrics metrics) {
        this.stepInvoker = stepInvoker;
        this.degradedResults = degradedResults;
        this.metrics = metrics;
    }

    /**
     * @param failure   the failure of the originally chosen worker
     * @param startNanos when the step started, for latency
     * @throws TaskCancelledException if the task is cancelled while healing
     */
    public StepOutcome heal(ExecutionContext ctx, int index, PlannedStep step, HiringDecision decision,
                            StepFailureException failure, int maxRetries, long startNanos) {
        WorkerEntry original = decision.chosen();
        List<String> trail = new ArrayList<>();
        trail.add(decision.rationale());
        trail.add(original.name() + " failed (" + failure.getMessage() + ")");

        FailureKind lastKind = failure.getKind();
        String lastError = failure.getMessage();
        int retries = 0;

        for (WorkerEntry alternative : decision.alternatives()) {
            if (retries >= maxRetries) {
                break;
            }
            ctx.token().throwIfCancelled();
            if (!ctx.canAfford(alternative.price())) {
                log.info("Self-heal skipping {}: price {} exceeds remaining budget {}",
                        alternative.id(), alternative.price(), ctx.remainingBudget());
                trail.add("skipped " + alternative.name() + " (over budget)");
                continue;
            }
            retries++;
            log.info("Self-heal attempt {}/{}: switching from {} to {} (reputation {}, price {})",
                    retries, maxRetries, original.id(), alternative.id(), alternative.reputation(), alternative.price());
            try {
                AttemptResult result = stepInvoker.attempt(ctx, step, alternative, original.id());
                trail.add("recovered via " + alternative.name());
                metrics.recordSelfHeal("healed");
                return Outcomes.success(index, step, result, String.join(" | ", trail), original.id(),
                        retries + 1, elapsedMs(startNanos));
            } catch (StepFailureException e) {
                log.warn("Self-heal attempt via {} failed: {}", alternative.id(), e.getMessage());
                trail.add(alternative.name() + " failed (" + e.getMessage() + ")");
                lastKind = e.getKind();
                lastError = e.getMessage();
            }
        }

        log.warn("Self-healing exhausted after {} alternative attempt(s) for {}; returning degraded result",
                retries, step.capabilityId());
        trail.add("degraded after " + retries + " alternative attempt(s)");
        metrics.recordSelfHeal("degraded");
        String error = lastError + " (all alternatives exhausted, last failure " + lastKind + ")";
        return Outcomes.degraded(index, step, original, degradedResults.placeholder(step),
                FailureKind.ALL_ALTERNATIVES_EXHAUSTED, error, String.join(" | ", trail),
                retries + 1, elapsedMs(startNanos));
    }

    static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}

package com.synergi.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Micrometer meters for task execution.
 */
@Service
public class SynergiMetrics {

    private final MeterRegistry registry;

    public SynergiMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPlanningDuration(long ms, String plannedBy) {
        Timer.builder("synergi.planning.duration")
                .tag("planner", plannedBy)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordStepOutcome(String capability, String status) {
        Counter.builder("synergi.steps.total")
                .tag("capability", capability)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordSettlement(BigDecimal amount, boolean delegated) {
        DistributionSummary.builder("synergi.settlement.amount")
                .description("Settled amounts per payment")
                .tag("delegated", String.valueOf(delegated))
                .register(registry)
                .record(amount.doubleValue());
    }

    /**
     * @param outcome "healed" or "degraded"
     */
    public void recordSelfHeal(String outcome) {
        Counter.builder("synergi.selfheal.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordBudgetRejection() {
        Counter.builder("synergi.budget.rejections")
                .register(registry)
                .increment();
    }

    public void recordDelegationDepth(int depth) {
        DistributionSummary.builder("synergi.delegation.depth")
                .register(registry)
                .record(depth);
    }

    public void recordTaskResult(String status, long ms) {
        Counter.builder("synergi.tasks.total")
                .tag("status", status)
                .register(registry)
                .increment();
        Timer.builder("synergi.task.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}

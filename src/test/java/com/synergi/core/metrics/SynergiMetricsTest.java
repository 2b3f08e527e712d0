package com.synergi.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SynergiMetricsTest {

    private SimpleMeterRegistry registry;
    private SynergiMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new SynergiMetrics(registry);
    }

    @Test
    @DisplayName("step outcomes are counted per capability and status")
    void stepOutcomes() {
        metrics.recordStepOutcome("math", "SUCCESS");
        metrics.recordStepOutcome("math", "SUCCESS");
        metrics.recordStepOutcome("data", "ERROR");

        assertEquals(2.0, registry.find("synergi.steps.total")
                .tag("capability", "math").tag("status", "SUCCESS").counter().count());
        assertEquals(1.0, registry.find("synergi.steps.total")
                .tag("capability", "data").tag("status", "ERROR").counter().count());
    }

    @Test
    @DisplayName("settlements are summarized separately for delegated payments")
    void settlements() {
        metrics.recordSettlement(new BigDecimal("0.002"), false);
        metrics.recordSettlement(new BigDecimal("0.003"), false);
        metrics.recordSettlement(new BigDecimal("0.001"), true);

        var direct = registry.find("synergi.settlement.amount").tag("delegated", "false").summary();
        assertEquals(2, direct.count());
        assertEquals(0.005, direct.totalAmount(), 1e-9);
        assertEquals(1, registry.find("synergi.settlement.amount").tag("delegated", "true").summary().count());
    }

    @Test
    @DisplayName("task results record both a counter and a timer")
    void taskResults() {
        metrics.recordTaskResult("completed", 250);

        assertEquals(1.0, registry.find("synergi.tasks.total").tag("status", "completed").counter().count());
        assertEquals(250.0, registry.find("synergi.task.duration").timer().totalTime(TimeUnit.MILLISECONDS), 1e-6);
    }

    @Test
    @DisplayName("planning duration is tagged by planner")
    void planningDuration() {
        metrics.recordPlanningDuration(40, "rules");

        assertEquals(1, registry.find("synergi.planning.duration").tag("planner", "rules").timer().count());
    }

    @Test
    void budgetRejectionsAndDepth() {
        metrics.recordBudgetRejection();
        metrics.recordDelegationDepth(2);

        assertEquals(1.0, registry.find("synergi.budget.rejections").counter().count());
        assertEquals(2.0, registry.find("synergi.delegation.depth").summary().max());
    }
}

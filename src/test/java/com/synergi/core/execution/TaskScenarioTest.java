package com.synergi.core.execution;

import com.synergi.core.engine.TaskEngine;
import com.synergi.core.events.SynergiEvent;
import com.synergi.core.model.ExecutionTrace;
import com.synergi.core.model.SettlementRecord;
import com.synergi.core.model.StepOutcome;
import com.synergi.core.model.StepStatus;
import com.synergi.core.model.TaskResult;
import com.synergi.core.planner.KeywordPlanner;
import com.synergi.core.planner.PlanOutcome;
import com.synergi.core.planner.PlannerAdapter;
import com.synergi.core.planner.PlanningCollaborator;
import com.synergi.core.synthesis.ResponseSynthesizer;
import com.synergi.core.synthesis.SummarizerCollaborator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Whole-task runs through {@link TaskEngine} with the rule-based planner, the real execution
 * stack and the concatenating synthesizer. No language model is involved.
 */
class TaskScenarioTest {

    private ExecutionFixture fx;
    private PlanningCollaborator llmPlanner;
    private TaskEngine engine;
    private final List<SynergiEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        fx = new ExecutionFixture();
        fx.properties.getPlanner().setLlmEnabled(false);
        fx.properties.getSynthesis().setLlmEnabled(false);
        llmPlanner = mock(PlanningCollaborator.class);

        var planner = new PlannerAdapter(llmPlanner, new KeywordPlanner(fx.properties), fx.registry,
                fx.callGuard, fx.properties);
        var synthesizer = new ResponseSynthesizer(mock(SummarizerCollaborator.class), fx.callGuard, fx.properties);
        engine = new TaskEngine(planner, fx.coordinator(), synthesizer, fx.eventBus, fx.metrics, fx.properties);
        fx.eventBus.subscribeAll(events::add);
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    @Test
    @DisplayName("weather in Tokyo: weather is chosen, fails, and weather-backup heals the step")
    void weatherSelfHealsToBackup() {
        fx.worker("weather", "data", "0.001", 90).worker("weather-backup", "data", "0.002", 70);
        fx.workers.fail("weather").answer("weather-backup", step -> Map.of(
                "city", String.valueOf(step.parameter("city")),
                "weather", Map.of("temp", 22, "condition", "Clear", "humidity", 55, "wind", "8 km/h")));

        TaskResult result = engine.runTask("SYN-2026-0100", "weather in Tokyo", new BigDecimal("0.10"), "alice");

        assertEquals(PlanOutcome.RULES, result.plannedBy());
        verifyNoInteractions(llmPlanner);

        ExecutionTrace trace = result.trace();
        assertEquals(1, trace.outcomes().size());
        StepOutcome outcome = trace.outcomes().get(0);
        assertEquals("data", outcome.capabilityId());
        assertEquals(StepStatus.SUCCESS, outcome.status());
        assertEquals("weather-backup", outcome.workerId());
        assertTrue(outcome.selfHealed());
        assertEquals("weather", outcome.originalWorkerId());
        assertEquals(1, fx.workers.calls("weather"));
        assertEquals(1, fx.workers.calls("weather-backup"));

        List<SettlementRecord> records = fx.ledger.all();
        assertEquals(1, records.size());
        SettlementRecord record = records.get(0);
        assertEquals("weather-backup", record.workerId());
        assertEquals("alice", record.payerId());
        assertTrue(record.selfHealed());
        assertEquals("weather", record.originalWorkerId());
        assertEquals(0, record.depth());

        assertEquals(0, new BigDecimal("0.002").compareTo(trace.cumulativeCost()));
        assertTrue(result.finalAnswer().contains("(healed from weather)"), result.finalAnswer());

        SynergiEvent done = events.get(events.size() - 1);
        assertEquals(SynergiEvent.DONE, done.eventType());
        assertEquals("completed", done.payload().get("status"));
    }

    @Test
    @DisplayName("a task cancelled between acceptance and start runs no steps and pays nobody")
    void cancelledBeforeStart() {
        fx.worker("weather", "data", "0.001", 90);

        engine.prepare("SYN-2026-0101");
        assertTrue(engine.cancel("SYN-2026-0101"));
        TaskResult result = engine.runTask("SYN-2026-0101", "weather in Tokyo", null, "alice");

        assertTrue(result.trace().cancelled());
        assertEquals(StepStatus.ERROR, result.trace().outcomes().get(0).status());
        assertEquals(0, fx.workers.calls("weather"));
        assertEquals(0, fx.ledger.size());
        assertFalse(engine.isRunning("SYN-2026-0101"));
        assertEquals("cancelled", events.get(events.size() - 1).payload().get("status"));
    }
}

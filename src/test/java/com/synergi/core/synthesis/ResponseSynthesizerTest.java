package com.synergi.core.synthesis;

import com.synergi.core.config.SynergiProperties;
import com.synergi.core.execution.CallGuard;
import com.synergi.core.model.ExecutionTrace;
import com.synergi.core.model.FailureKind;
import com.synergi.core.model.StepOutcome;
import com.synergi.core.model.StepResult;
import com.synergi.core.model.StepStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link ResponseSynthesizer}.
 */
class ResponseSynthesizerTest {

    private ExecutorService executor;
    private SummarizerCollaborator summarizer;
    private SynergiProperties properties;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        summarizer = mock(SummarizerCollaborator.class);
        properties = new SynergiProperties();
        properties.getOrchestration().getTimeouts().setSummarizer(Duration.ofMillis(300));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private ResponseSynthesizer synthesizer(boolean llmEnabled) {
        properties.getSynthesis().setLlmEnabled(llmEnabled);
        return new ResponseSynthesizer(summarizer, new CallGuard(executor), properties);
    }

    private static StepOutcome outcome(int index, String capability, String workerName, StepStatus status,
                                       StepResult result, boolean selfHealed, String originalWorkerId) {
        boolean degraded = status == StepStatus.DEGRADED;
        return new StepOutcome(index, capability, workerName, workerName, status,
                degraded ? FailureKind.ALL_ALTERNATIVES_EXHAUSTED : null, result, null, "r", null,
                List.of(), List.of(), selfHealed, originalWorkerId, degraded, 1, 5);
    }

    private static ExecutionTrace trace(StepOutcome... outcomes) {
        return new ExecutionTrace("SYN-1", "alice", BigDecimal.ONE, List.of(outcomes), BigDecimal.ZERO,
                BigDecimal.ZERO, 0, false, Instant.now(), Instant.now());
    }

    // -- Concatenation tests --------------------------------------------------

    @Nested
    @DisplayName("without summarizer")
    class Concatenation {

        @Test
        @DisplayName("lists usable results under their worker names in plan order")
        void concatenates() {
            var trace = trace(
                    outcome(0, "math", "Calc", StepStatus.SUCCESS, new StepResult.TextAnswer("4"), false, null),
                    outcome(1, "data", null, StepStatus.DEGRADED, new StepResult.Placeholder("no weather"), false, "wx"),
                    outcome(2, "code", null, StepStatus.REJECTED, null, false, null));

            String answer = synthesizer(false).synthesize("q", trace);

            assertEquals("**Calc**: 4\n\n**data**: no weather _(degraded)_", answer);
            verifyNoInteractions(summarizer);
        }

        @Test
        @DisplayName("self-healed results name the replaced worker")
        void healedLabel() {
            var trace = trace(outcome(0, "math", "Backup", StepStatus.SUCCESS,
                    new StepResult.TextAnswer("4"), true, "primary"));

            assertEquals("**Backup (healed from primary)**: 4", synthesizer(false).synthesize("q", trace));
        }

        @Test
        @DisplayName("a trace with nothing usable reports no results")
        void noResults() {
            var trace = trace(outcome(0, "math", null, StepStatus.ERROR, null, false, null));

            assertEquals(ResponseSynthesizer.NO_RESULTS, synthesizer(true).synthesize("q", trace));
            verifyNoInteractions(summarizer);
        }
    }

    // -- Summarizer tests -----------------------------------------------------

    @Nested
    @DisplayName("with summarizer")
    class Summarizer {

        private final ExecutionTrace trace = trace(
                outcome(0, "math", "Calc", StepStatus.SUCCESS, new StepResult.TextAnswer("4"), false, null));

        @Test
        @DisplayName("returns the summarizer's answer")
        void usesSummarizer() {
            when(summarizer.summarize(anyString(), any())).thenReturn("The answer is 4.");

            assertEquals("The answer is 4.", synthesizer(true).synthesize("2+2?", trace));
            verify(summarizer).summarize(eq("2+2?"), argThat(list -> list.size() == 1));
        }

        @Test
        @DisplayName("falls back to concatenation when the summarizer fails")
        void fallsBackOnFailure() {
            when(summarizer.summarize(anyString(), any())).thenThrow(new SynthesisFailureException("down", null));

            assertEquals("**Calc**: 4", synthesizer(true).synthesize("2+2?", trace));
        }

        @Test
        @DisplayName("falls back when the summarizer answers blank")
        void fallsBackOnBlank() {
            when(summarizer.summarize(anyString(), any())).thenReturn("  ");

            assertEquals("**Calc**: 4", synthesizer(true).synthesize("2+2?", trace));
        }

        @Test
        @DisplayName("falls back when the summarizer times out")
        void fallsBackOnTimeout() {
            when(summarizer.summarize(anyString(), any())).thenAnswer(inv -> {
                Thread.sleep(2000);
                return "late";
            });

            assertEquals("**Calc**: 4", synthesizer(true).synthesize("2+2?", trace));
        }
    }
}

package com.synergi.core.execution;

import com.synergi.core.model.PlannedStep;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DegradedResultFactoryTest {

    private final DegradedResultFactory factory = new DegradedResultFactory();

    @Test
    @DisplayName("weather placeholder names the city")
    void weather() {
        String text = factory.placeholder(new PlannedStep("data", Map.of("city", "Cairo"))).text();
        assertTrue(text.contains("Cairo"));
    }

    @Test
    @DisplayName("summary placeholder quotes a bounded excerpt of the source")
    void summaryExcerpt() {
        String source = "x".repeat(500);
        String text = factory.placeholder(new PlannedStep("summarization", Map.of("text", source))).text();
        assertTrue(text.endsWith("..."));
        assertTrue(text.length() < 200);
    }

    @Test
    @DisplayName("same step always yields the same placeholder")
    void deterministic() {
        var step = new PlannedStep("research", Map.of("query", "q"));
        assertEquals(factory.placeholder(step), factory.placeholder(step));
        assertTrue(factory.placeholder(step).text().contains("research"));
    }
}

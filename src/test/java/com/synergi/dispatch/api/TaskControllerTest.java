package com.synergi.dispatch.api;

import com.synergi.core.engine.InvalidTaskException;
import com.synergi.core.engine.TaskEngine;
import com.synergi.core.model.ExecutionTrace;
import com.synergi.core.model.TaskResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TaskController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class TaskControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private TaskEngine taskEngine;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    private static TaskResult result(String taskId, boolean cancelled) {
        var trace = new ExecutionTrace(taskId, "alice", new BigDecimal("0.05"), List.of(),
                new BigDecimal("0.004"), new BigDecimal("0.002"), 1, cancelled, Instant.now(), Instant.now());
        return new TaskResult(trace, "It is 22°C in New York.", "weather keywords", "rules");
    }

    // -- POST /api/v1/tasks ---------------------------------------------------

    @Test
    @DisplayName("POST /api/v1/tasks runs the task and returns the result")
    void runTask() throws Exception {
        when(taskEngine.runTask(eq("weather in new york"), eq(new BigDecimal("0.05")), eq("alice")))
                .thenReturn(result("SYN-2026-0001", false));

        mockMvc.perform(post("/api/v1/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"weather in new york\",\"budgetLimit\":0.05,\"requesterId\":\"alice\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.task_id").value("SYN-2026-0001"))
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.final_answer").value(containsString("New York")))
                .andExpect(jsonPath("$.planned_by").value("rules"))
                .andExpect(jsonPath("$.cumulative_cost").value("0.004"))
                .andExpect(jsonPath("$.delegated_cost").value("0.002"))
                .andExpect(jsonPath("$.max_depth").value(1))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    @DisplayName("snake_case request fields are accepted")
    void acceptsSnakeCase() throws Exception {
        when(taskEngine.runTask(anyString(), any(), any())).thenReturn(result("SYN-2026-0002", false));

        mockMvc.perform(post("/api/v1/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"2+2\",\"budget_limit\":0.01,\"requester_id\":\"bob\"}"))
                .andExpect(status().isOk());

        verify(taskEngine).runTask("2+2", new BigDecimal("0.01"), "bob");
    }

    @Test
    @DisplayName("invalid task returns 400 with the reason")
    void invalidTask() throws Exception {
        when(taskEngine.runTask(any(), any(), any())).thenThrow(new InvalidTaskException("Task text is required"));

        mockMvc.perform(post("/api/v1/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Task text is required"));
    }

    // -- POST /api/v1/tasks/submit --------------------------------------------

    @Test
    @DisplayName("submit returns 202 with the generated id")
    void submitAccepted() throws Exception {
        when(taskEngine.generateTaskId()).thenReturn("SYN-2026-0042");
        when(taskEngine.runTask(eq("SYN-2026-0042"), anyString(), any(), any()))
                .thenReturn(result("SYN-2026-0042", false));

        mockMvc.perform(post("/api/v1/tasks/submit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"what is 2+2\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.task_id").value("SYN-2026-0042"))
                .andExpect(jsonPath("$.status").value("RUNNING"));

        verify(taskEngine).prepare("SYN-2026-0042");
        verify(taskEngine, timeout(2000)).runTask(eq("SYN-2026-0042"), eq("what is 2+2"), isNull(), isNull());
    }

    @Test
    @DisplayName("submit validates before accepting")
    void submitRejectsNegativeBudget() throws Exception {
        mockMvc.perform(post("/api/v1/tasks/submit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"what is 2+2\",\"budgetLimit\":-1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(containsString("negative")));

        verify(taskEngine, never()).generateTaskId();
    }

    // -- GET /api/v1/tasks/{id} -----------------------------------------------

    @Test
    @DisplayName("GET returns 404 for an unknown task")
    void unknownTask() throws Exception {
        mockMvc.perform(get("/api/v1/tasks/SYN-0000-0000"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET returns the stored result of a finished task")
    void getFinishedTask() throws Exception {
        when(taskEngine.runTask(anyString(), any(), any())).thenReturn(result("SYN-2026-0007", true));
        mockMvc.perform(post("/api/v1/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\":\"weather\"}"));

        mockMvc.perform(get("/api/v1/tasks/SYN-2026-0007"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"))
                .andExpect(jsonPath("$.trace.taskId").value("SYN-2026-0007"));
    }

    // -- POST /api/v1/tasks/{id}/cancel ---------------------------------------

    @Test
    @DisplayName("cancel of a running task returns CANCELLING")
    void cancelRunning() throws Exception {
        when(taskEngine.cancel("SYN-2026-0009")).thenReturn(true);

        mockMvc.perform(post("/api/v1/tasks/SYN-2026-0009/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLING"));
    }

    @Test
    @DisplayName("cancel of an unknown task returns 404")
    void cancelUnknown() throws Exception {
        when(taskEngine.cancel(anyString())).thenReturn(false);

        mockMvc.perform(post("/api/v1/tasks/SYN-NOPE/cancel"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("cancel of a finished task returns 409")
    void cancelFinished() throws Exception {
        when(taskEngine.runTask(anyString(), any(), any())).thenReturn(result("SYN-2026-0010", false));
        when(taskEngine.cancel(anyString())).thenReturn(false);
        mockMvc.perform(post("/api/v1/tasks")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\":\"weather\"}"));

        mockMvc.perform(post("/api/v1/tasks/SYN-2026-0010/cancel"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Task is not running"));
    }

    // -- GET /api/v1/tasks/{id}/events ----------------------------------------

    @Test
    @DisplayName("events endpoint opens an SSE stream for the task")
    void streamEvents() throws Exception {
        when(sseStreamingService.createEmitter("SYN-2026-0011")).thenReturn(new SseEmitter());

        mockMvc.perform(get("/api/v1/tasks/SYN-2026-0011/events").accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(status().isOk())
                .andExpect(request().asyncStarted());

        verify(sseStreamingService).createEmitter("SYN-2026-0011");
    }
}

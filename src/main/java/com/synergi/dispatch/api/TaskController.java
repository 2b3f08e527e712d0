package com.synergi.dispatch.api;

import com.synergi.core.engine.InvalidTaskException;
import com.synergi.core.engine.TaskEngine;
import com.synergi.core.execution.TaskCancelledException;
import com.synergi.core.model.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * REST controller for the task lifecycle.
 */
@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private final TaskEngine taskEngine;
    private final SseStreamingService sseStreamingService;

    /** Latest known state of each submitted task, keyed by task id. */
    private final ConcurrentHashMap<String, TaskResponse> tasks = new ConcurrentHashMap<>();

    public TaskController(TaskEngine taskEngine, SseStreamingService sseStreamingService) {
        this.taskEngine = taskEngine;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/tasks: Run a task and wait for the full trace.
     */
    @PostMapping
    public ResponseEntity<TaskResponse> runTask(@RequestBody TaskRequest request) {
        TaskResult result = taskEngine.runTask(request.text(), request.budgetLimit(), request.requesterId());
        TaskResponse response = TaskResponse.from(result);
        tasks.put(response.taskId(), response);
        return ResponseEntity.ok(response);
    }

    /**
     * POST /api/v1/tasks/submit: Accept a task and run it in the background.
     * Progress is available from {@code /{id}/events}.
     */
    @PostMapping("/submit")
    public ResponseEntity<Map<String, String>> submitTask(@RequestBody TaskRequest request) {
        TaskEngine.validate(request.text(), request.budgetLimit());

        String taskId = taskEngine.generateTaskId();
        taskEngine.prepare(taskId);
        log.info("Accepted task {}, launching async execution", taskId);
        tasks.put(taskId, TaskResponse.running(taskId));

        CompletableFuture.runAsync(() -> {
            try {
                TaskResult result = taskEngine.runTask(taskId, request.text(), request.budgetLimit(),
                        request.requesterId());
                tasks.put(taskId, TaskResponse.from(result));
            } catch (TaskCancelledException e) {
                tasks.put(taskId, TaskResponse.failed(taskId, e.getMessage()));
            } catch (RuntimeException e) {
                log.error("Task {} failed", taskId, e);
                tasks.put(taskId, TaskResponse.failed(taskId,
                        e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
            }
        });

        return ResponseEntity.accepted().body(Map.of(
                "task_id", taskId,
                "status", TaskResponse.RUNNING
        ));
    }

    /**
     * GET /api/v1/tasks/{id}: Current state of a submitted task.
     */
    @GetMapping("/{id}")
    public ResponseEntity<TaskResponse> getTask(@PathVariable String id) {
        TaskResponse response = tasks.get(id);
        if (response == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(response);
    }

    /**
     * POST /api/v1/tasks/{id}/cancel: Cancel a running task.
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<Map<String, String>> cancelTask(@PathVariable String id) {
        if (!taskEngine.cancel(id)) {
            if (!tasks.containsKey(id)) {
                return ResponseEntity.notFound().build();
            }
            return ResponseEntity.status(409).body(Map.of(
                    "task_id", id,
                    "error", "Task is not running"
            ));
        }
        return ResponseEntity.ok(Map.of(
                "task_id", id,
                "status", "CANCELLING"
        ));
    }

    /**
     * GET /api/v1/tasks/{id}/events: Server-sent events for one task.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents(@PathVariable String id) {
        return sseStreamingService.createEmitter(id);
    }

    @ExceptionHandler(InvalidTaskException.class)
    public ResponseEntity<Map<String, String>> handleInvalidTask(InvalidTaskException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(TaskCancelledException.class)
    public ResponseEntity<Map<String, String>> handleCancelled(TaskCancelledException e) {
        return ResponseEntity.status(409).body(Map.of("error", e.getMessage()));
    }
}

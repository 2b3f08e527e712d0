package com.synergi.dispatch.api;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.UUID;

/**
 * Server-sent events across all tasks, for dashboards and {@code synergi watch}.
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventStreamController {

    private final SseStreamingService sseStreamingService;

    public EventStreamController(SseStreamingService sseStreamingService) {
        this.sseStreamingService = sseStreamingService;
    }

    @GetMapping(produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestParam(required = false) String clientId) {
        String id = clientId != null && !clientId.isBlank() ? clientId : UUID.randomUUID().toString();
        return sseStreamingService.createGlobalEmitter(id);
    }
}

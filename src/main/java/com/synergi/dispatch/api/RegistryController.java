package com.synergi.dispatch.api;

import com.synergi.core.model.WorkerEntry;
import com.synergi.core.registry.RegistrySort;
import com.synergi.core.registry.WorkerRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller exposing the worker registry.
 */
@RestController
@RequestMapping("/api/v1/registry")
public class RegistryController {

    private final WorkerRegistry registry;

    public RegistryController(WorkerRegistry registry) {
        this.registry = registry;
    }

    /**
     * GET /api/v1/registry: Workers, optionally filtered by category, sorted by
     * efficiency (default), price, reputation or jobs.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> listWorkers(
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String sort) {
        RegistrySort order;
        try {
            order = RegistrySort.parse(sort);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Invalid sort: " + sort));
        }

        List<WorkerEntry> workers = registry.listAll(category, order);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sort", order.name().toLowerCase());
        if (category != null && !category.isBlank()) {
            body.put("category", category);
        }
        body.put("count", workers.size());
        body.put("workers", workers);
        return ResponseEntity.ok(body);
    }
}

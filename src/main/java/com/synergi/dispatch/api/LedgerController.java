package com.synergi.dispatch.api;

import com.synergi.core.ledger.SettlementLedger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller exposing recent settlements.
 */
@RestController
@RequestMapping("/api/v1/ledger")
public class LedgerController {

    static final int MAX_LIMIT = 1000;

    private final SettlementLedger ledger;

    public LedgerController(SettlementLedger ledger) {
        this.ledger = ledger;
    }

    /**
     * GET /api/v1/ledger: Newest settlements first, with aggregate stats.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> recent(@RequestParam(defaultValue = "50") int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            return ResponseEntity.badRequest().body(
                    Map.of("error", "limit must be between 1 and " + MAX_LIMIT));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("records", ledger.recent(limit));
        body.put("stats", ledger.stats());
        return ResponseEntity.ok(body);
    }
}

package com.synergi.core.health;

import com.synergi.core.config.SynergiProperties;
import com.synergi.core.ledger.SettlementLedger;
import com.synergi.core.registry.WorkerRegistry;
import com.synergi.core.settlement.SettlementCollaborator;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private final WorkerRegistry registry;
    private final SettlementLedger ledger;
    private final SettlementCollaborator settlement;
    private final SynergiProperties properties;

    public HealthCheckService(WorkerRegistry registry, SettlementLedger ledger,
                              SettlementCollaborator settlement, SynergiProperties properties) {
        this.registry = registry;
        this.ledger = ledger;
        this.settlement = settlement;
        this.properties = properties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkRegistry());
        results.add(checkLedger());
        results.add(checkPlanner());
        results.add(checkSettlement());
        return results;
    }

    private HealthStatus checkRegistry() {
        if (registry.size() == 0) {
            return HealthStatus.down("registry", "No workers registered");
        }
        List<String> uncovered = registry.categories().stream()
                .filter(c -> registry.listActive(c).isEmpty())
                .toList();
        if (!uncovered.isEmpty()) {
            return HealthStatus.degraded("registry",
                    "No active worker for: " + String.join(", ", uncovered),
                    Map.of("workers", String.valueOf(registry.size())));
        }
        return HealthStatus.up("registry",
                registry.size() + " workers across " + registry.categories().size() + " categories",
                Map.of("workers", String.valueOf(registry.size())));
    }

    private HealthStatus checkLedger() {
        return HealthStatus.up("ledger",
                ledger.size() + " settlement(s) recorded", Map.of());
    }

    private HealthStatus checkPlanner() {
        boolean llm = properties.getPlanner().isLlmEnabled();
        return HealthStatus.up("planner",
                llm ? "Language model planner with rule-based fallback" : "Rule-based planner",
                Map.of("llmEnabled", String.valueOf(llm)));
    }

    private HealthStatus checkSettlement() {
        return HealthStatus.up("settlement",
                "Settlement mode: " + settlement.mode(),
                Map.of("network", properties.getSettlement().getNetwork()));
    }
}

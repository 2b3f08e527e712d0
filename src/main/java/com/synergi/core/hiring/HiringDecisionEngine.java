package com.synergi.core.hiring;

import com.synergi.core.model.HiringDecision;
import com.synergi.core.model.WorkerEntry;
import com.synergi.core.registry.WorkerRanking;
import com.synergi.core.registry.WorkerRegistry;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ranks the active workers of a category and picks one.
 * <p>
 * Read-only against the registry. The same registry state always yields the same decision:
 * workers are ordered by efficiency (descending), then price (ascending), then registration order.
 */
@Service
public class HiringDecisionEngine {

    /**
     * @return the decision, or empty when no active worker serves {@code category}
     */
    public Optional<HiringDecision> decide(String category, WorkerRegistry registry) {
        List<WorkerEntry> candidates = new ArrayList<>(registry.listActive(category));
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        candidates.sort(WorkerRanking.BY_EFFICIENCY);

        WorkerEntry chosen = candidates.get(0);
        List<WorkerEntry> alternatives = List.copyOf(candidates.subList(1, candidates.size()));
        return Optional.of(new HiringDecision(chosen, rationale(category, chosen, alternatives), alternatives));
    }

    private static String rationale(String category, WorkerEntry chosen, List<WorkerEntry> alternatives) {
        if (alternatives.isEmpty()) {
            return String.format("Only available specialist in category %s: %s (efficiency %.0f)",
                    category, chosen.name(), chosen.efficiency());
        }
        WorkerEntry runnerUp = alternatives.get(0);
        return String.format("Selected %s (efficiency %.0f, price %s, reputation %d) over %s (efficiency %.0f)",
                chosen.name(), chosen.efficiency(), chosen.price().toPlainString(), chosen.reputation(),
                runnerUp.name(), runnerUp.efficiency());
    }
}

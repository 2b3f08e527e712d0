package com.synergi.core.execution;

import com.synergi.core.config.SynergiProperties;
import com.synergi.core.ledger.LedgerIntegrityException;
import com.synergi.core.ledger.SettlementLedger;
import com.synergi.core.metrics.SynergiMetrics;
import com.synergi.core.model.NestedHire;
import com.synergi.core.model.SettlementRecord;
import com.synergi.core.registry.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Records the sub-hires a worker reports as child ledger entries.
 * <p>
 * Walks the reported hire tree depth-first, appending each hire one level below the record of
 * the worker that made it. Sub-hires are paid out of the hiring worker's fee, so the hires one
 * record makes may not add up to more than that record's amount.
 * <p>
 * Refused hires, and everything beneath them, never reach the ledger:
 * <ul>
 *   <li>a hire of the hiring worker itself or of any of its ancestors in the chain (cycle)</li>
 *   <li>a hire below the configured maximum depth</li>
 *   <li>a hire the hiring worker's fee can no longer cover</li>
 *   <li>a hire the ledger rejects</li>
 * </ul>
 */
@Component
public class DelegationIngestor {

    private static final Logger log = LoggerFactory.getLogger(DelegationIngestor.class);

    public record Result(List<SettlementRecord> appended, List<String> refused) {}

    private final SettlementLedger ledger;
    private final WorkerRegistry registry;
    private final SynergiMetrics metrics;
    private final int maxDepth;

    @Autowired
    public DelegationIngestor(SettlementLedger ledger, WorkerRegistry registry, SynergiMetrics metrics,
                              SynergiProperties properties) {
        this(ledger, registry, metrics, properties.getOrchestration().getMaxDelegationDepth());
    }

    public DelegationIngestor(SettlementLedger ledger, WorkerRegistry registry, SynergiMetrics metrics,
                              int maxDepth) {
        this.ledger = ledger;
        this.registry = registry;
        this.metrics = metrics;
        this.maxDepth = maxDepth;
    }

    public Result ingest(ExecutionContext ctx, SettlementRecord root, List<NestedHire> hires) {
        List<SettlementRecord> appended = new ArrayList<>();
        List<String> refused = new ArrayList<>();
        List<String> chain = new ArrayList<>();
        chain.add(root.workerId());
        walk(ctx, root, hires, chain, appended, refused);
        return new Result(appended, refused);
    }

    private void walk(ExecutionContext ctx, SettlementRecord parent, List<NestedHire> hires, List<String> chain,
                      List<SettlementRecord> appended, List<String> refused) {
        BigDecimal spent = BigDecimal.ZERO;
        for (NestedHire hire : hires) {
            String edge = parent.workerId() + " -> " + hire.workerId();
            if (chain.contains(hire.workerId())) {
                log.warn("Refusing delegated hire {}: worker is already in the hiring chain {}", edge, chain);
                refused.add(edge + " (cycle)");
                continue;
            }
            int depth = parent.depth() + 1;
            if (depth > maxDepth) {
                log.warn("Refusing delegated hire {}: depth {} exceeds limit {}", edge, depth, maxDepth);
                refused.add(edge + " (depth limit)");
                continue;
            }
            if (hire.amount() != null && spent.add(hire.amount()).compareTo(parent.amount()) > 0) {
                log.warn("Refusing delegated hire {}: {} would exceed the {} earned by {} ({} already passed on)",
                        edge, hire.amount(), parent.amount(), parent.workerId(), spent);
                refused.add(edge + " (exceeds fee)");
                continue;
            }

            String capability = hire.capabilityId() != null ? hire.capabilityId() : parent.capabilityId();
            String transactionId = hire.transactionId() != null
                    ? hire.transactionId()
                    : "delegated_" + parent.id() + "_" + hire.workerId();
            SettlementRecord record;
            try {
                record = ledger.append(
                        SettlementRecord.delegatedFrom(parent, capability, hire.workerId(), hire.amount(), transactionId));
            } catch (LedgerIntegrityException e) {
                log.warn("Refusing delegated hire {}: {}", edge, e.getMessage());
                refused.add(edge + " (rejected: " + e.getMessage() + ")");
                continue;
            }
            spent = spent.add(record.amount());
            appended.add(record);
            ctx.recordDelegated(record);
            registry.recordOutcome(hire.workerId(), true, hire.amount());
            metrics.recordSettlement(record.amount(), true);
            metrics.recordDelegationDepth(record.depth());
            log.info("Delegated hire {} for {} at depth {}", edge, record.amount(), record.depth());

            chain.add(hire.workerId());
            walk(ctx, record, hire.nested(), chain, appended, refused);
            chain.remove(chain.size() - 1);
        }
    }
}

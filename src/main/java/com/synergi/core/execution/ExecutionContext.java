package com.synergi.core.execution;

import com.synergi.core.model.SettlementRecord;

import java.math.BigDecimal;

/**
 * Budget and depth bookkeeping for one task. Owned by a single execution flow; not thread-safe.
 */
public final class ExecutionContext {

    private final String taskId;
    private final String requesterId;
    private final BigDecimal budgetLimit;
    private final CancellationToken token;

    private BigDecimal cumulativeCost = BigDecimal.ZERO;
    private BigDecimal delegatedCost = BigDecimal.ZERO;
    private int maxDepth;

    public ExecutionContext(String taskId, String requesterId, BigDecimal budgetLimit, CancellationToken token) {
        this.taskId = taskId;
        this.requesterId = requesterId;
        this.budgetLimit = budgetLimit;
        this.token = token;
    }

    public boolean canAfford(BigDecimal price) {
        return cumulativeCost.add(price).compareTo(budgetLimit) <= 0;
    }

    public BigDecimal remainingBudget() {
        return budgetLimit.subtract(cumulativeCost);
    }

    void recordDirect(SettlementRecord record) {
        cumulativeCost = cumulativeCost.add(record.amount());
        maxDepth = Math.max(maxDepth, record.depth());
    }

    void recordDelegated(SettlementRecord record) {
        delegatedCost = delegatedCost.add(record.amount());
        maxDepth = Math.max(maxDepth, record.depth());
    }

    public String taskId() { return taskId; }
    public String requesterId() { return requesterId; }
    public BigDecimal budgetLimit() { return budgetLimit; }
    public CancellationToken token() { return token; }
    public BigDecimal cumulativeCost() { return cumulativeCost; }
    public BigDecimal delegatedCost() { return delegatedCost; }
    public int maxDepth() { return maxDepth; }
}

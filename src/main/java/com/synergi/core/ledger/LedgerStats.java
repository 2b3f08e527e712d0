package com.synergi.core.ledger;

import java.math.BigDecimal;

/**
 * Aggregate view of the ledger.
 */
public record LedgerStats(
    int count,
    int delegatedCount,
    BigDecimal totalVolume,
    BigDecimal delegatedVolume,
    int maxDepth
) {
}

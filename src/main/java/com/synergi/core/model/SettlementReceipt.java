package com.synergi.core.model;

import java.io.Serializable;
import java.math.BigDecimal;

/**
 * Proof of a completed payment returned by the settlement collaborator.
 */
public record SettlementReceipt(
    String transactionId,
    String payerId,
    BigDecimal amount,
    String network
) implements Serializable {
}

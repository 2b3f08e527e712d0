package com.synergi.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Instant;

/**
 * Immutable ledger entry for one completed payment.
 *
 * @param id ledger-wide sequence number, assigned at append time
 * @param timestamp when the record was appended
 * @param taskId task the payment belongs to
 * @param capabilityId capability that was paid for
 * @param payerId requester id at depth 0, the hiring worker's id below that
 * @param workerId worker that was paid
 * @param amount amount paid
 * @param transactionId settlement transaction reference
 * @param delegated true when the payer is itself a worker
 * @param parentRecordId record that spawned this delegated hire, null at depth 0
 * @param depth delegation hops from the requester
 * @param selfHealed true when the worker replaced a failed one
 * @param originalWorkerId the failed worker a self-healed payment replaced
 */
public record SettlementRecord(
    long id,
    Instant timestamp,
    String taskId,
    String capabilityId,
    String payerId,
    String workerId,
    BigDecimal amount,
    String transactionId,
    @JsonProperty("isDelegated") boolean delegated,
    Long parentRecordId,
    int depth,
    boolean selfHealed,
    String originalWorkerId
) implements Serializable {

    /**
     * Returns a copy carrying the id and timestamp assigned by the ledger.
     */
    public SettlementRecord withIdentity(long newId, Instant appendedAt) {
        return new SettlementRecord(newId, appendedAt, taskId, capabilityId, payerId, workerId, amount,
                transactionId, delegated, parentRecordId, depth, selfHealed, originalWorkerId);
    }

    /**
     * Unappended depth-0 record for a requester-paid settlement.
     */
    public static SettlementRecord direct(String taskId, String capabilityId, String payerId, String workerId,
                                          BigDecimal amount, String transactionId,
                                          boolean selfHealed, String originalWorkerId) {
        return new SettlementRecord(0L, null, taskId, capabilityId, payerId, workerId, amount, transactionId,
                false, null, 0, selfHealed, originalWorkerId);
    }

    /**
     * Unappended delegated record one level below {@code parent}.
     */
    public static SettlementRecord delegatedFrom(SettlementRecord parent, String capabilityId, String workerId,
                                                 BigDecimal amount, String transactionId) {
        return new SettlementRecord(0L, null, parent.taskId(), capabilityId, parent.workerId(), workerId, amount,
                transactionId, true, parent.id(), parent.depth() + 1, false, null);
    }
}

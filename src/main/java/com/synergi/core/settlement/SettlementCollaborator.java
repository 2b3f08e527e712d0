package com.synergi.core.settlement;

import com.synergi.core.execution.CancellationToken;
import com.synergi.core.model.SettlementReceipt;

import java.math.BigDecimal;

/**
 * Pays a worker for a completed call.
 */
public interface SettlementCollaborator {

    /**
     * @param workerAddress address to pay
     * @param amount        amount owed
     * @param payerId       party paying
     * @param token         cancelled when the caller stops waiting
     * @return receipt with the transaction id and payer identity
     * @throws SettlementException if the payment fails
     */
    SettlementReceipt pay(String workerAddress, BigDecimal amount, String payerId, CancellationToken token);

    /** Short name reported by health checks. */
    String mode();

    /** Block explorer link for a settled transaction, or null when there is none to show. */
    default String explorerUrl(String transactionId) {
        return null;
    }
}

package com.synergi.core.ledger;

/**
 * Thrown when an append would break the ledger's parent/depth linkage.
 */
public class LedgerIntegrityException extends RuntimeException {

    public LedgerIntegrityException(String message) {
        super(message);
    }
}

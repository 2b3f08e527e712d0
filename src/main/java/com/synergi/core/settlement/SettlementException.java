package com.synergi.core.settlement;

/**
 * The settlement collaborator refused or failed to complete a payment.
 */
public class SettlementException extends RuntimeException {

    public SettlementException(String message) {
        super(message);
    }

    public SettlementException(String message, Throwable cause) {
        super(message, cause);
    }
}

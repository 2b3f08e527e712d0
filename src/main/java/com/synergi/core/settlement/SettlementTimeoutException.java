package com.synergi.core.settlement;

/**
 * No settlement receipt arrived before the deadline.
 */
public class SettlementTimeoutException extends SettlementException {

    public SettlementTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.synergi.core.model;

/**
 * Why a step did not produce a paid result.
 */
public enum FailureKind {
    CAPABILITY_NOT_FOUND,
    BUDGET_EXCEEDED,
    WORKER_CALL_FAILURE,
    SETTLEMENT_ERROR,
    SETTLEMENT_TIMEOUT,
    ALL_ALTERNATIVES_EXHAUSTED,
    CANCELLED
}

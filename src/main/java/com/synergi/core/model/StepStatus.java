package com.synergi.core.model;

/**
 * Final disposition of a planned step. Every step ends in exactly one of these.
 */
public enum StepStatus {
    SUCCESS,
    DEGRADED,
    REJECTED,
    ERROR
}

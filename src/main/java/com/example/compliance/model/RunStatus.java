package com.example.compliance.model;

public enum RunStatus {
    /** Every stage that ran produced structured output. */
    COMPLETED,
    /** At least one stage degraded or failed, at least one was usable. */
    DEGRADED,
    /** No stage produced usable output. */
    FAILED,
    CANCELLED
}

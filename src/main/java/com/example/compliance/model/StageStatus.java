package com.example.compliance.model;

public enum StageStatus {
    /** Structured payload extracted. */
    SUCCEEDED,
    /** Only free text came back. */
    DEGRADED,
    /** Gateway error or nothing extractable. */
    FAILED,
    /** The run was cancelled before or during the stage. */
    CANCELLED,
    /** Disabled for this run. */
    SKIPPED;

    /** Whether the stage produced anything a later stage or the report can use. */
    public boolean usable() {
        return this == SUCCEEDED || this == DEGRADED;
    }
}

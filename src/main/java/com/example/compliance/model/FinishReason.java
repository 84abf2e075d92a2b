package com.example.compliance.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why the model stopped generating a choice.
 */
public enum FinishReason {
    STOP("stop"),
    FUNCTION_CALL("function_call"),
    LENGTH("length"),
    ERROR("error"),
    UNKNOWN("unknown");

    private final String wireValue;

    FinishReason(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /** Lenient parsing: unrecognized or missing values map to {@link #UNKNOWN}. */
    @JsonCreator
    public static FinishReason fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        for (FinishReason reason : values()) {
            if (reason.wireValue.equalsIgnoreCase(raw.trim())) {
                return reason;
            }
        }
        return UNKNOWN;
    }
}

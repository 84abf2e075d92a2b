package com.example.compliance.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Map;

/**
 * Value of the {@code function_call} request field: {@code "auto"}, {@code "none"}
 * or {@code {"name": "..."}} to force a specific function.
 */
public record FunctionCallMode(String mode, String functionName) {

    private static final FunctionCallMode AUTO = new FunctionCallMode("auto", null);
    private static final FunctionCallMode NONE = new FunctionCallMode("none", null);

    public static FunctionCallMode auto() {
        return AUTO;
    }

    public static FunctionCallMode none() {
        return NONE;
    }

    public static FunctionCallMode named(String functionName) {
        return new FunctionCallMode("name", functionName);
    }

    @JsonValue
    public Object wireValue() {
        return functionName != null ? Map.of("name", functionName) : mode;
    }
}

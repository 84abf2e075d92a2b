package com.example.compliance.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Request envelope for one chat completion call, serialized as the gateway wire body.
 * Immutable; {@link #withFunctions} returns a copy.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String model,
        List<ChatMessage> messages,
        Double temperature,
        @JsonProperty("max_tokens") Integer maxTokens,
        List<FunctionDefinition> functions,
        @JsonProperty("function_call") FunctionCallMode functionCall
) {

    public ChatRequest {
        Objects.requireNonNull(model, "model");
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("A chat request needs at least one message");
        }
        messages = List.copyOf(messages);
        functions = functions != null ? List.copyOf(functions) : null;
    }

    public static ChatRequest of(String model, List<ChatMessage> messages, double temperature, int maxTokens) {
        return new ChatRequest(model, messages, temperature, maxTokens, null, null);
    }

    public ChatRequest withFunctions(List<FunctionDefinition> newFunctions, FunctionCallMode mode) {
        return new ChatRequest(model, messages, temperature, maxTokens, newFunctions, mode);
    }

    public boolean structured() {
        return functions != null && !functions.isEmpty();
    }
}

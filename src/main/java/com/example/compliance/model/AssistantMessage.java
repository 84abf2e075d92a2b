package com.example.compliance.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AssistantMessage(
        String role,
        String content,
        @JsonProperty("function_call") FunctionCall functionCall
) {

    public boolean hasText() {
        return content != null && !content.isBlank();
    }
}

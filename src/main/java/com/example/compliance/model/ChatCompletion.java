package com.example.compliance.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Wire body of a chat completion response.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatCompletion(
        List<Choice> choices,
        String model,
        TokenUsage usage
) {}

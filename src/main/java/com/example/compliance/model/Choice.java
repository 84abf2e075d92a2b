package com.example.compliance.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Choice(
        int index,
        @JsonProperty("finish_reason") FinishReason finishReason,
        AssistantMessage message
) {

    public Choice {
        if (finishReason == null) finishReason = FinishReason.UNKNOWN;
    }
}

package com.example.compliance.model;

import java.util.List;

/**
 * Gateway response as handed to the extraction step: the completion choices, the token usage
 * and the number of transport attempts it took to obtain them. Never mutated.
 */
public record RawResponse(
        List<Choice> choices,
        TokenUsage usage,
        int attempts
) {

    public RawResponse {
        choices = choices != null ? List.copyOf(choices) : List.of();
        if (usage == null) usage = TokenUsage.NONE;
    }

    public static RawResponse of(ChatCompletion completion, int attempts) {
        return new RawResponse(completion.choices(), completion.usage(), attempts);
    }

    public boolean isEmpty() {
        return choices.isEmpty();
    }
}

package com.example.compliance.model;

/**
 * Free text returned where structured output was requested. Degraded but usable.
 */
public record TextFallback(String text, FinishReason finishReason) implements ExtractedResult {

    @Override
    public Kind kind() {
        return Kind.TEXT_FALLBACK;
    }

    @Override
    public String describe() {
        String suffix = finishReason == FinishReason.LENGTH ? ", truncated" : "";
        return "text fallback (" + text.length() + " chars" + suffix + ")";
    }
}

package com.example.compliance.model;

/**
 * Outcome of normalizing a {@link RawResponse}. Exactly one of the three variants; callers
 * switch on {@link #kind()} instead of inspecting response keys.
 */
public sealed interface ExtractedResult permits StructuredPayload, TextFallback, ExtractionFailure {

    enum Kind { STRUCTURED, TEXT_FALLBACK, FAILURE }

    Kind kind();

    /** Short human-readable description for logs and the diagnostic trail. */
    String describe();
}

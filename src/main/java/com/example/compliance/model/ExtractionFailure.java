package com.example.compliance.model;

/**
 * Nothing usable could be extracted.
 *
 * @param reason       diagnostic message
 * @param rawArguments function-call arguments as received, kept for diagnostics; may be {@code null}
 */
public record ExtractionFailure(String reason, String rawArguments) implements ExtractedResult {

    public static ExtractionFailure of(String reason) {
        return new ExtractionFailure(reason, null);
    }

    @Override
    public Kind kind() {
        return Kind.FAILURE;
    }

    @Override
    public String describe() {
        return reason;
    }
}

package com.example.compliance.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Function-call arguments that parsed as JSON and validated against the requested schema.
 *
 * @param functionName name of the schema the data conforms to
 * @param data         the validated arguments object
 */
public record StructuredPayload(String functionName, JsonNode data) implements ExtractedResult {

    @Override
    public Kind kind() {
        return Kind.STRUCTURED;
    }

    @Override
    public String describe() {
        return "structured payload from " + functionName;
    }
}

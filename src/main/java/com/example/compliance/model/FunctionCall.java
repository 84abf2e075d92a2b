package com.example.compliance.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Function call emitted by the model. The gateway may send {@code arguments} either as a
 * JSON-encoded string or as an embedded JSON object.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FunctionCall(String name, JsonNode arguments) {

    /** Raw argument text, as received, for diagnostics. */
    public String argumentsText() {
        if (arguments == null || arguments.isNull() || arguments.isMissingNode()) {
            return null;
        }
        return arguments.isTextual() ? arguments.asText() : arguments.toString();
    }
}

package com.example.compliance.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Function offered to the model for structured output.
 *
 * @param name        function name, also the key the response is matched against
 * @param description what the function returns
 * @param parameters  JSON Schema of the arguments object
 */
public record FunctionDefinition(
        String name,
        String description,
        JsonNode parameters
) {}

package com.example.compliance.gateway;

import com.example.compliance.model.AssistantMessage;
import com.example.compliance.model.Choice;
import com.example.compliance.model.ExtractedResult;
import com.example.compliance.model.ExtractionFailure;
import com.example.compliance.model.FinishReason;
import com.example.compliance.model.FunctionCall;
import com.example.compliance.model.RawResponse;
import com.example.compliance.model.StructuredPayload;
import com.example.compliance.model.TextFallback;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Normalizes a {@link RawResponse} into an {@link ExtractedResult}.
 * <ol>
 *   <li>No choices: failure "empty response".</li>
 *   <li>First choice finished with {@code function_call} naming the expected function: the arguments
 *       are parsed and validated; on any problem the raw arguments are kept in the failure.</li>
 *   <li>Otherwise non-blank text: {@link TextFallback}.</li>
 *   <li>Otherwise: failure "unrecognized response shape".</li>
 * </ol>
 * A matching function call wins over text sent alongside it.
 */
public class ResponseExtractor {

    private static final Logger log = LoggerFactory.getLogger(ResponseExtractor.class);

    /** Tolerates trailing commas, comments, single quotes and unquoted names in model output. */
    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final FunctionSchemaRegistry schemas;

    public ResponseExtractor(FunctionSchemaRegistry schemas) {
        this.schemas = schemas;
    }

    public ExtractedResult extract(RawResponse response, String expectedSchemaName) {
        if (response == null || response.isEmpty()) {
            return ExtractionFailure.of("empty response");
        }

        Choice choice = response.choices().get(0);
        AssistantMessage message = choice.message();
        FunctionCall call = message != null ? message.functionCall() : null;

        if (choice.finishReason() == FinishReason.FUNCTION_CALL && call != null
                && expectedSchemaName.equals(call.name())) {
            return parseArguments(call, expectedSchemaName);
        }

        if (message != null && message.hasText()) {
            if (call != null) {
                log.warn("{}: model called '{}' instead, falling back to text", expectedSchemaName, call.name());
            } else {
                log.warn("{}: model returned text instead of a function call", expectedSchemaName);
            }
            return new TextFallback(message.content(), choice.finishReason());
        }

        log.warn("{}: unrecognized response shape (finish_reason={})", expectedSchemaName, choice.finishReason());
        return new ExtractionFailure("unrecognized response shape", call != null ? call.argumentsText() : null);
    }

    private ExtractedResult parseArguments(FunctionCall call, String schemaName) {
        String raw = call.argumentsText();
        if (raw == null || raw.isBlank()) {
            return new ExtractionFailure("function call " + schemaName + " has no arguments", raw);
        }

        JsonNode arguments = call.arguments();
        if (arguments.isTextual()) {
            try {
                arguments = LENIENT_MAPPER.readTree(raw);
            } catch (JsonProcessingException e) {
                log.warn("{}: arguments are not valid JSON — {}", schemaName, e.getOriginalMessage());
                return new ExtractionFailure("arguments of " + schemaName + " are not valid JSON: "
                        + e.getOriginalMessage(), raw);
            }
        }
        if (arguments == null || !arguments.isObject()) {
            return new ExtractionFailure("arguments of " + schemaName + " are not a JSON object", raw);
        }

        List<String> violations = schemas.validate(schemaName, arguments);
        if (!violations.isEmpty()) {
            log.warn("{}: arguments violate the schema — {}", schemaName, violations);
            return new ExtractionFailure("arguments of " + schemaName + " do not match the schema: "
                    + String.join("; ", violations), raw);
        }
        return new StructuredPayload(schemaName, arguments);
    }
}

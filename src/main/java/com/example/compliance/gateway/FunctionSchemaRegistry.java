package com.example.compliance.gateway;

import com.example.compliance.model.FunctionDefinition;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Function definitions offered to the model, loaded from {@code classpath:schemas/<name>.json},
 * with the compiled JSON Schema of each definition's {@code parameters}.
 */
public class FunctionSchemaRegistry {

    private static final Logger log = LoggerFactory.getLogger(FunctionSchemaRegistry.class);

    static final String LOCATION = "schemas/";

    private final Map<String, FunctionDefinition> definitions = new LinkedHashMap<>();
    private final Map<String, JsonSchema> schemas = new LinkedHashMap<>();

    public FunctionSchemaRegistry(ObjectMapper objectMapper, Collection<String> functionNames) {
        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
        for (String name : functionNames) {
            FunctionDefinition definition = load(objectMapper, name);
            definitions.put(name, definition);
            schemas.put(name, factory.getSchema(definition.parameters()));
        }
        log.info("FunctionSchemaRegistry: loaded {} function schemas {}", definitions.size(), definitions.keySet());
    }

    public FunctionDefinition definition(String name) {
        FunctionDefinition definition = definitions.get(name);
        if (definition == null) {
            throw new IllegalArgumentException("Unknown function schema: " + name);
        }
        return definition;
    }

    public Optional<FunctionDefinition> find(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    /**
     * Validates {@code arguments} against the parameters schema of {@code name}.
     *
     * @return violation messages, empty when the arguments conform
     */
    public List<String> validate(String name, JsonNode arguments) {
        JsonSchema schema = schemas.get(name);
        if (schema == null) {
            throw new IllegalArgumentException("Unknown function schema: " + name);
        }
        Set<ValidationMessage> messages = schema.validate(arguments);
        return messages.stream().map(ValidationMessage::getMessage).sorted().toList();
    }

    private static FunctionDefinition load(ObjectMapper objectMapper, String name) {
        ClassPathResource resource = new ClassPathResource(LOCATION + name + ".json");
        try (InputStream in = resource.getInputStream()) {
            FunctionDefinition definition = objectMapper.readValue(in, FunctionDefinition.class);
            if (!name.equals(definition.name())) {
                throw new IllegalStateException("Schema file " + resource.getPath()
                        + " declares function '" + definition.name() + "'");
            }
            if (definition.parameters() == null || !definition.parameters().isObject()) {
                throw new IllegalStateException("Schema file " + resource.getPath() + " has no parameters object");
            }
            return definition;
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to load function schema " + resource.getPath(), e);
        }
    }
}

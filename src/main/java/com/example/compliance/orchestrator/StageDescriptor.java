package com.example.compliance.orchestrator;

import com.example.compliance.model.StageName;

import java.util.function.Function;

/**
 * Everything the generic {@link StageRunner} needs to execute one stage.
 *
 * @param stage        the stage
 * @param functionName name of the function schema the model is asked to call
 * @param systemPrompt instructions sent as the system message
 * @param userPrompt   builds the user message from the bundle and the earlier results
 */
public record StageDescriptor(
        StageName stage,
        String functionName,
        String systemPrompt,
        Function<StageContext, String> userPrompt
) {}

package com.example.compliance.orchestrator;

import com.example.compliance.config.AnalyzerProperties;
import com.example.compliance.gateway.FunctionSchemaRegistry;
import com.example.compliance.gateway.GatewayClient;
import com.example.compliance.gateway.GatewayClientException;
import com.example.compliance.gateway.ResponseExtractor;
import com.example.compliance.gateway.TransportException;
import com.example.compliance.model.ChatMessage;
import com.example.compliance.model.ChatRequest;
import com.example.compliance.model.ExtractedResult;
import com.example.compliance.model.ExtractionFailure;
import com.example.compliance.model.FunctionCallMode;
import com.example.compliance.model.FunctionDefinition;
import com.example.compliance.model.RawResponse;
import com.example.compliance.model.StageName;
import com.example.compliance.model.StageResult;
import com.example.compliance.model.StageStatus;
import com.example.compliance.model.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Executes one {@link StageDescriptor}: builds the request, calls the gateway in structured mode
 * and turns whatever happens into a {@link StageResult}. Never throws for a stage failure.
 */
@Component
public class StageRunner {

    private static final Logger log = LoggerFactory.getLogger(StageRunner.class);

    private final GatewayClient gatewayClient;
    private final ResponseExtractor extractor;
    private final FunctionSchemaRegistry schemas;
    private final AnalyzerProperties.Gateway settings;

    public StageRunner(GatewayClient gatewayClient,
                       ResponseExtractor extractor,
                       FunctionSchemaRegistry schemas,
                       AnalyzerProperties properties) {
        this.gatewayClient = gatewayClient;
        this.extractor = extractor;
        this.schemas = schemas;
        this.settings = properties.gateway();
    }

    /**
     * @param cancelled reports whether the owning run has been cancelled
     */
    public StageResult run(StageDescriptor descriptor, StageContext context, BooleanSupplier cancelled) {
        StageName stage = descriptor.stage();
        long start = System.nanoTime();
        try {
            FunctionDefinition function = schemas.definition(descriptor.functionName());
            ChatRequest request = ChatRequest.of(settings.model(), List.of(
                            ChatMessage.system(descriptor.systemPrompt()),
                            ChatMessage.user(descriptor.userPrompt().apply(context))),
                    settings.temperature(), settings.maxTokens());

            RawResponse response = gatewayClient.completeStructured(request, List.of(function), FunctionCallMode.auto());
            if (cancelled.getAsBoolean()) {
                return StageResult.cancelled(stage, elapsedSince(start), response.attempts());
            }

            ExtractedResult extracted = extractor.extract(response, descriptor.functionName());
            StageStatus status = switch (extracted.kind()) {
                case STRUCTURED -> StageStatus.SUCCEEDED;
                case TEXT_FALLBACK -> StageStatus.DEGRADED;
                case FAILURE -> StageStatus.FAILED;
            };
            return new StageResult(stage, status, extracted, elapsedSince(start), response.attempts(),
                    extracted.describe(), response.usage());

        } catch (GatewayClientException e) {
            if (cancelled.getAsBoolean() || (e instanceof TransportException transport && transport.isCancelled())) {
                return StageResult.cancelled(stage, elapsedSince(start), e.attempts());
            }
            log.error("StageRunner: {} stage failed after {} attempt(s)", stage, e.attempts(), e);
            return failed(stage, e.getClass().getSimpleName() + ": " + e.getMessage(), start, e.attempts());
        } catch (RuntimeException e) {
            if (cancelled.getAsBoolean()) {
                return StageResult.cancelled(stage, elapsedSince(start), 0);
            }
            log.error("StageRunner: {} stage crashed", stage, e);
            return failed(stage, "internal error: " + e.getMessage(), start, 0);
        }
    }

    private static StageResult failed(StageName stage, String diagnostic, long start, int attempts) {
        return new StageResult(stage, StageStatus.FAILED,
                new ExtractionFailure(diagnostic, null),
                elapsedSince(start), attempts, diagnostic, TokenUsage.NONE);
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}

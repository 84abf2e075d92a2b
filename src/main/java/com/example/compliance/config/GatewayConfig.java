package com.example.compliance.config;

import com.example.compliance.gateway.CredentialManager;
import com.example.compliance.gateway.FunctionSchemaRegistry;
import com.example.compliance.gateway.GatewayClient;
import com.example.compliance.gateway.OAuthTokenExchange;
import com.example.compliance.gateway.ResilientTransport;
import com.example.compliance.gateway.ResponseExtractor;
import com.example.compliance.gateway.RetryPolicy;
import com.example.compliance.orchestrator.AnalysisPipeline;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wiring of the gateway client stack and the executor that runs analyses.
 * <p>
 * - gatewayRestClient: JDK HttpClient with the per-attempt timeout as connect and read timeout
 * - credentialManager: the single owner of the gateway token for the whole process
 */
@Configuration
public class GatewayConfig {

    /**
     * ObjectMapper shared for JSON serialization.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Bean
    public RestClient gatewayRestClient(RestClient.Builder builder, AnalyzerProperties properties) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.retry().timeout())
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(properties.retry().timeout());
        return builder.requestFactory(factory).build();
    }

    @Bean
    public CredentialManager credentialManager(RestClient gatewayRestClient, AnalyzerProperties properties) {
        AnalyzerProperties.Gateway gateway = properties.gateway();
        OAuthTokenExchange exchange = new OAuthTokenExchange(gatewayRestClient, gateway.authUrl(), gateway.scope());
        return new CredentialManager(gateway.credentialSecret(), exchange,
                gateway.tokenSafetyMargin(), Clock.systemUTC());
    }

    @Bean
    public ResilientTransport resilientTransport(CredentialManager credentialManager, AnalyzerProperties properties) {
        AnalyzerProperties.Retry retry = properties.retry();
        RetryPolicy policy = new RetryPolicy(retry.maxAttempts(), retry.baseDelay(), retry.maxJitter(), retry.timeout());
        return new ResilientTransport(policy, credentialManager);
    }

    @Bean
    public GatewayClient gatewayClient(RestClient gatewayRestClient, ResilientTransport resilientTransport,
                                       AnalyzerProperties properties) {
        return new GatewayClient(gatewayRestClient, resilientTransport, properties.gateway().baseUrl());
    }

    @Bean
    public FunctionSchemaRegistry functionSchemaRegistry(ObjectMapper objectMapper) {
        return new FunctionSchemaRegistry(objectMapper, AnalysisPipeline.functionNames());
    }

    @Bean
    public ResponseExtractor responseExtractor(FunctionSchemaRegistry functionSchemaRegistry) {
        return new ResponseExtractor(functionSchemaRegistry);
    }

    /**
     * Executor for analysis runs. Each run occupies one thread for its whole pipeline.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService analysisExecutor(AnalyzerProperties properties) {
        AtomicInteger sequence = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, "analysis-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, properties.analysis().workerThreads()), threads);
    }
}

package com.example.compliance.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties of the analyzer.
 */
@ConfigurationProperties(prefix = "analyzer")
public record AnalyzerProperties(
        Gateway gateway,
        Retry retry,
        Analysis analysis
) {

    /**
     * Remote LLM gateway.
     *
     * @param baseUrl           chat API base URL (the completions path is appended)
     * @param authUrl           token exchange endpoint
     * @param scope             scope requested in the token exchange
     * @param credentialSecret  long-lived authorization key, sent as Basic credentials
     * @param model             model identifier
     * @param temperature       sampling temperature
     * @param maxTokens         maximum output size per completion
     * @param tokenSafetyMargin how long before server-side expiry a token stops being used
     */
    public record Gateway(
            String baseUrl,
            String authUrl,
            String scope,
            String credentialSecret,
            String model,
            double temperature,
            int maxTokens,
            Duration tokenSafetyMargin
    ) {}

    /**
     * Retry behaviour of gateway calls.
     *
     * @param maxAttempts attempts per call
     * @param baseDelay   first backoff delay, doubled per attempt
     * @param maxJitter   upper bound of the random delay added to each backoff
     * @param timeout     per-attempt connect and read timeout
     */
    public record Retry(int maxAttempts, Duration baseDelay, Duration maxJitter, Duration timeout) {}

    /**
     * Analysis runs.
     *
     * @param securityEnabled default of the security flag when a request does not set it
     * @param requestTimeout  how long an inbound request waits for its run before cancelling it
     * @param workerThreads   size of the pool that executes runs
     */
    public record Analysis(boolean securityEnabled, Duration requestTimeout, int workerThreads) {}
}

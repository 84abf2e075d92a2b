package com.example.compliance.controller;

import com.example.compliance.config.AnalyzerProperties;
import com.example.compliance.gateway.CredentialManager;
import com.example.compliance.model.AggregateReport;
import com.example.compliance.model.AnalysisBundle;
import com.example.compliance.orchestrator.AnalysisOrchestrator;
import com.example.compliance.orchestrator.AnalysisRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.context.request.async.DeferredResult;

import java.time.Duration;
import java.util.Map;

/**
 * REST controller for compliance analysis.
 */
@RestController
@RequestMapping("/api")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    private final AnalysisOrchestrator orchestrator;
    private final CredentialManager credentialManager;
    private final boolean securityByDefault;
    private final Duration requestTimeout;

    public AnalysisController(AnalysisOrchestrator orchestrator,
                              CredentialManager credentialManager,
                              AnalyzerProperties properties) {
        this.orchestrator = orchestrator;
        this.credentialManager = credentialManager;
        this.securityByDefault = properties.analysis().securityEnabled();
        this.requestTimeout = properties.analysis().requestTimeout();
    }

    /**
     * Analyzes requirements, code, tests and documentation and returns the aggregate report.
     * The run is cancelled when the request times out or the client goes away.
     *
     * <p>Endpoint: POST /api/analyze
     * <p>Content-Type: application/json
     */
    @PostMapping(value = "/analyze", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public DeferredResult<ResponseEntity<?>> analyze(@RequestBody AnalysisRequest request) {
        AnalysisBundle bundle = request.toBundle(securityByDefault);

        log.info("Received analysis request ({} chars of requirements, {} chars of code, {} chars of tests)",
                bundle.requirements().length(), bundle.code().length(), bundle.tests().length());

        AnalysisRun run = orchestrator.submit(bundle);
        DeferredResult<ResponseEntity<?>> result = new DeferredResult<>(requestTimeout.toMillis());

        result.onTimeout(() -> {
            log.warn("Run {} timed out after {}, cancelling", run.runId(), requestTimeout);
            run.cancel();
            result.setResult(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "Analysis timed out", "run_id", run.runId())));
        });
        result.onError(error -> {
            log.warn("Run {} lost its client, cancelling: {}", run.runId(), error.getMessage());
            run.cancel();
        });

        run.report().whenComplete((AggregateReport report, Throwable error) -> {
            if (error == null) {
                result.setResult(ResponseEntity.ok(report));
                return;
            }
            log.error("Error during analysis run {}", run.runId(), error);
            result.setResult(ResponseEntity.internalServerError()
                    .body(Map.of(
                            "error", "Error during analysis",
                            "message", error.getMessage() != null ? error.getMessage() : "Unknown error"
                    )));
        });
        return result;
    }

    /**
     * Reports service liveness and whether a gateway token is currently cached.
     *
     * <p>Endpoint: GET /api/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "service", "compliance-analyzer",
                "credential", credentialManager.hasUsableToken() ? "cached" : "absent"
        ));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        log.info("Rejected analysis request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}

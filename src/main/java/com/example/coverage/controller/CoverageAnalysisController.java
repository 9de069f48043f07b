package com.example.coverage.controller;

import com.example.coverage.config.CoverageProperties;
import com.example.coverage.config.UnknownTenantException;
import com.example.coverage.config.VocabularyRegistry;
import com.example.coverage.model.CoverageAnalysisRequest;
import com.example.coverage.model.CoverageAnalysisResult;
import com.example.coverage.model.LineItem;
import com.example.coverage.orchestrator.CoverageAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.TreeSet;

/**
 * REST controller for claim coverage analysis.
 */
@RestController
@RequestMapping("/api/coverage")
public class CoverageAnalysisController {

    private static final Logger log = LoggerFactory.getLogger(CoverageAnalysisController.class);

    private final CoverageAnalyzer analyzer;
    private final VocabularyRegistry vocabularyRegistry;
    private final CoverageProperties properties;

    public CoverageAnalysisController(CoverageAnalyzer analyzer,
                                      VocabularyRegistry vocabularyRegistry,
                                      CoverageProperties properties) {
        this.analyzer = analyzer;
        this.vocabularyRegistry = vocabularyRegistry;
        this.properties = properties;
    }

    /**
     * Analyzes the line items of one claim against its policy.
     *
     * <p>Endpoint: POST /api/coverage/analyze
     * <p>Content-Type: application/json
     */
    @PostMapping(value = "/analyze", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> analyze(@RequestBody CoverageAnalysisRequest request) {
        // ── Input validation ──
        if (request.claimId() == null || request.claimId().isBlank()) {
            return badRequest("claimId is required.");
        }
        if (request.lineItems().isEmpty()) {
            return badRequest("At least one line item is required.");
        }
        if (request.policy() == null) {
            return badRequest("policy is required.");
        }
        for (int i = 0; i < request.lineItems().size(); i++) {
            LineItem item = request.lineItems().get(i);
            if (item == null || item.description().isBlank()) {
                return badRequest("Line item " + i + " has no description.");
            }
        }

        log.info("Received coverage request for claim '{}' ({} items, tenant {})",
                request.claimId(), request.lineItems().size(),
                request.tenant() != null ? request.tenant() : "default");

        try {
            CoverageAnalysisResult result = analyzer.analyze(request);
            return ResponseEntity.ok(result);
        } catch (UnknownTenantException e) {
            log.warn("Rejected claim '{}': {}", request.claimId(), e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Error during coverage analysis of claim '{}'", request.claimId(), e);
            return ResponseEntity.internalServerError()
                    .body(Map.of(
                            "error", "Error during analysis",
                            "message", e.getMessage() != null ? e.getMessage() : "Unknown error"
                    ));
        }
    }

    /**
     * Loaded tenants and LLM status.
     *
     * <p>Endpoint: GET /api/coverage/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "service", "coverage-engine",
                "tenants", new TreeSet<>(vocabularyRegistry.tenants()),
                "llmEnabled", properties.llm().enabled()
        ));
    }

    private ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }
}

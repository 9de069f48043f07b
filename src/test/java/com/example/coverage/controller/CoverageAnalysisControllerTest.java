package com.example.coverage.controller;

import com.example.coverage.config.CoverageProperties;
import com.example.coverage.config.TenantVocabulary;
import com.example.coverage.config.UnknownTenantException;
import com.example.coverage.config.VocabularyRegistry;
import com.example.coverage.model.CoverageAnalysisRequest;
import com.example.coverage.model.CoverageAnalysisResult;
import com.example.coverage.model.ExclusionReason;
import com.example.coverage.model.ItemType;
import com.example.coverage.model.NonCoveredExplanation;
import com.example.coverage.model.PrimaryRepairResult;
import com.example.coverage.model.RepairContext;
import com.example.coverage.orchestrator.CoverageAnalyzer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("CoverageAnalysisController Tests")
class CoverageAnalysisControllerTest {

    private static final String VALID_REQUEST = """
            {
              "claimId": "CLM-1",
              "lineItems": [
                {"description": "Ölkühler", "itemType": "teile", "totalPrice": 480.00},
                {"description": "Main d'œuvre", "itemType": "labor", "totalPrice": 300.00}
              ],
              "policy": {"coveredComponents": {"engine": ["Ölkühler"]}}
            }
            """;

    @Mock
    private CoverageAnalyzer analyzer;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        VocabularyRegistry registry = new VocabularyRegistry(
                Map.of("default", TenantVocabulary.empty(), "fleet", TenantVocabulary.empty()), "default");
        mockMvc = MockMvcBuilders.standaloneSetup(
                new CoverageAnalysisController(analyzer, registry, CoverageProperties.defaults())).build();
    }

    private void expectBadRequest(String body, String error) throws Exception {
        mockMvc.perform(post("/api/coverage/analyze").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(error));
        verifyNoInteractions(analyzer);
    }

    @Test
    @DisplayName("Valid request is analyzed")
    void analyzesValidRequest() throws Exception {
        when(analyzer.analyze(any())).thenReturn(new CoverageAnalysisResult("CLM-1", "default", Instant.now(),
                List.of(), RepairContext.none(), PrimaryRepairResult.none(), null, null,
                List.of(new NonCoveredExplanation(ExclusionReason.COMPONENT_EXCLUDED, List.of("Zahnriemen"),
                        List.of(), "engine", new BigDecimal("160.00"), "Component is on the policy exclusion list.",
                        null, 0.85)),
                "1 item(s) (CHF 160.00) are not covered. component_excluded"));

        mockMvc.perform(post("/api/coverage/analyze").contentType(MediaType.APPLICATION_JSON).content(VALID_REQUEST))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.claimId").value("CLM-1"))
                .andExpect(jsonPath("$.tenant").value("default"))
                .andExpect(jsonPath("$.nonCoveredExplanations[0].exclusionReason").value("component_excluded"))
                .andExpect(jsonPath("$.nonCoveredSummary").value("1 item(s) (CHF 160.00) are not covered. component_excluded"));

        ArgumentCaptor<CoverageAnalysisRequest> request = ArgumentCaptor.forClass(CoverageAnalysisRequest.class);
        verify(analyzer).analyze(request.capture());
        assertThat(request.getValue().lineItems()).hasSize(2);
        assertThat(request.getValue().lineItems().get(0).itemType()).isEqualTo(ItemType.PARTS);
        assertThat(request.getValue().lineItems().get(1).itemType()).isEqualTo(ItemType.LABOR);
        assertThat(request.getValue().policy().coveredCategories()).containsExactly("engine");
    }

    @Test
    @DisplayName("Missing claim id is rejected")
    void missingClaimId() throws Exception {
        expectBadRequest("""
                {"claimId": " ", "lineItems": [{"description": "Ölkühler", "itemType": "parts"}], "policy": {}}
                """, "claimId is required.");
    }

    @Test
    @DisplayName("Claim without line items is rejected")
    void noLineItems() throws Exception {
        expectBadRequest("""
                {"claimId": "CLM-1", "lineItems": [], "policy": {}}
                """, "At least one line item is required.");
    }

    @Test
    @DisplayName("Claim without policy is rejected")
    void noPolicy() throws Exception {
        expectBadRequest("""
                {"claimId": "CLM-1", "lineItems": [{"description": "Ölkühler", "itemType": "parts"}]}
                """, "policy is required.");
    }

    @Test
    @DisplayName("Line item without description is rejected")
    void blankDescription() throws Exception {
        expectBadRequest("""
                {"claimId": "CLM-1", "lineItems": [{"description": "", "itemType": "parts"}], "policy": {}}
                """, "Line item 0 has no description.");
    }

    @Test
    @DisplayName("Unknown tenant is a 404")
    void unknownTenant() throws Exception {
        when(analyzer.analyze(any())).thenThrow(new UnknownTenantException("acme"));

        mockMvc.perform(post("/api/coverage/analyze").contentType(MediaType.APPLICATION_JSON).content(VALID_REQUEST))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("No vocabulary configured for tenant 'acme'"));
    }

    @Test
    @DisplayName("Unexpected failure is a 500 with the message")
    void unexpectedFailure() throws Exception {
        when(analyzer.analyze(any())).thenThrow(new IllegalStateException("executor rejected task"));

        mockMvc.perform(post("/api/coverage/analyze").contentType(MediaType.APPLICATION_JSON).content(VALID_REQUEST))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Error during analysis"))
                .andExpect(jsonPath("$.message").value("executor rejected task"));
    }

    @Test
    @DisplayName("Health lists the loaded tenants")
    void health() throws Exception {
        mockMvc.perform(get("/api/coverage/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.service").value("coverage-engine"))
                .andExpect(jsonPath("$.tenants[0]").value("default"))
                .andExpect(jsonPath("$.tenants[1]").value("fleet"))
                .andExpect(jsonPath("$.llmEnabled").value(true));
    }
}

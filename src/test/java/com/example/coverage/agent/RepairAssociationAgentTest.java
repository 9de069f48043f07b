package com.example.coverage.agent;

import com.example.coverage.CoverageFixtures;
import com.example.coverage.config.CoverageProperties;
import com.example.coverage.model.CoverageStatus;
import com.example.coverage.model.DeterminationMethod;
import com.example.coverage.model.ItemType;
import com.example.coverage.model.LineItem;
import com.example.coverage.model.LineItemCoverage;
import com.example.coverage.model.MatchMethod;
import com.example.coverage.model.PrimaryRepairResult;
import com.example.coverage.model.RepairAssociationResponse;
import com.example.coverage.model.RepairAssociationResponse.Decision;
import com.example.coverage.service.ClaimContext;
import com.example.coverage.service.LlmCallContext;
import com.example.coverage.service.LlmCallException;
import com.example.coverage.service.StructuredLlmClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RepairAssociationAgent Tests")
class RepairAssociationAgentTest {

    private static final LineItem COOLER = LineItem.of("Ölkühler", ItemType.PARTS, "480.00");
    private static final LineItem MODULE = LineItem.of("Ölfiltermodul Gehäuse", ItemType.PARTS, "320.00");
    private static final LineItem PIPE = LineItem.of("Leitung", ItemType.PARTS, "45.00");

    @Mock
    private StructuredLlmClient llmClient;

    private RepairAssociationAgent agent;
    private ClaimContext context;
    private List<LineItemCoverage> items;
    private PrimaryRepairResult primary;

    @BeforeEach
    void setUp() {
        agent = new RepairAssociationAgent(llmClient, CoverageProperties.defaults());
        context = CoverageFixtures.context(CoverageFixtures.enginePolicy(), COOLER, MODULE, PIPE);
        items = List.of(
                LineItemCoverage.of(0, COOLER, CoverageStatus.COVERED, MatchMethod.KEYWORD,
                        "engine", "oil_cooler", 0.85, "keyword"),
                LineItemCoverage.of(1, MODULE, CoverageStatus.NOT_COVERED, MatchMethod.LLM,
                        "engine", null, 0.6, "not listed"),
                LineItemCoverage.of(2, PIPE, CoverageStatus.NOT_COVERED, MatchMethod.LLM,
                        "engine", null, 0.5, "not listed"));
        primary = new PrimaryRepairResult("oil_cooler", "engine", "Ölkühler", Boolean.TRUE, 0.85,
                DeterminationMethod.COVERED_ITEM, 0, false, "Highest-value covered part");
    }

    private static Decision decision(Integer index, Boolean covered, Double confidence) {
        return new Decision(index, covered, "oil_cooler", confidence, "part of the oil cooler assembly");
    }

    @Test
    @DisplayName("Keeps only the first decision for each candidate")
    void keepsCandidateDecisions() {
        when(llmClient.call(any(LlmCallContext.class), anyString(), anyString(), eq(RepairAssociationResponse.class)))
                .thenReturn(new RepairAssociationResponse(Arrays.asList(
                        decision(1, true, 0.9),
                        decision(0, true, 0.9),
                        decision(1, false, 0.9),
                        decision(null, true, 0.9),
                        null,
                        decision(2, false, 0.7))));

        Map<Integer, Decision> decisions = agent.validate(items, Set.of(1, 2), primary, context);

        assertThat(decisions).containsOnlyKeys(1, 2);
        assertThat(decisions.get(1).covered()).isTrue();
        assertThat(decisions.get(2).covered()).isFalse();
    }

    @Test
    @DisplayName("Prompt lists the candidates and the primary repair")
    void promptContents() {
        when(llmClient.call(any(LlmCallContext.class), anyString(), anyString(), eq(RepairAssociationResponse.class)))
                .thenReturn(new RepairAssociationResponse(List.of()));

        agent.validate(items, Set.of(1), primary, context);

        ArgumentCaptor<String> userPrompt = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<LlmCallContext> callContext = ArgumentCaptor.forClass(LlmCallContext.class);
        verify(llmClient).call(callContext.capture(), anyString(), userPrompt.capture(),
                eq(RepairAssociationResponse.class));
        assertThat(callContext.getValue().purpose()).isEqualTo(LlmCallContext.REPAIR_ASSOCIATION);
        String candidates = userPrompt.getValue().substring(userPrompt.getValue().indexOf("CANDIDATES TO RE-EXAMINE"));
        assertThat(userPrompt.getValue()).contains("PRIMARY REPAIR: oil_cooler (engine, covered=true)");
        assertThat(candidates).contains("Ölfiltermodul Gehäuse").doesNotContain("Leitung |");
    }

    @Test
    @DisplayName("Call failure yields no decisions")
    void callFailure() {
        when(llmClient.call(any(LlmCallContext.class), anyString(), anyString(), eq(RepairAssociationResponse.class)))
                .thenThrow(new LlmCallException("Error in repair_association after 3 attempts: 429", null));

        assertThat(agent.validate(items, Set.of(1, 2), primary, context)).isEmpty();
    }

    @Test
    @DisplayName("No candidates, no call")
    void noCandidates() {
        assertThat(agent.validate(items, Set.of(), primary, context)).isEmpty();
        verifyNoInteractions(llmClient);
    }

    @Test
    @DisplayName("Only confident covered decisions are accepted")
    void acceptance() {
        assertThat(agent.accepts(decision(1, true, 0.60))).isTrue();
        assertThat(agent.accepts(decision(1, true, 0.59))).isFalse();
        assertThat(agent.accepts(decision(1, false, 0.95))).isFalse();
        assertThat(agent.accepts(decision(1, true, null))).isFalse();
        assertThat(agent.cappedConfidence(decision(1, true, 0.99))).isEqualTo(0.85, within(1e-9));
    }
}

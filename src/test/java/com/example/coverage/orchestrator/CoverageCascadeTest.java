package com.example.coverage.orchestrator;

import com.example.coverage.CoverageFixtures;
import com.example.coverage.config.CoverageProperties;
import com.example.coverage.model.CoverageStatus;
import com.example.coverage.model.ItemType;
import com.example.coverage.model.LineItem;
import com.example.coverage.model.LineItemCoverage;
import com.example.coverage.model.MatchMethod;
import com.example.coverage.model.PolicyContext;
import com.example.coverage.service.ClaimContext;
import com.example.coverage.service.CoverageStrategy;
import com.example.coverage.service.KeywordMatcher;
import com.example.coverage.service.PartNumberLookup;
import com.example.coverage.service.RuleEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CoverageCascade Tests")
class CoverageCascadeTest {

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    /** Remote stage double that records which items it was asked about. */
    private static final class FakeLlmStage implements CoverageStrategy {

        private final Set<Integer> evaluated = ConcurrentHashMap.newKeySet();
        private final BiFunction<Integer, LineItem, Optional<LineItemCoverage>> answer;

        FakeLlmStage(BiFunction<Integer, LineItem, Optional<LineItemCoverage>> answer) {
            this.answer = answer;
        }

        static FakeLlmStage denying() {
            return new FakeLlmStage((index, item) -> Optional.of(LineItemCoverage.of(index, item,
                    CoverageStatus.NOT_COVERED, MatchMethod.LLM, "engine", null, 0.7, "not in policy")));
        }

        @Override
        public MatchMethod method() {
            return MatchMethod.LLM;
        }

        @Override
        public boolean remote() {
            return true;
        }

        @Override
        public Optional<LineItemCoverage> evaluate(int index, LineItem item, ClaimContext context) {
            evaluated.add(index);
            return answer.apply(index, item);
        }
    }

    private CoverageCascade cascade(FakeLlmStage llm, CoverageProperties.Llm settings) {
        return cascade(llm, settings, executor);
    }

    private static CoverageCascade cascade(FakeLlmStage llm, CoverageProperties.Llm settings, ExecutorService pool) {
        return new CoverageCascade(List.of(new RuleEngine(), new PartNumberLookup(), new KeywordMatcher(), llm),
                pool, CoverageProperties.defaults().withLlm(settings));
    }

    private static CoverageProperties.Llm llm(int maxItems, Duration timeout) {
        return llm(maxItems, timeout, 4);
    }

    private static CoverageProperties.Llm llm(int maxItems, Duration timeout, int concurrency) {
        return new CoverageProperties.Llm(true, "gpt-4o", 0.0, 512, maxItems, concurrency, timeout, 1,
                Duration.ZERO, Duration.ZERO);
    }

    private static FakeLlmStage slowCovering(long millis, AtomicInteger inFlight, AtomicInteger maxInFlight) {
        return new FakeLlmStage((index, item) -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                inFlight.decrementAndGet();
            }
            return Optional.of(LineItemCoverage.of(index, item, CoverageStatus.COVERED, MatchMethod.LLM,
                    "engine", "bracket", 0.8, "covered"));
        });
    }

    private static LineItem part(String description, String price) {
        return LineItem.of(description, ItemType.PARTS, price);
    }

    @Test
    @DisplayName("Each stage only sees what earlier stages declined")
    void stagesRunInOrder() {
        FakeLlmStage llm = FakeLlmStage.denying();
        ClaimContext context = CoverageFixtures.context(CoverageFixtures.enginePolicy(),
                LineItem.of("Entsorgung Altöl", ItemType.FEE, "25.00"),
                part("Kühler", "480.00").withPartCode("06L 115 105 B"),
                part("Ölkühler Gehäuse", "210.00"),
                part("Halter", "12.00"));

        List<LineItemCoverage> verdicts = cascade(llm, llm(35, Duration.ofSeconds(5))).run(context);

        assertThat(verdicts).extracting(LineItemCoverage::index).containsExactly(0, 1, 2, 3);
        assertThat(verdicts).extracting(LineItemCoverage::matchMethod)
                .containsExactly(MatchMethod.RULE, MatchMethod.PART_NUMBER, MatchMethod.KEYWORD, MatchMethod.LLM);
        assertThat(verdicts).extracting(LineItemCoverage::coverageStatus).containsExactly(
                CoverageStatus.NOT_COVERED, CoverageStatus.COVERED, CoverageStatus.COVERED, CoverageStatus.NOT_COVERED);
        assertThat(llm.evaluated).containsExactly(3);
    }

    @Test
    @DisplayName("Nothing reaches the LLM when every item resolves locally")
    void noRemoteCallsWhenResolvedLocally() {
        FakeLlmStage llm = FakeLlmStage.denying();
        ClaimContext context = CoverageFixtures.context(CoverageFixtures.enginePolicy(),
                part("Ölkühler", "480.00"),
                LineItem.of("Mietwagen 3 Tage", ItemType.LABOR, "150.00"));

        List<LineItemCoverage> verdicts = cascade(llm, llm(35, Duration.ofSeconds(5))).run(context);

        assertThat(verdicts).hasSize(2);
        assertThat(llm.evaluated).isEmpty();
    }

    @Test
    @DisplayName("Disabled LLM sends leftovers to review with the earlier stage's hint")
    void disabledLlmSendsToReview() {
        FakeLlmStage llm = FakeLlmStage.denying();
        PolicyContext policy = PolicyContext.builder().cover("cooling_system", "Thermostat").build();
        ClaimContext context = CoverageFixtures.context(policy, part("Wasserpumpe", "380.00"), part("Halter", "12.00"));

        List<LineItemCoverage> verdicts = cascade(llm, CoverageProperties.Llm.disabled()).run(context);

        assertThat(llm.evaluated).isEmpty();
        assertThat(verdicts).allSatisfy(v -> {
            assertThat(v.coverageStatus()).isEqualTo(CoverageStatus.REVIEW_NEEDED);
            assertThat(v.matchConfidence()).isZero();
            assertThat(v.matchReasoning()).startsWith(CoverageCascade.LLM_DISABLED_REASON);
        });
        assertThat(verdicts.get(0).matchedComponent()).isEqualTo("water_pump");
        assertThat(verdicts.get(0).matchReasoning()).contains("Pre-identified as 'water_pump'");
        assertThat(verdicts.get(1).matchReasoning()).isEqualTo(CoverageCascade.LLM_DISABLED_REASON);
    }

    @Test
    @DisplayName("Items beyond the LLM limit go to review in index order")
    void itemLimit() {
        FakeLlmStage llm = FakeLlmStage.denying();
        ClaimContext context = CoverageFixtures.context(CoverageFixtures.enginePolicy(),
                part("Halter A", "10.00"), part("Halter B", "10.00"), part("Halter C", "10.00"), part("Halter D", "10.00"));

        List<LineItemCoverage> verdicts = cascade(llm, llm(2, Duration.ofSeconds(5))).run(context);

        assertThat(llm.evaluated).containsExactlyInAnyOrder(0, 1);
        assertThat(verdicts).extracting(LineItemCoverage::coverageStatus).containsExactly(
                CoverageStatus.NOT_COVERED, CoverageStatus.NOT_COVERED,
                CoverageStatus.REVIEW_NEEDED, CoverageStatus.REVIEW_NEEDED);
        assertThat(verdicts.get(3).matchReasoning()).isEqualTo(CoverageCascade.LLM_LIMIT_REASON);
    }

    @Test
    @DisplayName("A task that exceeds its deadline becomes review, the others complete")
    void timeoutBecomesReview() {
        CountDownLatch release = new CountDownLatch(1);
        FakeLlmStage llm = new FakeLlmStage((index, item) -> {
            if (index == 0) {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return Optional.of(LineItemCoverage.of(index, item, CoverageStatus.COVERED, MatchMethod.LLM,
                    "engine", "bracket", 0.8, "covered"));
        });
        ClaimContext context = CoverageFixtures.context(CoverageFixtures.enginePolicy(),
                part("Halter A", "10.00"), part("Halter B", "10.00"));

        List<LineItemCoverage> verdicts;
        try {
            verdicts = cascade(llm, llm(35, Duration.ofMillis(200))).run(context);
        } finally {
            release.countDown();
        }

        assertThat(verdicts.get(0).coverageStatus()).isEqualTo(CoverageStatus.REVIEW_NEEDED);
        assertThat(verdicts.get(0).matchReasoning()).isEqualTo("LLM analysis did not complete: TimeoutException");
        assertThat(verdicts.get(1).coverageStatus()).isEqualTo(CoverageStatus.COVERED);
    }

    @Test
    @DisplayName("Time spent waiting for a worker does not count against an item's deadline")
    void deadlineStartsWithTheCall() {
        ExecutorService singleWorker = Executors.newSingleThreadExecutor();
        FakeLlmStage llm = slowCovering(300, new AtomicInteger(), new AtomicInteger());
        ClaimContext context = CoverageFixtures.context(CoverageFixtures.enginePolicy(),
                part("Halter A", "10.00"), part("Halter B", "10.00"), part("Halter C", "10.00"), part("Halter D", "10.00"));

        List<LineItemCoverage> verdicts;
        try {
            verdicts = cascade(llm, llm(35, Duration.ofSeconds(1)), singleWorker).run(context);
        } finally {
            singleWorker.shutdownNow();
        }

        assertThat(verdicts).extracting(LineItemCoverage::coverageStatus).containsOnly(CoverageStatus.COVERED);
        assertThat(llm.evaluated).containsExactlyInAnyOrder(0, 1, 2, 3);
    }

    @Test
    @DisplayName("A claim never has more LLM calls in flight than the configured concurrency")
    void concurrencyIsBoundedPerClaim() {
        ExecutorService unbounded = Executors.newCachedThreadPool();
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        FakeLlmStage llm = slowCovering(100, inFlight, maxInFlight);
        ClaimContext context = CoverageFixtures.context(CoverageFixtures.enginePolicy(),
                part("Halter A", "10.00"), part("Halter B", "10.00"), part("Halter C", "10.00"),
                part("Halter D", "10.00"), part("Halter E", "10.00"), part("Halter F", "10.00"));

        List<LineItemCoverage> verdicts;
        try {
            verdicts = cascade(llm, llm(35, Duration.ofSeconds(5), 2), unbounded).run(context);
        } finally {
            unbounded.shutdownNow();
        }

        assertThat(verdicts).hasSize(6).extracting(LineItemCoverage::coverageStatus)
                .containsOnly(CoverageStatus.COVERED);
        assertThat(maxInFlight.get()).isBetween(1, 2);
    }

    @Test
    @DisplayName("A failing task becomes review, never an exception")
    void failureBecomesReview() {
        FakeLlmStage llm = new FakeLlmStage((index, item) -> {
            throw new IllegalStateException("connection reset");
        });
        ClaimContext context = CoverageFixtures.context(CoverageFixtures.enginePolicy(), part("Halter", "12.00"));

        List<LineItemCoverage> verdicts = cascade(llm, llm(35, Duration.ofSeconds(5))).run(context);

        assertThat(verdicts).singleElement().satisfies(v -> {
            assertThat(v.coverageStatus()).isEqualTo(CoverageStatus.REVIEW_NEEDED);
            assertThat(v.matchReasoning()).isEqualTo("LLM analysis did not complete: connection reset");
        });
    }

    @Test
    @DisplayName("An item no stage resolves still gets exactly one verdict")
    void unresolvedItemGetsVerdict() {
        FakeLlmStage llm = new FakeLlmStage((index, item) -> Optional.empty());
        ClaimContext context = CoverageFixtures.context(CoverageFixtures.enginePolicy(), part("Halter", "12.00"));

        List<LineItemCoverage> verdicts = cascade(llm, llm(35, Duration.ofSeconds(5))).run(context);

        assertThat(verdicts).singleElement().satisfies(v -> {
            assertThat(v.coverageStatus()).isEqualTo(CoverageStatus.REVIEW_NEEDED);
            assertThat(v.matchReasoning()).isEqualTo(CoverageCascade.UNRESOLVED_REASON);
            assertThat(v.coveredAmount()).isEqualByComparingTo("0");
        });
    }
}

package com.example.coverage.orchestrator;

import com.example.coverage.agent.LlmFallbackMatcher;
import com.example.coverage.config.CoverageProperties;
import com.example.coverage.model.CoverageStatus;
import com.example.coverage.model.LineItem;
import com.example.coverage.model.LineItemCoverage;
import com.example.coverage.model.MatchMethod;
import com.example.coverage.service.ClaimContext;
import com.example.coverage.service.CoverageStrategy;
import com.example.coverage.service.KeywordMatcher;
import com.example.coverage.service.PartNumberLookup;
import com.example.coverage.service.RuleEngine;
import com.example.coverage.service.StageHint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Runs the item-level stages in a fixed order: rules, part numbers, keywords, LLM.
 * <p>
 * Each stage only sees the items every earlier stage declined. Local stages run inline;
 * the remote stage runs on the shared LLM worker pool, one task per item, with at most
 * {@code coverage.llm.concurrency} calls of one claim in flight. An item's deadline starts
 * when its call starts, so waiting for a permit or a worker never counts against it. Results
 * are merged by index once every call has completed or timed out; a result arriving after
 * its deadline is dropped.
 */
@Service
public class CoverageCascade {

    private static final Logger log = LoggerFactory.getLogger(CoverageCascade.class);

    static final String LLM_DISABLED_REASON = "No deterministic match; LLM fallback disabled";
    static final String LLM_LIMIT_REASON = "Skipped due to LLM item limit";
    static final String UNRESOLVED_REASON = "No stage could resolve this item";

    private final List<CoverageStrategy> strategies;
    private final ExecutorService llmExecutor;
    private final CoverageProperties.Llm llm;

    @Autowired
    public CoverageCascade(RuleEngine ruleEngine,
                           PartNumberLookup partNumberLookup,
                           KeywordMatcher keywordMatcher,
                           LlmFallbackMatcher llmFallbackMatcher,
                           @Qualifier("llmExecutor") ExecutorService llmExecutor,
                           CoverageProperties properties) {
        this(List.of(ruleEngine, partNumberLookup, keywordMatcher, llmFallbackMatcher), llmExecutor, properties);
    }

    CoverageCascade(List<CoverageStrategy> strategies, ExecutorService llmExecutor, CoverageProperties properties) {
        this.strategies = List.copyOf(strategies);
        this.llmExecutor = llmExecutor;
        this.llm = properties.llm();
    }

    /**
     * @return exactly one verdict per item, in index order
     */
    public List<LineItemCoverage> run(ClaimContext context) {
        Map<Integer, LineItemCoverage> verdicts = new TreeMap<>();

        for (CoverageStrategy strategy : strategies) {
            List<Integer> pending = pending(context);
            if (pending.isEmpty()) break;

            Map<Integer, LineItemCoverage> resolved = strategy.remote()
                    ? runRemote(strategy, pending, context)
                    : runLocal(strategy, pending, context);
            resolved.values().forEach(context::resolve);
            verdicts.putAll(resolved);
            log.info("Stage {}: {} of {} pending items resolved", strategy.method().value(),
                    resolved.size(), pending.size());
        }

        for (int index : pending(context)) {
            LineItemCoverage review = review(index, context, UNRESOLVED_REASON);
            context.resolve(review);
            verdicts.put(index, review);
        }
        return new ArrayList<>(verdicts.values());
    }

    private Map<Integer, LineItemCoverage> runLocal(CoverageStrategy strategy, List<Integer> pending,
                                                    ClaimContext context) {
        Map<Integer, LineItemCoverage> resolved = new LinkedHashMap<>();
        for (int index : pending) {
            LineItem item = context.items().get(index);
            strategy.evaluate(index, item, context).ifPresent(coverage -> {
                log.debug("[{}] '{}' -> {} by {} ({})", index, item.description(), coverage.coverageStatus(),
                        strategy.method().value(), coverage.matchConfidence());
                resolved.put(index, coverage);
            });
        }
        return resolved;
    }

    private Map<Integer, LineItemCoverage> runRemote(CoverageStrategy strategy, List<Integer> pending,
                                                     ClaimContext context) {
        Map<Integer, LineItemCoverage> resolved = new TreeMap<>();
        if (!llm.enabled()) {
            log.info("LLM fallback disabled, {} items sent to review", pending.size());
            pending.forEach(index -> resolved.put(index, review(index, context, LLM_DISABLED_REASON)));
            return resolved;
        }

        List<Integer> submitted = pending;
        if (pending.size() > llm.maxItems()) {
            submitted = pending.subList(0, llm.maxItems());
            List<Integer> skipped = pending.subList(llm.maxItems(), pending.size());
            log.warn("LLM item limit reached: {} items submitted, {} sent to review", submitted.size(), skipped.size());
            skipped.forEach(index -> resolved.put(index, review(index, context, LLM_LIMIT_REASON)));
        }

        Semaphore permits = new Semaphore(llm.concurrency());
        Map<Integer, CompletableFuture<LineItemCoverage>> futures = new LinkedHashMap<>();
        for (int index : submitted) {
            LineItem item = context.items().get(index);
            permits.acquireUninterruptibly();
            CompletableFuture<LineItemCoverage> call = submit(strategy, index, item, context);
            call.whenComplete((result, error) -> permits.release());
            futures.put(index, call.exceptionally(e -> {
                log.error("LLM task for [{}] '{}' failed: {}", index, item.description(), e.toString());
                return review(index, context, "LLM analysis did not complete: " + rootMessage(e));
            }));
        }

        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();
        futures.forEach((index, future) -> resolved.put(index, future.join()));
        return resolved;
    }

    private CompletableFuture<LineItemCoverage> submit(CoverageStrategy strategy, int index, LineItem item,
                                                       ClaimContext context) {
        CompletableFuture<LineItemCoverage> call = new CompletableFuture<>();
        try {
            llmExecutor.execute(() -> {
                call.orTimeout(llm.timeout().toMillis(), TimeUnit.MILLISECONDS);
                try {
                    LineItemCoverage result = strategy.evaluate(index, item, context)
                            .orElseGet(() -> review(index, context, UNRESOLVED_REASON));
                    if (!call.complete(result)) {
                        log.warn("LLM result for [{}] '{}' arrived after its deadline, dropped", index, item.description());
                    }
                } catch (RuntimeException e) {
                    call.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            call.completeExceptionally(e);
        }
        return call;
    }

    private static List<Integer> pending(ClaimContext context) {
        List<Integer> pending = new ArrayList<>();
        for (int i = 0; i < context.items().size(); i++) {
            if (!context.isResolved(i)) pending.add(i);
        }
        return pending;
    }

    private static LineItemCoverage review(int index, ClaimContext context, String reason) {
        LineItem item = context.items().get(index);
        StageHint hint = context.hintFor(index).orElse(null);
        String reasoning = hint != null ? reason + ". " + hint.describe() : reason;
        return LineItemCoverage.of(index, item, CoverageStatus.REVIEW_NEEDED, MatchMethod.LLM,
                hint != null ? hint.category() : null, hint != null ? hint.component() : null, 0.0, reasoning);
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}

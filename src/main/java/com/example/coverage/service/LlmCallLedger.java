package com.example.coverage.service;

import com.example.coverage.model.LlmAuditRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-claim call counter and token totals. Numbering, accumulation and forwarding to the
 * audit sink happen under one lock so concurrent workers can neither lose an update nor
 * deliver records out of sequence.
 */
public class LlmCallLedger {

    private static final Logger log = LoggerFactory.getLogger(LlmCallLedger.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final LlmAuditSink sink;

    private long sequence;
    private long successfulCalls;
    private long promptTokens;
    private long completionTokens;

    public LlmCallLedger(LlmAuditSink sink) {
        this.sink = sink;
    }

    /**
     * Records one attempt.
     *
     * @param response raw model output, {@code null} when the attempt failed
     * @param error    failure message, {@code null} on success
     */
    public LlmAuditRecord record(LlmCallContext context, int attempt, String model,
                                 String systemPrompt, String userPrompt,
                                 String response, String error,
                                 long promptTokenCount, long completionTokenCount) {
        lock.lock();
        try {
            sequence++;
            if (error == null) successfulCalls++;
            promptTokens += promptTokenCount;
            completionTokens += completionTokenCount;
            LlmAuditRecord record = new LlmAuditRecord(sequence, context.claimId(), context.correlationId(),
                    context.purpose(), context.itemIndex(), attempt, model, systemPrompt, userPrompt,
                    response, error, promptTokenCount, completionTokenCount, Instant.now());
            try {
                sink.record(record);
            } catch (RuntimeException e) {
                log.error("Audit sink rejected record {} for claim {}", sequence, context.claimId(), e);
            }
            return record;
        } finally {
            lock.unlock();
        }
    }

    /** Attempts recorded so far, successful or not. */
    public long attempts() {
        lock.lock();
        try {
            return sequence;
        } finally {
            lock.unlock();
        }
    }

    public long successfulCalls() {
        lock.lock();
        try {
            return successfulCalls;
        } finally {
            lock.unlock();
        }
    }

    public long promptTokens() {
        lock.lock();
        try {
            return promptTokens;
        } finally {
            lock.unlock();
        }
    }

    public long completionTokens() {
        lock.lock();
        try {
            return completionTokens;
        } finally {
            lock.unlock();
        }
    }
}

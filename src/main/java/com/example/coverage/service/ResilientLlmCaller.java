package com.example.coverage.service;

import com.example.coverage.config.CoverageProperties;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.ThreadLocalRandom;

/**
 * LLM calls with lenient JSON parsing and bounded retry.
 * <p>
 * Solves common LLM response issues:
 * <ul>
 *   <li>Trailing commas ({@code [{"a":1},]})</li>
 *   <li>Java-style comments in JSON</li>
 *   <li>Single quotes instead of double quotes</li>
 *   <li>Unexpected fields (ignoreUnknown)</li>
 * </ul>
 * <p>
 * Uses {@link BeanOutputConverter} with a lenient {@link ObjectMapper}. Failed attempts are
 * retried with exponential backoff and full jitter: the wait before attempt {@code n+1} is
 * uniform in {@code [0, min(baseDelay * 2^(n-1), maxDelay)]}. Every attempt is recorded in
 * the claim's {@link LlmCallLedger}.
 */
@Service
public class ResilientLlmCaller implements StructuredLlmClient {

    private static final Logger log = LoggerFactory.getLogger(ResilientLlmCaller.class);

    /** Lenient ObjectMapper that tolerates trailing commas, comments, and single quotes. */
    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ChatClient chatClient;
    private final CoverageProperties.Llm settings;

    public ResilientLlmCaller(@Qualifier("coverageChatClient") ChatClient chatClient,
                              CoverageProperties properties) {
        this.chatClient = chatClient;
        this.settings = properties.llm();
    }

    @Override
    public <T> T call(LlmCallContext context, String systemPrompt, String userPrompt, Class<T> type) {
        var converter = new BeanOutputConverter<>(type, LENIENT_MAPPER);
        String fullUserPrompt = userPrompt + "\n\n" + converter.getFormat();
        ChatOptions options = ChatOptions.builder()
                .model(settings.model())
                .temperature(settings.temperature())
                .maxTokens(settings.maxTokens())
                .build();

        int maxAttempts = settings.maxAttempts();
        Exception lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String content = null;
            long promptTokens = 0;
            long completionTokens = 0;
            try {
                ChatResponse chatResponse = chatClient.prompt()
                        .system(systemPrompt)
                        .user(fullUserPrompt)
                        .options(options)
                        .call()
                        .chatResponse();

                Usage usage = chatResponse != null && chatResponse.getMetadata() != null
                        ? chatResponse.getMetadata().getUsage()
                        : null;
                if (usage != null) {
                    promptTokens = usage.getPromptTokens() != null ? usage.getPromptTokens() : 0;
                    completionTokens = usage.getCompletionTokens() != null ? usage.getCompletionTokens() : 0;
                }

                content = (chatResponse != null && chatResponse.getResult() != null)
                        ? chatResponse.getResult().getOutput().getText()
                        : null;
                if (content == null || content.isBlank()) {
                    throw new IllegalStateException("Empty or null content in LLM response");
                }
                T value = converter.convert(content);
                if (value == null) {
                    throw new IllegalStateException("LLM response parsed to null");
                }
                context.ledger().record(context, attempt, settings.model(), systemPrompt, fullUserPrompt,
                        content, null, promptTokens, completionTokens);
                return value;
            } catch (Exception e) {
                lastError = e;
                context.ledger().record(context, attempt, settings.model(), systemPrompt, fullUserPrompt,
                        content, rootCauseMessage(e), promptTokens, completionTokens);
                if (attempt < maxAttempts) {
                    long delay = jitteredDelayMillis(attempt);
                    log.warn("{} [claim {}, item {}]: attempt {}/{} failed ({}), retrying in {}ms...",
                            context.purpose(), context.claimId(), context.itemIndex(),
                            attempt, maxAttempts, rootCauseMessage(e), delay);
                    try {
                        Thread.sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new LlmCallException("Interrupted while retrying " + context.purpose(), ie);
                    }
                }
            }
        }
        log.error("{} [claim {}, item {}]: failed after {} attempts: {}",
                context.purpose(), context.claimId(), context.itemIndex(), maxAttempts, rootCauseMessage(lastError));
        throw new LlmCallException("Error in " + context.purpose() + " after " + maxAttempts
                + " attempts: " + rootCauseMessage(lastError), lastError);
    }

    /** Upper bound of the wait after the given failed attempt (1-based). */
    long backoffCeilingMillis(int attempt) {
        long base = settings.baseDelay().toMillis();
        long max = settings.maxDelay().toMillis();
        int shift = Math.min(attempt - 1, 30);
        long exponential = base << shift;
        if (exponential < 0 || (shift > 0 && exponential >> shift != base)) {
            exponential = max;
        }
        return Math.min(exponential, max);
    }

    private long jitteredDelayMillis(int attempt) {
        return ThreadLocalRandom.current().nextLong(backoffCeilingMillis(attempt) + 1);
    }

    private static String rootCauseMessage(Exception e) {
        if (e == null) return "unknown error";
        Throwable cause = e;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        String msg = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return msg.length() > 150 ? msg.substring(0, 150) + "..." : msg;
    }
}

package com.example.coverage.config;

import com.example.coverage.service.LlmAuditSink;
import com.example.coverage.service.LoggingLlmAuditSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Chat client, LLM worker pool and vocabulary beans.
 */
@Configuration
public class AiConfig {

    /**
     * ChatClient used by the fallback matcher and the claim-level agents. Model name,
     * temperature and token budget are set per call from {@link CoverageProperties.Llm}.
     */
    @Bean("coverageChatClient")
    public ChatClient coverageChatClient(OpenAiChatModel openAiChatModel) {
        return ChatClient.builder(openAiChatModel).build();
    }

    /**
     * Shared pool for item-level LLM calls. Each claim bounds its own calls to
     * {@code coverage.llm.concurrency}, so the pool grows with the number of claims in flight.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService llmExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "llm-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(factory);
    }

    @Bean
    @ConditionalOnMissingBean(LlmAuditSink.class)
    public LlmAuditSink llmAuditSink() {
        return new LoggingLlmAuditSink();
    }

    @Bean
    public VocabularyLoader vocabularyLoader(ResourceLoader resourceLoader) {
        return new VocabularyLoader(resourceLoader);
    }

    /**
     * Loaded eagerly; a broken vocabulary fails the application start.
     */
    @Bean
    public VocabularyRegistry vocabularyRegistry(CoverageProperties properties, VocabularyLoader loader) {
        return VocabularyRegistry.fromProperties(properties, loader);
    }

    /**
     * ObjectMapper shared for JSON serialization.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}

package com.outreachagent.infrastructure.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openai.client.OpenAIClient;
import com.openai.errors.RateLimitException;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.outreachagent.infrastructure.pacing.RateLimiter;
import com.outreachagent.infrastructure.pacing.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Chat-completion wrapper used by AI enrichment and AI message composition.
 * <p>
 * Calls are paced ({@code openai.request-interval-ms}) and throttling responses
 * are retried with exponential backoff starting at
 * {@code openai.rate-limit-backoff-seconds}. A missing API key fails fast.
 * </p>
 */
@Slf4j
@Service
public class LlmClient {

    private final ObjectProvider<OpenAIClient> clientProvider;
    private final ObjectMapper objectMapper;
    private final Sleeper sleeper;
    private final RateLimiter rateLimiter;
    private final String model;
    private final int maxRetries;
    private final long rateLimitBackoffSeconds;

    public LlmClient(ObjectProvider<OpenAIClient> clientProvider,
                     ObjectMapper objectMapper,
                     Clock clock,
                     Sleeper sleeper,
                     @Value("${openai.request-interval-ms:3000}") long requestIntervalMs,
                     @Value("${openai.model:gpt-4o-mini}") String model,
                     @Value("${openai.max-retries:3}") int maxRetries,
                     @Value("${openai.rate-limit-backoff-seconds:10}") long rateLimitBackoffSeconds) {
        this.clientProvider = clientProvider;
        this.objectMapper = objectMapper;
        this.sleeper = sleeper;
        this.rateLimiter = new RateLimiter(Duration.ofMillis(requestIntervalMs), clock, sleeper);
        this.model = model;
        this.maxRetries = maxRetries;
        this.rateLimitBackoffSeconds = rateLimitBackoffSeconds;
    }

    public boolean isConfigured() {
        return clientProvider.getIfAvailable() != null;
    }

    /**
     * Sends one system/user exchange and parses the reply as a JSON object.
     *
     * @throws AiConfigurationException if no API key is configured
     * @throws AiRateLimitedException   if throttling outlasts every retry
     * @throws AiClientException        for any other failure, including unparseable output
     */
    public synchronized JsonNode completeJson(String systemPrompt, String userMessage,
                                              double temperature, int maxTokens) {
        OpenAIClient client = clientProvider.getIfAvailable();
        if (client == null) {
            throw new AiConfigurationException("OPENAI_API_KEY not set");
        }

        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                .model(model)
                .temperature(temperature)
                .maxCompletionTokens(maxTokens)
                .addSystemMessage(systemPrompt)
                .addUserMessage(userMessage)
                .build();

        for (int attempt = 0; ; attempt++) {
            pace();
            try {
                log.info("[LLM] Attempt {}/{} (model={})", attempt + 1, maxRetries + 1, model);
                ChatCompletion completion = client.chat().completions().create(params);

                completion.usage().ifPresent(usage ->
                        log.info("[LLM] Token usage - prompt: {}, completion: {}, total: {}",
                                usage.promptTokens(), usage.completionTokens(), usage.totalTokens()));

                String content = completion.choices().stream()
                        .findFirst()
                        .flatMap(choice -> choice.message().content())
                        .orElseThrow(() -> new AiClientException("LLM response had no content"));

                return parseJsonObject(content);
            } catch (RateLimitException e) {
                if (attempt >= maxRetries) {
                    log.error("[LLM] Rate limit exceeded after {} retries", maxRetries);
                    throw new AiRateLimitedException("LLM rate limit exceeded after " + maxRetries + " retries", e);
                }
                Duration backoff = Duration.ofSeconds(rateLimitBackoffSeconds << attempt);
                log.warn("[LLM] Rate limit hit, waiting {}s before retry", backoff.toSeconds());
                sleep(backoff);
            } catch (AiClientException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("[LLM] Call failed: {}", e.getMessage());
                throw new AiClientException("LLM call failed: " + e.getMessage(), e);
            }
        }
    }

    /**
     * Extracts the JSON object from a reply that may be wrapped in code fences or prose.
     */
    JsonNode parseJsonObject(String content) {
        String text = content.strip();
        if (text.startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            text = firstNewline < 0 ? "" : text.substring(firstNewline + 1);
            if (text.endsWith("```")) {
                text = text.substring(0, text.length() - 3);
            }
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            text = text.substring(start, end + 1);
        }

        try {
            JsonNode node = objectMapper.readTree(text);
            if (node == null || !node.isObject()) {
                throw new AiClientException("LLM response is not a JSON object");
            }
            return node;
        } catch (AiClientException e) {
            throw e;
        } catch (Exception e) {
            throw new AiClientException("Failed to parse LLM JSON response", e);
        }
    }

    private void pace() {
        try {
            rateLimiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AiClientException("Interrupted while waiting for the LLM rate limit", e);
        }
    }

    private void sleep(Duration duration) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AiClientException("Interrupted during LLM backoff", e);
        }
    }
}

/**
 * Text-generation client for OpenAI-compatible chat-completions endpoints (Groq by default)
 *
 * @author William Callahan
 *
 * Features:
 * - Sends one system and one user message with a per-call temperature
 * - Returns the first choice's message content as raw text
 * - Maps transport errors, timeouts and empty answers to {@link GenerationException}
 * - Records request outcomes and latency through {@link ApiRequestMonitor}
 */

package com.williamcallahan.research_engine.service.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.research_engine.config.AppConfigurationProperties;
import com.williamcallahan.research_engine.monitoring.ApiRequestMonitor;
import com.williamcallahan.research_engine.util.LoggingUtils;
import com.williamcallahan.research_engine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Service
public class ChatCompletionClient implements TextGenerationClient {

    private static final Logger logger = LoggerFactory.getLogger(ChatCompletionClient.class);
    private static final String ENDPOINT = "generation/chat-completions";

    private final WebClient webClient;
    private final AppConfigurationProperties.Generation settings;
    private final ApiRequestMonitor apiRequestMonitor;

    public ChatCompletionClient(@Qualifier("generationWebClientBuilder") WebClient.Builder webClientBuilder,
                                AppConfigurationProperties appProperties,
                                ApiRequestMonitor apiRequestMonitor) {
        this.settings = appProperties.getGeneration();
        this.apiRequestMonitor = apiRequestMonitor;
        this.webClient = webClientBuilder
            .baseUrl(settings.getBaseUrl())
            .defaultHeader(HttpHeaders.USER_AGENT, "ResearchEngine/1.0")
            .build();
        logger.info("ChatCompletionClient initialized. Model: {}, URL: {}, key configured: {}",
            settings.getModel(), settings.getBaseUrl(), ValidationUtils.hasText(settings.getApiKey()));
    }

    @Override
    public Mono<String> generate(String systemContext, String userContent, double temperature) {
        if (!ValidationUtils.hasText(settings.getApiKey())) {
            return Mono.error(new GenerationException("Text generation API key is not configured (app.generation.api-key)"));
        }

        Map<String, Object> request = Map.of(
            "model", settings.getModel(),
            "temperature", temperature,
            "max_tokens", settings.getMaxTokens(),
            "messages", List.of(
                Map.of("role", "system", "content", systemContext),
                Map.of("role", "user", "content", userContent)
            )
        );

        long startedAt = System.nanoTime();
        return webClient.post()
            .uri("/chat/completions")
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + settings.getApiKey())
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(Duration.ofSeconds(settings.getTimeoutSeconds()))
            .flatMap(this::extractContent)
            .doOnSuccess(content -> {
                apiRequestMonitor.recordSuccessfulRequest(ENDPOINT);
                apiRequestMonitor.recordLatency(ENDPOINT, Duration.ofNanos(System.nanoTime() - startedAt));
                logger.debug("Chat completion returned {} characters", content != null ? content.length() : 0);
            })
            .onErrorMap(error -> !(error instanceof GenerationException), error -> {
                apiRequestMonitor.recordFailedRequest(ENDPOINT, error.getMessage());
                LoggingUtils.warn(logger, error, "Chat completion call to {} failed", settings.getBaseUrl());
                return new GenerationException("Text generation call failed: " + LoggingUtils.describe(error), error);
            });
    }

    private Mono<String> extractContent(JsonNode root) {
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (content.isTextual() && !content.asText().isBlank()) {
            return Mono.just(content.asText());
        }
        apiRequestMonitor.recordFailedRequest(ENDPOINT, "empty completion");
        return Mono.error(new GenerationException("Chat completion response had no message content"));
    }
}

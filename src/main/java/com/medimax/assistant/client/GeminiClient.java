package com.medimax.assistant.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.medimax.assistant.config.GeminiConfig;
import com.medimax.assistant.exception.OrchestrationException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Map;

/**
 * Gemini {@code generateContent} client. The API key travels in the
 * {@code x-goog-api-key} header, never in the URL.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GeminiClient implements LLMProvider {

    private final GeminiConfig config;

    private WebClient geminiWebClient;

    @PostConstruct
    public void init() {
        this.geminiWebClient = WebClient.builder()
            .baseUrl(config.getBaseUrl())
            .defaultHeader("x-goog-api-key", config.getApiKey() == null ? "" : config.getApiKey())
            .exchangeStrategies(ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                .build())
            .build();
        log.info("Gemini client configured for model {}", config.getModel());
    }

    @Override
    public String chat(String prompt, String agentName, String sessionId) {
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new IllegalStateException("app.gemini.api-key is not configured");
        }
        String url = String.format("/%s/models/%s:generateContent", config.getApiVersion(), config.getModel());
        Map<String, Object> body = Map.of(
            "contents", List.of(Map.of("role", "user", "parts", List.of(Map.of("text", prompt)))),
            "generationConfig", Map.of(
                "temperature", config.getTemperature(),
                "maxOutputTokens", config.getMaxOutputTokens(),
                "responseMimeType", "application/json"));

        long start = System.currentTimeMillis();
        JsonNode response = geminiWebClient.post().uri(url)
            .bodyValue(body)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .block();

        String text = extractText(response);
        log.debug("[{}] Gemini answered for session {} in {}ms ({} chars)",
            agentName, sessionId, System.currentTimeMillis() - start, text.length());
        return text;
    }

    private static String extractText(JsonNode response) {
        JsonNode parts = response == null ? null : response.path("candidates").path(0).path("content").path("parts");
        if (parts == null || !parts.isArray() || parts.isEmpty()) {
            String reason = response == null ? "empty body" : response.path("candidates").path(0).path("finishReason").asText("no candidates");
            throw new OrchestrationException("Gemini returned no content: " + reason);
        }
        StringBuilder text = new StringBuilder();
        parts.forEach(part -> text.append(part.path("text").asText("")));
        return text.toString();
    }
}

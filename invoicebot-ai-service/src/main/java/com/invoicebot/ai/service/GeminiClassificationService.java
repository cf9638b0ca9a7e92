package com.invoicebot.ai.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.invoicebot.ai.service.strategy.ClassificationModelStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Google Gemini implementation of ClassificationModelStrategy, using
 * {@code generateContent} with a system instruction and JSON response mode.
 */
@Slf4j
public class GeminiClassificationService implements ClassificationModelStrategy {

    private static final Duration TIMEOUT = Duration.ofSeconds(60);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String baseUrl;
    private final String model;
    private final int maxTokens;

    public GeminiClassificationService(String apiKey, String baseUrl, String model, int maxTokens) {
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
        this.model = model;
        this.maxTokens = maxTokens;
        this.webClient = WebClient.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(40 * 1024 * 1024))
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String getProviderName() {
        return "Google Gemini (" + model + ")";
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public ModelReply classifyText(String systemPrompt, String userPrompt) {
        return send(systemPrompt, List.of(Map.of("text", userPrompt)));
    }

    @Override
    public ModelReply classifyImage(String systemPrompt, String userPrompt, byte[] image, String mediaType) {
        return send(systemPrompt, List.of(
                Map.of("inline_data", Map.of(
                        "mime_type", mediaType,
                        "data", Base64.getEncoder().encodeToString(image))),
                Map.of("text", userPrompt)));
    }

    private ModelReply send(String systemPrompt, List<Map<String, Object>> parts) {
        try {
            Map<String, Object> requestBody = Map.of(
                    "system_instruction", Map.of("parts", List.of(Map.of("text", systemPrompt))),
                    "contents", List.of(Map.of("role", "user", "parts", parts)),
                    "generationConfig", Map.of(
                            "response_mime_type", "application/json",
                            "temperature", 0.0,
                            "maxOutputTokens", maxTokens));

            String response = webClient
                    .post()
                    .uri(baseUrl + "/models/" + model + ":generateContent?key=" + apiKey)
                    .header("Content-Type", "application/json")
                    .bodyValue(requestBody)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(TIMEOUT);

            return parseResponse(response);

        } catch (Exception e) {
            log.error("[{}] Model call failed: {}", getProviderName(), e.getMessage(), e);
            return ModelReply.failed("Gemini API error: " + e.getMessage());
        }
    }

    @SuppressWarnings("unchecked")
    private ModelReply parseResponse(String response) {
        try {
            Map<String, Object> responseMap = objectMapper.readValue(response, Map.class);

            List<Map<String, Object>> candidates = (List<Map<String, Object>>) responseMap.get("candidates");
            if (candidates == null || candidates.isEmpty()) {
                return ModelReply.failed("No candidates in Gemini response");
            }

            Map<String, Object> content = (Map<String, Object>) candidates.get(0).get("content");
            if (content == null) {
                return ModelReply.failed("No content in Gemini candidate");
            }
            List<Map<String, Object>> parts = (List<Map<String, Object>>) content.get("parts");
            if (parts == null || parts.isEmpty()) {
                return ModelReply.failed("No parts in Gemini content");
            }

            Object text = parts.get(0).get("text");
            if (!(text instanceof String) || ((String) text).isBlank()) {
                return ModelReply.failed("Empty text in Gemini response");
            }
            return ModelReply.success(((String) text).trim());

        } catch (Exception e) {
            log.error("Failed to parse Gemini response: {}", e.getMessage(), e);
            return ModelReply.failed("Parse error: " + e.getMessage());
        }
    }
}

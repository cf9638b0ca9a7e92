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
 * Anthropic Messages API implementation of ClassificationModelStrategy.
 *
 * Request: {@code POST {baseUrl}/messages} with the system prompt and one
 * user turn (text, or image block + text). Response text is
 * {@code content[0].text}.
 */
@Slf4j
public class AnthropicClassificationService implements ClassificationModelStrategy {

    private static final String API_VERSION = "2023-06-01";
    private static final Duration TIMEOUT = Duration.ofSeconds(60);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String baseUrl;
    private final String model;
    private final int maxTokens;

    public AnthropicClassificationService(String apiKey, String baseUrl, String model, int maxTokens) {
        this(WebClient.builder(), apiKey, baseUrl, model, maxTokens);
    }

    public AnthropicClassificationService(WebClient.Builder builder, String apiKey, String baseUrl,
            String model, int maxTokens) {
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
        this.model = model;
        this.maxTokens = maxTokens;
        this.webClient = builder
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(40 * 1024 * 1024))
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String getProviderName() {
        return "Anthropic (" + model + ")";
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public ModelReply classifyText(String systemPrompt, String userPrompt) {
        log.debug("[{}] Text classification, prompt length {}", getProviderName(), userPrompt.length());
        return send(systemPrompt, List.of(Map.of("type", "text", "text", userPrompt)));
    }

    @Override
    public ModelReply classifyImage(String systemPrompt, String userPrompt, byte[] image, String mediaType) {
        log.debug("[{}] Vision classification, {} bytes of {}", getProviderName(), image.length, mediaType);
        Map<String, Object> imageBlock = Map.of(
                "type", "image",
                "source", Map.of(
                        "type", "base64",
                        "media_type", mediaType,
                        "data", Base64.getEncoder().encodeToString(image)));
        return send(systemPrompt, List.of(imageBlock, Map.of("type", "text", "text", userPrompt)));
    }

    private ModelReply send(String systemPrompt, List<Map<String, Object>> content) {
        try {
            Map<String, Object> requestBody = Map.of(
                    "model", model,
                    "max_tokens", maxTokens,
                    "system", systemPrompt,
                    "messages", List.of(Map.of("role", "user", "content", content)));

            String response = webClient
                    .post()
                    .uri(baseUrl + "/messages")
                    .header("Content-Type", "application/json")
                    .header("x-api-key", apiKey)
                    .header("anthropic-version", API_VERSION)
                    .bodyValue(requestBody)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(TIMEOUT);

            return parseResponse(response);

        } catch (Exception e) {
            log.error("[{}] Model call failed: {}", getProviderName(), e.getMessage(), e);
            return ModelReply.failed("Anthropic API error: " + e.getMessage());
        }
    }

    @SuppressWarnings("unchecked")
    private ModelReply parseResponse(String response) {
        try {
            Map<String, Object> responseMap = objectMapper.readValue(response, Map.class);

            if (responseMap.containsKey("error")) {
                Map<String, Object> error = (Map<String, Object>) responseMap.get("error");
                return ModelReply.failed("Anthropic API error: " + error.get("message"));
            }

            List<Map<String, Object>> content = (List<Map<String, Object>>) responseMap.get("content");
            if (content == null || content.isEmpty()) {
                return ModelReply.failed("No content in Anthropic response");
            }

            Object text = content.get(0).get("text");
            if (!(text instanceof String) || ((String) text).isBlank()) {
                return ModelReply.failed("Empty text in Anthropic response");
            }

            if (responseMap.containsKey("usage")) {
                Map<String, Object> usage = (Map<String, Object>) responseMap.get("usage");
                log.debug("Token usage - Input: {}, Output: {}", usage.get("input_tokens"), usage.get("output_tokens"));
            }
            return ModelReply.success(((String) text).trim());

        } catch (Exception e) {
            log.error("Failed to parse Anthropic response: {}", e.getMessage(), e);
            return ModelReply.failed("Parse error: " + e.getMessage());
        }
    }
}

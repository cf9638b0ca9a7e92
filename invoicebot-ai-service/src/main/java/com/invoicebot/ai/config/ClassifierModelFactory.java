package com.invoicebot.ai.config;

import com.invoicebot.ai.service.AnthropicClassificationService;
import com.invoicebot.ai.service.GeminiClassificationService;
import com.invoicebot.ai.service.strategy.ClassificationModelStrategy;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates the classification model strategy for a provider name.
 */
@Slf4j
public class ClassifierModelFactory {

    private ClassifierModelFactory() {
    }

    /**
     * @param provider "anthropic" or "google"
     * @throws IllegalArgumentException if provider is not supported
     */
    public static ClassificationModelStrategy create(
            String provider, String apiKey, String baseUrl, String model, int maxTokens) {

        return switch (provider.toLowerCase()) {
            case "anthropic" -> {
                log.info("Factory: Creating Anthropic classification strategy");
                log.info("   Model: {}", model);
                yield new AnthropicClassificationService(apiKey, baseUrl, model, maxTokens);
            }
            case "google" -> {
                log.info("Factory: Creating Google Gemini classification strategy");
                log.info("   Model: {}", model);
                yield new GeminiClassificationService(apiKey, baseUrl, model, maxTokens);
            }
            default -> throw new IllegalArgumentException(
                    "Unsupported classifier provider: '" + provider + "'. " +
                            "Supported providers: anthropic, google. " +
                            "Set 'classifier.provider' in application.yml.");
        };
    }
}

package com.invoicebot.ai.config;

import com.invoicebot.ai.service.strategy.ClassificationModelStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Picks the classification model from {@code classifier.provider} and hands
 * the provider's settings to {@link ClassifierModelFactory}.
 */
@Slf4j
@Configuration
public class ClassifierModelConfig {

    @Value("${classifier.provider:anthropic}")
    private String provider;

    @Value("${classifier.max-tokens:512}")
    private int maxTokens;

    // ═══════════════════════════════════════════════════════
    // Anthropic
    // ═══════════════════════════════════════════════════════

    @Value("${anthropic.api-key:}")
    private String anthropicApiKey;

    @Value("${anthropic.base-url:https://api.anthropic.com/v1}")
    private String anthropicBaseUrl;

    @Value("${anthropic.model:claude-haiku-4-5}")
    private String anthropicModel;

    // ═══════════════════════════════════════════════════════
    // Google
    // ═══════════════════════════════════════════════════════

    @Value("${gemini.api-key:}")
    private String geminiApiKey;

    @Value("${gemini.base-url:https://generativelanguage.googleapis.com/v1beta}")
    private String geminiBaseUrl;

    @Value("${gemini.model:gemini-2.0-flash}")
    private String geminiModel;

    @Bean
    public ClassificationModelStrategy classificationModelStrategy() {
        log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━");
        log.info("CONFIGURING CLASSIFICATION MODEL");
        log.info("   Selected provider: {}", provider);

        String apiKey;
        String baseUrl;
        String model;

        switch (provider.toLowerCase()) {
            case "anthropic" -> {
                apiKey = anthropicApiKey;
                baseUrl = anthropicBaseUrl;
                model = anthropicModel;
            }
            case "google" -> {
                apiKey = geminiApiKey;
                baseUrl = geminiBaseUrl;
                model = geminiModel;
            }
            default -> throw new IllegalArgumentException("Unknown classifier provider: " + provider);
        }

        ClassificationModelStrategy strategy = ClassifierModelFactory.create(provider, apiKey, baseUrl, model, maxTokens);

        if (!strategy.isConfigured()) {
            log.warn("   No API key for {}: every document will be routed to review", strategy.getProviderName());
        } else {
            log.info("   API Key loaded: {}", apiKey.substring(0, Math.min(4, apiKey.length())) + "...");
        }
        log.info("   Active provider: {}", strategy.getProviderName());
        log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━");

        return strategy;
    }
}

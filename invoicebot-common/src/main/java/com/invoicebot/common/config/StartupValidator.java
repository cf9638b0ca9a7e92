package com.invoicebot.common.config;

import com.invoicebot.common.auth.RefreshTokenStore;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Fails the boot when required settings are missing so that a misconfigured
 * deployment never gets as far as the first poll.
 */
@Slf4j
@Component
public class StartupValidator {

    private final InvoiceBotProperties properties;
    private final RefreshTokenStore refreshTokenStore;

    @Value("${graph.client-id:}")
    private String graphClientId;

    @Value("${graph.refresh-token:}")
    private String graphRefreshToken;

    public StartupValidator(InvoiceBotProperties properties, RefreshTokenStore refreshTokenStore) {
        this.properties = properties;
        this.refreshTokenStore = refreshTokenStore;
    }

    @PostConstruct
    void validate() {
        List<String> missing = new ArrayList<>();
        if (isBlank(properties.getStorage().getRootFolder())) {
            missing.add("invoicebot.storage.root-folder");
        }
        if (isBlank(graphClientId)) {
            missing.add("graph.client-id (GRAPH_CLIENT_ID)");
        }
        // a token rotated by an earlier run is as good as a configured one
        if (isBlank(graphRefreshToken) && refreshTokenStore.load().isEmpty()) {
            missing.add("graph.refresh-token (GRAPH_REFRESH_TOKEN)");
        }
        String accountantEmail = properties.getAccountant().getEmail();
        if (isBlank(accountantEmail) || !accountantEmail.contains("@")) {
            missing.add("invoicebot.accountant.email (ACCOUNTANT_EMAIL)");
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Missing required configuration: " + String.join(", ", missing));
        }

        double threshold = properties.getClassifier().getConfidenceThreshold();
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalStateException("invoicebot.classifier.confidence-threshold must be within [0,1], got " + threshold);
        }
        if (properties.getStorage().getChunkSize() % (320 * 1024) != 0) {
            throw new IllegalStateException("invoicebot.storage.chunk-size must be a multiple of 320 KiB");
        }

        log.info("Configuration OK: root folder '{}', {} whitelisted sender(s), threshold {}",
                properties.getStorage().getRootFolder(),
                properties.getMail().getWhitelistedSenders().size(),
                threshold);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

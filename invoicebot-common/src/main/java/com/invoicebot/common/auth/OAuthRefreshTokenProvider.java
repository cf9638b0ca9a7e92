package com.invoicebot.common.auth;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * Exchanges a long-lived refresh token for Graph access tokens using the OAuth2
 * refresh_token grant. The access token is cached on this instance. Rotated
 * refresh tokens go to the {@link RefreshTokenStore}, and a stored token wins
 * over the configured one at startup.
 */
@Slf4j
public class OAuthRefreshTokenProvider implements AccessTokenProvider {

    private final WebClient oauthClient;
    private final String tenant;
    private final String clientId;
    private final String scope;
    private final RefreshTokenStore tokenStore;

    private String refreshToken;
    private String accessToken;

    public OAuthRefreshTokenProvider(WebClient oauthClient, String tenant, String clientId,
            String configuredRefreshToken, String scope, RefreshTokenStore tokenStore) {
        this.oauthClient = oauthClient;
        this.tenant = tenant;
        this.clientId = clientId;
        this.scope = scope;
        this.tokenStore = tokenStore;
        Optional<String> stored = tokenStore.load();
        if (stored.isPresent()) {
            log.info("Using refresh token stored in {}", tokenStore.getFile());
        }
        this.refreshToken = stored.orElse(configuredRefreshToken);
    }

    @Override
    public synchronized String getToken() {
        if (accessToken == null) {
            accessToken = requestAccessToken();
        }
        return accessToken;
    }

    @Override
    public synchronized String refreshToken() {
        log.warn("Refreshing Graph access token");
        accessToken = requestAccessToken();
        return accessToken;
    }

    private String requestAccessToken() {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new IllegalStateException("No Graph refresh token configured (graph.refresh-token / GRAPH_REFRESH_TOKEN)");
        }

        MultiValueMap<String, String> formData = new LinkedMultiValueMap<>();
        formData.add("client_id", clientId);
        formData.add("grant_type", "refresh_token");
        formData.add("refresh_token", refreshToken);
        formData.add("scope", scope);

        TokenResponse response = oauthClient.post()
                .uri("/{tenant}/oauth2/v2.0/token", tenant)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData(formData))
                .retrieve()
                .onStatus(status -> status.isError(), resp ->
                        resp.bodyToMono(String.class)
                                .doOnNext(b -> log.error("Token endpoint error: {} - {}", resp.statusCode(), b))
                                .then(Mono.error(new RuntimeException(
                                        "Failed to refresh access token: " + resp.statusCode()))))
                .bodyToMono(TokenResponse.class)
                .block(Duration.ofSeconds(30));

        if (response == null || response.getAccessToken() == null) {
            throw new IllegalStateException("Token endpoint returned no access token");
        }
        if (response.getRefreshToken() != null && !response.getRefreshToken().equals(refreshToken)) {
            refreshToken = response.getRefreshToken();
            try {
                tokenStore.save(refreshToken);
            } catch (IOException e) {
                log.warn("Rotated refresh token kept in memory only, could not write {}: {}",
                        tokenStore.getFile(), e.getMessage());
            }
        }
        log.info("Obtained Graph access token (expires in {}s)", response.getExpiresIn());
        return response.getAccessToken();
    }

    @Data
    static class TokenResponse {
        @JsonProperty("access_token")
        private String accessToken;

        @JsonProperty("refresh_token")
        private String refreshToken;

        @JsonProperty("expires_in")
        private Long expiresIn;
    }
}

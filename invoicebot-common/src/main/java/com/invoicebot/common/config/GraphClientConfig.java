package com.invoicebot.common.config;

import com.invoicebot.common.auth.AccessTokenProvider;
import com.invoicebot.common.auth.OAuthRefreshTokenProvider;
import com.invoicebot.common.auth.RefreshTokenStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.nio.file.Path;
import java.time.Duration;

@Configuration
public class GraphClientConfig {

    @Value("${graph.base-url:https://graph.microsoft.com/v1.0}")
    private String graphBaseUrl;

    @Value("${graph.authority:https://login.microsoftonline.com}")
    private String authority;

    @Value("${graph.tenant:consumers}")
    private String tenant;

    @Value("${graph.client-id:}")
    private String clientId;

    @Value("${graph.refresh-token:}")
    private String refreshToken;

    @Value("${graph.scope:offline_access Mail.ReadWrite Files.ReadWrite}")
    private String scope;

    @Bean
    public WebClient graphWebClient(WebClient.Builder builder) {
        // attachments are capped at 20 MiB but arrive base64 encoded inside JSON
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(64 * 1024 * 1024))
                .build();

        HttpClient httpClient = HttpClient.create()
                .responseTimeout(Duration.ofSeconds(60));

        return builder
                .baseUrl(graphBaseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies)
                .build();
    }

    @Bean
    public WebClient microsoftOauthClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(Duration.ofSeconds(30));

        return builder
                .baseUrl(authority)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Bean
    public RefreshTokenStore refreshTokenStore(InvoiceBotProperties properties) {
        return new RefreshTokenStore(Path.of(properties.getDataDir(), RefreshTokenStore.FILENAME));
    }

    @Bean
    public AccessTokenProvider accessTokenProvider(WebClient microsoftOauthClient, RefreshTokenStore refreshTokenStore) {
        return new OAuthRefreshTokenProvider(microsoftOauthClient, tenant, clientId, refreshToken, scope,
                refreshTokenStore);
    }
}

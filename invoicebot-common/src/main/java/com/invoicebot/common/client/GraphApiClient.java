package com.invoicebot.common.client;

import com.invoicebot.common.auth.AccessTokenProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.function.BiFunction;

/**
 * Thin wrapper around the Graph {@link WebClient} that attaches the bearer token
 * and retries a request exactly once after an HTTP 401, with a freshly
 * refreshed token. A second 401, and every other error status, propagates to
 * the caller as a {@link WebClientResponseException}.
 */
@Slf4j
@Component
public class GraphApiClient {

    private final WebClient graphWebClient;
    private final AccessTokenProvider tokenProvider;

    public GraphApiClient(@Qualifier("graphWebClient") WebClient graphWebClient,
            AccessTokenProvider tokenProvider) {
        this.graphWebClient = graphWebClient;
        this.tokenProvider = tokenProvider;
    }

    /**
     * Runs {@code request} with the Graph client and an "Authorization" header
     * value, blocking for the result.
     *
     * @param operation short description used in log lines
     */
    public <T> T execute(String operation, BiFunction<WebClient, String, Mono<T>> request) {
        try {
            return request.apply(graphWebClient, bearer(tokenProvider.getToken())).block();
        } catch (WebClientResponseException.Unauthorized e) {
            log.warn("Graph answered 401 for {}, refreshing token and retrying once", operation);
            return request.apply(graphWebClient, bearer(tokenProvider.refreshToken())).block();
        }
    }

    private static String bearer(String token) {
        return "Bearer " + token;
    }
}

package com.invoicebot.ai.service;

import com.invoicebot.ai.service.strategy.ClassificationModelStrategy.ModelReply;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnthropicClassificationServiceTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    private AnthropicClassificationService serviceAnswering(HttpStatus status, String body) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, "application/json")
                    .body(body)
                    .build());
        });
        return new AnthropicClassificationService(builder, "sk-test", "https://api.test/v1", "test-model", 512);
    }

    @Test
    @DisplayName("Should return the first content block text and send the API headers")
    void classifyText_shouldReturnContentText() {
        AnthropicClassificationService service = serviceAnswering(HttpStatus.OK,
                "{\"content\":[{\"type\":\"text\",\"text\":\"  {\\\"is_invoice\\\": true}  \"}],"
                        + "\"usage\":{\"input_tokens\":10,\"output_tokens\":5}}");

        ModelReply reply = service.classifyText("system", "user");

        assertTrue(reply.isSuccessful());
        assertEquals("{\"is_invoice\": true}", reply.getText());
        ClientRequest request = requests.get(0);
        assertEquals("https://api.test/v1/messages", request.url().toString());
        assertEquals("sk-test", request.headers().getFirst("x-api-key"));
        assertEquals("2023-06-01", request.headers().getFirst("anthropic-version"));
    }

    @Test
    @DisplayName("Should turn an HTTP error into a failed reply instead of throwing")
    void classifyImage_shouldFailOnHttpError() {
        AnthropicClassificationService service = serviceAnswering(HttpStatus.TOO_MANY_REQUESTS,
                "{\"type\":\"error\",\"error\":{\"message\":\"rate limited\"}}");

        ModelReply reply = service.classifyImage("system", "user", new byte[] { 1 }, "image/png");

        assertFalse(reply.isSuccessful());
        assertNotNull(reply.getErrorMessage());
    }

    @Test
    @DisplayName("Should fail when the response carries no content")
    void classifyText_shouldFailOnEmptyContent() {
        AnthropicClassificationService service = serviceAnswering(HttpStatus.OK, "{\"content\":[]}");

        assertFalse(service.classifyText("system", "user").isSuccessful());
    }

    @Test
    @DisplayName("Should report itself unconfigured without an API key")
    void isConfigured_shouldRequireKey() {
        assertFalse(new AnthropicClassificationService("", "https://api.test/v1", "m", 512).isConfigured());
        assertTrue(serviceAnswering(HttpStatus.OK, "{}").isConfigured());
    }
}

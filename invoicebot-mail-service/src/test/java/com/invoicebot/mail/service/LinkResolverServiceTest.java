package com.invoicebot.mail.service;

import com.invoicebot.common.config.InvoiceBotProperties;
import com.invoicebot.common.model.CandidateDocument;
import com.invoicebot.common.model.DocumentOrigin;
import com.invoicebot.common.model.SupportedMediaTypes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LinkResolverServiceTest {

    private static final String PDF_BODY = "%PDF-1.4 invoice";

    private final Map<String, String> dns = new HashMap<>();
    private final List<ClientRequest> requests = new ArrayList<>();
    private final Deque<ClientResponse> responses = new ArrayDeque<>();

    private InvoiceBotProperties properties;
    private LinkResolverService resolver;

    @BeforeEach
    void setUp() {
        properties = new InvoiceBotProperties();
        dns.put("billing.example.com", "93.184.216.34");
        resolver = newResolver();
    }

    private LinkResolverService newResolver() {
        HostResolver hostResolver = host -> {
            String ip = dns.get(host);
            if (ip == null) {
                throw new UnknownHostException(host);
            }
            // literal addresses, no lookup happens
            return List.of(InetAddress.getByName(ip));
        };
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(responses.isEmpty() ? ClientResponse.create(HttpStatus.NOT_FOUND).build() : responses.poll());
        });
        return new LinkResolverService(builder, hostResolver, properties);
    }

    private static ClientResponse pdf(String contentDisposition) {
        ClientResponse.Builder response = ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, "application/pdf");
        if (contentDisposition != null) {
            response.header(HttpHeaders.CONTENT_DISPOSITION, contentDisposition);
        }
        return response.body(PDF_BODY).build();
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Address guard
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should refuse loopback, private and link-local targets before any request")
    void resolve_shouldRefuseInternalAddresses() {
        dns.put("loopback.test", "127.0.0.1");
        dns.put("private.test", "10.0.0.1");
        dns.put("metadata.test", "169.254.169.254");
        dns.put("lan.test", "192.168.1.20");
        dns.put("v6.test", "::1");

        for (String host : List.of("loopback.test", "private.test", "metadata.test", "lan.test", "v6.test")) {
            assertTrue(resolver.resolve("https://" + host + "/invoice.pdf").isEmpty(), host);
        }
        assertTrue(requests.isEmpty());
    }

    @Test
    @DisplayName("Should refuse a host that does not resolve")
    void resolve_shouldRefuseUnresolvableHost() {
        assertTrue(resolver.resolve("https://nowhere.test/invoice.pdf").isEmpty());
        assertTrue(requests.isEmpty());
    }

    @Test
    @DisplayName("Should refuse non-http schemes")
    void resolve_shouldRefuseOtherSchemes() {
        assertTrue(resolver.resolve("file:///etc/passwd").isEmpty());
        assertTrue(resolver.resolve("ftp://billing.example.com/invoice.pdf").isEmpty());
        assertTrue(requests.isEmpty());
    }

    @Test
    @DisplayName("Should flag IPv6 unique-local addresses as internal")
    void isInternal_shouldCoverUniqueLocalIpv6() throws UnknownHostException {
        assertTrue(LinkResolverService.isInternal(InetAddress.getByName("fd12:3456::1")));
        assertTrue(LinkResolverService.isInternal(InetAddress.getByName("0.0.0.0")));
        assertFalse(LinkResolverService.isInternal(InetAddress.getByName("2606:4700::1111")));
        assertFalse(LinkResolverService.isInternal(InetAddress.getByName("8.8.8.8")));
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Download
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should download from a public address with the configured User-Agent")
    void resolve_shouldDownloadFromPublicAddress() {
        responses.add(pdf("attachment; filename=\"INV-2025-001.pdf\""));

        Optional<CandidateDocument> document = resolver.resolve("https://billing.example.com/download?id=1");

        assertTrue(document.isPresent());
        assertEquals("INV-2025-001.pdf", document.get().name());
        assertEquals(SupportedMediaTypes.PDF, document.get().mediaType());
        assertEquals(DocumentOrigin.LINK_DOWNLOAD, document.get().origin());
        assertEquals(PDF_BODY, new String(document.get().content(), StandardCharsets.UTF_8));
        assertEquals(1, requests.size());
        assertEquals("Mozilla/5.0 (invoice-bot)", requests.get(0).headers().getFirst(HttpHeaders.USER_AGENT));
    }

    @Test
    @DisplayName("Should follow a redirect and name the file after the final URL")
    void resolve_shouldFollowRedirects() {
        dns.put("cdn.example.net", "151.101.1.1");
        responses.add(ClientResponse.create(HttpStatus.FOUND)
                .header(HttpHeaders.LOCATION, "https://cdn.example.net/files/facture-mars.pdf")
                .build());
        responses.add(pdf(null));

        Optional<CandidateDocument> document = resolver.resolve("https://billing.example.com/invoice/42");

        assertTrue(document.isPresent());
        assertEquals("facture-mars.pdf", document.get().name());
        assertEquals(2, requests.size());
        assertEquals(URI.create("https://cdn.example.net/files/facture-mars.pdf"), requests.get(1).url());
    }

    @Test
    @DisplayName("Should refuse a redirect that points at an internal address")
    void resolve_shouldCheckEveryRedirectHop() {
        dns.put("internal.example.com", "10.1.2.3");
        responses.add(ClientResponse.create(HttpStatus.MOVED_PERMANENTLY)
                .header(HttpHeaders.LOCATION, "http://internal.example.com/admin")
                .build());

        assertTrue(resolver.resolve("https://billing.example.com/invoice/42").isEmpty());
        assertEquals(1, requests.size());
    }

    @Test
    @DisplayName("Should stop after too many redirects")
    void resolve_shouldLimitRedirects() {
        properties.getLinks().setMaxRedirects(1);
        resolver = newResolver();
        for (int i = 0; i < 3; i++) {
            responses.add(ClientResponse.create(HttpStatus.FOUND)
                    .header(HttpHeaders.LOCATION, "/invoice/" + i)
                    .build());
        }

        assertTrue(resolver.resolve("https://billing.example.com/invoice/start").isEmpty());
        assertEquals(2, requests.size());
    }

    @Test
    @DisplayName("Should refuse a response whose declared length exceeds the cap")
    void resolve_shouldRefuseOversizedDeclaredLength() {
        properties.getMail().setMaxAttachmentBytes(8);
        resolver = newResolver();
        responses.add(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, "application/pdf")
                .header(HttpHeaders.CONTENT_LENGTH, String.valueOf(PDF_BODY.length()))
                .body(PDF_BODY)
                .build());

        assertTrue(resolver.resolve("https://billing.example.com/invoice.pdf").isEmpty());
    }

    @Test
    @DisplayName("Should refuse a body that exceeds the cap without a declared length")
    void resolve_shouldRefuseOversizedBody() {
        properties.getMail().setMaxAttachmentBytes(8);
        resolver = newResolver();
        responses.add(pdf(null));

        assertTrue(resolver.resolve("https://billing.example.com/invoice.pdf").isEmpty());
    }

    @Test
    @DisplayName("Should refuse unsupported content types and error statuses")
    void resolve_shouldRefuseUnsupportedResponses() {
        responses.add(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, "text/html")
                .body("<html>login</html>")
                .build());
        assertTrue(resolver.resolve("https://billing.example.com/invoice").isEmpty());

        responses.add(ClientResponse.create(HttpStatus.FORBIDDEN).build());
        assertTrue(resolver.resolve("https://billing.example.com/invoice").isEmpty());
    }

    @Test
    @DisplayName("Should accept octet-stream when the filename has a supported extension")
    void resolve_shouldInferTypeFromFilename() {
        responses.add(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, "application/octet-stream")
                .body(PDF_BODY)
                .build());

        Optional<CandidateDocument> document = resolver.resolve("https://billing.example.com/files/bill.pdf");

        assertTrue(document.isPresent());
        assertEquals(SupportedMediaTypes.PDF, document.get().mediaType());
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Filename derivation
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should prefer the RFC 5987 filename over the plain one")
    void filenameFrom_shouldPreferExtendedForm() {
        String header = "attachment; filename=\"fallback.pdf\"; filename*=UTF-8''facture%20d%C3%A9cembre.pdf";

        assertEquals("facture décembre.pdf",
                LinkResolverService.filenameFrom(header, URI.create("https://x.test/a"), SupportedMediaTypes.PDF));
    }

    @Test
    @DisplayName("Should keep only the base name of a plain Content-Disposition filename")
    void filenameFrom_shouldStripDirectories() {
        assertEquals("inv-42.pdf", LinkResolverService.filenameFrom("attachment; filename=\"reports/2025/inv-42.pdf\"",
                URI.create("https://x.test/a"), SupportedMediaTypes.PDF));
    }

    @Test
    @DisplayName("Should fall back to the URL path when the header cannot be parsed")
    void filenameFrom_shouldIgnoreMalformedHeader() {
        assertEquals("bill.pdf", LinkResolverService.filenameFrom("attachment; filename*=UTF-16''inv.pdf",
                URI.create("https://x.test/files/bill.pdf"), SupportedMediaTypes.PDF));
    }

    @Test
    @DisplayName("Should use the URL path or a generic name when no header helps")
    void filenameFrom_shouldFallBack() {
        assertEquals("bill 7.pdf", LinkResolverService.filenameFrom(null,
                URI.create("https://x.test/files/bill%207.pdf"), SupportedMediaTypes.PDF));
        assertEquals("invoice.png", LinkResolverService.filenameFrom("inline",
                URI.create("https://x.test/download"), SupportedMediaTypes.PNG));
    }
}

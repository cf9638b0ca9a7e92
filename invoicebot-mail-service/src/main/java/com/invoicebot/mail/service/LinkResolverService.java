package com.invoicebot.mail.service;

import com.invoicebot.common.config.InvoiceBotProperties;
import com.invoicebot.common.model.CandidateDocument;
import com.invoicebot.common.model.DocumentOrigin;
import com.invoicebot.common.model.SupportedMediaTypes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriUtils;
import reactor.core.publisher.Mono;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Link Resolver: downloads a document referenced from a message body.
 *
 * Every hop, the first request and each redirect target, is checked against
 * the address guard before anything is sent: a host that does not resolve,
 * or that resolves to any loopback, link-local, private or wildcard address,
 * is refused. Redirects are followed by hand for that reason. Never throws;
 * a refusal is an empty result plus a WARN line.
 */
@Slf4j
@Service
public class LinkResolverService {

    private final WebClient downloadClient;
    private final HostResolver hostResolver;
    private final InvoiceBotProperties.Links settings;
    private final long maxBytes;

    public LinkResolverService(WebClient.Builder webClientBuilder, HostResolver hostResolver,
            InvoiceBotProperties properties) {
        this.downloadClient = webClientBuilder.build();
        this.hostResolver = hostResolver;
        this.settings = properties.getLinks();
        this.maxBytes = properties.getMail().getMaxAttachmentBytes();
    }

    public Optional<CandidateDocument> resolve(String url) {
        URI current;
        try {
            current = URI.create(url.trim());
        } catch (IllegalArgumentException e) {
            log.warn("Link refused, malformed URL: {}", url);
            return Optional.empty();
        }

        try {
            for (int hop = 0; hop <= settings.getMaxRedirects(); hop++) {
                if (!isSafeTarget(current)) {
                    return Optional.empty();
                }

                Fetched fetched = fetch(current);
                if (fetched.status().is3xxRedirection()) {
                    String location = fetched.headers().getFirst(HttpHeaders.LOCATION);
                    if (location == null || location.isBlank()) {
                        log.warn("Link refused, redirect without Location: {}", current);
                        return Optional.empty();
                    }
                    current = current.resolve(location.trim());
                    log.debug("Following redirect to {}", current);
                    continue;
                }
                if (!fetched.status().is2xxSuccessful()) {
                    log.warn("Link refused, HTTP {} from {}", fetched.status().value(), current);
                    return Optional.empty();
                }
                if (fetched.body() == null) {
                    log.warn("Link refused, declared size {} exceeds {} bytes: {}",
                            fetched.headers().getContentLength(), maxBytes, current);
                    return Optional.empty();
                }
                return toDocument(current, fetched);
            }
            log.warn("Link refused, more than {} redirects: {}", settings.getMaxRedirects(), url);
            return Optional.empty();
        } catch (Exception e) {
            log.warn("Link download failed for {}: {}", url, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Address guard. Only http(s) URLs whose host resolves exclusively to
     * public addresses pass.
     */
    boolean isSafeTarget(URI uri) {
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            log.warn("Link refused, unsupported scheme: {}", uri);
            return false;
        }
        String host = uri.getHost();
        if (host == null || host.isBlank()) {
            log.warn("Link refused, no host: {}", uri);
            return false;
        }

        List<InetAddress> addresses;
        try {
            addresses = hostResolver.resolve(host);
        } catch (UnknownHostException e) {
            log.warn("Link refused, host does not resolve: {}", host);
            return false;
        }
        if (addresses == null || addresses.isEmpty()) {
            log.warn("Link refused, host does not resolve: {}", host);
            return false;
        }
        for (InetAddress address : addresses) {
            if (isInternal(address)) {
                log.warn("Link refused, {} resolves to internal address {}", host, address.getHostAddress());
                return false;
            }
        }
        return true;
    }

    static boolean isInternal(InetAddress address) {
        if (address.isLoopbackAddress() || address.isLinkLocalAddress()
                || address.isSiteLocalAddress() || address.isAnyLocalAddress()) {
            return true;
        }
        // IPv6 unique local fc00::/7
        return address instanceof Inet6Address && (address.getAddress()[0] & 0xFE) == 0xFC;
    }

    private Fetched fetch(URI uri) {
        return downloadClient
                .get()
                .uri(uri)
                .header(HttpHeaders.USER_AGENT, settings.getUserAgent())
                .exchangeToMono(this::readResponse)
                .timeout(settings.getTimeout())
                .block();
    }

    private Mono<Fetched> readResponse(ClientResponse response) {
        HttpStatusCode status = response.statusCode();
        HttpHeaders headers = response.headers().asHttpHeaders();
        if (!status.is2xxSuccessful()) {
            return response.releaseBody().thenReturn(new Fetched(status, headers, null));
        }
        if (headers.getContentLength() > maxBytes) {
            return response.releaseBody().thenReturn(new Fetched(status, headers, null));
        }
        // join fails with DataBufferLimitException past the cap
        return DataBufferUtils.join(response.bodyToFlux(DataBuffer.class), (int) Math.min(maxBytes, Integer.MAX_VALUE))
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return bytes;
                })
                .defaultIfEmpty(new byte[0])
                .map(bytes -> new Fetched(status, headers, bytes));
    }

    private Optional<CandidateDocument> toDocument(URI finalUri, Fetched fetched) {
        String contentType = SupportedMediaTypes.normalize(fetched.headers().getFirst(HttpHeaders.CONTENT_TYPE));
        String filename = filenameFrom(fetched.headers().getFirst(HttpHeaders.CONTENT_DISPOSITION), finalUri, contentType);

        if (!SupportedMediaTypes.isSupported(contentType)) {
            // generic binary types are accepted when the filename says what the file is
            Optional<String> byName = SupportedMediaTypes.isContainer(null, filename)
                    ? Optional.of(SupportedMediaTypes.ZIP)
                    : SupportedMediaTypes.forDocumentExtension(filename);
            if (!"application/octet-stream".equals(contentType) || byName.isEmpty()) {
                log.warn("Link refused, unsupported content type {}: {}", contentType, finalUri);
                return Optional.empty();
            }
            contentType = byName.get();
        }
        if (fetched.body().length == 0) {
            log.warn("Link refused, empty body: {}", finalUri);
            return Optional.empty();
        }

        log.info("Downloaded invoice from link: filename='{}' content_type={} size={} bytes",
                filename, contentType, fetched.body().length);
        return Optional.of(new CandidateDocument(filename, contentType, fetched.body(), DocumentOrigin.LINK_DOWNLOAD));
    }

    /**
     * Content-Disposition {@code filename*} (RFC 5987), then {@code filename},
     * then the last path segment when it has an extension, then a generic name.
     */
    static String filenameFrom(String contentDisposition, URI finalUri, String contentType) {
        if (contentDisposition != null && !contentDisposition.isBlank()) {
            try {
                String name = ContentDisposition.parse(contentDisposition).getFilename();
                if (name != null && !name.isBlank()) {
                    return basename(name.trim());
                }
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring malformed Content-Disposition '{}': {}", contentDisposition, e.getMessage());
            }
        }

        String path = finalUri.getRawPath();
        if (path != null && !path.isEmpty()) {
            String segment = UriUtils.decode(path.substring(path.lastIndexOf('/') + 1), StandardCharsets.UTF_8);
            if (segment.contains(".")) {
                return segment;
            }
        }
        return "invoice" + SupportedMediaTypes.extensionFor(contentType);
    }

    private static String basename(String name) {
        String normalized = name.replace('\\', '/');
        return normalized.substring(normalized.lastIndexOf('/') + 1);
    }

    private record Fetched(HttpStatusCode status, HttpHeaders headers, byte[] body) {
    }
}

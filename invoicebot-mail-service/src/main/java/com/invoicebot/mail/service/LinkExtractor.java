package com.invoicebot.mail.service;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls candidate download URLs out of a message body.
 */
@Slf4j
@Component
public class LinkExtractor {

    private static final Pattern RAW_URL = Pattern.compile("https?://[^\\s\"'<>]+");

    /**
     * URLs whose lowercase form contains at least one keyword, in first-seen
     * order without duplicates.
     *
     * @param html true when the body content type is HTML
     */
    public List<String> extract(String body, boolean html, List<String> keywords) {
        if (body == null || body.isBlank() || keywords == null || keywords.isEmpty()) {
            return List.of();
        }

        List<String> candidates;
        if (html) {
            try {
                candidates = anchors(body);
            } catch (RuntimeException e) {
                log.warn("HTML body could not be parsed, falling back to raw URL scan: {}", e.getMessage());
                candidates = rawUrls(body);
            }
        } else {
            candidates = rawUrls(body);
        }

        List<String> lowered = keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(k -> k.trim().toLowerCase(Locale.ROOT))
                .toList();

        Set<String> matched = new LinkedHashSet<>();
        for (String url : candidates) {
            String lower = url.toLowerCase(Locale.ROOT);
            if (lowered.stream().anyMatch(lower::contains)) {
                matched.add(url);
            }
        }
        return new ArrayList<>(matched);
    }

    private List<String> anchors(String html) {
        List<String> urls = new ArrayList<>();
        for (Element a : Jsoup.parse(html).select("a[href]")) {
            String href = a.attr("href").trim();
            if (href.startsWith("http://") || href.startsWith("https://")) {
                urls.add(href);
            }
        }
        return urls;
    }

    private List<String> rawUrls(String text) {
        List<String> urls = new ArrayList<>();
        Matcher m = RAW_URL.matcher(text);
        while (m.find()) {
            urls.add(m.group());
        }
        return urls;
    }
}

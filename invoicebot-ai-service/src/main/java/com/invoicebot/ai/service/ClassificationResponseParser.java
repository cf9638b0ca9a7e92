package com.invoicebot.ai.service;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.invoicebot.common.config.InvoiceBotProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns the model's text answer into a {@link ModelAssessment}.
 *
 * The answer must hold a JSON object with at least {@code is_invoice} and
 * {@code confidence}; anything else yields {@link Optional#empty()}. Optional
 * fields are sanitized individually and dropped to null when they fail:
 * <ul>
 * <li>supplier: null markers rejected, capped at 80 chars, discarded when it
 * contains one of the owner's own business names;</li>
 * <li>invoice_date: strict {@code YYYY-MM-DD} and a real calendar date;</li>
 * <li>amounts: finite numbers only, negatives allowed (credit notes);</li>
 * <li>currency: uppercased, capped at 8 chars, null markers rejected.</li>
 * </ul>
 */
@Slf4j
@Component
public class ClassificationResponseParser {

    static final int MAX_SUPPLIER_CHARS = 80;
    static final int MAX_CURRENCY_CHARS = 8;
    private static final int MAX_REASON_CHARS = 500;

    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final Set<String> NULL_MARKERS = Set.of("null", "none", "n/a", "");

    // NaN/Infinity literals must parse so they can be rejected per field
    private final ObjectMapper objectMapper = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .build();

    private final List<String> ownerNames;

    public ClassificationResponseParser(InvoiceBotProperties properties) {
        this.ownerNames = properties.getClassifier().getOwnerBusinessNames().stream()
                .filter(name -> name != null && !name.isBlank())
                .map(name -> name.strip().toLowerCase(Locale.ROOT))
                .toList();
    }

    public Optional<ModelAssessment> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            log.warn("Empty classifier response");
            return Optional.empty();
        }
        try {
            JsonNode data = objectMapper.readTree(stripFences(raw));
            if (data == null || !data.isObject()) {
                log.warn("Classifier response is not a JSON object: {}", abbreviate(raw));
                return Optional.empty();
            }

            Boolean isInvoice = parseBoolean(data.get("is_invoice"));
            Double confidence = parseNumber(data.get("confidence"));
            if (isInvoice == null || confidence == null) {
                log.warn("Classifier response lacks is_invoice/confidence: {}", abbreviate(raw));
                return Optional.empty();
            }

            return Optional.of(new ModelAssessment(
                    isInvoice,
                    Math.max(0.0, Math.min(1.0, confidence)),
                    parseReason(data.get("reason")),
                    parseDate(data.get("invoice_date")),
                    parseSupplier(data.get("supplier")),
                    parseNumber(data.get("amount_ht")),
                    parseNumber(data.get("amount_tva")),
                    parseNumber(data.get("amount_ttc")),
                    parseCurrency(data.get("currency"))));

        } catch (Exception e) {
            log.warn("Failed to parse classifier response {}: {}", abbreviate(raw), e.getMessage());
            return Optional.empty();
        }
    }

    /** Removes Markdown code fences and any prose around the JSON object. */
    static String stripFences(String raw) {
        String clean = raw.strip();
        if (clean.startsWith("```json")) {
            clean = clean.substring(7);
        } else if (clean.startsWith("```")) {
            clean = clean.substring(3);
        }
        if (clean.endsWith("```")) {
            clean = clean.substring(0, clean.length() - 3);
        }
        clean = clean.strip();
        if (!clean.startsWith("{")) {
            int start = clean.indexOf('{');
            int end = clean.lastIndexOf('}');
            if (start >= 0 && end > start) {
                clean = clean.substring(start, end + 1);
            }
        }
        return clean;
    }

    private static Boolean parseBoolean(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            String text = node.textValue().strip().toLowerCase(Locale.ROOT);
            if (text.equals("true")) {
                return true;
            }
            if (text.equals("false")) {
                return false;
            }
        }
        return null;
    }

    /** Finite number from a JSON number or numeric string, else null. */
    static Double parseNumber(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        double value;
        if (node.isNumber()) {
            value = node.doubleValue();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.textValue().strip());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(value) ? value : null;
    }

    static LocalDate parseDate(JsonNode node) {
        String text = nonNullText(node);
        if (text == null) {
            return null;
        }
        if (!ISO_DATE.matcher(text).matches()) {
            log.debug("invoice_date '{}' ignored, not YYYY-MM-DD", text);
            return null;
        }
        try {
            return LocalDate.parse(text);
        } catch (DateTimeException e) {
            log.debug("invoice_date '{}' ignored, not a calendar date", text);
            return null;
        }
    }

    String parseSupplier(JsonNode node) {
        String supplier = nonNullText(node);
        if (supplier == null) {
            return null;
        }
        if (supplier.length() > MAX_SUPPLIER_CHARS) {
            supplier = supplier.substring(0, MAX_SUPPLIER_CHARS);
        }
        String lower = supplier.toLowerCase(Locale.ROOT);
        for (String owned : ownerNames) {
            if (lower.contains(owned)) {
                log.debug("Discarding owner business name as supplier: '{}'", supplier);
                return null;
            }
        }
        return supplier;
    }

    static String parseCurrency(JsonNode node) {
        String currency = nonNullText(node);
        if (currency == null) {
            return null;
        }
        currency = currency.toUpperCase(Locale.ROOT);
        return currency.length() > MAX_CURRENCY_CHARS ? currency.substring(0, MAX_CURRENCY_CHARS) : currency;
    }

    private static String parseReason(JsonNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        String reason = node.isTextual() ? node.textValue() : node.toString();
        return reason.length() > MAX_REASON_CHARS ? reason.substring(0, MAX_REASON_CHARS) : reason;
    }

    /** Stripped text of a scalar node, or null for JSON null and null markers. */
    private static String nonNullText(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String text = node.asText().strip();
        return NULL_MARKERS.contains(text.toLowerCase(Locale.ROOT)) ? null : text;
    }

    private static String abbreviate(String raw) {
        return raw.length() > 200 ? raw.substring(0, 200) + "..." : raw;
    }
}

package com.invoicebot.common.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Bot settings bound from the {@code invoicebot} prefix.
 *
 * <pre>
 * invoicebot:
 *   data-dir: /app/data
 *   mail:
 *     whitelisted-senders: [billing@example.com]
 *     subject-keywords: [invoice, facture]
 *   links:
 *     keywords: [download, invoice]
 *   classifier:
 *     confidence-threshold: 0.5
 *     owner-business-names: [my own company]
 *     sender-suppliers:
 *       "[billing@example.com]": Example Corp
 *   storage:
 *     root-folder: Invoices
 *   accountant:
 *     email: accounting@example.com
 * </pre>
 *
 * Provider credentials (model API keys, Graph client id) are read with
 * {@code @Value} by the classes that use them.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "invoicebot")
public class InvoiceBotProperties {

    private String dataDir = "./data";

    private Mail mail = new Mail();
    private Links links = new Links();
    private Classifier classifier = new Classifier();
    private Storage storage = new Storage();
    private Report report = new Report();
    private Accountant accountant = new Accountant();
    private Schedule schedule = new Schedule();

    @Getter
    @Setter
    public static class Mail {
        private String primaryFolder = "inbox";
        private List<String> secondaryFolders = new ArrayList<>(List.of("junkemail", "archive"));
        private int pageSize = 100;
        private Instant since;
        private Duration lookback = Duration.ofDays(30);
        private List<String> whitelistedSenders = new ArrayList<>();
        private List<String> subjectKeywords = new ArrayList<>();
        private long maxAttachmentBytes = 20L * 1024 * 1024;

        public int effectivePageSize() {
            return Math.max(1, Math.min(pageSize, 1000));
        }
    }

    @Getter
    @Setter
    public static class Links {
        private List<String> keywords = new ArrayList<>();
        private Duration timeout = Duration.ofSeconds(30);
        private int maxRedirects = 5;
        private String userAgent = "Mozilla/5.0 (invoice-bot)";
    }

    @Getter
    @Setter
    public static class Classifier {
        private double confidenceThreshold = 0.5;
        private List<String> ownerBusinessNames = new ArrayList<>();
        private int maxTextChars = 3000;
        private int maxPdfPages = 2;
        private int maxSpreadsheetRows = 100;
        private Map<String, String> senderSuppliers = new LinkedHashMap<>();

        /** Supplier hint configured for a sender address, matched case-insensitively. */
        public Optional<String> supplierHintFor(String sender) {
            if (sender == null || senderSuppliers.isEmpty()) {
                return Optional.empty();
            }
            String key = sender.trim().toLowerCase(Locale.ROOT);
            return senderSuppliers.entrySet().stream()
                    .filter(e -> e.getKey().trim().toLowerCase(Locale.ROOT).equals(key))
                    .map(Map.Entry::getValue)
                    .filter(v -> v != null && !v.isBlank())
                    .findFirst();
        }
    }

    @Getter
    @Setter
    public static class Storage {
        private String rootFolder;
        private String reviewFolder = "_review";
        private long simpleUploadLimit = 4L * 1024 * 1024;
        // must stay a multiple of 320 KiB
        private int chunkSize = 10 * 320 * 1024;
        // "anonymous" for personal accounts, "organization" for work tenants
        private String shareScope = "anonymous";
    }

    @Getter
    @Setter
    public static class Report {
        private String homeCurrency = "EUR";
        private String cron = "0 0 8 1 * *";
    }

    @Getter
    @Setter
    public static class Accountant {
        // recipient of the monthly report draft, never sent automatically
        private String email;
    }

    @Getter
    @Setter
    public static class Schedule {
        // off for one-shot backfill runs
        private boolean enabled = true;
        private Duration pollInterval = Duration.ofMinutes(60);
    }
}

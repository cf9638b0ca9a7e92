package com.invoicebot.mail.service;

import java.text.Normalizer;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Set;

/**
 * Deterministic, sortable names for stored documents:
 * {@code {date}_{company-label}_{original-name}}.
 */
public final class StorageNaming {

    private static final int MAX_LABEL_CHARS = 40;
    private static final String UNKNOWN_DATE = "0000-00-00";

    private static final Set<String> COMPOUND_TLDS = Set.of(
            "co.uk", "co.jp", "co.nz", "co.za", "co.in", "co.kr",
            "com.au", "com.br", "com.fr", "com.mx", "com.ar",
            "org.uk", "net.au", "gov.uk");

    private StorageNaming() {
    }

    /**
     * @param invoiceDate extracted invoice date, may be null
     * @param receivedAt  message reception time, may be null
     * @param supplier    extracted supplier name, may be null
     */
    public static String buildFilename(LocalDate invoiceDate, OffsetDateTime receivedAt,
            String supplier, String sender, String originalName) {
        String date;
        if (invoiceDate != null) {
            date = invoiceDate.toString();
        } else if (receivedAt != null) {
            date = receivedAt.withOffsetSameInstant(ZoneOffset.UTC).toLocalDate().toString();
        } else {
            date = UNKNOWN_DATE;
        }
        return date + "_" + companyLabel(supplier, sender) + "_" + sanitize(originalName);
    }

    /**
     * Supplier slug when the supplier yields one, else the sender's domain label.
     * Also names the per-supplier invoice folder.
     */
    public static String companyLabel(String supplier, String sender) {
        if (supplier != null && !supplier.isBlank()) {
            String slug = supplierLabel(supplier);
            if (!slug.isEmpty()) {
                return slug;
            }
        }
        return senderLabel(sender);
    }

    /** "EDF Électricité de France" becomes "edf-electricite-de-france". */
    public static String supplierLabel(String supplier) {
        String ascii = Normalizer.normalize(supplier, Normalizer.Form.NFKD).replaceAll("[^\\p{ASCII}]", "");
        String slug = ascii.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+|-+$", "");
        return slug.length() > MAX_LABEL_CHARS ? slug.substring(0, MAX_LABEL_CHARS) : slug;
    }

    /**
     * Second-level domain of the sender: "noreply@shop.com" gives "shop",
     * "billing@mail.acme.co.uk" gives "acme".
     */
    public static String senderLabel(String sender) {
        if (sender == null || sender.isBlank()) {
            return "unknown";
        }
        String domain = sender.contains("@") ? sender.substring(sender.lastIndexOf('@') + 1) : sender;
        String[] parts = domain.trim().toLowerCase(Locale.ROOT).split("\\.");

        String label;
        if (parts.length >= 3 && COMPOUND_TLDS.contains(parts[parts.length - 2] + "." + parts[parts.length - 1])) {
            label = parts[parts.length - 3];
        } else if (parts.length >= 2) {
            label = parts[parts.length - 2];
        } else {
            label = parts[0];
        }
        label = sanitize(label);
        return label.isEmpty() ? "unknown" : label;
    }

    /** Replaces characters that are not allowed in OneDrive item names. */
    public static String sanitize(String name) {
        if (name == null) {
            return "";
        }
        return name.replaceAll("[<>:\"/\\\\|?*\\x00-\\x1f]", "_").trim();
    }
}

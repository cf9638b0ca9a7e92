package com.invoicebot.common.model;

import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.List;

/**
 * One mailbox item produced by a scan. Never mutated; the durable trace of a
 * message is its processed_emails row, not this object.
 */
public record MailMessage(
        String messageId,
        String sender,
        String subject,
        OffsetDateTime receivedAt,
        String sourceFolder,
        List<CandidateDocument> documents
) {
    public MailMessage {
        sender = sender == null ? "" : sender.trim().toLowerCase();
        subject = subject == null ? "" : subject;
        documents = documents == null ? List.of() : List.copyOf(documents);
    }

    /**
     * Year/month of reception in UTC, the fallback storage period. The current
     * month when the mail API gave no timestamp.
     */
    public YearMonth receivedPeriod() {
        if (receivedAt == null) {
            return YearMonth.now(ZoneOffset.UTC);
        }
        return YearMonth.from(receivedAt.withOffsetSameInstant(ZoneOffset.UTC));
    }
}

package com.invoicebot.common.entity;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Dedup guard: one row per mail message that went through the pipeline.
 * Written once, never updated or deleted.
 */
@Entity
@Table(name = "processed_emails")
public class ProcessedEmail {

    @Id
    @Column(name = "email_id", nullable = false, length = 512)
    private String emailId;

    @Column(name = "processed_at", nullable = false)
    private Instant processedAt;

    @Column(name = "sender", nullable = false, length = 320)
    private String sender;

    @Column(name = "subject", length = 1000)
    private String subject;

    @Column(name = "received_at")
    private Instant receivedAt;

    @Column(name = "source_folder", length = 100)
    private String sourceFolder; // inbox, junkemail, archive

    // Constructors
    public ProcessedEmail() {
        this.processedAt = Instant.now();
    }

    public ProcessedEmail(String emailId, String sender, String subject, Instant receivedAt, String sourceFolder) {
        this();
        this.emailId = emailId;
        this.sender = sender == null ? "" : sender;
        this.subject = truncate(subject, 1000);
        this.receivedAt = receivedAt;
        this.sourceFolder = sourceFolder;
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }

    // Getters
    public String getEmailId() {
        return emailId;
    }

    public Instant getProcessedAt() {
        return processedAt;
    }

    public String getSender() {
        return sender;
    }

    public String getSubject() {
        return subject;
    }

    public Instant getReceivedAt() {
        return receivedAt;
    }

    public String getSourceFolder() {
        return sourceFolder;
    }

    @Override
    public String toString() {
        return "ProcessedEmail{" +
                "emailId='" + emailId + '\'' +
                ", sender='" + sender + '\'' +
                ", processedAt=" + processedAt +
                '}';
    }
}

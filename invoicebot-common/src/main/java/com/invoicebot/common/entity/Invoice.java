package com.invoicebot.common.entity;

import jakarta.persistence.*;
import java.time.Instant;
import java.time.LocalDate;

/**
 * A document filed as an invoice, with its store location and the fields the
 * classifier extracted. Only {@code reported} ever changes after insert.
 *
 * One row per (message, stored filename): replaying a message after a crash
 * finds the row written the first time instead of adding another.
 *
 * New columns must stay nullable so that rows written by older versions keep
 * loading.
 */
@Entity
@Table(name = "invoices", uniqueConstraints = {
        @UniqueConstraint(name = "uk_invoices_email_filename", columnNames = { "email_id", "filename" })
}, indexes = {
        @Index(name = "idx_invoices_email_id", columnList = "email_id"),
        @Index(name = "idx_invoices_period", columnList = "period_year, period_month, reported")
})
public class Invoice {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "email_id", nullable = false, length = 512)
    private String emailId; // logical FK -> processed_emails.email_id

    @Column(name = "filename", nullable = false, length = 400)
    private String filename;

    @Column(name = "drive_file_id", length = 200)
    private String driveFileId;

    @Column(name = "drive_web_link", length = 1000)
    private String driveWebLink;

    @Column(name = "sender", nullable = false, length = 320)
    private String sender;

    @Column(name = "received_at")
    private Instant receivedAt; // null when the mail API gave no timestamp

    @Column(name = "received_date")
    private LocalDate receivedDate; // UTC date of receivedAt, used for ordering

    @Column(name = "period_year", nullable = false)
    private int year;

    @Column(name = "period_month", nullable = false)
    private int month;

    @Column(name = "reported", nullable = false)
    private boolean reported = false;

    // Classifier output
    @Column(name = "invoice_date")
    private LocalDate invoiceDate;

    @Column(name = "supplier", length = 80)
    private String supplier;

    @Column(name = "amount_ht")
    private Double amountPretax;

    @Column(name = "amount_tva")
    private Double amountTax;

    @Column(name = "amount_ttc")
    private Double amountTotal;

    @Column(name = "currency", length = 8)
    private String currency;

    @Column(name = "confidence")
    private Double confidence;

    @Column(name = "reason", length = 1000)
    private String reason;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public Invoice() {
        this.createdAt = Instant.now();
    }

    public void markAsReported() {
        this.reported = true;
    }

    /** Label used in reports: the extracted supplier, else the sender address. */
    public String displaySupplier() {
        return supplier != null && !supplier.isBlank() ? supplier : sender;
    }

    // Getters and Setters
    public Long getId() {
        return id;
    }

    public String getEmailId() {
        return emailId;
    }

    public void setEmailId(String emailId) {
        this.emailId = emailId;
    }

    public String getFilename() {
        return filename;
    }

    public void setFilename(String filename) {
        this.filename = filename;
    }

    public String getDriveFileId() {
        return driveFileId;
    }

    public void setDriveFileId(String driveFileId) {
        this.driveFileId = driveFileId;
    }

    public String getDriveWebLink() {
        return driveWebLink;
    }

    public void setDriveWebLink(String driveWebLink) {
        this.driveWebLink = driveWebLink;
    }

    public String getSender() {
        return sender;
    }

    public void setSender(String sender) {
        this.sender = sender;
    }

    public Instant getReceivedAt() {
        return receivedAt;
    }

    public void setReceivedAt(Instant receivedAt) {
        this.receivedAt = receivedAt;
    }

    public LocalDate getReceivedDate() {
        return receivedDate;
    }

    public void setReceivedDate(LocalDate receivedDate) {
        this.receivedDate = receivedDate;
    }

    public int getYear() {
        return year;
    }

    public void setYear(int year) {
        this.year = year;
    }

    public int getMonth() {
        return month;
    }

    public void setMonth(int month) {
        this.month = month;
    }

    public boolean isReported() {
        return reported;
    }

    public LocalDate getInvoiceDate() {
        return invoiceDate;
    }

    public void setInvoiceDate(LocalDate invoiceDate) {
        this.invoiceDate = invoiceDate;
    }

    public String getSupplier() {
        return supplier;
    }

    public void setSupplier(String supplier) {
        this.supplier = supplier;
    }

    public Double getAmountPretax() {
        return amountPretax;
    }

    public void setAmountPretax(Double amountPretax) {
        this.amountPretax = amountPretax;
    }

    public Double getAmountTax() {
        return amountTax;
    }

    public void setAmountTax(Double amountTax) {
        this.amountTax = amountTax;
    }

    public Double getAmountTotal() {
        return amountTotal;
    }

    public void setAmountTotal(Double amountTotal) {
        this.amountTotal = amountTotal;
    }

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = currency;
    }

    public Double getConfidence() {
        return confidence;
    }

    public void setConfidence(Double confidence) {
        this.confidence = confidence;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "Invoice{" +
                "id=" + id +
                ", filename='" + filename + '\'' +
                ", supplier='" + supplier + '\'' +
                ", period=" + year + "-" + month +
                ", reported=" + reported +
                '}';
    }
}

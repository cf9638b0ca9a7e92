package com.invoicebot.common.entity;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Marks that the reporting cycle ran for a (year, month), even when there
 * was nothing to report.
 */
@Entity
@Table(name = "monthly_reports", uniqueConstraints = {
        @UniqueConstraint(name = "uk_monthly_reports_period", columnNames = { "report_year", "report_month" })
})
public class MonthlyReport {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "report_year", nullable = false)
    private int year;

    @Column(name = "report_month", nullable = false)
    private int month;

    @Column(name = "sent_at", nullable = false)
    private Instant sentAt;

    public MonthlyReport() {
        this.sentAt = Instant.now();
    }

    public MonthlyReport(int year, int month) {
        this();
        this.year = year;
        this.month = month;
    }

    public Long getId() {
        return id;
    }

    public int getYear() {
        return year;
    }

    public int getMonth() {
        return month;
    }

    public Instant getSentAt() {
        return sentAt;
    }
}

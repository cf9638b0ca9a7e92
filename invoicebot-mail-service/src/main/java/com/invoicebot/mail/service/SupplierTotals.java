package com.invoicebot.mail.service;

import com.invoicebot.common.entity.Invoice;

/**
 * Running count and amount sums for a group of invoices. Absent amounts are
 * skipped; {@link #hasAmounts()} tells a group without any apart from a zero
 * total.
 */
final class SupplierTotals {

    private int count;
    private double pretax;
    private double tax;
    private double total;
    private boolean hasAmounts;

    void add(Invoice invoice) {
        count++;
        if (invoice.getAmountPretax() != null) {
            pretax += invoice.getAmountPretax();
            hasAmounts = true;
        }
        if (invoice.getAmountTax() != null) {
            tax += invoice.getAmountTax();
            hasAmounts = true;
        }
        if (invoice.getAmountTotal() != null) {
            total += invoice.getAmountTotal();
            hasAmounts = true;
        }
    }

    void merge(SupplierTotals other) {
        count += other.count;
        pretax += other.pretax;
        tax += other.tax;
        total += other.total;
        hasAmounts |= other.hasAmounts;
    }

    int count() {
        return count;
    }

    double pretax() {
        return pretax;
    }

    double tax() {
        return tax;
    }

    double total() {
        return total;
    }

    boolean hasAmounts() {
        return hasAmounts;
    }
}

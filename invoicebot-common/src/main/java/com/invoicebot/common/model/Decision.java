package com.invoicebot.common.model;

/**
 * Terminal routing decision for one document.
 *
 * INVOICE  → filed under ROOT/YYYY/MM/<supplier>/ and recorded in the invoices table
 * REVIEW   → uncertain, unreadable or unsupported; filed under ROOT/YYYY/MM/_review/
 * REJECTED → confidently not an invoice; also filed under the review folder
 */
public enum Decision {
    INVOICE,
    REVIEW,
    REJECTED;

    public boolean isInvoice() {
        return this == INVOICE;
    }
}

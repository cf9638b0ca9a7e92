package com.invoicebot.common.model;

import java.time.LocalDate;

/**
 * Structured output of document classification.
 *
 * Every field except {@code decision} and {@code confidence} may be null.
 * {@code decision} is the single policy point: INVOICE or REJECTED only when
 * the model was at least as confident as the configured threshold, REVIEW
 * otherwise.
 */
public record ClassificationVerdict(
        Decision decision,
        double confidence,
        LocalDate invoiceDate,
        String supplierName,
        Double amountPretax,
        Double amountTax,
        Double amountTotal,
        String currency,
        String reason
) {

    public static ClassificationVerdict review(String reason) {
        return new ClassificationVerdict(Decision.REVIEW, 0.0, null, null, null, null, null, null, reason);
    }

    public boolean hasSupplier() {
        return supplierName != null && !supplierName.isBlank();
    }
}

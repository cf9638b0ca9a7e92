package com.invoicebot.ai.service;

import java.time.LocalDate;

/**
 * Sanitized content of one model answer, before the confidence threshold is
 * applied. Optional fields are null when absent or rejected by sanitization.
 */
public record ModelAssessment(
        boolean invoice,
        double confidence,
        String reason,
        LocalDate invoiceDate,
        String supplier,
        Double amountPretax,
        Double amountTax,
        Double amountTotal,
        String currency
) {
}

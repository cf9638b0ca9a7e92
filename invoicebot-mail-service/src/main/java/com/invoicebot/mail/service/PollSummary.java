package com.invoicebot.mail.service;

import com.invoicebot.common.model.Decision;
import lombok.Getter;

/**
 * Counters of one poll cycle.
 */
@Getter
public class PollSummary {

    private int found;
    private int alreadyProcessed;
    private int invoices;
    private int review;
    private int rejected;
    private int errors;

    void messagesFound(int count) {
        this.found = count;
    }

    void alreadyProcessed() {
        alreadyProcessed++;
    }

    void record(Decision decision) {
        switch (decision) {
            case INVOICE -> invoices++;
            case REJECTED -> rejected++;
            default -> review++;
        }
    }

    void error() {
        errors++;
    }

    @Override
    public String toString() {
        return "found=" + found + " already_processed=" + alreadyProcessed + " invoices=" + invoices
                + " review=" + review + " rejected=" + rejected + " errors=" + errors;
    }
}

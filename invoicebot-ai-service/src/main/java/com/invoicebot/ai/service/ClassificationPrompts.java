package com.invoicebot.ai.service;

/**
 * Prompt text shared by every model provider. The JSON keys in
 * {@link #SYSTEM} are what {@link ClassificationResponseParser} reads.
 */
final class ClassificationPrompts {

    static final String SYSTEM = """
            You are an expert accounting assistant. Decide whether a document is an invoice, \
            a credit note or a receipt, that is a commercial document issued by a supplier \
            stating an amount due or paid. When it is, extract the document date (the invoice \
            date, not the due date), the name of the supplier that issued it, the pre-tax, tax \
            and total amounts, and the currency. Credit notes carry negative amounts.
            Answer ONLY with valid JSON, no text around it:
            {"is_invoice": true/false, "confidence": 0.0-1.0, "reason": "...", \
            "invoice_date": "YYYY-MM-DD or null", "supplier": "supplier name or null", \
            "amount_ht": <number or null>, "amount_tva": <number or null>, \
            "amount_ttc": <number or null>, "currency": "EUR or null"}""";

    static final String USER_TEXT = """
            Here is the text extracted from a document. Is it an invoice, a credit note or a receipt?

            %s""";

    static final String USER_IMAGE = "Here is an image of a document. Is it an invoice, a credit note or a receipt?";

    static final String HINT_SUFFIX = """


            The document probably comes from the supplier "%s". Confirm this name, or correct it \
            if the document explicitly names a different issuer.""";

    private ClassificationPrompts() {
    }

    static String textPrompt(String text, String supplierHint) {
        return withHint(String.format(USER_TEXT, text), supplierHint);
    }

    static String imagePrompt(String supplierHint) {
        return withHint(USER_IMAGE, supplierHint);
    }

    private static String withHint(String prompt, String supplierHint) {
        if (supplierHint == null || supplierHint.isBlank()) {
            return prompt;
        }
        return prompt + String.format(HINT_SUFFIX, supplierHint.strip());
    }
}

package com.invoicebot.ai.service.strategy;

/**
 * Strategy interface for the document-understanding model.
 *
 * Implementations send either extracted text or an encoded image together
 * with a system prompt and return the model's raw text answer. Interpreting
 * that answer is left to the caller, so every provider shares one response
 * parser.
 */
public interface ClassificationModelStrategy {

    ModelReply classifyText(String systemPrompt, String userPrompt);

    ModelReply classifyImage(String systemPrompt, String userPrompt, byte[] image, String mediaType);

    /**
     * Get the name of the active provider (for logging)
     */
    String getProviderName();

    /**
     * False when no API key is set; the classifier then routes everything to review.
     */
    boolean isConfigured();

    /**
     * Result of a model call: the raw text on success, an error message otherwise.
     */
    class ModelReply {
        private final String text;
        private final String errorMessage;
        private final boolean successful;

        private ModelReply(String text, String errorMessage, boolean successful) {
            this.text = text;
            this.errorMessage = errorMessage;
            this.successful = successful;
        }

        public static ModelReply success(String text) {
            return new ModelReply(text, null, true);
        }

        public static ModelReply failed(String errorMessage) {
            return new ModelReply(null, errorMessage, false);
        }

        public String getText() {
            return text;
        }

        public String getErrorMessage() {
            return errorMessage;
        }

        public boolean isSuccessful() {
            return successful;
        }
    }
}

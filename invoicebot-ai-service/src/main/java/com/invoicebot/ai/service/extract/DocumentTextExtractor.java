package com.invoicebot.ai.service.extract;

import java.io.IOException;

/**
 * Pulls plain text out of a text-bearing document so it can be sent to the
 * model as a prompt. Implementations are stateless and bound the amount of
 * text they return.
 */
public interface DocumentTextExtractor {

    /**
     * @param mediaType normalized media type of the document
     * @param filename  document name, consulted when the media type is generic
     */
    boolean supports(String mediaType, String filename);

    /**
     * @return the extracted text, possibly empty, never null
     * @throws IOException when the document cannot be opened
     */
    String extract(byte[] content) throws IOException;
}

package com.invoicebot.ai.service.extract;

import com.invoicebot.common.config.InvoiceBotProperties;
import com.invoicebot.common.model.SupportedMediaTypes;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Text of the first pages of a PDF, enough for a typical invoice header.
 */
@Slf4j
@Component
public class PdfTextExtractor implements DocumentTextExtractor {

    private final int maxPages;
    private final int maxChars;

    public PdfTextExtractor(InvoiceBotProperties properties) {
        this.maxPages = properties.getClassifier().getMaxPdfPages();
        this.maxChars = properties.getClassifier().getMaxTextChars();
    }

    @Override
    public boolean supports(String mediaType, String filename) {
        return SupportedMediaTypes.isPdf(mediaType, filename);
    }

    @Override
    public String extract(byte[] content) throws IOException {
        try (PDDocument document = Loader.loadPDF(content)) {
            int totalPages = document.getNumberOfPages();
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setStartPage(1);
            stripper.setEndPage(Math.min(maxPages, totalPages));

            String text = stripper.getText(document).strip();
            String truncated = text.length() > maxChars ? text.substring(0, maxChars) : text;
            log.debug("PDF extraction: total_pages={} pages_read={} chars_extracted={} chars_sent={}",
                    totalPages, Math.min(maxPages, totalPages), text.length(), truncated.length());
            return truncated;
        }
    }
}

package com.invoicebot.ai.service.extract;

import com.invoicebot.common.config.InvoiceBotProperties;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class PdfTextExtractorTest {

    private InvoiceBotProperties properties;

    @BeforeEach
    void setUp() {
        properties = new InvoiceBotProperties();
    }

    private static byte[] pdfWithPages(String... pageTexts) throws IOException {
        try (PDDocument document = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            for (String text : pageTexts) {
                PDPage page = new PDPage();
                document.addPage(page);
                try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
                    stream.beginText();
                    stream.setFont(font, 12);
                    stream.newLineAtOffset(50, 700);
                    stream.showText(text);
                    stream.endText();
                }
            }
            document.save(out);
            return out.toByteArray();
        }
    }

    @Test
    @DisplayName("Should read only the first two pages")
    void extract_shouldLimitPages() throws IOException {
        PdfTextExtractor extractor = new PdfTextExtractor(properties);

        String text = extractor.extract(pdfWithPages("Invoice number 42", "Total due 120 EUR", "Terms and conditions"));

        assertTrue(text.contains("Invoice number 42"));
        assertTrue(text.contains("Total due 120 EUR"));
        assertFalse(text.contains("Terms and conditions"));
    }

    @Test
    @DisplayName("Should truncate the text to the character budget")
    void extract_shouldTruncateText() throws IOException {
        properties.getClassifier().setMaxTextChars(10);
        PdfTextExtractor extractor = new PdfTextExtractor(properties);

        String text = extractor.extract(pdfWithPages("ABCDEFGHIJKLMNOPQRSTUVWXYZ"));

        assertEquals("ABCDEFGHIJ", text);
    }

    @Test
    @DisplayName("Should fail with IOException on bytes that are not a PDF")
    void extract_shouldFailOnGarbage() {
        PdfTextExtractor extractor = new PdfTextExtractor(properties);

        assertThrows(IOException.class, () -> extractor.extract("definitely not a pdf".getBytes()));
    }

    @Test
    @DisplayName("Should support PDFs by media type or extension")
    void supports_shouldMatchPdf() {
        PdfTextExtractor extractor = new PdfTextExtractor(properties);

        assertTrue(extractor.supports("application/pdf", "x"));
        assertTrue(extractor.supports("application/octet-stream", "scan.PDF"));
        assertFalse(extractor.supports("image/png", "scan.png"));
    }
}

package com.invoicebot.mail.service;

import com.invoicebot.common.config.InvoiceBotProperties;
import com.invoicebot.common.model.CandidateDocument;
import com.invoicebot.common.model.DocumentOrigin;
import com.invoicebot.common.model.MailMessage;
import com.invoicebot.common.model.SupportedMediaTypes;
import com.invoicebot.mail.client.GraphMailClient;
import com.invoicebot.mail.dto.GraphAttachment;
import com.invoicebot.mail.dto.GraphMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for MailScannerService: acceptance policy, folder selection,
 * attachment filtering and link documents.
 */
@ExtendWith(MockitoExtension.class)
class MailScannerServiceTest {

    @Mock
    private GraphMailClient mailClient;

    @Mock
    private LinkResolverService linkResolver;

    private InvoiceBotProperties properties;

    private static final Instant SINCE = Instant.parse("2025-06-01T00:00:00Z");
    private static final Predicate<String> NOTHING_HANDLED = id -> false;
    private static final String PDF_BASE64 = Base64.getEncoder().encodeToString("%PDF-1.4".getBytes(StandardCharsets.UTF_8));

    @BeforeEach
    void setUp() {
        properties = new InvoiceBotProperties();
        properties.getMail().setSubjectKeywords(List.of("Invoice", "facture"));
    }

    private MailScannerService scanner() {
        return new MailScannerService(mailClient, new LinkExtractor(), linkResolver, properties);
    }

    private static GraphMessage graphMessage(String id, String sender, String subject, boolean hasAttachments) {
        GraphMessage.EmailAddress address = new GraphMessage.EmailAddress();
        address.setAddress(sender);
        GraphMessage.Recipient recipient = new GraphMessage.Recipient();
        recipient.setEmailAddress(address);

        GraphMessage message = new GraphMessage();
        message.setId(id);
        message.setSender(recipient);
        message.setSubject(subject);
        message.setReceivedDateTime(OffsetDateTime.parse("2025-06-20T14:30:00Z"));
        message.setHasAttachments(hasAttachments);
        return message;
    }

    private static GraphAttachment attachment(String id, String name, String contentType, long size, boolean inline) {
        GraphAttachment attachment = new GraphAttachment();
        attachment.setOdataType(GraphAttachment.FILE_ATTACHMENT);
        attachment.setId(id);
        attachment.setName(name);
        attachment.setContentType(contentType);
        attachment.setSize(size);
        attachment.setInline(inline);
        return attachment;
    }

    private static GraphAttachment withContent(GraphAttachment attachment, String base64) {
        GraphAttachment full = attachment(attachment.getId(), attachment.getName(), attachment.getContentType(),
                attachment.getSize(), false);
        full.setContentBytes(base64);
        return full;
    }

    private void stubPdfAttachment(String messageId) {
        GraphAttachment pdf = attachment("att-1", "invoice.pdf", "application/pdf", 8, false);
        when(mailClient.listAttachments(messageId)).thenReturn(List.of(pdf));
        when(mailClient.getAttachment(messageId, "att-1")).thenReturn(withContent(pdf, PDF_BASE64));
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Acceptance policy
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should accept allow-listed senders regardless of subject")
    void accept_shouldBypassSubjectFilterForAllowListedSender() {
        properties.getMail().setWhitelistedSenders(List.of(" Billing@Shop.com "));
        MailScannerService scanner = scanner();

        assertTrue(scanner.accept("billing@shop.com", "Newsletter", false));
        assertTrue(scanner.accept("billing@shop.com", "Newsletter", true));
    }

    @Test
    @DisplayName("Should reject unknown senders in secondary folders")
    void accept_shouldRejectUnknownSenderInSecondaryFolder() {
        properties.getMail().setWhitelistedSenders(List.of("billing@shop.com"));

        assertFalse(scanner().accept("someone@else.com", "Invoice 42", true));
    }

    @Test
    @DisplayName("Should filter inbox subjects by keyword and let empty subjects through")
    void accept_shouldApplySubjectKeywords() {
        MailScannerService scanner = scanner();

        assertTrue(scanner.accept("a@b.com", "Your INVOICE for June", false));
        assertTrue(scanner.accept("a@b.com", "Votre facture", false));
        assertFalse(scanner.accept("a@b.com", "Weekly digest", false));
        assertTrue(scanner.accept("a@b.com", "", false));
        assertTrue(scanner.accept("a@b.com", null, false));
    }

    @Test
    @DisplayName("Should accept everything when no filter is configured")
    void accept_shouldAcceptWithoutFilters() {
        properties.getMail().setSubjectKeywords(List.of());

        assertTrue(scanner().accept("a@b.com", "Weekly digest", false));
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Folders
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should scan only the primary folder without an allow-list")
    void scan_shouldSkipSecondaryFoldersWithoutAllowList() {
        when(mailClient.listMessages("inbox", SINCE, 100)).thenReturn(List.of());

        scanner().scan(SINCE, NOTHING_HANDLED);

        verify(mailClient).listMessages("inbox", SINCE, 100);
        verify(mailClient, never()).listMessages(eq("junkemail"), any(), anyInt());
        verify(mailClient, never()).listMessages(eq("archive"), any(), anyInt());
    }

    @Test
    @DisplayName("Should scan secondary folders for allow-listed senders only")
    void scan_shouldScanSecondaryFoldersWithAllowList() {
        properties.getMail().setWhitelistedSenders(List.of("billing@shop.com"));
        when(mailClient.listMessages("inbox", SINCE, 100)).thenReturn(List.of());
        when(mailClient.listMessages("junkemail", SINCE, 100)).thenReturn(List.of(
                graphMessage("junk-1", "billing@shop.com", "Your invoice", true),
                graphMessage("junk-2", "spam@bad.example", "Invoice!!!", true)));
        when(mailClient.listMessages("archive", SINCE, 100))
                .thenThrow(WebClientResponseException.create(404, "Not Found", new HttpHeaders(), new byte[0], StandardCharsets.UTF_8));
        stubPdfAttachment("junk-1");

        List<MailMessage> messages = scanner().scan(SINCE, NOTHING_HANDLED);

        assertEquals(1, messages.size());
        assertEquals("junk-1", messages.get(0).messageId());
        assertEquals("junk", messages.get(0).sourceFolder());
        verify(mailClient, never()).listAttachments("junk-2");
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Attachments and links
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should fetch only supported, non-inline file attachments under the size cap")
    void scan_shouldFilterAttachments() {
        GraphAttachment pdf = attachment("att-1", "invoice.pdf", "application/pdf", 8, false);
        GraphAttachment logo = attachment("att-2", "logo.png", "image/png", 100, true);
        GraphAttachment doc = attachment("att-3", "terms.docx", "application/msword", 100, false);
        GraphAttachment huge = attachment("att-4", "scan.pdf", "application/pdf", 30L * 1024 * 1024, false);
        GraphAttachment item = attachment("att-5", "forwarded", "message/rfc822", 100, false);
        item.setOdataType("#microsoft.graph.itemAttachment");

        when(mailClient.listMessages("inbox", SINCE, 100))
                .thenReturn(List.of(graphMessage("msg-1", "Billing@Shop.com", "Invoice", true)));
        when(mailClient.listAttachments("msg-1")).thenReturn(List.of(pdf, logo, doc, huge, item));
        when(mailClient.getAttachment("msg-1", "att-1")).thenReturn(withContent(pdf, PDF_BASE64));

        List<MailMessage> messages = scanner().scan(SINCE, NOTHING_HANDLED);

        assertEquals(1, messages.size());
        MailMessage message = messages.get(0);
        assertEquals("billing@shop.com", message.sender());
        assertEquals(1, message.documents().size());
        assertEquals("invoice.pdf", message.documents().get(0).name());
        assertEquals("%PDF-1.4", new String(message.documents().get(0).content(), StandardCharsets.UTF_8));
        verify(mailClient, times(1)).getAttachment(anyString(), anyString());
    }

    @Test
    @DisplayName("Should skip an attachment whose content cannot be fetched or decoded")
    void scan_shouldSkipBrokenAttachments() {
        GraphAttachment broken = attachment("att-1", "a.pdf", "application/pdf", 8, false);
        GraphAttachment garbled = attachment("att-2", "b.pdf", "application/pdf", 8, false);
        GraphAttachment good = attachment("att-3", "c.pdf", "application/pdf", 8, false);

        when(mailClient.listMessages("inbox", SINCE, 100))
                .thenReturn(List.of(graphMessage("msg-1", "a@shop.com", "Invoice", true)));
        when(mailClient.listAttachments("msg-1")).thenReturn(List.of(broken, garbled, good));
        when(mailClient.getAttachment("msg-1", "att-1"))
                .thenThrow(WebClientResponseException.create(500, "Server Error", new HttpHeaders(), new byte[0], StandardCharsets.UTF_8));
        when(mailClient.getAttachment("msg-1", "att-2")).thenReturn(withContent(garbled, "***not base64***"));
        when(mailClient.getAttachment("msg-1", "att-3")).thenReturn(withContent(good, PDF_BASE64));

        List<MailMessage> messages = scanner().scan(SINCE, NOTHING_HANDLED);

        assertEquals(1, messages.size());
        assertEquals(List.of("c.pdf"), messages.get(0).documents().stream().map(CandidateDocument::name).toList());
    }

    @Test
    @DisplayName("Should not emit a message that ends up without documents")
    void scan_shouldDropMessagesWithoutDocuments() {
        when(mailClient.listMessages("inbox", SINCE, 100)).thenReturn(List.of(
                graphMessage("msg-1", "a@shop.com", "Invoice", false),
                graphMessage("msg-2", "a@shop.com", "Invoice", true)));
        when(mailClient.listAttachments("msg-2"))
                .thenThrow(WebClientResponseException.create(503, "Unavailable", new HttpHeaders(), new byte[0], StandardCharsets.UTF_8));

        assertTrue(scanner().scan(SINCE, NOTHING_HANDLED).isEmpty());
        verify(mailClient, never()).listAttachments("msg-1");
    }

    @Test
    @DisplayName("Should append documents downloaded from keyword links in the body")
    void scan_shouldAddLinkDocuments() {
        properties.getLinks().setKeywords(List.of("invoice"));
        GraphMessage message = graphMessage("msg-1", "a@shop.com", "Invoice", false);
        GraphMessage.ItemBody body = new GraphMessage.ItemBody();
        body.setContentType("html");
        body.setContent("<p><a href=\"https://shop.example.com/invoice/7\">Download</a>"
                + "<a href=\"https://shop.example.com/help\">Help</a></p>");
        message.setBody(body);

        CandidateDocument downloaded = new CandidateDocument("invoice-7.pdf", SupportedMediaTypes.PDF,
                new byte[]{1}, DocumentOrigin.LINK_DOWNLOAD);
        when(mailClient.listMessages("inbox", SINCE, 100)).thenReturn(List.of(message));
        when(linkResolver.resolve("https://shop.example.com/invoice/7")).thenReturn(Optional.of(downloaded));

        List<MailMessage> messages = scanner().scan(SINCE, NOTHING_HANDLED);

        assertEquals(1, messages.size());
        assertEquals(List.of(downloaded), messages.get(0).documents());
        verify(linkResolver, times(1)).resolve(anyString());
    }

    @Test
    @DisplayName("Should not download anything for a message that was already handled")
    void scan_shouldSkipHandledMessagesBeforeFetching() {
        properties.getLinks().setKeywords(List.of("invoice"));
        GraphMessage known = graphMessage("msg-1", "a@shop.com", "Invoice", true);
        GraphMessage.ItemBody body = new GraphMessage.ItemBody();
        body.setContentType("text");
        body.setContent("Download https://shop.example.com/invoice/1");
        known.setBody(body);
        when(mailClient.listMessages("inbox", SINCE, 100))
                .thenReturn(List.of(known, graphMessage("msg-2", "a@shop.com", "Invoice", true)));
        stubPdfAttachment("msg-2");

        List<MailMessage> messages = scanner().scan(SINCE, "msg-1"::equals);

        assertEquals(List.of("msg-2"), messages.stream().map(MailMessage::messageId).toList());
        verify(mailClient, never()).listAttachments("msg-1");
        verifyNoInteractions(linkResolver);
    }

    @Test
    @DisplayName("Should map the junk folder to a short source label")
    void folderLabel_shouldShortenJunk() {
        assertEquals("junk", MailScannerService.folderLabel("JunkEmail"));
        assertEquals("inbox", MailScannerService.folderLabel("Inbox"));
    }
}

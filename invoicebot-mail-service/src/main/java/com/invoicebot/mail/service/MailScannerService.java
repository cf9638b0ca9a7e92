package com.invoicebot.mail.service;

import com.invoicebot.common.config.InvoiceBotProperties;
import com.invoicebot.common.model.CandidateDocument;
import com.invoicebot.common.model.MailMessage;
import com.invoicebot.common.model.SupportedMediaTypes;
import com.invoicebot.mail.client.GraphMailClient;
import com.invoicebot.mail.dto.GraphAttachment;
import com.invoicebot.mail.dto.GraphMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Mail Scanner: turns mailbox folders into {@link MailMessage}s that carry at
 * least one candidate document.
 *
 * Acceptance policy, evaluated before any attachment is fetched:
 * <ol>
 *   <li>allow-listed sender: accepted, subject not checked;</li>
 *   <li>secondary folder (junk, archive): rejected;</li>
 *   <li>subject-keyword filter configured and subject non-empty: accepted
 *       only on a keyword match;</li>
 *   <li>otherwise accepted.</li>
 * </ol>
 * Secondary folders are scanned only when an allow-list exists. Messages the
 * caller already handled are dropped before any attachment or link is fetched.
 */
@Slf4j
@Service
public class MailScannerService {

    private final GraphMailClient mailClient;
    private final LinkExtractor linkExtractor;
    private final LinkResolverService linkResolver;
    private final InvoiceBotProperties.Mail settings;
    private final List<String> linkKeywords;

    private final Set<String> allowList;
    private final List<String> subjectKeywords;

    public MailScannerService(GraphMailClient mailClient, LinkExtractor linkExtractor,
            LinkResolverService linkResolver, InvoiceBotProperties properties) {
        this.mailClient = mailClient;
        this.linkExtractor = linkExtractor;
        this.linkResolver = linkResolver;
        this.settings = properties.getMail();
        this.linkKeywords = properties.getLinks().getKeywords();
        this.allowList = normalize(settings.getWhitelistedSenders()).stream().collect(Collectors.toSet());
        this.subjectKeywords = normalize(settings.getSubjectKeywords());

        if (!allowList.isEmpty()) {
            log.info("Sender whitelist active: {} sender(s)", allowList.size());
        }
        if (!subjectKeywords.isEmpty()) {
            log.info("Subject keyword filter active: {} keyword(s)", subjectKeywords.size());
        }
    }

    /**
     * Scan the primary folder and, when an allow-list is configured, the
     * secondary folders, for messages received after {@code since}.
     *
     * @param alreadyHandled tested with the message id of every accepted
     *                       message; {@code true} skips it without fetching
     */
    public List<MailMessage> scan(Instant since, Predicate<String> alreadyHandled) {
        List<MailMessage> result = new ArrayList<>();
        result.addAll(scanFolder(settings.getPrimaryFolder(), false, since, alreadyHandled));

        if (allowList.isEmpty()) {
            log.debug("No sender whitelist, secondary folders not scanned");
        } else {
            for (String folder : settings.getSecondaryFolders()) {
                result.addAll(scanFolder(folder, true, since, alreadyHandled));
            }
        }
        return result;
    }

    private List<MailMessage> scanFolder(String folder, boolean secondary, Instant since,
            Predicate<String> alreadyHandled) {
        List<GraphMessage> messages;
        try {
            messages = mailClient.listMessages(folder, since, settings.effectivePageSize());
        } catch (RuntimeException e) {
            log.error("Could not list folder '{}': {}", folder, e.getMessage(), e);
            return List.of();
        }

        String source = folderLabel(folder);
        List<MailMessage> accepted = new ArrayList<>();
        for (GraphMessage message : messages) {
            try {
                if (!accept(message.senderAddress(), message.getSubject(), secondary)) {
                    log.debug("Skipping message from {} subject='{}' ({})",
                            message.senderAddress(), message.getSubject(), source);
                    continue;
                }
                if (alreadyHandled.test(message.getId())) {
                    log.debug("Already processed: '{}' from {}", message.getSubject(), message.senderAddress());
                    continue;
                }

                List<CandidateDocument> attachments = message.isHasAttachments()
                        ? fetchAttachments(message.getId())
                        : List.of();
                List<CandidateDocument> links = fetchLinkedDocuments(message);

                if (attachments.isEmpty() && links.isEmpty()) {
                    continue;
                }
                List<CandidateDocument> documents = new ArrayList<>(attachments);
                documents.addAll(links);

                log.info("Email queued: from={} subject='{}' received={} file_attachments={} link_attachments={} source={}",
                        message.senderAddress(), message.getSubject(), message.getReceivedDateTime(),
                        attachments.size(), links.size(), source);
                accepted.add(new MailMessage(message.getId(), message.senderAddress(), message.getSubject(),
                        message.getReceivedDateTime(), source, documents));
            } catch (RuntimeException e) {
                log.error("Failed to scan message {} in '{}': {}", message.getId(), folder, e.getMessage(), e);
            }
        }
        return accepted;
    }

    boolean accept(String sender, String subject, boolean secondaryFolder) {
        if (!allowList.isEmpty() && allowList.contains(sender)) {
            return true;
        }
        if (secondaryFolder) {
            return false;
        }
        if (!subjectKeywords.isEmpty() && subject != null && !subject.isBlank()) {
            String lower = subject.toLowerCase(Locale.ROOT);
            return subjectKeywords.stream().anyMatch(lower::contains);
        }
        return true;
    }

    private List<CandidateDocument> fetchAttachments(String messageId) {
        List<GraphAttachment> listed;
        try {
            listed = mailClient.listAttachments(messageId);
        } catch (RuntimeException e) {
            log.warn("Could not list attachments of {}: {}", messageId, e.getMessage());
            return List.of();
        }

        List<CandidateDocument> documents = new ArrayList<>();
        for (GraphAttachment att : listed) {
            if (!att.isFileAttachment() || att.isInline()) {
                log.debug("Skipping inline or non-file attachment: {}", att.getName());
                continue;
            }
            if (!SupportedMediaTypes.isSupported(att.getContentType())) {
                log.debug("Skipping unsupported attachment type {}: {}", att.getContentType(), att.getName());
                continue;
            }
            if (att.getSize() > settings.getMaxAttachmentBytes()) {
                log.warn("Skipping oversized attachment: name='{}' size={} bytes limit={}",
                        att.getName(), att.getSize(), settings.getMaxAttachmentBytes());
                continue;
            }

            try {
                GraphAttachment full = mailClient.getAttachment(messageId, att.getId());
                if (full == null || full.getContentBytes() == null) {
                    log.warn("Attachment '{}' came back without content, skipped", att.getName());
                    continue;
                }
                byte[] bytes = Base64.getDecoder().decode(full.getContentBytes());
                log.info("Attachment fetched: name='{}' type={} size={} bytes", att.getName(), att.getContentType(), bytes.length);
                documents.add(CandidateDocument.attachment(att.getName(), att.getContentType(), bytes));
            } catch (RuntimeException e) {
                log.warn("Could not fetch attachment '{}' of {}: {}", att.getName(), messageId, e.getMessage());
            }
        }
        return documents;
    }

    private List<CandidateDocument> fetchLinkedDocuments(GraphMessage message) {
        if (linkKeywords.isEmpty() || message.getBody() == null) {
            return List.of();
        }
        List<String> urls = linkExtractor.extract(message.getBody().getContent(), message.getBody().isHtml(), linkKeywords);
        List<CandidateDocument> documents = new ArrayList<>();
        for (String url : urls) {
            log.info("Invoice link detected: {}", url);
            linkResolver.resolve(url).ifPresent(documents::add);
        }
        return documents;
    }

    static String folderLabel(String folder) {
        return "junkemail".equalsIgnoreCase(folder) ? "junk" : folder.toLowerCase(Locale.ROOT);
    }

    private static List<String> normalize(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(v -> v.trim().toLowerCase(Locale.ROOT))
                .toList();
    }
}

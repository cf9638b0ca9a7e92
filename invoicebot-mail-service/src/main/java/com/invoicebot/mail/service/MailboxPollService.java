package com.invoicebot.mail.service;

import com.invoicebot.common.config.InvoiceBotProperties;
import com.invoicebot.common.model.CandidateDocument;
import com.invoicebot.common.model.Decision;
import com.invoicebot.common.model.MailMessage;
import com.invoicebot.common.service.DedupStoreService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * One poll cycle: scan, skipping what the Dedup Store already knows before
 * anything is downloaded, route every document of every new message, then
 * mark the message processed.
 *
 * A message is marked only after all of its documents were attempted, so a
 * crash part-way through replays the whole message on the next cycle; the
 * replay is cheap because uploads skip files that already exist.
 */
@Slf4j
@Service
public class MailboxPollService {

    private final MailScannerService scanner;
    private final InvoiceRoutingPipeline pipeline;
    private final DedupStoreService dedupStore;
    private final InvoiceBotProperties.Mail mailSettings;

    public MailboxPollService(MailScannerService scanner, InvoiceRoutingPipeline pipeline,
            DedupStoreService dedupStore, InvoiceBotProperties properties) {
        this.scanner = scanner;
        this.pipeline = pipeline;
        this.dedupStore = dedupStore;
        this.mailSettings = properties.getMail();
    }

    /** Poll from the configured floor: {@code since}, else now minus {@code lookback}. */
    public PollSummary pollOnce() {
        return pollOnce(defaultFloor());
    }

    public PollSummary pollOnce(Instant since) {
        log.info("━━━━━━━━━━━━━━━━━━━━ POLL START ━━━━━━━━━━━━━━━━━━━━");
        PollSummary summary = new PollSummary();

        List<MailMessage> messages = scanner.scan(since, messageId -> {
            if (dedupStore.isProcessed(messageId)) {
                summary.alreadyProcessed();
                return true;
            }
            return false;
        });
        summary.messagesFound(messages.size());
        log.info("Found {} new message(s) since {}, {} already processed",
                messages.size(), since, summary.getAlreadyProcessed());

        for (MailMessage message : messages) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Poll interrupted, remaining messages are left for the next cycle");
                break;
            }
            processMessage(message, summary);
        }

        log.info("Poll summary: {}", summary);
        log.info("━━━━━━━━━━━━━━━━━━━━ POLL END ━━━━━━━━━━━━━━━━━━━━");
        return summary;
    }

    private void processMessage(MailMessage message, PollSummary summary) {
        log.info("Processing email from {} subject='{}' received={} documents={}",
                message.sender(), message.subject(), message.receivedAt(), message.documents().size());

        for (CandidateDocument document : message.documents()) {
            try {
                Decision decision = pipeline.route(message, document);
                summary.record(decision);
            } catch (RuntimeException e) {
                summary.error();
                log.error("Failed to process '{}' of message {}: {}",
                        document.name(), message.messageId(), e.getMessage(), e);
            }
        }
        dedupStore.markProcessed(message);
    }

    public Instant defaultFloor() {
        return mailSettings.getSince() != null
                ? mailSettings.getSince()
                : Instant.now().minus(mailSettings.getLookback());
    }
}

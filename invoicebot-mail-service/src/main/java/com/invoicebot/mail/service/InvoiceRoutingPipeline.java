package com.invoicebot.mail.service;

import com.invoicebot.ai.service.DocumentClassifierService;
import com.invoicebot.common.config.InvoiceBotProperties;
import com.invoicebot.common.dto.StoredItem;
import com.invoicebot.common.entity.Invoice;
import com.invoicebot.common.model.CandidateDocument;
import com.invoicebot.common.model.ClassificationVerdict;
import com.invoicebot.common.model.Decision;
import com.invoicebot.common.model.MailMessage;
import com.invoicebot.common.service.DedupStoreService;
import com.invoicebot.common.service.OneDriveStorageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Routing Pipeline for a single document of a message.
 *
 * <pre>
 * container? --yes--> expand, route every member, INVOICE if any member is one, else REJECTED
 *     | no
 * classify -> period (invoice date, else received) -> filename -> upload -> persist (INVOICE only)
 * </pre>
 *
 * Containers are never uploaded themselves. Upload and persist failures
 * propagate to the caller; a failing archive member is logged and does not
 * stop its siblings.
 */
@Slf4j
@Service
public class InvoiceRoutingPipeline {

    private final ArchiveExpander archiveExpander;
    private final DocumentClassifierService classifier;
    private final OneDriveStorageService storage;
    private final DedupStoreService dedupStore;
    private final InvoiceBotProperties.Classifier classifierSettings;

    public InvoiceRoutingPipeline(ArchiveExpander archiveExpander,
            DocumentClassifierService classifier,
            OneDriveStorageService storage,
            DedupStoreService dedupStore,
            InvoiceBotProperties properties) {
        this.archiveExpander = archiveExpander;
        this.classifier = classifier;
        this.storage = storage;
        this.dedupStore = dedupStore;
        this.classifierSettings = properties.getClassifier();
    }

    public Decision route(MailMessage message, CandidateDocument document) {
        if (document.isContainer()) {
            return routeContainer(message, document);
        }

        String hint = classifierSettings.supplierHintFor(message.sender()).orElse(null);
        ClassificationVerdict verdict = classifier.classify(document, hint);

        YearMonth period = verdict.invoiceDate() != null
                ? YearMonth.from(verdict.invoiceDate())
                : message.receivedPeriod();
        String filename = StorageNaming.buildFilename(verdict.invoiceDate(), message.receivedAt(),
                verdict.supplierName(), message.sender(), document.name());

        if (verdict.decision().isInvoice()) {
            String label = StorageNaming.companyLabel(verdict.supplierName(), message.sender());
            StoredItem stored = storage.uploadInvoice(period.getYear(), period.getMonthValue(), label,
                    filename, document.content());
            dedupStore.saveInvoice(toInvoice(message, filename, stored, period, verdict));
            log.info("Invoice filed: '{}' -> {}/{} confidence={}", document.name(), label, filename, verdict.confidence());
        } else {
            storage.uploadToReview(period.getYear(), period.getMonthValue(), filename, document.content());
            log.info("Sent to review ({}): '{}' -> {} reason='{}'",
                    verdict.decision(), document.name(), filename, verdict.reason());
        }
        return verdict.decision();
    }

    private Decision routeContainer(MailMessage message, CandidateDocument container) {
        List<CandidateDocument> members = archiveExpander.expand(container);
        if (members.isEmpty()) {
            log.info("ZIP '{}' has no supported files, rejected", container.name());
            return Decision.REJECTED;
        }

        boolean anyInvoice = false;
        for (CandidateDocument member : members) {
            try {
                if (route(message, member).isInvoice()) {
                    anyInvoice = true;
                }
            } catch (RuntimeException e) {
                log.error("Failed to route '{}' from ZIP '{}': {}", member.name(), container.name(), e.getMessage(), e);
            }
        }
        Decision decision = anyInvoice ? Decision.INVOICE : Decision.REJECTED;
        log.info("ZIP '{}' resolved to {} ({} member(s))", container.name(), decision, members.size());
        return decision;
    }

    private Invoice toInvoice(MailMessage message, String filename, StoredItem stored,
            YearMonth period, ClassificationVerdict verdict) {
        Invoice invoice = new Invoice();
        invoice.setEmailId(message.messageId());
        invoice.setFilename(filename);
        invoice.setDriveFileId(stored.id());
        invoice.setDriveWebLink(stored.webUrl());
        invoice.setSender(message.sender());
        if (message.receivedAt() != null) {
            invoice.setReceivedAt(message.receivedAt().toInstant());
            invoice.setReceivedDate(message.receivedAt().withOffsetSameInstant(ZoneOffset.UTC).toLocalDate());
        }
        invoice.setYear(period.getYear());
        invoice.setMonth(period.getMonthValue());
        invoice.setInvoiceDate(verdict.invoiceDate());
        invoice.setSupplier(verdict.supplierName());
        invoice.setAmountPretax(verdict.amountPretax());
        invoice.setAmountTax(verdict.amountTax());
        invoice.setAmountTotal(verdict.amountTotal());
        invoice.setCurrency(verdict.currency());
        invoice.setConfidence(verdict.confidence());
        invoice.setReason(verdict.reason());
        return invoice;
    }
}

package com.invoicebot.common.service;

import com.invoicebot.common.entity.Invoice;
import com.invoicebot.common.entity.MonthlyReport;
import com.invoicebot.common.entity.ProcessedEmail;
import com.invoicebot.common.model.MailMessage;
import com.invoicebot.common.repository.InvoiceRepository;
import com.invoicebot.common.repository.MonthlyReportRepository;
import com.invoicebot.common.repository.ProcessedEmailRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of handled messages, filed invoices and report cycles.
 *
 * Inserts keyed by a natural key (message id, message and filename, report
 * period) are idempotent:
 * an existing row, or a unique-constraint violation raised by a concurrent
 * writer, counts as success.
 */
@Slf4j
@Service
public class DedupStoreService {

    private final ProcessedEmailRepository processedEmailRepository;
    private final InvoiceRepository invoiceRepository;
    private final MonthlyReportRepository monthlyReportRepository;

    public DedupStoreService(ProcessedEmailRepository processedEmailRepository,
            InvoiceRepository invoiceRepository,
            MonthlyReportRepository monthlyReportRepository) {
        this.processedEmailRepository = processedEmailRepository;
        this.invoiceRepository = invoiceRepository;
        this.monthlyReportRepository = monthlyReportRepository;
    }

    public boolean isProcessed(String messageId) {
        return processedEmailRepository.existsById(messageId);
    }

    public void markProcessed(MailMessage message) {
        if (processedEmailRepository.existsById(message.messageId())) {
            log.debug("Message {} already marked processed", message.messageId());
            return;
        }
        ProcessedEmail row = new ProcessedEmail(
                message.messageId(),
                message.sender(),
                message.subject(),
                message.receivedAt() == null ? null : message.receivedAt().toInstant(),
                message.sourceFolder());
        try {
            processedEmailRepository.saveAndFlush(row);
            log.info("Email marked as processed: id={} sender={} subject='{}'",
                    message.messageId(), message.sender(), message.subject());
        } catch (DataIntegrityViolationException e) {
            log.debug("Message {} was marked processed concurrently", message.messageId());
        }
    }

    /**
     * Insert an invoice row unless the same message already filed the same
     * filename; the existing row is returned in that case.
     */
    public Invoice saveInvoice(Invoice invoice) {
        Optional<Invoice> existing = findInvoice(invoice.getEmailId(), invoice.getFilename());
        if (existing.isPresent()) {
            log.info("Invoice already recorded: id={} email={} filename='{}'",
                    existing.get().getId(), invoice.getEmailId(), invoice.getFilename());
            return existing.get();
        }

        Invoice saved;
        try {
            saved = invoiceRepository.saveAndFlush(invoice);
        } catch (DataIntegrityViolationException e) {
            log.debug("Invoice {} of {} was recorded concurrently", invoice.getFilename(), invoice.getEmailId());
            return findInvoice(invoice.getEmailId(), invoice.getFilename()).orElseThrow(() -> e);
        }
        log.info("Invoice saved: id={} filename='{}' period={}-{} supplier='{}' date={} total={} {}",
                saved.getId(), saved.getFilename(), saved.getYear(), saved.getMonth(),
                saved.getSupplier(), saved.getInvoiceDate(), saved.getAmountTotal(), saved.getCurrency());
        return saved;
    }

    private Optional<Invoice> findInvoice(String emailId, String filename) {
        return invoiceRepository.findByEmailId(emailId).stream()
                .filter(i -> i.getFilename().equals(filename))
                .findFirst();
    }

    public List<Invoice> findUnreported(int year, int month) {
        List<Invoice> invoices = invoiceRepository.findUnreported(year, month);
        log.info("Queried unreported invoices: year={} month={} count={}", year, month, invoices.size());
        return invoices;
    }

    @Transactional
    public void markReported(Collection<Long> invoiceIds) {
        if (invoiceIds.isEmpty()) {
            return;
        }
        int updated = invoiceRepository.markReported(invoiceIds);
        log.info("Marked {} invoice(s) as reported", updated);
    }

    public boolean hasReportRun(int year, int month) {
        return monthlyReportRepository.existsByYearAndMonth(year, month);
    }

    public void saveReportMarker(int year, int month) {
        if (hasReportRun(year, month)) {
            return;
        }
        try {
            monthlyReportRepository.saveAndFlush(new MonthlyReport(year, month));
            log.info("Report marker saved for {}-{}", year, String.format("%02d", month));
        } catch (DataIntegrityViolationException e) {
            log.debug("Report marker for {}-{} already present", year, month);
        }
    }
}

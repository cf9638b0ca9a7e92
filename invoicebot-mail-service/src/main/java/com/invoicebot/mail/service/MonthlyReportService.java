package com.invoicebot.mail.service;

import com.invoicebot.common.config.InvoiceBotProperties;
import com.invoicebot.common.entity.Invoice;
import com.invoicebot.common.service.DedupStoreService;
import com.invoicebot.common.service.OneDriveStorageService;
import com.invoicebot.mail.client.GraphMailClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Monthly report cycle: an XLSX summary of the invoices filed for a month,
 * uploaded next to them, and a draft to the accountant in the mailbox with
 * the summary attached and a view link to the month folder. Nothing is sent;
 * the owner reviews the draft. Runs at most once per month thanks to the
 * report marker, including for months without invoices.
 */
@Slf4j
@Service
public class MonthlyReportService {

    private final DedupStoreService dedupStore;
    private final OneDriveStorageService storage;
    private final GraphMailClient mailClient;
    private final String homeCurrency;
    private final String accountantEmail;

    public MonthlyReportService(DedupStoreService dedupStore, OneDriveStorageService storage,
            GraphMailClient mailClient, InvoiceBotProperties properties) {
        this.dedupStore = dedupStore;
        this.storage = storage;
        this.mailClient = mailClient;
        this.homeCurrency = properties.getReport().getHomeCurrency();
        this.accountantEmail = properties.getAccountant().getEmail();
    }

    public void runForPreviousMonth() {
        runReport(YearMonth.now(ZoneOffset.UTC).minusMonths(1));
    }

    /**
     * A failure to save the draft propagates and leaves the month unreported,
     * so the next run tries again. Summary and folder link failures only
     * degrade the draft.
     *
     * @return false when the month was already reported
     */
    public boolean runReport(YearMonth period) {
        int year = period.getYear();
        int month = period.getMonthValue();
        log.info("━━━━━━━━━━━━━━━━━━━━ REPORT {} ━━━━━━━━━━━━━━━━━━━━", period);

        if (dedupStore.hasReportRun(year, month)) {
            log.info("Report for {} already done, skipping", period);
            return false;
        }

        List<Invoice> invoices = dedupStore.findUnreported(year, month);
        if (invoices.isEmpty()) {
            log.info("No invoices for {}, recording empty report", period);
            dedupStore.saveReportMarker(year, month);
            return true;
        }

        String filename = String.format("%d-%02d_summary.xlsx", year, month);
        byte[] workbook = null;
        try {
            workbook = MonthlySummaryWorkbook.build(invoices, period, homeCurrency);
            storage.uploadToMonthFolder(year, month, filename, workbook);
            log.info("Summary {} uploaded ({} invoice(s))", filename, invoices.size());
        } catch (IOException | RuntimeException e) {
            log.warn("Summary {} could not be built or uploaded: {}", filename, e.getMessage(), e);
        }

        String folderLink = "";
        try {
            folderLink = storage.shareMonthFolder(year, month);
        } catch (RuntimeException e) {
            log.warn("Could not share the {} folder, draft goes out without the link: {}", period, e.getMessage());
        }

        String draftId = mailClient.createDraft(MonthlyReportDraft.message(
                accountantEmail, invoices, period, homeCurrency, folderLink, workbook, filename));
        log.info("Draft {} for {} saved to the mailbox", draftId, accountantEmail);

        dedupStore.markReported(invoices.stream().map(Invoice::getId).toList());
        dedupStore.saveReportMarker(year, month);
        return true;
    }
}

package com.invoicebot.mail.scheduler;

import com.invoicebot.mail.service.MailboxPollService;
import com.invoicebot.mail.service.MonthlyReportService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic triggers. Spring's default scheduler has a single thread, so a
 * poll and a report never overlap, and a fixed delay means the next poll
 * starts only after the previous one returned.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "invoicebot.schedule", name = "enabled", havingValue = "true", matchIfMissing = true)
public class InvoiceBotScheduler {

    private final MailboxPollService pollService;
    private final MonthlyReportService reportService;

    public InvoiceBotScheduler(MailboxPollService pollService, MonthlyReportService reportService) {
        this.pollService = pollService;
        this.reportService = reportService;
    }

    @Scheduled(fixedDelayString = "${invoicebot.schedule.poll-interval:PT60M}", initialDelay = 0)
    public void poll() {
        try {
            pollService.pollOnce();
        } catch (RuntimeException e) {
            log.error("Poll cycle failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${invoicebot.report.cron:0 0 8 1 * *}", zone = "UTC")
    public void monthlyReport() {
        try {
            reportService.runForPreviousMonth();
        } catch (RuntimeException e) {
            log.error("Monthly report failed: {}", e.getMessage(), e);
        }
    }
}

package com.invoicebot.mail.runner;

import com.invoicebot.common.model.CandidateDocument;
import com.invoicebot.common.model.MailMessage;
import com.invoicebot.common.service.DedupStoreService;
import com.invoicebot.mail.service.MailScannerService;
import com.invoicebot.mail.service.MailboxPollService;
import com.invoicebot.mail.service.PollSummary;
import com.invoicebot.mail.service.StorageNaming;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One-shot processing of historical mail.
 *
 * <pre>
 * java -jar invoicebot-mail-service.jar --backfill
 * java -jar invoicebot-mail-service.jar --backfill --since=2025-01-01
 * java -jar invoicebot-mail-service.jar --backfill --since=2025-06-01 --dry-run
 * </pre>
 *
 * Uses the same scan, dedup and routing as the scheduled poll. A dry run only
 * logs the filenames that would be produced; nothing is classified, uploaded
 * or written to the database.
 */
@Slf4j
@Component
public class BackfillRunner implements ApplicationRunner {

    public static final String BACKFILL_OPTION = "backfill";

    private final MailScannerService scanner;
    private final MailboxPollService pollService;
    private final DedupStoreService dedupStore;

    public BackfillRunner(MailScannerService scanner, MailboxPollService pollService, DedupStoreService dedupStore) {
        this.scanner = scanner;
        this.pollService = pollService;
        this.dedupStore = dedupStore;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(BACKFILL_OPTION)) {
            return;
        }

        Instant since = resolveSince(args);
        boolean dryRun = args.containsOption("dry-run");

        log.info("━━━━━━━━━━━━━━━━━━━━ BACKFILL START ━━━━━━━━━━━━━━━━━━━━");
        log.info("Emails since {}{}", since, dryRun ? " (DRY RUN, nothing uploaded or written)" : "");

        if (dryRun) {
            dryRun(since);
        } else {
            PollSummary summary = pollService.pollOnce(since);
            log.info("Backfill complete: {}", summary);
        }
        log.info("━━━━━━━━━━━━━━━━━━━━ BACKFILL END ━━━━━━━━━━━━━━━━━━━━");
    }

    private void dryRun(Instant since) {
        AtomicInteger alreadyProcessed = new AtomicInteger();
        List<MailMessage> messages = scanner.scan(since, messageId -> {
            boolean processed = dedupStore.isProcessed(messageId);
            if (processed) {
                alreadyProcessed.incrementAndGet();
            }
            return processed;
        });
        for (MailMessage message : messages) {
            for (CandidateDocument document : message.documents()) {
                log.info("[DRY RUN] would process: {}", StorageNaming.buildFilename(
                        null, message.receivedAt(), null, message.sender(), document.name()));
            }
        }
        log.info("Dry run complete: already_processed={} would_process={}",
                alreadyProcessed.get(), messages.size());
    }

    private Instant resolveSince(ApplicationArguments args) {
        List<String> values = args.getOptionValues("since");
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return pollService.defaultFloor();
        }
        try {
            return LocalDate.parse(values.get(0).trim()).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid --since " + values.get(0) + " (expected YYYY-MM-DD)", e);
        }
    }
}

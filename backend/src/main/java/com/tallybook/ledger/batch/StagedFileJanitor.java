package com.tallybook.ledger.batch;

import com.tallybook.ledger.config.ImportSettings;
import com.tallybook.ledger.source.StagedFileLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/** Removes staged upload files that outlived the configured time-to-live. */
@Component
public class StagedFileJanitor {
    private static final Logger log = LoggerFactory.getLogger(StagedFileJanitor.class);

    private final StagedFileLocator locator;
    private final ImportSettings settings;

    public StagedFileJanitor(StagedFileLocator locator, ImportSettings settings) {
        this.locator = locator;
        this.settings = settings;
    }

    @Scheduled(cron = "${tallybook.import.janitor-cron:0 0 * * * *}") // hourly by default
    public void cleanup() {
        purgeOlderThan(Instant.now().minus(settings.getStagedFileTtl()));
    }

    public int purgeOlderThan(Instant cutoff) {
        int removed = 0;
        try {
            for (Path file : locator.listStaged()) {
                try {
                    if (Files.getLastModifiedTime(file).toInstant().isBefore(cutoff)) {
                        Files.deleteIfExists(file);
                        removed++;
                        log.info("[StagedFileJanitor] removed {}", file.getFileName());
                    }
                } catch (IOException e) {
                    log.warn("[StagedFileJanitor] could not remove {}: {}", file.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            log.warn("[StagedFileJanitor] could not list staging dir {}: {}", locator.stagingDir(), e.getMessage());
        }
        return removed;
    }
}

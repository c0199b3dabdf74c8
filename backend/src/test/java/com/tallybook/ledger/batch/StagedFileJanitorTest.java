package com.tallybook.ledger.batch;

import com.tallybook.ledger.config.ImportSettings;
import com.tallybook.ledger.source.StagedFileLocator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class StagedFileJanitorTest {

    @TempDir Path dir;

    @Test
    void removesOnlyFilesOlderThanTtl() throws Exception {
        ImportSettings settings = new ImportSettings();
        settings.setStagingDir(dir.toString());
        settings.setStagedFileTtlHours(24);
        StagedFileJanitor janitor = new StagedFileJanitor(new StagedFileLocator(settings), settings);

        Path stale = Files.writeString(dir.resolve("old_q.csv"), "x");
        Files.setLastModifiedTime(stale, FileTime.from(Instant.now().minus(Duration.ofHours(30))));
        Path fresh = Files.writeString(dir.resolve("new_q.csv"), "x");

        janitor.cleanup();

        assertThat(stale).doesNotExist();
        assertThat(fresh).exists();
    }

    @Test
    void missingStagingDirIsNotAnError() {
        ImportSettings settings = new ImportSettings();
        settings.setStagingDir(dir.resolve("absent").toString());
        StagedFileJanitor janitor = new StagedFileJanitor(new StagedFileLocator(settings), settings);

        assertThat(janitor.purgeOlderThan(Instant.now())).isZero();
    }
}

package com.tallybook.ledger.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class ImportSettings {

    public enum BlankNamePolicy { EXCLUDE, ERROR }

    @Value("${tallybook.import.staging-dir:data/imports/staging}")
    private String stagingDir = "data/imports/staging";

    @Value("${tallybook.import.checkpoint-interval:100}")
    private int checkpointInterval = 100;

    @Value("${tallybook.import.error-page-size:100}")
    private int errorPageSize = 100;

    @Value("${tallybook.import.blank-name-policy:EXCLUDE}")
    private BlankNamePolicy blankNamePolicy = BlankNamePolicy.EXCLUDE;

    @Value("${tallybook.import.preview-rows:50}")
    private int previewRows = 50;

    @Value("${tallybook.import.staged-file-ttl-hours:24}")
    private long stagedFileTtlHours = 24;

    @Value("${tallybook.import.default-price-type:default}")
    private String defaultPriceType = "default";

    @Value("${tallybook.matching.threshold:90}")
    private int matchThreshold = 90;

    @Value("${tallybook.matching.limit:3}")
    private int matchLimit = 3;

    public String getStagingDir() { return stagingDir; }
    public int getCheckpointInterval() { return Math.max(1, checkpointInterval); }
    public int getErrorPageSize() { return errorPageSize; }
    public BlankNamePolicy getBlankNamePolicy() { return blankNamePolicy; }
    public int getPreviewRows() { return previewRows; }
    public Duration getStagedFileTtl() { return Duration.ofHours(stagedFileTtlHours); }
    public String getDefaultPriceType() { return defaultPriceType; }
    public int getMatchThreshold() { return matchThreshold; }
    public int getMatchLimit() { return matchLimit; }

    // setters for tests that build the services by hand
    public void setStagingDir(String stagingDir) { this.stagingDir = stagingDir; }
    public void setCheckpointInterval(int checkpointInterval) { this.checkpointInterval = checkpointInterval; }
    public void setErrorPageSize(int errorPageSize) { this.errorPageSize = errorPageSize; }
    public void setBlankNamePolicy(BlankNamePolicy blankNamePolicy) { this.blankNamePolicy = blankNamePolicy; }
    public void setPreviewRows(int previewRows) { this.previewRows = previewRows; }
    public void setStagedFileTtlHours(long stagedFileTtlHours) { this.stagedFileTtlHours = stagedFileTtlHours; }
    public void setDefaultPriceType(String defaultPriceType) { this.defaultPriceType = defaultPriceType; }
    public void setMatchThreshold(int matchThreshold) { this.matchThreshold = matchThreshold; }
    public void setMatchLimit(int matchLimit) { this.matchLimit = matchLimit; }
}

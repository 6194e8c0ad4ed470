package com.example.cliporganizer.domain.model;

import com.example.cliporganizer.domain.enumtype.SyncOutcomeType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of one attempted catalog mutation.
 */
public final class SyncOutcome {

    private final SyncOutcomeType outcome;
    private final String filePath;
    private final Long catalogId;
    private final String title;
    private final String errorMessage;
    private final List<String> warnings;

    private SyncOutcome(SyncOutcomeType outcome,
                        String filePath,
                        Long catalogId,
                        String title,
                        String errorMessage,
                        List<String> warnings) {
        this.outcome = outcome;
        this.filePath = filePath;
        this.catalogId = catalogId;
        this.title = title;
        this.errorMessage = errorMessage;
        this.warnings = warnings == null || warnings.isEmpty()
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public static SyncOutcome added(String filePath, Long catalogId, String title, List<String> warnings) {
        return new SyncOutcome(SyncOutcomeType.ADDED, filePath, catalogId, title, null, warnings);
    }

    public static SyncOutcome removed(String filePath, Long catalogId, String title, List<String> warnings) {
        return new SyncOutcome(SyncOutcomeType.REMOVED, filePath, catalogId, title, null, warnings);
    }

    public static SyncOutcome failed(String filePath, Long catalogId, String title, String errorMessage) {
        return new SyncOutcome(SyncOutcomeType.FAILED, filePath, catalogId, title, errorMessage, null);
    }

    public SyncOutcomeType getOutcome() {
        return outcome;
    }

    public String getFilePath() {
        return filePath;
    }

    public Long getCatalogId() {
        return catalogId;
    }

    public String getTitle() {
        return title;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public boolean isFailed() {
        return outcome == SyncOutcomeType.FAILED;
    }
}

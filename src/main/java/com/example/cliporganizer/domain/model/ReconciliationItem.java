package com.example.cliporganizer.domain.model;

import com.example.cliporganizer.domain.enumtype.ReconciliationStatus;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One classified path of a reconciliation diff.
 *
 * <p>Instances are only created through the per-status factories, so the status-specific fields
 * are always consistent: file facts exist for {@code NEW}/{@code MATCHED}, catalog facts exist for
 * {@code MATCHED}/{@code MISSING}, and an error message exists only for {@code ERROR}.
 */
public final class ReconciliationItem {

    private final ReconciliationStatus status;
    private final String filePath;
    private final String locationKey;
    private final String directory;
    private final Long fileSizeBytes;
    private final Instant modifiedAt;
    private final Long catalogId;
    private final String title;
    private final String description;
    private final List<CatalogTag> tags;
    private final String errorMessage;

    private ReconciliationItem(ReconciliationStatus status,
                               String filePath,
                               String locationKey,
                               ScannedFile file,
                               CatalogEntry entry,
                               String errorMessage) {
        this.status = status;
        this.filePath = filePath;
        this.locationKey = locationKey;
        this.directory = file == null ? null : file.getDirectory();
        this.fileSizeBytes = file == null ? null : file.getSizeBytes();
        this.modifiedAt = file == null ? null : file.getModifiedAt();
        this.catalogId = entry == null ? null : entry.getId();
        this.title = entry == null ? null : entry.getTitle();
        this.description = entry == null ? null : entry.getDescription();
        this.tags = entry == null || entry.getTags() == null
                ? null
                : Collections.unmodifiableList(new ArrayList<>(entry.getTags()));
        this.errorMessage = errorMessage;
    }

    public static ReconciliationItem newFile(ScannedFile file, String locationKey) {
        Objects.requireNonNull(file, "file");
        return new ReconciliationItem(ReconciliationStatus.NEW, file.getPath(), locationKey, file, null, null);
    }

    public static ReconciliationItem matched(ScannedFile file, CatalogEntry entry, String locationKey) {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(entry.getId(), "catalog id");
        return new ReconciliationItem(ReconciliationStatus.MATCHED, file.getPath(), locationKey, file, entry, null);
    }

    public static ReconciliationItem missing(CatalogEntry entry, String locationKey) {
        Objects.requireNonNull(entry.getId(), "catalog id");
        return new ReconciliationItem(ReconciliationStatus.MISSING, entry.getLocationString(), locationKey, null, entry, null);
    }

    public static ReconciliationItem error(String filePath, String errorMessage) {
        Objects.requireNonNull(errorMessage, "errorMessage");
        return new ReconciliationItem(ReconciliationStatus.ERROR, filePath == null ? "" : filePath, null, null, null, errorMessage);
    }

    public ReconciliationStatus getStatus() {
        return status;
    }

    public String getFilePath() {
        return filePath;
    }

    public String getLocationKey() {
        return locationKey;
    }

    public String getDirectory() {
        return directory;
    }

    public Long getFileSizeBytes() {
        return fileSizeBytes;
    }

    public Instant getModifiedAt() {
        return modifiedAt;
    }

    public Long getCatalogId() {
        return catalogId;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public List<CatalogTag> getTags() {
        return tags;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return "ReconciliationItem{" + status + " " + filePath
                + (catalogId == null ? "" : " clipId=" + catalogId)
                + (errorMessage == null ? "" : " error=" + errorMessage) + "}";
    }
}

package com.example.cliporganizer.application.service;

import com.example.cliporganizer.common.config.AppSyncProperties;
import com.example.cliporganizer.common.exception.CatalogUnavailableException;
import com.example.cliporganizer.common.exception.LocationKeyException;
import com.example.cliporganizer.common.util.LogSanitizer;
import com.example.cliporganizer.domain.enumtype.SyncOutcomeType;
import com.example.cliporganizer.domain.model.CatalogEntry;
import com.example.cliporganizer.domain.model.CreateEntryResult;
import com.example.cliporganizer.domain.model.DeleteEntryResult;
import com.example.cliporganizer.domain.model.ProbeResult;
import com.example.cliporganizer.domain.model.SyncOutcome;
import com.example.cliporganizer.domain.model.SyncReport;
import com.example.cliporganizer.domain.model.SyncSelection;
import com.example.cliporganizer.domain.model.ThumbnailResult;
import com.example.cliporganizer.infrastructure.catalog.CatalogStore;
import com.example.cliporganizer.infrastructure.media.ThumbnailGenerator;
import com.example.cliporganizer.infrastructure.media.VideoMetadataProbe;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Applies a selection to the catalog, one item at a time.
 *
 * <p>Additions are handled before removals, each list in the order given. A failing item is
 * recorded as {@link SyncOutcomeType#FAILED} and the run continues; only
 * {@link CatalogUnavailableException} ends the run early. Cancellation is checked before each item
 * and leaves everything already applied in place.
 */
@Component
public class SyncExecutor {

    private static final Logger log = LoggerFactory.getLogger(SyncExecutor.class);

    static final String DUPLICATE_MESSAGE = "A clip with this file path already exists";
    static final String FILE_NOT_FOUND_MESSAGE = "File does not exist";

    private final CatalogStore catalogStore;
    private final VideoMetadataProbe videoMetadataProbe;
    private final ThumbnailGenerator thumbnailGenerator;
    private final PathNormalizer pathNormalizer;
    private final VideoFileScanner videoFileScanner;
    private final AppSyncProperties appSyncProperties;
    private final MeterRegistry meterRegistry;

    public SyncExecutor(CatalogStore catalogStore,
                        VideoMetadataProbe videoMetadataProbe,
                        ThumbnailGenerator thumbnailGenerator,
                        PathNormalizer pathNormalizer,
                        VideoFileScanner videoFileScanner,
                        AppSyncProperties appSyncProperties,
                        ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.catalogStore = catalogStore;
        this.videoMetadataProbe = videoMetadataProbe;
        this.thumbnailGenerator = thumbnailGenerator;
        this.pathNormalizer = pathNormalizer;
        this.videoFileScanner = videoFileScanner;
        this.appSyncProperties = appSyncProperties;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public SyncReport apply(Path root, SyncSelection selection, BooleanSupplier cancelSignal) {
        SyncReport report = new SyncReport();
        report.setRequestedCount(selection.size());
        String rootKey = pathNormalizer.normalize(root.toString());
        Set<String> extensions = appSyncProperties.normalizedVideoExtensions();
        int progressInterval = Math.max(1, appSyncProperties.getProgressLogInterval());

        log.info("SYNC_APPLY_START root={} toAdd={} toRemove={}",
                LogSanitizer.sanitizePath(root.toString()),
                selection.getFilesToAdd().size(), selection.getClipIdsToRemove().size());

        for (String rawPath : selection.getFilesToAdd()) {
            if (isCanceled(cancelSignal)) {
                report.setCanceled(true);
                break;
            }
            record(report, addFile(rawPath, rootKey, extensions));
            logProgress(report, progressInterval);
        }
        for (Long clipId : selection.getClipIdsToRemove()) {
            if (report.isCanceled() || isCanceled(cancelSignal)) {
                report.setCanceled(true);
                break;
            }
            record(report, removeClip(clipId));
            logProgress(report, progressInterval);
        }

        if (report.isCanceled()) {
            log.info("SYNC_CANCELED processed={} requested={}", report.getProcessedCount(), report.getRequestedCount());
        }
        log.info("SYNC_APPLY_FINISH processed={} added={} removed={} failed={} canceled={}",
                report.getProcessedCount(), report.getTotalAdded(), report.getTotalRemoved(),
                report.getErrorCount(), report.isCanceled());
        return report;
    }

    private SyncOutcome addFile(String rawPath, String rootKey, Set<String> extensions) {
        String displayPath;
        String locationKey;
        Path file;
        try {
            displayPath = pathNormalizer.toDisplayPath(rawPath);
            locationKey = pathNormalizer.normalize(rawPath);
            file = Paths.get(displayPath);
        } catch (LocationKeyException | InvalidPathException e) {
            return SyncOutcome.failed(rawPath == null ? "" : rawPath, null, null, "Invalid file path: " + e.getMessage());
        }
        if (!pathNormalizer.isUnder(locationKey, rootKey)) {
            return SyncOutcome.failed(displayPath, null, null, "File is outside the root folder");
        }
        if (!Files.isRegularFile(file)) {
            return SyncOutcome.failed(displayPath, null, null, FILE_NOT_FOUND_MESSAGE);
        }
        if (!videoFileScanner.isVideoFile(String.valueOf(file.getFileName()), extensions)) {
            return SyncOutcome.failed(displayPath, null, null, "Unsupported video file extension");
        }

        List<String> warnings = new ArrayList<>();
        ProbeResult probe = probeQuietly(file);
        if (!probe.isSuccess()) {
            warnings.add("Metadata probe failed: " + probe.getMessage());
            log.warn("SYNC_PROBE_FALLBACK path={} reason={}",
                    LogSanitizer.sanitizePath(displayPath), LogSanitizer.sanitize(probe.getMessage()));
        }
        String title = StringUtils.hasText(probe.getTitle()) ? probe.getTitle() : VideoMetadataProbe.defaultTitle(file);

        CreateEntryResult created;
        try {
            created = catalogStore.createEntry(displayPath, locationKey, title, probe.getDurationSec());
        } catch (CatalogUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("SYNC_ADD_FAILED path={}", LogSanitizer.sanitizePath(displayPath), e);
            return SyncOutcome.failed(displayPath, null, title, "Error adding clip: " + e.getMessage());
        }
        if (created.isDuplicate()) {
            log.info("SYNC_ADD_DUPLICATE path={} existingClipId={}",
                    LogSanitizer.sanitizePath(displayPath), created.getConflictingId());
            return SyncOutcome.failed(displayPath, created.getConflictingId(), title, DUPLICATE_MESSAGE);
        }

        ThumbnailResult thumbnail = generateThumbnailQuietly(created.getId(), file, probe.getDurationSec());
        if (thumbnail.isSuccess()) {
            try {
                catalogStore.updateThumbnailPath(created.getId(), thumbnail.getThumbnailPath());
            } catch (CatalogUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                warnings.add("Thumbnail path could not be saved: " + e.getMessage());
                thumbnailGenerator.deleteThumbnail(thumbnail.getThumbnailPath());
            }
        } else {
            warnings.add("Thumbnail generation failed: " + thumbnail.getMessage());
            log.warn("SYNC_THUMBNAIL_FAILED clipId={} path={} reason={}", created.getId(),
                    LogSanitizer.sanitizePath(displayPath), LogSanitizer.sanitize(thumbnail.getMessage()));
        }
        return SyncOutcome.added(displayPath, created.getId(), title, warnings);
    }

    private SyncOutcome removeClip(Long clipId) {
        if (clipId == null) {
            return SyncOutcome.failed("", null, null, "Clip id is required");
        }
        CatalogEntry entry;
        try {
            entry = catalogStore.findEntry(clipId);
        } catch (CatalogUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("SYNC_REMOVE_FAILED clipId={}", clipId, e);
            return SyncOutcome.failed("", clipId, null, "Error removing clip: " + e.getMessage());
        }
        if (entry == null) {
            return notFound(clipId);
        }
        String location = entry.getLocationString() == null ? "" : entry.getLocationString();
        if (!entry.isLocal()) {
            return SyncOutcome.failed(location, clipId, entry.getTitle(), "Clip is not a local file clip");
        }

        DeleteEntryResult deleted;
        try {
            deleted = catalogStore.deleteEntry(clipId);
        } catch (CatalogUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("SYNC_REMOVE_FAILED clipId={}", clipId, e);
            return SyncOutcome.failed(location, clipId, entry.getTitle(), "Error removing clip: " + e.getMessage());
        }
        if (!deleted.isDeleted()) {
            return notFound(clipId);
        }

        List<String> warnings = new ArrayList<>();
        String thumbnailPath = deleted.getDeleted().getThumbnailPath();
        if (StringUtils.hasText(thumbnailPath) && !thumbnailGenerator.deleteThumbnail(thumbnailPath)) {
            warnings.add("Thumbnail file could not be deleted: " + thumbnailPath);
        }
        return SyncOutcome.removed(location, clipId, entry.getTitle(), warnings);
    }

    private ProbeResult probeQuietly(Path file) {
        try {
            return videoMetadataProbe.probe(file);
        } catch (RuntimeException e) {
            return ProbeResult.failure(VideoMetadataProbe.defaultTitle(file), e.toString());
        }
    }

    // the clip row already exists at this point, so a thumbnail error must not lose its outcome
    private ThumbnailResult generateThumbnailQuietly(Long clipId, Path file, int durationSec) {
        try {
            return thumbnailGenerator.generate(clipId, file, durationSec);
        } catch (RuntimeException e) {
            return ThumbnailResult.failed(e.toString());
        }
    }

    private SyncOutcome notFound(Long clipId) {
        return SyncOutcome.failed("", clipId, null, "Clip " + clipId + " not found");
    }

    private boolean isCanceled(BooleanSupplier cancelSignal) {
        return cancelSignal != null && cancelSignal.getAsBoolean();
    }

    private void record(SyncReport report, SyncOutcome outcome) {
        report.record(outcome);
        if (outcome.isFailed()) {
            log.warn("SYNC_ITEM_FAILED path={} clipId={} reason={}",
                    LogSanitizer.sanitizePath(outcome.getFilePath()), outcome.getCatalogId(),
                    LogSanitizer.sanitize(outcome.getErrorMessage()));
        }
        recordCounter("clip.sync.outcome", "outcome", outcome.getOutcome().name().toLowerCase(Locale.ROOT));
    }

    private void logProgress(SyncReport report, int interval) {
        if (report.getProcessedCount() % interval == 0) {
            log.info("SYNC_APPLY_PROGRESS processed={} requested={} added={} removed={} failed={}",
                    report.getProcessedCount(), report.getRequestedCount(), report.getTotalAdded(),
                    report.getTotalRemoved(), report.getErrorCount());
        }
    }

    private void recordCounter(String name, String... tags) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter(name, tags).increment();
        } catch (Exception ex) {
            log.debug("Sync metric counter failed, name={}", name, ex);
        }
    }
}

package com.example.cliporganizer.application.service;

import com.example.cliporganizer.api.request.QuickSyncRequest;
import com.example.cliporganizer.api.request.SelectiveSyncRequest;
import com.example.cliporganizer.api.response.ReconciliationItemResponse;
import com.example.cliporganizer.api.response.ScanWarningResponse;
import com.example.cliporganizer.api.response.SyncAddedClipResponse;
import com.example.cliporganizer.api.response.SyncErrorResponse;
import com.example.cliporganizer.api.response.SyncPreviewResponse;
import com.example.cliporganizer.api.response.SyncRemovedClipResponse;
import com.example.cliporganizer.api.response.SyncResponse;
import com.example.cliporganizer.api.response.TagResponse;
import com.example.cliporganizer.common.util.LogSanitizer;
import com.example.cliporganizer.domain.enumtype.SyncMode;
import com.example.cliporganizer.domain.model.CatalogTag;
import com.example.cliporganizer.domain.model.ReconciliationDiff;
import com.example.cliporganizer.domain.model.ReconciliationItem;
import com.example.cliporganizer.domain.model.ScanWarning;
import com.example.cliporganizer.domain.model.SyncOutcome;
import com.example.cliporganizer.domain.model.SyncReport;
import com.example.cliporganizer.domain.model.SyncSelection;
import com.example.cliporganizer.infrastructure.catalog.CatalogStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

@Service
public class ClipSyncService {

    private static final Logger log = LoggerFactory.getLogger(ClipSyncService.class);

    private final RootFolderService rootFolderService;
    private final VideoFileScanner videoFileScanner;
    private final Reconciler reconciler;
    private final SyncExecutor syncExecutor;
    private final CatalogStore catalogStore;
    private final SyncCancellationRegistry cancellationRegistry;
    private final MeterRegistry meterRegistry;

    public ClipSyncService(RootFolderService rootFolderService,
                           VideoFileScanner videoFileScanner,
                           Reconciler reconciler,
                           SyncExecutor syncExecutor,
                           CatalogStore catalogStore,
                           SyncCancellationRegistry cancellationRegistry,
                           ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.rootFolderService = rootFolderService;
        this.videoFileScanner = videoFileScanner;
        this.reconciler = reconciler;
        this.syncExecutor = syncExecutor;
        this.catalogStore = catalogStore;
        this.cancellationRegistry = cancellationRegistry;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public SyncPreviewResponse preview(String rootFolderPath, String sessionId) {
        Path root = rootFolderService.resolveRoot(rootFolderPath);
        String id = cancellationRegistry.register(sessionId);
        long startedAtNanos = System.nanoTime();
        log.info("SYNC_PREVIEW_START sessionId={} root={}", id, LogSanitizer.sanitizePath(root.toString()));
        try {
            ReconciliationSession session = openSession(id, root);
            ReconciliationDiff diff = session.preview();
            recordCounter("clip.sync.scan.files", diff.getTotalScanned());
            return toPreviewResponse(session, diff);
        } finally {
            cancellationRegistry.unregister(id);
            recordDuration(SyncMode.PREVIEW, System.nanoTime() - startedAtNanos);
        }
    }

    public SyncResponse selectiveSync(SelectiveSyncRequest request) {
        Path root = rootFolderService.resolveRoot(request.getRootFolderPath());
        String id = cancellationRegistry.register(request.getSessionId());
        long startedAtNanos = System.nanoTime();
        log.info("SYNC_SELECTIVE_START sessionId={} root={} toAdd={} toRemove={}",
                id, LogSanitizer.sanitizePath(root.toString()),
                sizeOf(request.getFilesToAdd()), sizeOf(request.getClipIdsToRemove()));
        try {
            ReconciliationSession session = openSession(id, root);
            SyncReport report = session.applySelection(
                    new SyncSelection(request.getFilesToAdd(), request.getClipIdsToRemove()));
            return toSyncResponse(session, report);
        } finally {
            cancellationRegistry.unregister(id);
            recordDuration(SyncMode.SELECTIVE, System.nanoTime() - startedAtNanos);
        }
    }

    public SyncResponse quickSync(QuickSyncRequest request) {
        QuickSyncRequest safeRequest = request == null ? new QuickSyncRequest() : request;
        Path root = rootFolderService.resolveRoot(safeRequest.getRootFolderPath());
        String id = cancellationRegistry.register(safeRequest.getSessionId());
        long startedAtNanos = System.nanoTime();
        log.info("SYNC_FULL_START sessionId={} root={}", id, LogSanitizer.sanitizePath(root.toString()));
        try {
            ReconciliationSession session = openSession(id, root);
            SyncReport report = session.applyAll();
            recordCounter("clip.sync.scan.files", report.getTotalScanned());
            return toSyncResponse(session, report);
        } finally {
            cancellationRegistry.unregister(id);
            recordDuration(SyncMode.FULL, System.nanoTime() - startedAtNanos);
        }
    }

    public boolean cancel(String sessionId) {
        boolean found = cancellationRegistry.cancel(sessionId);
        log.info("SYNC_CANCEL_REQUESTED sessionId={} found={}", LogSanitizer.sanitize(sessionId), found);
        return found;
    }

    private ReconciliationSession openSession(String id, Path root) {
        return new ReconciliationSession(id, root, videoFileScanner, reconciler, syncExecutor, catalogStore,
                () -> cancellationRegistry.isCancelRequested(id));
    }

    private SyncPreviewResponse toPreviewResponse(ReconciliationSession session, ReconciliationDiff diff) {
        SyncPreviewResponse response = new SyncPreviewResponse();
        for (ReconciliationItem item : diff.getItems()) {
            response.getItems().add(toItemResponse(item));
        }
        response.setTotalScanned(diff.getTotalScanned());
        response.setNewFilesCount(diff.getNewCount());
        response.setMissingFilesCount(diff.getMissingCount());
        response.setMatchedFilesCount(diff.getMatchedCount());
        response.setErrorCount(diff.getErrorCount());
        response.setRootFolderPath(session.getRootFolder().toString());
        response.setWarnings(toWarningResponses(session.getScanWarnings()));
        response.setSessionId(session.getSessionId());
        response.setCanceled(session.isCanceled());
        return response;
    }

    private ReconciliationItemResponse toItemResponse(ReconciliationItem item) {
        ReconciliationItemResponse response = new ReconciliationItemResponse();
        response.setFilePath(item.getFilePath());
        response.setStatus(item.getStatus().getCode());
        response.setDirectory(item.getDirectory());
        response.setFileSize(item.getFileSizeBytes());
        response.setLastModified(item.getModifiedAt());
        response.setClipId(item.getCatalogId());
        response.setTitle(item.getTitle());
        response.setDescription(item.getDescription());
        if (item.getTags() != null) {
            List<TagResponse> tags = new ArrayList<>(item.getTags().size());
            for (CatalogTag tag : item.getTags()) {
                tags.add(new TagResponse(tag.getId(), tag.getCategory(), tag.getValue()));
            }
            response.setTags(tags);
        }
        response.setErrorMessage(item.getErrorMessage());
        return response;
    }

    private SyncResponse toSyncResponse(ReconciliationSession session, SyncReport report) {
        SyncResponse response = new SyncResponse();
        for (SyncOutcome outcome : report.getOutcomes()) {
            switch (outcome.getOutcome()) {
                case ADDED:
                    response.getAddedClips().add(new SyncAddedClipResponse(
                            outcome.getCatalogId(), outcome.getFilePath(), outcome.getTitle(), outcome.getWarnings()));
                    break;
                case REMOVED:
                    response.getRemovedClips().add(new SyncRemovedClipResponse(
                            outcome.getCatalogId(), outcome.getFilePath(), outcome.getTitle(), outcome.getWarnings()));
                    break;
                default:
                    response.getErrors().add(new SyncErrorResponse(
                            outcome.getFilePath(), outcome.getCatalogId(), outcome.getErrorMessage()));
                    break;
            }
        }
        response.setWarnings(toWarningResponses(report.getScanWarnings()));
        response.setTotalScanned(report.getTotalScanned());
        response.setTotalAdded(report.getTotalAdded());
        response.setTotalRemoved(report.getTotalRemoved());
        response.setProcessedCount(report.getProcessedCount());
        response.setCanceled(report.isCanceled());
        response.setRootFolderPath(session.getRootFolder().toString());
        response.setSessionId(session.getSessionId());
        return response;
    }

    private List<ScanWarningResponse> toWarningResponses(List<ScanWarning> warnings) {
        List<ScanWarningResponse> responses = new ArrayList<>(warnings.size());
        for (ScanWarning warning : warnings) {
            responses.add(new ScanWarningResponse(warning.getPath(), warning.getMessage()));
        }
        return responses;
    }

    private int sizeOf(List<?> values) {
        return values == null ? 0 : values.size();
    }

    private void recordCounter(String name, int value) {
        if (meterRegistry == null || value <= 0) {
            return;
        }
        try {
            meterRegistry.counter(name).increment(value);
        } catch (Exception ex) {
            log.debug("Sync metric counter failed, name={}", name, ex);
        }
    }

    private void recordDuration(SyncMode mode, long nanos) {
        if (meterRegistry == null || nanos <= 0) {
            return;
        }
        try {
            meterRegistry.timer("clip.sync.duration", "mode", mode.tag()).record(nanos, TimeUnit.NANOSECONDS);
        } catch (Exception ex) {
            log.debug("Sync metric timer failed, mode={}", mode, ex);
        }
    }
}

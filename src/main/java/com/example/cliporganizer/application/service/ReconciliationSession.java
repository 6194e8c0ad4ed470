package com.example.cliporganizer.application.service;

import com.example.cliporganizer.common.exception.RootNotFoundException;
import com.example.cliporganizer.common.util.LogSanitizer;
import com.example.cliporganizer.domain.enumtype.SessionState;
import com.example.cliporganizer.domain.model.CatalogEntry;
import com.example.cliporganizer.domain.model.ReconciliationDiff;
import com.example.cliporganizer.domain.model.ScanWarning;
import com.example.cliporganizer.domain.model.ScannedFile;
import com.example.cliporganizer.domain.model.SyncReport;
import com.example.cliporganizer.domain.model.SyncSelection;
import com.example.cliporganizer.infrastructure.catalog.CatalogStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One reconciliation run against one root folder.
 *
 * <p>{@code IDLE -> SCANNING -> DIFFING -> READY -> APPLYING -> COMPLETED}. {@code READY} may be
 * left for another preview, which replaces the previous diff. A full sync goes from
 * {@code DIFFING} straight to {@code APPLYING} with everything selected. A selective apply starts
 * from {@code IDLE} or {@code READY} without scanning. {@code FAILED} is reached only when the root
 * is missing or the catalog is unreachable; item failures still complete the session.
 */
public class ReconciliationSession {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationSession.class);

    private final String sessionId;
    private final Path rootFolder;
    private final VideoFileScanner videoFileScanner;
    private final Reconciler reconciler;
    private final SyncExecutor syncExecutor;
    private final CatalogStore catalogStore;
    private final BooleanSupplier cancelSignal;

    private SessionState state = SessionState.IDLE;
    private ReconciliationDiff diff;
    private List<ScanWarning> scanWarnings = Collections.emptyList();
    private int scannedCount;
    private boolean canceled;

    public ReconciliationSession(String sessionId,
                                 Path rootFolder,
                                 VideoFileScanner videoFileScanner,
                                 Reconciler reconciler,
                                 SyncExecutor syncExecutor,
                                 CatalogStore catalogStore,
                                 BooleanSupplier cancelSignal) {
        this.sessionId = sessionId;
        this.rootFolder = rootFolder;
        this.videoFileScanner = videoFileScanner;
        this.reconciler = reconciler;
        this.syncExecutor = syncExecutor;
        this.catalogStore = catalogStore;
        this.cancelSignal = cancelSignal;
    }

    /**
     * Scans and diffs. Returns an empty diff when canceled during the scan.
     */
    public synchronized ReconciliationDiff preview() {
        requireState(SessionState.IDLE, SessionState.READY);
        if (!scanAndDiff()) {
            moveTo(SessionState.COMPLETED);
            return diff;
        }
        moveTo(SessionState.READY);
        return diff;
    }

    public synchronized SyncReport applySelection(SyncSelection selection) {
        requireState(SessionState.IDLE, SessionState.READY);
        if (!Files.isDirectory(rootFolder)) {
            moveTo(SessionState.FAILED);
            throw new RootNotFoundException(rootFolder.toString(), "Root folder does not exist");
        }
        moveTo(SessionState.APPLYING);
        SyncReport report = execute(selection);
        report.setTotalScanned(selection.getFilesToAdd().size());
        return report;
    }

    /**
     * Scans, diffs, then applies every new and missing item without pausing.
     */
    public synchronized SyncReport applyAll() {
        requireState(SessionState.IDLE);
        if (!scanAndDiff()) {
            moveTo(SessionState.COMPLETED);
            SyncReport report = new SyncReport();
            report.setTotalScanned(scannedCount);
            report.addScanWarnings(scanWarnings);
            report.setCanceled(true);
            return report;
        }
        moveTo(SessionState.APPLYING);
        SyncReport report = execute(diff.selectAll());
        report.setTotalScanned(diff.getTotalScanned());
        report.addScanWarnings(scanWarnings);
        return report;
    }

    private boolean scanAndDiff() {
        moveTo(SessionState.SCANNING);
        diff = null;
        scannedCount = 0;
        VideoFileScanner.VideoFileScan scan;
        try {
            scan = videoFileScanner.scan(rootFolder);
        } catch (RuntimeException e) {
            moveTo(SessionState.FAILED);
            throw e;
        }
        List<ScannedFile> files = new ArrayList<>();
        for (ScannedFile file : scan) {
            if (cancelSignal != null && cancelSignal.getAsBoolean()) {
                canceled = true;
                break;
            }
            files.add(file);
            scannedCount++;
        }
        scanWarnings = scan.getWarnings();
        log.info("SYNC_SCAN_FINISH sessionId={} root={} scanned={} warnings={} canceled={}",
                sessionId, LogSanitizer.sanitizePath(rootFolder.toString()), scannedCount, scanWarnings.size(), canceled);
        if (canceled) {
            log.info("SYNC_CANCELED sessionId={} phase=scan scanned={}", sessionId, scannedCount);
            diff = new ReconciliationDiff(Collections.emptyList(), scannedCount);
            return false;
        }

        moveTo(SessionState.DIFFING);
        List<CatalogEntry> snapshot;
        try {
            snapshot = catalogStore.listLocalEntries();
        } catch (RuntimeException e) {
            moveTo(SessionState.FAILED);
            throw e;
        }
        diff = reconciler.diff(files, snapshot, rootFolder.toAbsolutePath().normalize().toString());
        log.info("SYNC_DIFF_FINISH sessionId={} new={} missing={} matched={} errors={}",
                sessionId, diff.getNewCount(), diff.getMissingCount(), diff.getMatchedCount(), diff.getErrorCount());
        return true;
    }

    private SyncReport execute(SyncSelection selection) {
        SyncReport report;
        try {
            report = syncExecutor.apply(rootFolder, selection, cancelSignal);
        } catch (RuntimeException e) {
            moveTo(SessionState.FAILED);
            log.error("SYNC_APPLY_ABORTED sessionId={} reason={}", sessionId, LogSanitizer.sanitize(e.getMessage()));
            throw e;
        }
        canceled = report.isCanceled();
        moveTo(SessionState.COMPLETED);
        return report;
    }

    private void requireState(SessionState... allowed) {
        for (SessionState candidate : allowed) {
            if (state == candidate) {
                return;
            }
        }
        throw new IllegalStateException("Session " + sessionId + " cannot run from state " + state);
    }

    private void moveTo(SessionState next) {
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Session " + sessionId + " cannot move from " + state + " to " + next);
        }
        log.debug("SYNC_SESSION_STATE sessionId={} from={} to={}", sessionId, state, next);
        state = next;
    }

    public String getSessionId() {
        return sessionId;
    }

    public Path getRootFolder() {
        return rootFolder;
    }

    public synchronized SessionState getState() {
        return state;
    }

    public synchronized ReconciliationDiff getDiff() {
        return diff;
    }

    public synchronized List<ScanWarning> getScanWarnings() {
        return scanWarnings;
    }

    public synchronized boolean isCanceled() {
        return canceled;
    }
}

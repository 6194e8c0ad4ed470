package com.example.cliporganizer.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.cliporganizer.common.config.AppSyncProperties;
import com.example.cliporganizer.common.exception.CatalogUnavailableException;
import com.example.cliporganizer.common.exception.RootNotFoundException;
import com.example.cliporganizer.domain.enumtype.ReconciliationStatus;
import com.example.cliporganizer.domain.enumtype.SessionState;
import com.example.cliporganizer.domain.model.ProbeResult;
import com.example.cliporganizer.domain.model.ReconciliationDiff;
import com.example.cliporganizer.domain.model.ReconciliationItem;
import com.example.cliporganizer.domain.model.SyncOutcome;
import com.example.cliporganizer.domain.model.SyncReport;
import com.example.cliporganizer.domain.model.SyncSelection;
import com.example.cliporganizer.domain.model.ThumbnailResult;
import com.example.cliporganizer.infrastructure.media.ThumbnailGenerator;
import com.example.cliporganizer.infrastructure.media.VideoMetadataProbe;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

class ReconciliationSessionTest {

    @TempDir
    Path root;

    private InMemoryCatalogStore catalogStore;
    private VideoFileScanner scanner;
    private Reconciler reconciler;
    private SyncExecutor executor;

    @BeforeEach
    void setUp() {
        AppSyncProperties properties = new AppSyncProperties();
        PathNormalizer pathNormalizer = new PathNormalizer(true);
        catalogStore = new InMemoryCatalogStore(pathNormalizer);
        scanner = new VideoFileScanner(properties);
        reconciler = new Reconciler(pathNormalizer);

        VideoMetadataProbe probe = mock(VideoMetadataProbe.class);
        ThumbnailGenerator thumbnails = mock(ThumbnailGenerator.class);
        when(probe.probe(any(Path.class))).thenAnswer(invocation ->
                ProbeResult.success(VideoMetadataProbe.defaultTitle(invocation.getArgument(0)), 5));
        when(thumbnails.generate(anyLong(), any(Path.class), anyInt()))
                .thenReturn(ThumbnailResult.failed("ffmpeg disabled in tests"));

        executor = new SyncExecutor(catalogStore, probe, thumbnails, pathNormalizer, scanner, properties,
                emptyMeterRegistry());
    }

    @Test
    void previewOfEmptyCatalogShouldListAllFilesAsNew() throws IOException {
        video("a.mp4");
        video("b.mov");

        ReconciliationSession session = session(null);
        ReconciliationDiff diff = session.preview();

        assertEquals(2, diff.getNewCount());
        assertEquals(0, diff.getMissingCount());
        assertEquals(0, diff.getMatchedCount());
        assertEquals(SessionState.READY, session.getState());
    }

    @Test
    void previewShouldMatchKnownFilesAndReportMissingOnes() throws IOException {
        givenLibraryWithKnownAAndMissingC();

        ReconciliationDiff diff = session(null).preview();

        assertEquals(ReconciliationStatus.MATCHED, statusOf(diff, "a.mp4"));
        assertEquals(ReconciliationStatus.NEW, statusOf(diff, "b.mov"));
        assertEquals(ReconciliationStatus.MISSING, statusOf(diff, "c.mp4"));
    }

    @Test
    void selectiveApplyShouldAddOnlySelectedFileAndRescanAsMatched() throws IOException {
        givenLibraryWithKnownAAndMissingC();
        ReconciliationSession session = session(null);
        ReconciliationDiff diff = session.preview();
        String bPath = pathOf(diff, "b.mov");

        SyncReport report = session.applySelection(new SyncSelection(Collections.singletonList(bPath), null));

        assertEquals(1, report.getTotalAdded());
        assertEquals(1, report.getTotalScanned());
        assertEquals(3, catalogStore.size());
        assertEquals(SessionState.COMPLETED, session.getState());

        ReconciliationDiff rescan = session(null).preview();
        assertEquals(ReconciliationStatus.MATCHED, statusOf(rescan, "b.mov"));
        assertEquals(ReconciliationStatus.MISSING, statusOf(rescan, "c.mp4"));
    }

    @Test
    void missingRootShouldFailWithoutTouchingCatalog() {
        catalogStore.seedLocal(root.resolve("a.mp4").toString(), "a");
        ReconciliationSession session = new ReconciliationSession("s-1", root.resolve("absent"), scanner, reconciler,
                executor, catalogStore, null);

        assertThrows(RootNotFoundException.class, session::preview);

        assertEquals(SessionState.FAILED, session.getState());
        assertEquals(1, catalogStore.size());
        assertEquals(0, catalogStore.getCreateCalls());
    }

    @Test
    void applyingToMissingRootShouldFail() {
        ReconciliationSession session = new ReconciliationSession("s-1", root.resolve("absent"), scanner, reconciler,
                executor, catalogStore, null);

        assertThrows(RootNotFoundException.class,
                () -> session.applySelection(new SyncSelection(Collections.singletonList("/x/a.mp4"), null)));
        assertEquals(SessionState.FAILED, session.getState());
    }

    @Test
    void applyingNewSetTwiceShouldNotCreateDuplicates() throws IOException {
        video("a.mp4");
        video("b.mov");
        SyncSelection newFiles = session(null).preview().selectAll();

        SyncReport first = session(null).applySelection(newFiles);
        SyncReport second = session(null).applySelection(newFiles);

        assertEquals(2, first.getTotalAdded());
        assertEquals(0, second.getTotalAdded());
        assertEquals(2, second.getErrorCount());
        for (SyncOutcome outcome : second.getOutcomes()) {
            assertEquals(SyncExecutor.DUPLICATE_MESSAGE, outcome.getErrorMessage());
        }
        assertEquals(2, catalogStore.size());
    }

    @Test
    void fullSyncShouldAddNewAndRemoveMissing() throws IOException {
        givenLibraryWithKnownAAndMissingC();
        ReconciliationSession session = session(null);

        SyncReport report = session.applyAll();

        assertEquals(1, report.getTotalAdded());
        assertEquals(1, report.getTotalRemoved());
        assertEquals(2, report.getTotalScanned());
        assertEquals(SessionState.COMPLETED, session.getState());

        ReconciliationDiff after = session(null).preview();
        assertEquals(2, after.getMatchedCount());
        assertEquals(0, after.getNewCount());
        assertEquals(0, after.getMissingCount());
    }

    @Test
    void clipsOutsideTheRootShouldNotBeMissingOrRemoved() throws IOException {
        Path library = Files.createDirectories(root.resolve("lib"));
        Path other = Files.createDirectories(root.resolve("other"));
        Path sibling = Files.createDirectories(root.resolve("lib2"));
        Files.writeString(library.resolve("a.mp4"), "a");
        catalogStore.seedLocal(Files.writeString(other.resolve("x.mp4"), "x").toString(), "x");
        catalogStore.seedLocal(sibling.resolve("gone.mp4").toString(), "gone elsewhere");
        catalogStore.seedLocal(library.resolve("c.mp4").toString(), "c");

        ReconciliationDiff diff = librarySession(library).preview();
        assertEquals(1, diff.getMissingCount());
        assertEquals(ReconciliationStatus.MISSING, statusOf(diff, "c.mp4"));
        assertEquals(0, diff.getErrorCount());

        SyncReport first = librarySession(library).applyAll();
        SyncReport second = librarySession(library).applyAll();

        assertEquals(1, first.getTotalRemoved());
        assertEquals(0, first.getErrorCount());
        assertEquals(0, second.getTotalRemoved());
        assertEquals(0, second.getErrorCount());
        assertEquals(3, catalogStore.size());
    }

    @Test
    void cancelDuringScanShouldCompleteWithoutChanges() throws IOException {
        video("a.mp4");
        video("b.mov");
        ReconciliationSession session = session(() -> true);

        SyncReport report = session.applyAll();

        assertTrue(report.isCanceled());
        assertEquals(0, report.getProcessedCount());
        assertEquals(0, catalogStore.size());
        assertEquals(SessionState.COMPLETED, session.getState());
    }

    @Test
    void unreachableCatalogShouldFailTheSession() throws IOException {
        video("a.mp4");
        catalogStore.setUnavailable(true);
        ReconciliationSession session = session(null);

        assertThrows(CatalogUnavailableException.class, session::preview);
        assertEquals(SessionState.FAILED, session.getState());
    }

    @Test
    void previewMayBeRepeatedBeforeApplying() throws IOException {
        video("a.mp4");
        ReconciliationSession session = session(null);
        session.preview();
        video("b.mov");

        ReconciliationDiff second = session.preview();

        assertEquals(2, second.getNewCount());
        assertEquals(SessionState.READY, session.getState());
    }

    @Test
    void completedSessionShouldNotRunAgain() throws IOException {
        video("a.mp4");
        ReconciliationSession session = session(null);
        session.applyAll();

        assertThrows(IllegalStateException.class, session::preview);
        assertThrows(IllegalStateException.class, session::applyAll);
    }

    private void givenLibraryWithKnownAAndMissingC() throws IOException {
        catalogStore.seedLocal(video("a.mp4").toString(), "a");
        catalogStore.seedLocal(root.resolve("c.mp4").toString(), "c");
        video("b.mov");
    }

    private ReconciliationSession session(BooleanSupplier cancelSignal) {
        return new ReconciliationSession("s-1", root, scanner, reconciler, executor, catalogStore, cancelSignal);
    }

    private ReconciliationSession librarySession(Path library) {
        return new ReconciliationSession("s-2", library, scanner, reconciler, executor, catalogStore, null);
    }

    private Path video(String name) throws IOException {
        Path file = root.resolve(name);
        Files.writeString(file, name);
        return file;
    }

    private static ReconciliationStatus statusOf(ReconciliationDiff diff, String fileName) {
        return itemOf(diff, fileName).getStatus();
    }

    private static String pathOf(ReconciliationDiff diff, String fileName) {
        return itemOf(diff, fileName).getFilePath();
    }

    private static ReconciliationItem itemOf(ReconciliationDiff diff, String fileName) {
        for (ReconciliationItem item : diff.getItems()) {
            if (item.getFilePath().endsWith("/" + fileName)) {
                return item;
            }
        }
        throw new AssertionError("no item for " + fileName + " in " + diff.getItems());
    }

    private ObjectProvider<MeterRegistry> emptyMeterRegistry() {
        return new StaticListableBeanFactory().getBeanProvider(MeterRegistry.class);
    }
}

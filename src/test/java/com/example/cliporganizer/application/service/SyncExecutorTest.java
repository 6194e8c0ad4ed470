package com.example.cliporganizer.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.cliporganizer.common.config.AppSyncProperties;
import com.example.cliporganizer.common.exception.CatalogUnavailableException;
import com.example.cliporganizer.domain.enumtype.StorageType;
import com.example.cliporganizer.domain.enumtype.SyncOutcomeType;
import com.example.cliporganizer.domain.model.CatalogEntry;
import com.example.cliporganizer.domain.model.ProbeResult;
import com.example.cliporganizer.domain.model.SyncOutcome;
import com.example.cliporganizer.domain.model.SyncReport;
import com.example.cliporganizer.domain.model.SyncSelection;
import com.example.cliporganizer.domain.model.ThumbnailResult;
import com.example.cliporganizer.infrastructure.media.ThumbnailGenerator;
import com.example.cliporganizer.infrastructure.media.VideoMetadataProbe;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

class SyncExecutorTest {

    @TempDir
    Path root;

    private InMemoryCatalogStore catalogStore;
    private VideoMetadataProbe probe;
    private ThumbnailGenerator thumbnails;
    private SimpleMeterRegistry meterRegistry;
    private SyncExecutor executor;

    @BeforeEach
    void setUp() {
        AppSyncProperties properties = new AppSyncProperties();
        PathNormalizer pathNormalizer = new PathNormalizer(true);
        catalogStore = new InMemoryCatalogStore(pathNormalizer);
        probe = mock(VideoMetadataProbe.class);
        thumbnails = mock(ThumbnailGenerator.class);
        meterRegistry = new SimpleMeterRegistry();

        when(probe.probe(any(Path.class))).thenAnswer(invocation ->
                ProbeResult.success(VideoMetadataProbe.defaultTitle(invocation.getArgument(0)), 42));
        when(thumbnails.generate(anyLong(), any(Path.class), anyInt())).thenAnswer(invocation ->
                ThumbnailResult.generated("thumbnails/" + invocation.getArgument(0) + ".jpg"));
        when(thumbnails.deleteThumbnail(any())).thenReturn(true);

        executor = new SyncExecutor(catalogStore, probe, thumbnails, pathNormalizer,
                new VideoFileScanner(properties), properties, beanProvider(meterRegistry));
    }

    @Test
    void shouldAddFileWithProbedMetadataAndThumbnail() throws IOException {
        Path clip = video("holiday.mp4");

        SyncReport report = executor.apply(root, selection(clip.toString()), null);

        assertEquals(1, report.getTotalAdded());
        SyncOutcome added = report.getOutcomes().get(0);
        assertEquals(SyncOutcomeType.ADDED, added.getOutcome());
        assertEquals("holiday", added.getTitle());
        assertTrue(added.getWarnings().isEmpty());
        CatalogEntry entry = catalogStore.get(added.getCatalogId());
        assertEquals(clip.toString(), entry.getLocationString());
        assertEquals(Integer.valueOf(42), entry.getDurationSec());
        assertEquals("thumbnails/" + entry.getId() + ".jpg", entry.getThumbnailPath());
        assertEquals(1.0, meterRegistry.counter("clip.sync.outcome", "outcome", "added").count());
    }

    @Test
    void applyingSameFileTwiceShouldReportDuplicate() throws IOException {
        Path clip = video("a.mp4");
        executor.apply(root, selection(clip.toString()), null);

        SyncReport second = executor.apply(root, selection(root + "//./" + clip.getFileName()), null);

        assertEquals(0, second.getTotalAdded());
        assertEquals(1, second.getErrorCount());
        SyncOutcome failed = second.getOutcomes().get(0);
        assertEquals(SyncExecutor.DUPLICATE_MESSAGE, failed.getErrorMessage());
        assertEquals(Long.valueOf(1L), failed.getCatalogId());
        assertEquals(1, catalogStore.size());
        verify(thumbnails).generate(anyLong(), any(Path.class), anyInt());
    }

    @Test
    void probeAndThumbnailFailuresShouldDegradeToWarnings() throws IOException {
        Path clip = video("broken.webm");
        when(probe.probe(clip)).thenReturn(ProbeResult.failure("broken", "ffprobe exited with 1"));
        when(thumbnails.generate(anyLong(), any(Path.class), anyInt()))
                .thenReturn(ThumbnailResult.failed("ffmpeg not found"));

        SyncReport report = executor.apply(root, selection(clip.toString()), null);

        assertEquals(1, report.getTotalAdded());
        SyncOutcome added = report.getOutcomes().get(0);
        assertEquals("broken", added.getTitle());
        assertEquals(2, added.getWarnings().size());
        assertTrue(added.getWarnings().get(0).startsWith("Metadata probe failed"));
        assertTrue(added.getWarnings().get(1).startsWith("Thumbnail generation failed"));
        CatalogEntry entry = catalogStore.get(added.getCatalogId());
        assertEquals(Integer.valueOf(0), entry.getDurationSec());
        assertNull(entry.getThumbnailPath());
    }

    @Test
    void throwingCollaboratorsShouldNotAbortTheBatch() throws IOException {
        Path first = video("first.mp4");
        Path second = video("second.mp4");
        when(probe.probe(first)).thenThrow(new IllegalStateException("probe crashed"));
        when(thumbnails.generate(anyLong(), any(Path.class), anyInt()))
                .thenThrow(new IllegalArgumentException("bad thumbnail directory"));

        SyncReport report = executor.apply(root, selection(first.toString(), second.toString()), null);

        assertEquals(2, report.getTotalAdded());
        assertEquals(0, report.getErrorCount());
        SyncOutcome added = report.getOutcomes().get(0);
        assertEquals("first", added.getTitle());
        assertEquals(2, added.getWarnings().size());
        assertTrue(added.getWarnings().get(0).contains("probe crashed"));
        assertTrue(added.getWarnings().get(1).contains("bad thumbnail directory"));
        assertEquals(1, report.getOutcomes().get(1).getWarnings().size());
        assertEquals(2, catalogStore.size());
    }

    @Test
    void shouldRejectFilesThatCannotBeAdded() throws IOException {
        Path outside = Files.createTempFile("outside", ".mp4");
        Path text = root.resolve("notes.txt");
        Files.writeString(text, "x");
        try {
            SyncReport report = executor.apply(root, new SyncSelection(Arrays.asList(
                    root.resolve("gone.mp4").toString(),
                    outside.toString(),
                    text.toString(),
                    "bad\0path"), null), null);

            assertEquals(4, report.getErrorCount());
            List<SyncOutcome> outcomes = report.getOutcomes();
            assertEquals(SyncExecutor.FILE_NOT_FOUND_MESSAGE, outcomes.get(0).getErrorMessage());
            assertEquals("File is outside the root folder", outcomes.get(1).getErrorMessage());
            assertEquals("Unsupported video file extension", outcomes.get(2).getErrorMessage());
            assertTrue(outcomes.get(3).getErrorMessage().startsWith("Invalid file path"));
            assertEquals(0, catalogStore.size());
        } finally {
            Files.deleteIfExists(outside);
        }
    }

    @Test
    void shouldRemoveMissingClipAndItsThumbnail() {
        CatalogEntry gone = catalogStore.seedLocal(root.resolve("gone.mp4").toString(), "Gone");
        gone.setThumbnailPath("thumbnails/1.jpg");

        SyncReport report = executor.apply(root, new SyncSelection(null, Collections.singletonList(gone.getId())), null);

        assertEquals(1, report.getTotalRemoved());
        assertEquals("Gone", report.getOutcomes().get(0).getTitle());
        assertEquals(0, catalogStore.size());
        verify(thumbnails).deleteThumbnail("thumbnails/1.jpg");
    }

    @Test
    void alreadyDeletedClipShouldFailWithNotFound() {
        CatalogEntry gone = catalogStore.seedLocal(root.resolve("gone.mp4").toString(), "Gone");

        SyncReport report = executor.apply(root,
                new SyncSelection(null, Arrays.asList(gone.getId(), 99L)), null);

        assertEquals(1, report.getTotalRemoved());
        assertEquals(1, report.getErrorCount());
        SyncOutcome failed = report.outcomesOf(SyncOutcomeType.FAILED).get(0);
        assertEquals(Long.valueOf(99L), failed.getCatalogId());
        assertTrue(failed.getErrorMessage().contains("not found"));
    }

    @Test
    void shouldRemoveSelectedClipEvenWhenItsFileIsPresent() throws IOException {
        Path present = video("here.mp4");
        CatalogEntry onDisk = catalogStore.seedLocal(present.toString(), "Here");

        SyncReport report = executor.apply(root, new SyncSelection(null, Collections.singletonList(onDisk.getId())), null);

        assertEquals(1, report.getTotalRemoved());
        assertEquals(0, report.getErrorCount());
        assertEquals(0, catalogStore.size());
        assertTrue(Files.exists(present));
    }

    @Test
    void shouldRejectNonLocalAndBlankRemovals() {
        CatalogEntry online = catalogStore.seed(StorageType.YOUTUBE, "https://youtu.be/x", "Online");

        SyncReport report = executor.apply(root,
                new SyncSelection(null, Arrays.asList(online.getId(), null)), null);

        assertEquals(2, report.getErrorCount());
        assertEquals("Clip is not a local file clip", report.getOutcomes().get(0).getErrorMessage());
        assertEquals("Clip id is required", report.getOutcomes().get(1).getErrorMessage());
        assertEquals(1, catalogStore.size());
    }

    @Test
    void leftoverThumbnailShouldBeReportedAsWarning() {
        CatalogEntry gone = catalogStore.seedLocal(root.resolve("gone.mp4").toString(), "Gone");
        gone.setThumbnailPath("thumbnails/locked.jpg");
        when(thumbnails.deleteThumbnail("thumbnails/locked.jpg")).thenReturn(false);

        SyncReport report = executor.apply(root, new SyncSelection(null, Collections.singletonList(gone.getId())), null);

        assertEquals(1, report.getTotalRemoved());
        assertEquals(1, report.getOutcomes().get(0).getWarnings().size());
    }

    @Test
    void addsShouldRunBeforeRemovals() throws IOException {
        CatalogEntry gone = catalogStore.seedLocal(root.resolve("gone.mp4").toString(), "Gone");
        Path clip = video("new.mp4");

        SyncReport report = executor.apply(root, new SyncSelection(
                Collections.singletonList(clip.toString()), Collections.singletonList(gone.getId())), null);

        assertEquals(SyncOutcomeType.ADDED, report.getOutcomes().get(0).getOutcome());
        assertEquals(SyncOutcomeType.REMOVED, report.getOutcomes().get(1).getOutcome());
        assertEquals(2, report.getRequestedCount());
    }

    @Test
    void cancellationShouldStopBeforeNextItemAndKeepApplied() throws IOException {
        Path first = video("1.mp4");
        Path second = video("2.mp4");
        CatalogEntry gone = catalogStore.seedLocal(root.resolve("gone.mp4").toString(), "Gone");
        AtomicInteger checks = new AtomicInteger();

        SyncReport report = executor.apply(root, new SyncSelection(
                Arrays.asList(first.toString(), second.toString()), Collections.singletonList(gone.getId())),
                () -> checks.incrementAndGet() > 1);

        assertTrue(report.isCanceled());
        assertEquals(1, report.getProcessedCount());
        assertEquals(1, report.getTotalAdded());
        assertEquals(2, catalogStore.size());
        assertEquals(3, report.getRequestedCount());
    }

    @Test
    void unreachableCatalogShouldAbortTheRun() throws IOException {
        Path clip = video("a.mp4");
        catalogStore.setUnavailable(true);

        assertThrows(CatalogUnavailableException.class,
                () -> executor.apply(root, selection(clip.toString()), null));
        verify(thumbnails, never()).generate(anyLong(), any(Path.class), anyInt());
    }

    @Test
    void emptySelectionShouldDoNothing() {
        SyncReport report = executor.apply(root, new SyncSelection(null, null), () -> false);

        assertEquals(0, report.getProcessedCount());
        assertFalse(report.isCanceled());
    }

    private Path video(String name) throws IOException {
        Path file = root.resolve(name);
        Files.writeString(file, "video");
        return file;
    }

    private static SyncSelection selection(String... files) {
        return new SyncSelection(Arrays.asList(files), null);
    }

    private ObjectProvider<MeterRegistry> beanProvider(MeterRegistry meterRegistry) {
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        beanFactory.addBean("meterRegistry", meterRegistry);
        return beanFactory.getBeanProvider(MeterRegistry.class);
    }
}

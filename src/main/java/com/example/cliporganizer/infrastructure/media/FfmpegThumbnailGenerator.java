package com.example.cliporganizer.infrastructure.media;

import com.example.cliporganizer.common.config.AppSyncProperties;
import com.example.cliporganizer.common.util.LogSanitizer;
import com.example.cliporganizer.domain.model.ThumbnailResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Grabs one frame at 10% of the clip (1s when the duration is unknown) and stores it as {@code {clipId}.jpg}.
 */
@Component
public class FfmpegThumbnailGenerator implements ThumbnailGenerator {

    private static final Logger log = LoggerFactory.getLogger(FfmpegThumbnailGenerator.class);

    private final FfmpegBinaries ffmpegBinaries;
    private final AppSyncProperties appSyncProperties;

    public FfmpegThumbnailGenerator(FfmpegBinaries ffmpegBinaries, AppSyncProperties appSyncProperties) {
        this.ffmpegBinaries = ffmpegBinaries;
        this.appSyncProperties = appSyncProperties;
    }

    @Override
    public ThumbnailResult generate(Long clipId, Path videoFile, int durationSec) {
        if (!Files.isRegularFile(videoFile)) {
            return ThumbnailResult.failed("Video file not found");
        }
        Path target;
        try {
            Path dir = thumbnailDirectory();
            Files.createDirectories(dir);
            target = dir.resolve(clipId + ".jpg");
        } catch (IOException | InvalidPathException e) {
            return ThumbnailResult.failed("Thumbnail directory not usable: " + e.getMessage());
        }

        List<String> command = Arrays.asList(
                ffmpegBinaries.ffmpeg(),
                "-y",
                "-loglevel", "error",
                "-ss", captureTime(durationSec),
                "-i", videoFile.toString(),
                "-frames:v", "1",
                "-vf", String.format(Locale.ROOT, "scale=%d:%d:force_original_aspect_ratio=decrease",
                        appSyncProperties.getThumbnailWidth(), appSyncProperties.getThumbnailHeight()),
                "-q:v", "3",
                target.toString());
        ProcessRunner.Result result = ProcessRunner.run(command, appSyncProperties.getThumbnailTimeoutSec());
        if (!result.isSuccess() || !Files.isRegularFile(target)) {
            deleteQuietly(target);
            String reason = result.isSuccess() ? "ffmpeg produced no image" : result.getFailureReason();
            return ThumbnailResult.failed("ffmpeg failed: " + reason);
        }
        return ThumbnailResult.generated(target.toString());
    }

    @Override
    public boolean deleteThumbnail(String thumbnailPath) {
        if (!StringUtils.hasText(thumbnailPath)) {
            return true;
        }
        try {
            Files.deleteIfExists(Paths.get(thumbnailPath));
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to delete thumbnail, path={} reason={}",
                    LogSanitizer.sanitizePath(thumbnailPath), LogSanitizer.sanitize(e.getMessage()));
            return false;
        }
    }

    String captureTime(int durationSec) {
        double seconds = durationSec > 0 ? durationSec * 0.1D : 1D;
        return String.format(Locale.ROOT, "%.3f", seconds);
    }

    private Path thumbnailDirectory() {
        return Paths.get(appSyncProperties.getThumbnailDirectory()).toAbsolutePath().normalize();
    }

    private void deleteQuietly(Path target) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            log.debug("Partial thumbnail delete failed: {}", target, e);
        }
    }
}

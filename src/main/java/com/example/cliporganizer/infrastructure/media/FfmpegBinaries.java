package com.example.cliporganizer.infrastructure.media;

import com.example.cliporganizer.common.config.AppSyncProperties;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Resolves the ffmpeg and ffprobe executables from the configured folder, falling back to PATH.
 */
@Component
public class FfmpegBinaries {

    private static final Logger log = LoggerFactory.getLogger(FfmpegBinaries.class);

    private final String ffmpeg;
    private final String ffprobe;

    public FfmpegBinaries(AppSyncProperties appSyncProperties) {
        String folder = appSyncProperties.getFfmpegBinaryFolder();
        this.ffmpeg = resolve(folder, "ffmpeg");
        this.ffprobe = resolve(folder, "ffprobe");
    }

    public String ffmpeg() {
        return ffmpeg;
    }

    public String ffprobe() {
        return ffprobe;
    }

    private static String resolve(String folder, String tool) {
        String executable = isWindows() ? tool + ".exe" : tool;
        if (!StringUtils.hasText(folder)) {
            return executable;
        }
        Path dir = Paths.get(folder.trim()).toAbsolutePath().normalize();
        if (!Files.isDirectory(dir)) {
            log.warn("FFmpeg binary folder not found: {}. Using {} from PATH", dir, tool);
            return executable;
        }
        return dir.resolve(executable).toString();
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
    }
}

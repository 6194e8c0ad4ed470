package com.example.cliporganizer.common.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.sync")
public class AppSyncProperties {

    /**
     * Root used when a request leaves the root empty and no root-folder setting is stored.
     */
    private String defaultRootFolder = "";

    private List<String> videoExtensions = new ArrayList<>(Arrays.asList("mp4", "webm", "ogg", "mov", "avi"));

    /**
     * Whether location keys are case-folded, so that paths differing only by case compare equal.
     */
    private boolean caseInsensitivePaths = true;

    private boolean followDirectoryLinks = false;

    private String thumbnailDirectory = "thumbnails";

    /**
     * Folder holding the ffmpeg and ffprobe binaries. Empty means resolve them from PATH.
     */
    private String ffmpegBinaryFolder = "";

    private int probeTimeoutSec = 20;

    private int thumbnailTimeoutSec = 30;

    private int thumbnailWidth = 320;

    private int thumbnailHeight = 180;

    private int progressLogInterval = 200;

    /**
     * API requests taking at least this long are logged at WARN.
     */
    private long slowRequestLogMs = 10000L;

    public Set<String> normalizedVideoExtensions() {
        return videoExtensions.stream()
                .filter(item -> item != null && !item.trim().isEmpty())
                .map(item -> item.trim().toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}

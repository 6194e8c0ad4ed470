package com.example.cliporganizer.infrastructure.media;

import com.example.cliporganizer.domain.model.ProbeResult;
import java.nio.file.Path;

public interface VideoMetadataProbe {

    /**
     * Reads title and duration. Never throws: a failed probe returns the file name as title and zero duration.
     */
    ProbeResult probe(Path videoFile);

    static String defaultTitle(Path videoFile) {
        String fileName = String.valueOf(videoFile.getFileName());
        int idx = fileName.lastIndexOf('.');
        return idx > 0 ? fileName.substring(0, idx) : fileName;
    }
}

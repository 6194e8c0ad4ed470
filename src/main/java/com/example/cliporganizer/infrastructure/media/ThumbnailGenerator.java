package com.example.cliporganizer.infrastructure.media;

import com.example.cliporganizer.domain.model.ThumbnailResult;
import java.nio.file.Path;

public interface ThumbnailGenerator {

    /**
     * Writes a still frame for the clip. Failures are returned, not thrown.
     */
    ThumbnailResult generate(Long clipId, Path videoFile, int durationSec);

    /**
     * @return false when the file existed but could not be deleted
     */
    boolean deleteThumbnail(String thumbnailPath);
}

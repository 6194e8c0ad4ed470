package com.example.cliporganizer.domain.model;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A video file found under the library root during one scan. Never persisted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScannedFile {

    private String path;

    private String directory;

    private long sizeBytes;

    private Instant modifiedAt;
}

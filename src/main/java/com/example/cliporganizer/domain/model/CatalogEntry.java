package com.example.cliporganizer.domain.model;

import com.example.cliporganizer.domain.enumtype.StorageType;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Read-only view of a clip record owned by the catalog store.
 */
@Data
@NoArgsConstructor
public class CatalogEntry {

    private Long id;

    private StorageType storageType;

    /**
     * Stored location: an absolute file path for local clips, a URL or video id otherwise.
     */
    private String locationString;

    private String title;

    private String description;

    private Integer durationSec;

    private String thumbnailPath;

    private List<CatalogTag> tags = new ArrayList<>();

    public boolean isLocal() {
        return storageType == StorageType.LOCAL;
    }
}

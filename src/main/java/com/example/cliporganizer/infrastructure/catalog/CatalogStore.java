package com.example.cliporganizer.infrastructure.catalog;

import com.example.cliporganizer.common.exception.CatalogUnavailableException;
import com.example.cliporganizer.domain.model.CatalogEntry;
import com.example.cliporganizer.domain.model.CreateEntryResult;
import com.example.cliporganizer.domain.model.DeleteEntryResult;
import java.util.List;

/**
 * The clip catalog as seen by library synchronization.
 *
 * <p>Every method throws {@link CatalogUnavailableException} when the store cannot be reached.
 * Expected per-item conflicts are returned as results, not thrown.
 */
public interface CatalogStore {

    /**
     * All clips stored as local files, with their tags.
     */
    List<CatalogEntry> listLocalEntries();

    CatalogEntry findEntry(Long id);

    /**
     * Creates a local clip. Returns a duplicate result when a clip with the same location key already exists.
     */
    CreateEntryResult createEntry(String locationString, String locationKey, String title, int durationSec);

    void updateThumbnailPath(Long id, String thumbnailPath);

    DeleteEntryResult deleteEntry(Long id);
}

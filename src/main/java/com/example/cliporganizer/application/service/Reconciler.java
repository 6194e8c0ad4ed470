package com.example.cliporganizer.application.service;

import com.example.cliporganizer.common.exception.LocationKeyException;
import com.example.cliporganizer.domain.model.CatalogEntry;
import com.example.cliporganizer.domain.model.ReconciliationDiff;
import com.example.cliporganizer.domain.model.ReconciliationItem;
import com.example.cliporganizer.domain.model.ScannedFile;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Diffs scanned files against a catalog snapshot. Performs no I/O.
 *
 * <p>Items are emitted in a fixed order: one item per scanned file in scan order ({@code NEW},
 * {@code MATCHED} or {@code ERROR}), then {@code MISSING} clips in catalog order, then catalog rows
 * that could not take part in the diff. Non-local catalog rows are ignored entirely, and so are
 * local rows outside the scanned root when one is given.
 */
@Component
public class Reconciler {

    private final PathNormalizer pathNormalizer;

    public Reconciler(PathNormalizer pathNormalizer) {
        this.pathNormalizer = pathNormalizer;
    }

    public ReconciliationDiff diff(Iterable<ScannedFile> scannedFiles, List<CatalogEntry> catalogEntries) {
        return diff(scannedFiles, catalogEntries, null);
    }

    /**
     * @param rootFolder scanned root; catalog rows whose key is not under it are left out of the diff.
     *                   {@code null} compares against the whole catalog.
     */
    public ReconciliationDiff diff(Iterable<ScannedFile> scannedFiles, List<CatalogEntry> catalogEntries,
                                   String rootFolder) {
        String rootKey = rootFolder == null ? null : pathNormalizer.normalize(rootFolder);
        Map<String, CatalogEntry> catalogByKey = new LinkedHashMap<>();
        List<ReconciliationItem> catalogErrors = new ArrayList<>();
        if (catalogEntries != null) {
            for (CatalogEntry entry : catalogEntries) {
                if (entry == null || !entry.isLocal()) {
                    continue;
                }
                String key;
                try {
                    key = pathNormalizer.normalize(entry.getLocationString());
                } catch (LocationKeyException e) {
                    catalogErrors.add(ReconciliationItem.error(entry.getLocationString(),
                            "Stored location of clip " + entry.getId() + " is not a valid path: " + e.getMessage()));
                    continue;
                }
                if (rootKey != null && !pathNormalizer.isUnder(key, rootKey)) {
                    continue;
                }
                CatalogEntry first = catalogByKey.putIfAbsent(key, entry);
                if (first != null) {
                    catalogErrors.add(ReconciliationItem.error(entry.getLocationString(),
                            "Duplicate catalog entry: clip " + entry.getId()
                                    + " has the same location as clip " + first.getId()));
                }
            }
        }

        List<ReconciliationItem> items = new ArrayList<>();
        Map<String, String> scannedKeys = new HashMap<>();
        int totalScanned = 0;
        if (scannedFiles != null) {
            for (ScannedFile file : scannedFiles) {
                totalScanned++;
                String displayPath;
                String key;
                try {
                    displayPath = pathNormalizer.toDisplayPath(file.getPath());
                    key = pathNormalizer.normalize(file.getPath());
                } catch (LocationKeyException e) {
                    items.add(ReconciliationItem.error(file.getPath(), "File path is not valid: " + e.getMessage()));
                    continue;
                }
                String sameKeyPath = scannedKeys.putIfAbsent(key, displayPath);
                if (sameKeyPath != null) {
                    items.add(ReconciliationItem.error(displayPath,
                            "Duplicate file path: same location as " + sameKeyPath));
                    continue;
                }
                ScannedFile normalizedFile = new ScannedFile(displayPath, normalizeDirectory(file.getDirectory()),
                        file.getSizeBytes(), file.getModifiedAt());
                CatalogEntry entry = catalogByKey.get(key);
                if (entry == null) {
                    items.add(ReconciliationItem.newFile(normalizedFile, key));
                } else {
                    items.add(ReconciliationItem.matched(normalizedFile, entry, key));
                }
            }
        }

        for (Map.Entry<String, CatalogEntry> catalogItem : catalogByKey.entrySet()) {
            if (!scannedKeys.containsKey(catalogItem.getKey())) {
                items.add(ReconciliationItem.missing(catalogItem.getValue(), catalogItem.getKey()));
            }
        }
        items.addAll(catalogErrors);
        return new ReconciliationDiff(items, totalScanned);
    }

    private String normalizeDirectory(String directory) {
        if (directory == null) {
            return null;
        }
        try {
            return pathNormalizer.toDisplayPath(directory);
        } catch (LocationKeyException e) {
            return directory;
        }
    }
}

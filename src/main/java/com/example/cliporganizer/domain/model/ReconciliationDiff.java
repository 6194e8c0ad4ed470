package com.example.cliporganizer.domain.model;

import com.example.cliporganizer.domain.enumtype.ReconciliationStatus;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of diffing one scan against one catalog snapshot.
 */
public class ReconciliationDiff {

    private final List<ReconciliationItem> items;
    private final int totalScanned;

    public ReconciliationDiff(List<ReconciliationItem> items, int totalScanned) {
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
        this.totalScanned = totalScanned;
    }

    public List<ReconciliationItem> getItems() {
        return items;
    }

    public int getTotalScanned() {
        return totalScanned;
    }

    public List<ReconciliationItem> itemsWithStatus(ReconciliationStatus status) {
        return items.stream()
                .filter(item -> item.getStatus() == status)
                .collect(Collectors.toList());
    }

    public int count(ReconciliationStatus status) {
        int count = 0;
        for (ReconciliationItem item : items) {
            if (item.getStatus() == status) {
                count++;
            }
        }
        return count;
    }

    public int getNewCount() {
        return count(ReconciliationStatus.NEW);
    }

    public int getMissingCount() {
        return count(ReconciliationStatus.MISSING);
    }

    public int getMatchedCount() {
        return count(ReconciliationStatus.MATCHED);
    }

    public int getErrorCount() {
        return count(ReconciliationStatus.ERROR);
    }

    /**
     * Selects every {@code NEW} file for addition and every {@code MISSING} clip for removal.
     */
    public SyncSelection selectAll() {
        List<String> filesToAdd = new ArrayList<>();
        List<Long> clipIdsToRemove = new ArrayList<>();
        for (ReconciliationItem item : items) {
            if (item.getStatus() == ReconciliationStatus.NEW) {
                filesToAdd.add(item.getFilePath());
            } else if (item.getStatus() == ReconciliationStatus.MISSING) {
                clipIdsToRemove.add(item.getCatalogId());
            }
        }
        return new SyncSelection(filesToAdd, clipIdsToRemove);
    }
}

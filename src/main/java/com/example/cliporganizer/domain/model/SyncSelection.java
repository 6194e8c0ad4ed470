package com.example.cliporganizer.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The subset of a diff a caller wants applied. Items are processed in the order given.
 */
public class SyncSelection {

    private final List<String> filesToAdd;
    private final List<Long> clipIdsToRemove;

    public SyncSelection(List<String> filesToAdd, List<Long> clipIdsToRemove) {
        this.filesToAdd = filesToAdd == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(filesToAdd));
        this.clipIdsToRemove = clipIdsToRemove == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(clipIdsToRemove));
    }

    public List<String> getFilesToAdd() {
        return filesToAdd;
    }

    public List<Long> getClipIdsToRemove() {
        return clipIdsToRemove;
    }

    public int size() {
        return filesToAdd.size() + clipIdsToRemove.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }
}

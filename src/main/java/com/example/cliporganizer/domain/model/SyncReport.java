package com.example.cliporganizer.domain.model;

import com.example.cliporganizer.domain.enumtype.SyncOutcomeType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Aggregate of one apply run. Outcomes keep the order in which items were processed.
 */
public class SyncReport {

    private final List<SyncOutcome> outcomes = new ArrayList<>();
    private final List<ScanWarning> scanWarnings = new ArrayList<>();
    private int totalScanned;
    private int requestedCount;
    private boolean canceled;

    public void record(SyncOutcome outcome) {
        outcomes.add(outcome);
    }

    public void addScanWarnings(List<ScanWarning> warnings) {
        if (warnings != null) {
            scanWarnings.addAll(warnings);
        }
    }

    public List<SyncOutcome> getOutcomes() {
        return Collections.unmodifiableList(outcomes);
    }

    public List<SyncOutcome> outcomesOf(SyncOutcomeType type) {
        return outcomes.stream()
                .filter(outcome -> outcome.getOutcome() == type)
                .collect(Collectors.toList());
    }

    public List<ScanWarning> getScanWarnings() {
        return Collections.unmodifiableList(scanWarnings);
    }

    public int getTotalAdded() {
        return outcomesOf(SyncOutcomeType.ADDED).size();
    }

    public int getTotalRemoved() {
        return outcomesOf(SyncOutcomeType.REMOVED).size();
    }

    public int getErrorCount() {
        return outcomesOf(SyncOutcomeType.FAILED).size();
    }

    /**
     * Number of selection items handled before the run finished or was canceled.
     */
    public int getProcessedCount() {
        return outcomes.size();
    }

    public int getTotalScanned() {
        return totalScanned;
    }

    public void setTotalScanned(int totalScanned) {
        this.totalScanned = totalScanned;
    }

    public int getRequestedCount() {
        return requestedCount;
    }

    public void setRequestedCount(int requestedCount) {
        this.requestedCount = requestedCount;
    }

    public boolean isCanceled() {
        return canceled;
    }

    public void setCanceled(boolean canceled) {
        this.canceled = canceled;
    }
}

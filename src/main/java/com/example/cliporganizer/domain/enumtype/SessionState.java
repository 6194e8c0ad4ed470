package com.example.cliporganizer.domain.enumtype;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one reconciliation session.
 */
public enum SessionState {
    IDLE,
    SCANNING,
    DIFFING,
    READY,
    APPLYING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canMoveTo(SessionState next) {
        return allowedNext().contains(next);
    }

    private Set<SessionState> allowedNext() {
        switch (this) {
            case IDLE:
                // selective apply starts without a scan
                return EnumSet.of(SCANNING, APPLYING, FAILED);
            case SCANNING:
                return EnumSet.of(DIFFING, COMPLETED, FAILED);
            case DIFFING:
                return EnumSet.of(READY, APPLYING, FAILED);
            case READY:
                return EnumSet.of(SCANNING, APPLYING, FAILED);
            case APPLYING:
                return EnumSet.of(COMPLETED, FAILED);
            default:
                return Collections.emptySet();
        }
    }
}

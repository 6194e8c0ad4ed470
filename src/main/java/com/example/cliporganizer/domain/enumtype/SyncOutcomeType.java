package com.example.cliporganizer.domain.enumtype;

public enum SyncOutcomeType {
    ADDED,
    REMOVED,
    FAILED
}

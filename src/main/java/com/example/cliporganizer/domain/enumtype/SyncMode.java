package com.example.cliporganizer.domain.enumtype;

import java.util.Locale;

public enum SyncMode {
    PREVIEW,
    SELECTIVE,
    FULL;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}

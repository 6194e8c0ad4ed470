package com.example.cliporganizer.domain.enumtype;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ReconciliationStatus {
    NEW("new"),
    MISSING("missing"),
    MATCHED("matched"),
    ERROR("error");

    private final String code;

    ReconciliationStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}

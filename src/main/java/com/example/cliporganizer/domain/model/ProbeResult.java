package com.example.cliporganizer.domain.model;

/**
 * Outcome of reading title and duration from a video file. A failed probe still carries usable defaults.
 */
public final class ProbeResult {

    private final boolean success;
    private final String title;
    private final int durationSec;
    private final String message;

    private ProbeResult(boolean success, String title, int durationSec, String message) {
        this.success = success;
        this.title = title;
        this.durationSec = durationSec;
        this.message = message;
    }

    public static ProbeResult success(String title, int durationSec) {
        return new ProbeResult(true, title, Math.max(0, durationSec), null);
    }

    public static ProbeResult failure(String fallbackTitle, String message) {
        return new ProbeResult(false, fallbackTitle, 0, message);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getTitle() {
        return title;
    }

    public int getDurationSec() {
        return durationSec;
    }

    public String getMessage() {
        return message;
    }
}

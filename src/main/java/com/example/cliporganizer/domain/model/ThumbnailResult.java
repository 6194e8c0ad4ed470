package com.example.cliporganizer.domain.model;

public final class ThumbnailResult {

    private final boolean success;
    private final String thumbnailPath;
    private final String message;

    private ThumbnailResult(boolean success, String thumbnailPath, String message) {
        this.success = success;
        this.thumbnailPath = thumbnailPath;
        this.message = message;
    }

    public static ThumbnailResult generated(String thumbnailPath) {
        return new ThumbnailResult(true, thumbnailPath, null);
    }

    public static ThumbnailResult failed(String message) {
        return new ThumbnailResult(false, null, message);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getThumbnailPath() {
        return thumbnailPath;
    }

    public String getMessage() {
        return message;
    }
}

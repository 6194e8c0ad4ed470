package com.example.cliporganizer.common.exception;

/**
 * The catalog store cannot be reached. Aborts the running session; items already applied stay committed.
 */
public class CatalogUnavailableException extends BusinessException {

    public static final String CODE = "CATALOG_UNAVAILABLE";

    public CatalogUnavailableException(String message, Throwable cause) {
        super(CODE, message, "Retry once the catalog database is reachable", cause);
    }
}

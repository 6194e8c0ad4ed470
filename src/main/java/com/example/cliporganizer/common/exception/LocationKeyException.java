package com.example.cliporganizer.common.exception;

/**
 * A path or stored location string could not be turned into a location key.
 */
public class LocationKeyException extends IllegalArgumentException {

    private final String rawValue;

    public LocationKeyException(String rawValue, String message) {
        super(message);
        this.rawValue = rawValue;
    }

    public String getRawValue() {
        return rawValue;
    }
}

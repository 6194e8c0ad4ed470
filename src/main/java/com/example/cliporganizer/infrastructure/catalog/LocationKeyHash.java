package com.example.cliporganizer.infrastructure.catalog;

import java.nio.charset.StandardCharsets;
import org.springframework.util.DigestUtils;

/**
 * Fixed-width form of a location key, used for the unique index on clip locations.
 */
public final class LocationKeyHash {

    private LocationKeyHash() {
    }

    public static String of(String locationKey) {
        if (locationKey == null) {
            throw new IllegalArgumentException("locationKey must not be null");
        }
        return DigestUtils.md5DigestAsHex(locationKey.getBytes(StandardCharsets.UTF_8));
    }
}

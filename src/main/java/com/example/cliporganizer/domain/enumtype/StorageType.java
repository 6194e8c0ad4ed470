package com.example.cliporganizer.domain.enumtype;

public enum StorageType {
    LOCAL,
    YOUTUBE
}

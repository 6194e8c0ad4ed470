package com.example.cliporganizer.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class ClipEntity {

    private Long id;

    private String title;

    private String description;

    private String storageType;

    private String locationString;

    private String locationKeyMd5;

    private Integer durationSec;

    private String thumbnailPath;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}

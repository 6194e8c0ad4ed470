package com.example.cliporganizer.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class AppSettingEntity {

    private Long id;

    private String settingKey;

    private String settingValue;

    private LocalDateTime updatedAt;
}

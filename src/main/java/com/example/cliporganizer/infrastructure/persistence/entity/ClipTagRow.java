package com.example.cliporganizer.infrastructure.persistence.entity;

import lombok.Data;

@Data
public class ClipTagRow {

    private Long clipId;

    private Long tagId;

    private String category;

    private String tagValue;
}

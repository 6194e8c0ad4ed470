package com.example.cliporganizer.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;
import lombok.Data;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReconciliationItemResponse {

    private String filePath;
    private String status;
    private String directory;
    private Long fileSize;
    private Instant lastModified;
    private Long clipId;
    private String title;
    private String description;
    private List<TagResponse> tags;
    private String errorMessage;
}

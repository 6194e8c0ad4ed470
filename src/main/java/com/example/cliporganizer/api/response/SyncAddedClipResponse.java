package com.example.cliporganizer.api.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SyncAddedClipResponse {

    private Long clipId;
    private String filePath;
    private String title;
    private List<String> warnings;
}

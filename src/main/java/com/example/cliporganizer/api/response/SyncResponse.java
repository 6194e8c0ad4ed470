package com.example.cliporganizer.api.response;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class SyncResponse {

    private List<SyncAddedClipResponse> addedClips = new ArrayList<>();
    private List<SyncRemovedClipResponse> removedClips = new ArrayList<>();
    private List<SyncErrorResponse> errors = new ArrayList<>();
    private List<ScanWarningResponse> warnings = new ArrayList<>();
    private int totalScanned;
    private int totalAdded;
    private int totalRemoved;
    private int processedCount;
    private boolean canceled;
    private String rootFolderPath;
    private String sessionId;
}

package com.example.cliporganizer.api.response;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class SyncPreviewResponse {

    private List<ReconciliationItemResponse> items = new ArrayList<>();
    private int totalScanned;
    private int newFilesCount;
    private int missingFilesCount;
    private int matchedFilesCount;
    private int errorCount;
    private String rootFolderPath;
    private List<ScanWarningResponse> warnings = new ArrayList<>();
    private String sessionId;
    private boolean canceled;
}

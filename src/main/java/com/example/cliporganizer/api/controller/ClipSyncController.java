package com.example.cliporganizer.api.controller;

import com.example.cliporganizer.api.request.QuickSyncRequest;
import com.example.cliporganizer.api.request.SelectiveSyncRequest;
import com.example.cliporganizer.api.response.ApiResponse;
import com.example.cliporganizer.api.response.SyncPreviewResponse;
import com.example.cliporganizer.api.response.SyncResponse;
import com.example.cliporganizer.application.service.ClipSyncService;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/clips")
public class ClipSyncController {

    private final ClipSyncService clipSyncService;

    public ClipSyncController(ClipSyncService clipSyncService) {
        this.clipSyncService = clipSyncService;
    }

    @GetMapping("/sync-preview")
    public ApiResponse<SyncPreviewResponse> preview(
            @RequestParam(value = "rootFolderPath", required = false) String rootFolderPath,
            @RequestParam(value = "sessionId", required = false) String sessionId) {
        return ApiResponse.success(clipSyncService.preview(rootFolderPath, sessionId));
    }

    @PostMapping("/selective-sync")
    public ApiResponse<SyncResponse> selectiveSync(@Valid @RequestBody SelectiveSyncRequest request) {
        return ApiResponse.success(clipSyncService.selectiveSync(request));
    }

    @PostMapping("/sync")
    public ApiResponse<SyncResponse> quickSync(@Valid @RequestBody(required = false) QuickSyncRequest request) {
        return ApiResponse.success(clipSyncService.quickSync(request));
    }

    @PostMapping("/sync/sessions/{sessionId}/cancel")
    public ApiResponse<String> cancel(@PathVariable("sessionId") String sessionId) {
        if (!clipSyncService.cancel(sessionId)) {
            return ApiResponse.fail("404", "Sync session not found or already finished");
        }
        return ApiResponse.success("CANCEL_REQUESTED");
    }
}

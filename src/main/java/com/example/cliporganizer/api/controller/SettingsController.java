package com.example.cliporganizer.api.controller;

import com.example.cliporganizer.api.request.RootFolderSettingRequest;
import com.example.cliporganizer.api.response.ApiResponse;
import com.example.cliporganizer.api.response.RootFolderSettingResponse;
import com.example.cliporganizer.application.service.RootFolderService;
import javax.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/settings")
public class SettingsController {

    private final RootFolderService rootFolderService;

    public SettingsController(RootFolderService rootFolderService) {
        this.rootFolderService = rootFolderService;
    }

    @GetMapping("/root-folder")
    public ApiResponse<RootFolderSettingResponse> getRootFolder() {
        return ApiResponse.success(rootFolderService.getRootFolder());
    }

    @PutMapping("/root-folder")
    public ApiResponse<RootFolderSettingResponse> updateRootFolder(@Valid @RequestBody RootFolderSettingRequest request) {
        return ApiResponse.success(rootFolderService.updateRootFolder(request.getRootFolderPath()));
    }
}

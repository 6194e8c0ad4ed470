package com.example.cliporganizer.application.service;

import com.example.cliporganizer.api.response.RootFolderSettingResponse;
import com.example.cliporganizer.common.config.AppSyncProperties;
import com.example.cliporganizer.common.exception.BusinessException;
import com.example.cliporganizer.common.exception.CatalogUnavailableException;
import com.example.cliporganizer.common.exception.RootNotFoundException;
import com.example.cliporganizer.common.util.LogSanitizer;
import com.example.cliporganizer.infrastructure.persistence.entity.AppSettingEntity;
import com.example.cliporganizer.infrastructure.persistence.mapper.AppSettingMapper;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Resolves the library root for a sync call: the requested path, else the stored setting, else the configured default.
 */
@Service
public class RootFolderService {

    private static final Logger log = LoggerFactory.getLogger(RootFolderService.class);

    public static final String ROOT_FOLDER_KEY = "video-library.root-folder";

    private final AppSettingMapper appSettingMapper;
    private final AppSyncProperties appSyncProperties;

    public RootFolderService(AppSettingMapper appSettingMapper, AppSyncProperties appSyncProperties) {
        this.appSettingMapper = appSettingMapper;
        this.appSyncProperties = appSyncProperties;
    }

    public Path resolveRoot(String requestedPath) {
        String value = StringUtils.hasText(requestedPath) ? requestedPath.trim() : getRootFolder().getRootFolderPath();
        if (!StringUtils.hasText(value)) {
            throw new BusinessException("ROOT_FOLDER_NOT_CONFIGURED",
                    "Root folder path is not configured",
                    "Configure it in Settings or provide it in the request");
        }
        return toAbsolutePath(value);
    }

    public RootFolderSettingResponse getRootFolder() {
        String stored = readStoredRoot();
        if (StringUtils.hasText(stored)) {
            return new RootFolderSettingResponse(stored, "SETTING");
        }
        if (StringUtils.hasText(appSyncProperties.getDefaultRootFolder())) {
            return new RootFolderSettingResponse(appSyncProperties.getDefaultRootFolder().trim(), "CONFIG");
        }
        return new RootFolderSettingResponse("", "NONE");
    }

    public RootFolderSettingResponse updateRootFolder(String rootFolderPath) {
        Path root = toAbsolutePath(rootFolderPath == null ? "" : rootFolderPath.trim());
        if (!Files.isDirectory(root)) {
            throw new RootNotFoundException(root.toString(), "Root folder does not exist");
        }
        String value = root.normalize().toString();
        try {
            if (appSettingMapper.updateValue(ROOT_FOLDER_KEY, value) == 0) {
                try {
                    appSettingMapper.insert(ROOT_FOLDER_KEY, value);
                } catch (DuplicateKeyException e) {
                    appSettingMapper.updateValue(ROOT_FOLDER_KEY, value);
                }
            }
        } catch (DataAccessResourceFailureException e) {
            throw new CatalogUnavailableException("Catalog store unavailable while saving the root folder", e);
        }
        log.info("ROOT_FOLDER_UPDATED root={}", LogSanitizer.sanitizePath(value));
        return new RootFolderSettingResponse(value, "SETTING");
    }

    private String readStoredRoot() {
        try {
            AppSettingEntity setting = appSettingMapper.selectByKey(ROOT_FOLDER_KEY);
            return setting == null ? null : setting.getSettingValue();
        } catch (DataAccessResourceFailureException e) {
            throw new CatalogUnavailableException("Catalog store unavailable while reading the root folder", e);
        }
    }

    private Path toAbsolutePath(String value) {
        Path path;
        try {
            path = Paths.get(value);
        } catch (InvalidPathException e) {
            throw new BusinessException("ROOT_FOLDER_INVALID", "Root folder path is not valid: " + e.getReason());
        }
        if (!path.isAbsolute()) {
            throw new BusinessException("ROOT_FOLDER_NOT_ABSOLUTE", "Root folder path must be an absolute path");
        }
        return path.normalize();
    }
}

package com.example.cliporganizer.common.exception;

/**
 * The library root is missing or is not a directory. Raised before any scanning or catalog mutation.
 */
public class RootNotFoundException extends BusinessException {

    public static final String CODE = "ROOT_NOT_FOUND";

    private final String rootFolderPath;

    public RootNotFoundException(String rootFolderPath, String message) {
        super(CODE, message, "Check the root folder setting and that the folder is mounted");
        this.rootFolderPath = rootFolderPath;
    }

    public String getRootFolderPath() {
        return rootFolderPath;
    }
}

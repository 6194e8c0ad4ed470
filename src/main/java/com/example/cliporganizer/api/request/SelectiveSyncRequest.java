package com.example.cliporganizer.api.request;

import java.util.ArrayList;
import java.util.List;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Size;
import lombok.Data;

@Data
public class SelectiveSyncRequest {

    /**
     * Empty means the stored or configured default root.
     */
    private String rootFolderPath = "";

    @NotNull
    @Size(max = 20000)
    private List<String> filesToAdd = new ArrayList<>();

    @NotNull
    @Size(max = 20000)
    private List<Long> clipIdsToRemove = new ArrayList<>();

    @Size(max = 64)
    private String sessionId;
}

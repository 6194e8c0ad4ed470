package com.example.cliporganizer.api.request;

import javax.validation.constraints.Size;
import lombok.Data;

@Data
public class QuickSyncRequest {

    private String rootFolderPath;

    @Size(max = 64)
    private String sessionId;
}

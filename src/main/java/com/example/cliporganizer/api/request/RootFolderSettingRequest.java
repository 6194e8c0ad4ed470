package com.example.cliporganizer.api.request;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.Size;
import lombok.Data;

@Data
public class RootFolderSettingRequest {

    @NotBlank
    @Size(max = 2048)
    private String rootFolderPath;
}

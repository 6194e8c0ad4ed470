package com.example.cliporganizer.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RootFolderSettingResponse {

    private String rootFolderPath;

    /**
     * {@code SETTING}, {@code CONFIG} or {@code NONE}.
     */
    private String source;
}

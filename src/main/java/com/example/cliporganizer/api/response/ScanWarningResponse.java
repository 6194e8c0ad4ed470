package com.example.cliporganizer.api.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScanWarningResponse {

    private String path;
    private String message;
}

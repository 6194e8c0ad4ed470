package com.example.cliporganizer.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An entry the scanner could not read. The scan continues past it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScanWarning {

    private String path;

    private String message;
}

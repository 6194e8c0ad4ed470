package com.example.cliporganizer.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CatalogTag {

    private Long id;

    private String category;

    private String value;
}

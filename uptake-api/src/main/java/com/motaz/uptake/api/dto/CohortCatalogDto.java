package com.motaz.uptake.api.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@Builder
public class CohortCatalogDto {
    private List<String> products;
    private List<String> regions;
    private Map<String, Double> prices;
}

package com.motaz.uptake.api.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Cohorts the dashboard may request, and the unit price used for each product. */
@Data
@ConfigurationProperties(prefix = "uptake.cohorts")
public class CohortProperties {

    private List<String> products = new ArrayList<>(List.of("Drug_A", "Drug_B"));
    private List<String> regions = new ArrayList<>(List.of("North", "South", "East", "West"));
    private Map<String, Double> prices = new LinkedHashMap<>(Map.of("Drug_A", 450.0, "Drug_B", 300.0));
    private String currencySymbol = "₹";
}

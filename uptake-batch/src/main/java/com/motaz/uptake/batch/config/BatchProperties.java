package com.motaz.uptake.batch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "uptake.batch")
public class BatchProperties {

    private long seed = 42L;
    private int weeks = 160;
    /** A Monday. */
    private LocalDate startDate = LocalDate.of(2021, 1, 4);
    private List<String> products = new ArrayList<>(List.of("Drug_A", "Drug_B"));
    private List<String> regions = new ArrayList<>(List.of("North", "South", "East", "West"));
    private Map<String, Double> baseVolumes = new LinkedHashMap<>(Map.of("Drug_A", 1200.0, "Drug_B", 800.0));
    private Map<String, Double> prices = new LinkedHashMap<>(Map.of("Drug_A", 450.0, "Drug_B", 300.0));
    private Executor executor = new Executor();

    @Data
    public static class Executor {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 10;
    }
}

package com.motaz.uptake.api.config;

import com.motaz.uptake.core.config.DetectionProperties;
import com.motaz.uptake.core.pipeline.CohortPipeline;
import com.motaz.uptake.core.report.ExecutiveSummaryFormatter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class DetectionConfig {

    @Bean
    @ConfigurationProperties(prefix = "uptake.detection")
    public DetectionProperties detectionProperties() {
        return new DetectionProperties();
    }

    @Bean
    public CohortPipeline cohortPipeline(DetectionProperties detectionProperties) {
        log.info("Cohort pipeline: z-score threshold {}, severity medium/high {}/{}",
                detectionProperties.getZScoreThreshold(),
                detectionProperties.getSeverity().getMedium(),
                detectionProperties.getSeverity().getHigh());
        return CohortPipeline.of(detectionProperties);
    }

    @Bean
    public ExecutiveSummaryFormatter executiveSummaryFormatter(CohortProperties cohortProperties) {
        return new ExecutiveSummaryFormatter(cohortProperties.getCurrencySymbol());
    }
}

package com.motaz.uptake.api.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI uptakeOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Prescription Uptake Early-Warning API")
                        .version("1.0.0")
                        .description("Detects abnormal prescription changes per product/region cohort, "
                                + "quantifies business impact and prioritises actions.\n\n"
                                + "1. Fit a seasonal baseline to the cohort's weekly history\n"
                                + "2. Flag weeks whose robust z-score exceeds the threshold\n"
                                + "3. Group flagged weeks into events, rank them by severity and revenue impact\n"
                                + "4. Backtest detections against the labelled events in the store"));
    }
}

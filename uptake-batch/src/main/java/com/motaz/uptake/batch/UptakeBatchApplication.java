package com.motaz.uptake.batch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class UptakeBatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(UptakeBatchApplication.class, args);
    }
}

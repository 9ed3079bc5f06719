package com.motaz.uptake.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;


@SpringBootApplication
@ConfigurationPropertiesScan
public class UptakeApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(UptakeApiApplication.class, args);
    }

}

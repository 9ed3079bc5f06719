package com.motaz.uptake.api.dto;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;

@Data
@Builder
public class PrescriptionDto {
    private LocalDate date;
    private String product;
    private String region;
    private Long units;
    private Double pricePerUnit;
    private Double revenue;
    private String eventType;
}

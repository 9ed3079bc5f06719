package com.motaz.uptake.core.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class ImpactEvent {
    LocalDate startDate;
    LocalDate endDate;
    int durationWeeks;
    double avgPctDeviation;
    double totalRevenueImpact;
    Severity severity;
    LikelyCause likelyCause;
}

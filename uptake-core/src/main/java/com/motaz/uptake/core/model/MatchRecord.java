package com.motaz.uptake.core.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class MatchRecord {
    String groundTruthLabel;
    LocalDate groundTruthStart;
    LocalDate detectedStart;
    long latencyWeeks;
}

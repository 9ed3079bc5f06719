package com.motaz.uptake.core.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BacktestMetrics {
    int groundTruthCount;
    int detectedCount;
    int truePositives;
    int falsePositives;
    double precision;
    double recall;
    /** Null when nothing matched. */
    Double avgLatencyWeeks;
}

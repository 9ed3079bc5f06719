package com.motaz.uptake.core.model;

import lombok.Value;

import java.util.List;
import java.util.Optional;

@Value
public class CohortAnalysis {
    Cohort cohort;
    double pricePerUnit;
    List<AnomalyRecord> anomalies;
    /** Ranked, highest priority first. */
    List<ImpactEvent> impacts;

    public Optional<ImpactEvent> topEvent() {
        return impacts.isEmpty() ? Optional.empty() : Optional.of(impacts.get(0));
    }

    public long anomalyCount() {
        return anomalies.stream().filter(AnomalyRecord::isAnomaly).count();
    }
}

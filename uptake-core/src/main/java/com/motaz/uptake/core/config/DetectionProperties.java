package com.motaz.uptake.core.config;

import lombok.Data;

/**
 * Tunables for one run of the cohort pipeline. Every component receives the
 * instance it needs at construction; defaults are the values the severity
 * ladder and cause rules were calibrated against.
 */
@Data
public class DetectionProperties {

    private double zScoreThreshold = 3.5;
    private double epsilon = 1e-6;

    /** Ground-truth labels continue an event while the gap is at most this many days. */
    private int groundTruthGapDays = 7;

    /** Detected anomalies continue an event only when the gap is exactly this many days. */
    private int detectionCadenceDays = 7;

    private Forecaster forecaster = new Forecaster();
    private Severity severity = new Severity();
    private Cause cause = new Cause();

    @Data
    public static class Forecaster {
        private boolean yearlySeasonality = true;
        private boolean weeklySeasonality = false;
        private boolean dailySeasonality = false;
        private int yearlyFourierOrder = 10;
        private int weeklyFourierOrder = 3;
        private double changepointPriorScale = 0.05;
        private double seasonalityPriorScale = 10.0;
        private double trendPriorScale = 5.0;
        private int changepoints = 25;
        private double changepointRange = 0.8;
        private int minimumCycles = 2;
        private int observationsPerCycle = 52;

        public int minimumObservations() {
            return minimumCycles * observationsPerCycle;
        }
    }

    /**
     * Thresholds on |avg pct deviation|. {@code low} is carried for reporting
     * only: anything under {@code medium} is Low.
     */
    @Data
    public static class Severity {
        private double low = 0.15;
        private double medium = 0.30;
        private double high = 0.45;
    }

    @Data
    public static class Cause {
        private double supplyIssueMean = -0.35;
        private double competitorEntryMean = -0.20;
        private int competitorEntryMinWeeks = 6;
        private double promotionMean = 0.20;
    }
}

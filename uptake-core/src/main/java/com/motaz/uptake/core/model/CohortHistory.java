package com.motaz.uptake.core.model;

import lombok.Value;

import java.util.List;

/** A cohort's weekly volumes together with the event labels recorded for the same weeks. */
@Value
public class CohortHistory {
    Cohort cohort;
    List<Observation> observations;
    List<LabeledPoint> groundTruth;
}

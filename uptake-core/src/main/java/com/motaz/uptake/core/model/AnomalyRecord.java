package com.motaz.uptake.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class AnomalyRecord {
    LocalDate date;
    double actual;
    double expected;
    double residual;
    /** residual / expected, or null when expected is zero. */
    Double pctDeviation;
    @Getter(onMethod_ = @JsonProperty("zScore"))
    double zScore;
    boolean anomaly;

    public boolean hasDefinedDeviation() {
        return pctDeviation != null;
    }
}

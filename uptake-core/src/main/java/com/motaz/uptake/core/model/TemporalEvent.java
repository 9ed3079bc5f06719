package com.motaz.uptake.core.model;

import lombok.Value;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

@Value
public class TemporalEvent {
    String label;
    LocalDate start;
    LocalDate end;
    int pointCount;

    public long spanDays() {
        return ChronoUnit.DAYS.between(start, end);
    }
}

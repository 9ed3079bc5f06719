package com.motaz.uptake.core.model;

import lombok.Value;

import java.time.LocalDate;

@Value(staticConstructor = "of")
public class ForecastPoint {
    LocalDate date;
    double expected;
}

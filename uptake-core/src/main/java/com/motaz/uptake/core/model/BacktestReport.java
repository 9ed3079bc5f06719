package com.motaz.uptake.core.model;

import lombok.Value;

import java.util.List;

@Value
public class BacktestReport {
    Cohort cohort;
    BacktestMetrics metrics;
    List<MatchRecord> matches;
}

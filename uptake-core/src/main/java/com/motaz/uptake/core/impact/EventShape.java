package com.motaz.uptake.core.impact;

import com.motaz.uptake.core.scoring.RobustStatistics;
import lombok.Value;

import java.util.List;

/** What the cause rules look at: the mean percent deviation and how many weeks it lasted. */
@Value
public class EventShape {
    double meanPctDeviation;
    int weeks;

    public static EventShape of(List<Double> pctDeviations) {
        double[] values = pctDeviations.stream().mapToDouble(Double::doubleValue).toArray();
        return new EventShape(RobustStatistics.mean(values), values.length);
    }
}

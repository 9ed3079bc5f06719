package com.motaz.uptake.core.forecast;

import com.motaz.uptake.core.model.ForecastPoint;
import com.motaz.uptake.core.model.Observation;

import java.util.List;

/**
 * Fits a baseline to a cohort's history and predicts every historical date.
 * Prediction is in-sample: the points being scored are the points the model
 * was fitted on.
 */
public interface BaselineForecaster {

    /**
     * @param history ordered by date, no duplicate dates
     * @return one point per input date, in input order
     * @throws com.motaz.uptake.core.exception.InsufficientDataException if the
     *         history is too short to estimate the seasonal cycle
     */
    List<ForecastPoint> fitPredict(List<Observation> history);
}

package com.motaz.uptake.core.scoring;

import com.motaz.uptake.core.config.DetectionProperties;
import com.motaz.uptake.core.exception.ForecastAlignmentException;
import com.motaz.uptake.core.model.AnomalyRecord;
import com.motaz.uptake.core.model.ForecastPoint;
import com.motaz.uptake.core.model.Observation;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores residuals against a robust baseline (median / MAD) computed over the
 * whole series at once. The baseline is not causal: extending a series can
 * change the z-scores, and flags, of points already scored.
 */
@Slf4j
public class AnomalyScorer {

    private final double threshold;
    private final double epsilon;

    public AnomalyScorer(DetectionProperties properties) {
        this.threshold = properties.getZScoreThreshold();
        this.epsilon = properties.getEpsilon();
    }

    /**
     * Joins observations to the forecast by date, observation side leading.
     * Forecast dates without an observation are ignored.
     *
     * @throws ForecastAlignmentException if an observation has no forecast point
     */
    public List<AnomalyRecord> score(List<Observation> observations, List<ForecastPoint> forecast) {
        if (observations.isEmpty()) {
            return List.of();
        }
        Map<LocalDate, Double> expectedByDate = new HashMap<>();
        for (ForecastPoint point : forecast) {
            expectedByDate.put(point.getDate(), point.getExpected());
        }

        List<Observation> ordered = new ArrayList<>(observations);
        ordered.sort(Comparator.comparing(Observation::getDate));

        int n = ordered.size();
        double[] expected = new double[n];
        double[] residual = new double[n];
        for (int i = 0; i < n; i++) {
            Observation o = ordered.get(i);
            Double e = expectedByDate.get(o.getDate());
            if (e == null) {
                throw new ForecastAlignmentException(o.getDate());
            }
            expected[i] = e;
            residual[i] = o.getActual() - e;
        }

        double center = RobustStatistics.median(residual);
        double scale = RobustStatistics.mad(residual, center) + epsilon;
        log.debug("Residual baseline: median={}, scale={}", center, scale);

        List<AnomalyRecord> records = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double z = (residual[i] - center) / scale;
            records.add(AnomalyRecord.builder()
                    .date(ordered.get(i).getDate())
                    .actual(ordered.get(i).getActual())
                    .expected(expected[i])
                    .residual(residual[i])
                    .pctDeviation(expected[i] == 0.0 ? null : residual[i] / expected[i])
                    .zScore(z)
                    .anomaly(Math.abs(z) > threshold)
                    .build());
        }
        return records;
    }
}

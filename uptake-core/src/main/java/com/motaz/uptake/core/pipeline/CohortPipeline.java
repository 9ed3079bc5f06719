package com.motaz.uptake.core.pipeline;

import com.motaz.uptake.core.backtest.BacktestEvaluator;
import com.motaz.uptake.core.config.DetectionProperties;
import com.motaz.uptake.core.forecast.BaselineForecaster;
import com.motaz.uptake.core.forecast.SeasonalTrendForecaster;
import com.motaz.uptake.core.impact.ImpactScorer;
import com.motaz.uptake.core.model.AnomalyRecord;
import com.motaz.uptake.core.model.BacktestReport;
import com.motaz.uptake.core.model.Cohort;
import com.motaz.uptake.core.model.CohortAnalysis;
import com.motaz.uptake.core.model.ForecastPoint;
import com.motaz.uptake.core.model.ImpactEvent;
import com.motaz.uptake.core.model.LabeledPoint;
import com.motaz.uptake.core.model.Observation;
import com.motaz.uptake.core.scoring.AnomalyScorer;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Forecast, score, group and rank one cohort. Holds no per-run state, so one
 * instance can serve any number of cohorts concurrently.
 */
@Slf4j
public class CohortPipeline {

    private final BaselineForecaster forecaster;
    private final AnomalyScorer scorer;
    private final ImpactScorer impactScorer;
    private final BacktestEvaluator backtestEvaluator;

    public CohortPipeline(BaselineForecaster forecaster, AnomalyScorer scorer,
                          ImpactScorer impactScorer, BacktestEvaluator backtestEvaluator) {
        this.forecaster = forecaster;
        this.scorer = scorer;
        this.impactScorer = impactScorer;
        this.backtestEvaluator = backtestEvaluator;
    }

    public static CohortPipeline of(DetectionProperties properties) {
        return new CohortPipeline(
                new SeasonalTrendForecaster(properties.getForecaster()),
                new AnomalyScorer(properties),
                new ImpactScorer(properties),
                new BacktestEvaluator(properties));
    }

    public List<AnomalyRecord> detect(Cohort cohort, List<Observation> history) {
        List<ForecastPoint> forecast = forecaster.fitPredict(history);
        List<AnomalyRecord> records = scorer.score(history, forecast);
        log.debug("{}: {} points scored", cohort, records.size());
        return records;
    }

    public CohortAnalysis analyze(Cohort cohort, List<Observation> history, double pricePerUnit) {
        return rank(cohort, detect(cohort, history), pricePerUnit);
    }

    /** Impact events from records already produced by {@link #detect}. */
    public CohortAnalysis rank(Cohort cohort, List<AnomalyRecord> records, double pricePerUnit) {
        List<ImpactEvent> impacts = impactScorer.score(records, pricePerUnit);
        CohortAnalysis analysis = new CohortAnalysis(cohort, pricePerUnit, records, impacts);
        log.info("{}: {} anomalous weeks, {} impact events", cohort, analysis.anomalyCount(), impacts.size());
        return analysis;
    }

    public BacktestReport backtest(Cohort cohort, List<Observation> history, List<LabeledPoint> groundTruth) {
        return evaluate(cohort, detect(cohort, history), groundTruth);
    }

    /** Backtest of records already produced by {@link #detect}. */
    public BacktestReport evaluate(Cohort cohort, List<AnomalyRecord> records, List<LabeledPoint> groundTruth) {
        return backtestEvaluator.evaluate(cohort, groundTruth, records);
    }
}

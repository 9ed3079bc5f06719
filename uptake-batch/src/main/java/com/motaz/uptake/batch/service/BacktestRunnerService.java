package com.motaz.uptake.batch.service;

import com.motaz.uptake.batch.model.PrescriptionEntity;
import com.motaz.uptake.batch.repository.PrescriptionRepository;
import com.motaz.uptake.core.exception.DataNotFoundException;
import com.motaz.uptake.core.exception.ForecastAlignmentException;
import com.motaz.uptake.core.model.AnomalyRecord;
import com.motaz.uptake.core.model.BacktestMetrics;
import com.motaz.uptake.core.model.BacktestReport;
import com.motaz.uptake.core.model.Cohort;
import com.motaz.uptake.core.model.CohortAnalysis;
import com.motaz.uptake.core.model.CohortHistory;
import com.motaz.uptake.core.model.ImpactEvent;
import com.motaz.uptake.core.model.LabeledPoint;
import com.motaz.uptake.core.model.MatchRecord;
import com.motaz.uptake.core.model.Observation;
import com.motaz.uptake.core.pipeline.CohortPipeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

@Slf4j
@Service
public class BacktestRunnerService {

    private final PrescriptionRepository prescriptionRepository;
    private final CohortPipeline cohortPipeline;
    private final Executor cohortExecutor;

    public BacktestRunnerService(PrescriptionRepository prescriptionRepository,
                                 CohortPipeline cohortPipeline,
                                 @Qualifier("cohortExecutor") Executor cohortExecutor) {
        this.prescriptionRepository = prescriptionRepository;
        this.cohortPipeline = cohortPipeline;
        this.cohortExecutor = cohortExecutor;
    }

    /** Backtests one cohort and prints its metrics, matches and top-ranked impact at the given price. */
    public BacktestReport runBacktest(String product, String region, double pricePerUnit) {
        CohortHistory history = loadHistory(Cohort.of(product, region));
        List<AnomalyRecord> records = cohortPipeline.detect(history.getCohort(), history.getObservations());
        BacktestReport report = cohortPipeline.evaluate(history.getCohort(), records, history.getGroundTruth());
        CohortAnalysis analysis = cohortPipeline.rank(history.getCohort(), records, pricePerUnit);

        System.out.println(formatReport(report));
        System.out.println(formatTopImpact(analysis));
        return report;
    }

    /**
     * Backtests every cohort in the store on the cohort executor. A cohort that
     * fails is logged and left out; the others still complete.
     */
    public Map<Cohort, BacktestReport> backtestAll() {
        List<Cohort> cohorts = prescriptionRepository.findDistinctCohorts().stream()
                .map(r -> Cohort.of((String) r[0], (String) r[1]))
                .toList();
        log.info("Backtesting {} cohorts...", cohorts.size());

        List<CompletableFuture<BacktestReport>> futures = new ArrayList<>();
        for (Cohort cohort : cohorts) {
            futures.add(CompletableFuture.supplyAsync(() -> backtest(cohort), cohortExecutor));
        }

        Map<Cohort, BacktestReport> reports = new LinkedHashMap<>();
        for (int i = 0; i < cohorts.size(); i++) {
            Cohort cohort = cohorts.get(i);
            try {
                BacktestReport report = futures.get(i).join();
                reports.put(cohort, report);
                System.out.println(formatReport(report));
            } catch (CompletionException e) {
                if (e.getCause() instanceof ForecastAlignmentException) {
                    log.error("Forecast does not cover {} history", cohort, e.getCause());
                } else {
                    log.warn("Backtest failed for {}: {}", cohort, e.getCause().getMessage());
                }
                System.out.println(cohort + ": FAILED (" + e.getCause().getMessage() + ")");
            }
        }
        log.info("Backtest sweep completed: {} of {} cohorts", reports.size(), cohorts.size());
        return reports;
    }

    BacktestReport backtest(Cohort cohort) {
        CohortHistory history = loadHistory(cohort);
        return cohortPipeline.backtest(cohort, history.getObservations(), history.getGroundTruth());
    }

    CohortHistory loadHistory(Cohort cohort) {
        List<PrescriptionEntity> rows = prescriptionRepository.findAllByProductAndRegionOrderByDateAsc(
                cohort.getProduct(), cohort.getRegion());
        if (rows.isEmpty()) {
            throw new DataNotFoundException("No data found for " + cohort);
        }
        List<Observation> observations = rows.stream().map(p -> Observation.of(p.getDate(), p.getUnits())).toList();
        List<LabeledPoint> labels = rows.stream().map(p -> LabeledPoint.of(p.getDate(), p.getEventType())).toList();
        return new CohortHistory(cohort, observations, labels);
    }

    static String formatReport(BacktestReport report) {
        BacktestMetrics m = report.getMetrics();
        StringBuilder out = new StringBuilder();
        out.append("Backtesting metrics: ").append(report.getCohort()).append('\n');
        out.append("ground_truth_events: ").append(m.getGroundTruthCount()).append('\n');
        out.append("detected_events: ").append(m.getDetectedCount()).append('\n');
        out.append("true_positives: ").append(m.getTruePositives()).append('\n');
        out.append("false_positives: ").append(m.getFalsePositives()).append('\n');
        out.append("precision: ").append(round2(m.getPrecision())).append('\n');
        out.append("recall: ").append(round2(m.getRecall())).append('\n');
        out.append("avg_detection_latency_weeks: ")
                .append(m.getAvgLatencyWeeks() == null ? "n/a" : round2(m.getAvgLatencyWeeks()));
        if (!report.getMatches().isEmpty()) {
            out.append("\n\nMatched events:\n");
            out.append(String.format(Locale.ROOT, "%-20s %-12s %-12s %s%n",
                    "ground_truth_event", "gt_start", "detected_start", "latency_weeks"));
            for (MatchRecord match : report.getMatches()) {
                out.append(String.format(Locale.ROOT, "%-20s %-12s %-12s %d%n",
                        match.getGroundTruthLabel(), match.getGroundTruthStart(),
                        match.getDetectedStart(), match.getLatencyWeeks()));
            }
        }
        return out.toString();
    }

    static String formatTopImpact(CohortAnalysis analysis) {
        return analysis.topEvent()
                .map(BacktestRunnerService::formatImpact)
                .orElse("No impact events for " + analysis.getCohort());
    }

    private static String formatImpact(ImpactEvent e) {
        return String.format(Locale.ROOT,
                "Top impact: %s to %s, %d weeks, avg deviation %.2f, revenue impact %.2f, %s, %s",
                e.getStartDate(), e.getEndDate(), e.getDurationWeeks(), e.getAvgPctDeviation(),
                e.getTotalRevenueImpact(), e.getSeverity().getLabel(), e.getLikelyCause().getLabel());
    }

    private static String round2(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}

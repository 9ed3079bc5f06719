package com.motaz.uptake.core.backtest;

import com.motaz.uptake.core.config.DetectionProperties;
import com.motaz.uptake.core.events.ContinuityRule;
import com.motaz.uptake.core.events.TemporalEventGrouper;
import com.motaz.uptake.core.model.AnomalyRecord;
import com.motaz.uptake.core.model.BacktestMetrics;
import com.motaz.uptake.core.model.BacktestReport;
import com.motaz.uptake.core.model.Cohort;
import com.motaz.uptake.core.model.LabeledPoint;
import com.motaz.uptake.core.model.MatchRecord;
import com.motaz.uptake.core.model.TemporalEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Scores detection quality against labelled history.
 * <p>
 * Ground-truth labels are grouped with a lenient gap rule (at most
 * {@code groundTruthGapDays}); detections with the strict cadence rule the
 * impact scorer uses. The two rules differ on irregular gaps and are kept
 * apart on purpose.
 */
@Slf4j
public class BacktestEvaluator {

    static final String DETECTED_LABEL = "anomaly";
    private static final int DAYS_PER_WEEK = 7;

    private final TemporalEventGrouper groundTruthGrouper;
    private final TemporalEventGrouper detectionGrouper;

    public BacktestEvaluator(DetectionProperties properties) {
        this.groundTruthGrouper = new TemporalEventGrouper(ContinuityRule.withinDays(properties.getGroundTruthGapDays()));
        this.detectionGrouper = new TemporalEventGrouper(ContinuityRule.exactCadence(properties.getDetectionCadenceDays()));
    }

    public BacktestReport evaluate(Cohort cohort, List<LabeledPoint> groundTruth, List<AnomalyRecord> anomalies) {
        List<LabeledPoint> truth = new ArrayList<>(groundTruth);
        truth.sort(Comparator.comparing(LabeledPoint::getDate));
        List<TemporalEvent> truthEvents = groundTruthGrouper.group(truth);

        List<LabeledPoint> flags = anomalies.stream()
                .sorted(Comparator.comparing(AnomalyRecord::getDate))
                .map(r -> LabeledPoint.of(r.getDate(), r.isAnomaly() ? DETECTED_LABEL : TemporalEventGrouper.INACTIVE))
                .toList();
        List<TemporalEvent> detectedEvents = detectionGrouper.group(flags);

        List<MatchRecord> matches = match(truthEvents, detectedEvents);
        BacktestMetrics metrics = metrics(truthEvents.size(), detectedEvents.size(), matches);
        log.info("Backtest {}: ground truth={}, detected={}, matched={}",
                cohort, truthEvents.size(), detectedEvents.size(), matches.size());
        return new BacktestReport(cohort, metrics, List.copyOf(matches));
    }

    /**
     * Greedy one-to-one matching in ground-truth order. Each truth event takes
     * the unused detection, not ending before it starts, whose start is
     * closest to its own; the earliest such detection wins a tie.
     */
    List<MatchRecord> match(List<TemporalEvent> truthEvents, List<TemporalEvent> detectedEvents) {
        boolean[] used = new boolean[detectedEvents.size()];
        List<MatchRecord> matches = new ArrayList<>();
        for (TemporalEvent truth : truthEvents) {
            int best = -1;
            long bestDistance = Long.MAX_VALUE;
            for (int i = 0; i < detectedEvents.size(); i++) {
                TemporalEvent detected = detectedEvents.get(i);
                if (used[i] || detected.getEnd().isBefore(truth.getStart())) {
                    continue;
                }
                long distance = Math.abs(ChronoUnit.DAYS.between(truth.getStart(), detected.getStart()));
                if (distance < bestDistance) {
                    best = i;
                    bestDistance = distance;
                }
            }
            if (best < 0) {
                log.debug("Missed ground-truth event {} starting {}", truth.getLabel(), truth.getStart());
                continue;
            }
            used[best] = true;
            matches.add(MatchRecord.builder()
                    .groundTruthLabel(truth.getLabel())
                    .groundTruthStart(truth.getStart())
                    .detectedStart(detectedEvents.get(best).getStart())
                    .latencyWeeks(bestDistance / DAYS_PER_WEEK)
                    .build());
        }
        return matches;
    }

    static BacktestMetrics metrics(int groundTruthCount, int detectedCount, List<MatchRecord> matches) {
        int tp = matches.size();
        Double avgLatency = matches.isEmpty() ? null
                : matches.stream().mapToLong(MatchRecord::getLatencyWeeks).average().orElseThrow();
        return BacktestMetrics.builder()
                .groundTruthCount(groundTruthCount)
                .detectedCount(detectedCount)
                .truePositives(tp)
                .falsePositives(detectedCount - tp)
                .precision(detectedCount == 0 ? 0.0 : (double) tp / detectedCount)
                .recall(groundTruthCount == 0 ? 0.0 : (double) tp / groundTruthCount)
                .avgLatencyWeeks(avgLatency)
                .build();
    }
}

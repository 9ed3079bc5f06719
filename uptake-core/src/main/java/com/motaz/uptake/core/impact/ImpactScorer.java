package com.motaz.uptake.core.impact;

import com.motaz.uptake.core.config.DetectionProperties;
import com.motaz.uptake.core.events.ContinuityRule;
import com.motaz.uptake.core.events.TemporalEventGrouper;
import com.motaz.uptake.core.exception.UndefinedDeviationException;
import com.motaz.uptake.core.model.AnomalyRecord;
import com.motaz.uptake.core.model.ImpactEvent;
import com.motaz.uptake.core.model.LabeledPoint;
import com.motaz.uptake.core.model.Severity;
import com.motaz.uptake.core.model.TemporalEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns flagged points into ranked business-impact events.
 * <p>
 * Only anomalous points are grouped, and a run continues only while
 * consecutive anomalous points sit exactly one cadence apart, so any skipped
 * week starts a new event.
 */
@Slf4j
public class ImpactScorer {

    static final String ANOMALY_LABEL = "anomaly";

    static final Comparator<ImpactEvent> PRIORITY = Comparator
            .<ImpactEvent, Severity>comparing(ImpactEvent::getSeverity, Comparator.reverseOrder())
            .thenComparing(Comparator.<ImpactEvent>comparingDouble(ImpactEvent::getTotalRevenueImpact).reversed());

    private final DetectionProperties.Severity severity;
    private final CauseInference causeInference;
    private final TemporalEventGrouper grouper;

    public ImpactScorer(DetectionProperties properties) {
        this.severity = properties.getSeverity();
        this.causeInference = new CauseInference(properties.getCause());
        this.grouper = new TemporalEventGrouper(ContinuityRule.exactCadence(properties.getDetectionCadenceDays()));
    }

    /**
     * @return events ordered by severity, then revenue impact, both descending;
     *         ties keep chronological order. Empty when nothing was flagged.
     * @throws UndefinedDeviationException if a flagged point has a zero expected value
     */
    public List<ImpactEvent> score(List<AnomalyRecord> records, double pricePerUnit) {
        List<AnomalyRecord> flagged = records.stream().filter(AnomalyRecord::isAnomaly).toList();
        if (flagged.isEmpty()) {
            log.debug("No anomalous points, empty impact report");
            return List.of();
        }

        List<LabeledPoint> labeled = flagged.stream()
                .map(r -> LabeledPoint.of(r.getDate(), ANOMALY_LABEL))
                .toList();

        List<ImpactEvent> events = new ArrayList<>();
        int offset = 0;
        for (TemporalEvent event : grouper.group(labeled)) {
            List<AnomalyRecord> members = flagged.subList(offset, offset + event.getPointCount());
            offset += event.getPointCount();
            events.add(toImpact(event, members, pricePerUnit));
        }

        events.sort(PRIORITY);
        return List.copyOf(events);
    }

    private ImpactEvent toImpact(TemporalEvent event, List<AnomalyRecord> members, double pricePerUnit) {
        double revenue = 0.0;
        List<Double> pcts = new ArrayList<>(members.size());
        for (AnomalyRecord r : members) {
            if (!r.hasDefinedDeviation()) {
                throw new UndefinedDeviationException("Expected value is zero on " + r.getDate()
                        + ", percent deviation is undefined");
            }
            revenue += Math.abs(r.getResidual()) * pricePerUnit;
            pcts.add(r.getPctDeviation());
        }
        EventShape shape = EventShape.of(pcts);
        return ImpactEvent.builder()
                .startDate(event.getStart())
                .endDate(event.getEnd())
                .durationWeeks(members.size())
                .avgPctDeviation(shape.getMeanPctDeviation())
                .totalRevenueImpact(revenue)
                .severity(classify(shape.getMeanPctDeviation()))
                .likelyCause(causeInference.infer(shape))
                .build();
    }

    Severity classify(double avgPctDeviation) {
        double magnitude = Math.abs(avgPctDeviation);
        if (magnitude >= severity.getHigh()) {
            return Severity.HIGH;
        }
        if (magnitude >= severity.getMedium()) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }
}

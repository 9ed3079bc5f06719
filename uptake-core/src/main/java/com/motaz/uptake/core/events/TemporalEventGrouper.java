package com.motaz.uptake.core.events;

import com.motaz.uptake.core.model.LabeledPoint;
import com.motaz.uptake.core.model.TemporalEvent;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Clusters a date-ordered run of labels into events. A point extends the open
 * event when it carries the same label and the {@link ContinuityRule} accepts
 * the gap; otherwise the open event is emitted and a new one starts. An
 * {@link #INACTIVE} point closes the open event without opening another.
 */
public class TemporalEventGrouper {

    public static final String INACTIVE = "none";

    private final ContinuityRule continuity;

    public TemporalEventGrouper(ContinuityRule continuity) {
        this.continuity = continuity;
    }

    public List<TemporalEvent> group(List<LabeledPoint> points) {
        List<TemporalEvent> events = new ArrayList<>();
        String label = null;
        LocalDate start = null;
        LocalDate end = null;
        int count = 0;

        for (LabeledPoint point : points) {
            boolean inactive = INACTIVE.equals(point.getLabel());
            if (label != null && !inactive && label.equals(point.getLabel())
                    && continuity.continues(ChronoUnit.DAYS.between(end, point.getDate()))) {
                end = point.getDate();
                count++;
                continue;
            }
            if (label != null) {
                events.add(new TemporalEvent(label, start, end, count));
                label = null;
            }
            if (!inactive) {
                label = point.getLabel();
                start = point.getDate();
                end = point.getDate();
                count = 1;
            }
        }
        if (label != null) {
            events.add(new TemporalEvent(label, start, end, count));
        }
        return events;
    }
}

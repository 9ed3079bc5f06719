package com.motaz.uptake.core.events;

/**
 * Decides whether a same-label point continues the open event, given the gap
 * in days between the event's last point and the current one.
 */
@FunctionalInterface
public interface ContinuityRule {

    boolean continues(long gapDays);

    /** Continues while the gap is at most {@code maxDays}; used for ground-truth labels. */
    static ContinuityRule withinDays(int maxDays) {
        return gapDays -> gapDays <= maxDays;
    }

    /** Continues only on exactly {@code cadenceDays}; used for detected anomalies. */
    static ContinuityRule exactCadence(int cadenceDays) {
        return gapDays -> gapDays == cadenceDays;
    }
}

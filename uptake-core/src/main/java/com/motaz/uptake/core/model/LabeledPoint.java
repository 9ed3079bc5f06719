package com.motaz.uptake.core.model;

import lombok.Value;

import java.time.LocalDate;

/** A dated label; {@link com.motaz.uptake.core.events.TemporalEventGrouper#INACTIVE} marks no event. */
@Value(staticConstructor = "of")
public class LabeledPoint {
    LocalDate date;
    String label;
}

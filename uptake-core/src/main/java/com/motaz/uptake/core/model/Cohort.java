package com.motaz.uptake.core.model;

import lombok.Value;

/** A (product, region) pair, the unit of independent analysis. */
@Value(staticConstructor = "of")
public class Cohort {
    String product;
    String region;

    @Override
    public String toString() {
        return product + " - " + region;
    }
}

package com.motaz.uptake.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LikelyCause {
    SUPPLY_ISSUE("Supply Issue / Recall"),
    COMPETITOR_ENTRY("Competitor Entry"),
    PROMOTION("Promotion / Campaign"),
    UNCLASSIFIED("Unclassified");

    private final String label;

    LikelyCause(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}

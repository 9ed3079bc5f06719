package com.motaz.uptake.core.report;

import com.motaz.uptake.core.model.Cohort;
import com.motaz.uptake.core.model.ImpactEvent;

import java.util.Locale;

/** Renders the top-ranked impact event as a short markdown brief. */
public class ExecutiveSummaryFormatter {

    public static final String NO_ACTION = "No executive actions required at this time.";

    private final String currencySymbol;

    public ExecutiveSummaryFormatter(String currencySymbol) {
        this.currencySymbol = currencySymbol;
    }

    public String summarize(Cohort cohort, ImpactEvent top) {
        if (top == null) {
            return NO_ACTION;
        }
        return String.format(Locale.ROOT,
                "**Key Finding:**\n"
                        + "Prescription uptake for **%s** in **%s** shows a **%.1f%% deviation** from expected levels "
                        + "over **%d weeks**.\n\n"
                        + "**Business Impact:**\n"
                        + "Estimated revenue impact of **%s%,.0f**.\n\n"
                        + "**Severity:** %s\n"
                        + "**Likely Cause:** %s\n\n"
                        + "**Recommended Action:**\n"
                        + "Immediate investigation and targeted field intervention.",
                cohort.getProduct(), cohort.getRegion(),
                Math.abs(top.getAvgPctDeviation()) * 100.0, top.getDurationWeeks(),
                currencySymbol, top.getTotalRevenueImpact(),
                top.getSeverity().getLabel(), top.getLikelyCause().getLabel());
    }
}

package com.motaz.uptake.core.impact;

import com.motaz.uptake.core.config.DetectionProperties;
import com.motaz.uptake.core.model.LikelyCause;

import java.util.List;

/**
 * Rule-based likely cause. Rules are evaluated top to bottom and the first
 * match wins; an event no rule matches is {@link LikelyCause#UNCLASSIFIED}.
 */
public class CauseInference {

    private final List<CauseRule> rules;

    public CauseInference(DetectionProperties.Cause cutoffs) {
        this.rules = List.of(
                new CauseRule("deep drop", s -> s.getMeanPctDeviation() < cutoffs.getSupplyIssueMean(),
                        LikelyCause.SUPPLY_ISSUE),
                new CauseRule("sustained drop", s -> s.getMeanPctDeviation() < cutoffs.getCompetitorEntryMean()
                        && s.getWeeks() >= cutoffs.getCompetitorEntryMinWeeks(), LikelyCause.COMPETITOR_ENTRY),
                new CauseRule("lift", s -> s.getMeanPctDeviation() > cutoffs.getPromotionMean(),
                        LikelyCause.PROMOTION));
    }

    public List<CauseRule> rules() {
        return rules;
    }

    public LikelyCause infer(EventShape shape) {
        for (CauseRule rule : rules) {
            if (rule.matches(shape)) {
                return rule.getCause();
            }
        }
        return LikelyCause.UNCLASSIFIED;
    }

    public LikelyCause infer(List<Double> pctDeviations) {
        return infer(EventShape.of(pctDeviations));
    }
}

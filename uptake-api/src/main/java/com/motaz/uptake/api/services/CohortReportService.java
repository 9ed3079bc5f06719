package com.motaz.uptake.api.services;

import com.motaz.uptake.api.dto.CohortReportDto;
import com.motaz.uptake.core.model.BacktestReport;
import com.motaz.uptake.core.model.Cohort;
import com.motaz.uptake.core.model.CohortAnalysis;
import com.motaz.uptake.core.model.CohortHistory;
import com.motaz.uptake.core.pipeline.CohortPipeline;
import com.motaz.uptake.core.report.ExecutiveSummaryFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the pipeline for one cohort per call. Nothing is cached between calls:
 * the store can be replaced at any time by an ingestion run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CohortReportService {

    private final CohortCatalogService catalogService;
    private final PrescriptionQueryService queryService;
    private final CohortPipeline cohortPipeline;
    private final ExecutiveSummaryFormatter summaryFormatter;

    public CohortAnalysis analyze(String product, String region) {
        Cohort cohort = catalogService.resolve(product, region);
        double price = catalogService.priceFor(product);
        log.info("---Start cohort analysis : {} at {} per unit", cohort, price);
        CohortHistory history = queryService.loadHistory(cohort);
        CohortAnalysis analysis = cohortPipeline.analyze(cohort, history.getObservations(), price);
        log.info("--- Cohort analysis completed for {}", cohort);
        return analysis;
    }

    public CohortReportDto report(String product, String region) {
        CohortAnalysis analysis = analyze(product, region);
        return CohortReportDto.builder()
                .product(product)
                .region(region)
                .pricePerUnit(analysis.getPricePerUnit())
                .anomalies(analysis.getAnomalies())
                .impacts(analysis.getImpacts())
                .topEvent(analysis.topEvent().orElse(null))
                .summary(summaryFormatter.summarize(analysis.getCohort(), analysis.topEvent().orElse(null)))
                .build();
    }

    public BacktestReport backtest(String product, String region) {
        Cohort cohort = catalogService.resolve(product, region);
        CohortHistory history = queryService.loadHistory(cohort);
        return cohortPipeline.backtest(cohort, history.getObservations(), history.getGroundTruth());
    }
}

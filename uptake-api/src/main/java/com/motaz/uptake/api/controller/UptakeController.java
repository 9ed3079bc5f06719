package com.motaz.uptake.api.controller;

import com.motaz.uptake.api.dto.CohortCatalogDto;
import com.motaz.uptake.api.dto.CohortReportDto;
import com.motaz.uptake.api.dto.PrescriptionDto;
import com.motaz.uptake.api.services.CohortCatalogService;
import com.motaz.uptake.api.services.CohortReportService;
import com.motaz.uptake.api.services.PrescriptionQueryService;
import com.motaz.uptake.core.model.AnomalyRecord;
import com.motaz.uptake.core.model.BacktestReport;
import com.motaz.uptake.core.model.ImpactEvent;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/uptake")
@RequiredArgsConstructor
public class UptakeController {
    private final CohortCatalogService catalogService;
    private final PrescriptionQueryService queryService;
    private final CohortReportService reportService;

    @GetMapping("/cohorts")
    public CohortCatalogDto cohorts() {
        return catalogService.catalog();
    }

    @GetMapping("/prescriptions")
    public List<PrescriptionDto> prescriptions(
            @Parameter(description = "Product filter, all products when omitted", example = "Drug_A")
            @RequestParam(name = "product", required = false) String product,
            @Parameter(description = "Region filter, all regions when omitted", example = "North")
            @RequestParam(name = "region", required = false) String region) {
        return queryService.findRows(product, region);
    }

    @GetMapping("/{product}/{region}/anomalies")
    public List<AnomalyRecord> anomalies(
            @Parameter(description = "Product name", required = true, example = "Drug_A")
            @PathVariable(name = "product") String product,
            @Parameter(description = "Region name", required = true, example = "North")
            @PathVariable(name = "region") String region) {
        return reportService.analyze(product, region).getAnomalies();
    }

    @GetMapping("/{product}/{region}/impacts")
    public List<ImpactEvent> impacts(
            @Parameter(description = "Product name", required = true, example = "Drug_A")
            @PathVariable(name = "product") String product,
            @Parameter(description = "Region name", required = true, example = "North")
            @PathVariable(name = "region") String region) {
        return reportService.analyze(product, region).getImpacts();
    }

    @GetMapping("/{product}/{region}/report")
    public CohortReportDto report(
            @Parameter(description = "Product name", required = true, example = "Drug_A")
            @PathVariable(name = "product") String product,
            @Parameter(description = "Region name", required = true, example = "North")
            @PathVariable(name = "region") String region) {
        return reportService.report(product, region);
    }

    @GetMapping("/{product}/{region}/backtest")
    public BacktestReport backtest(
            @Parameter(description = "Product name", required = true, example = "Drug_A")
            @PathVariable(name = "product") String product,
            @Parameter(description = "Region name", required = true, example = "North")
            @PathVariable(name = "region") String region) {
        return reportService.backtest(product, region);
    }
}

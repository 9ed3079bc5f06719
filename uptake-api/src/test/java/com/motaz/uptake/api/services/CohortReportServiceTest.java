package com.motaz.uptake.api.services;

import com.motaz.uptake.api.dto.CohortReportDto;
import com.motaz.uptake.core.config.DetectionProperties;
import com.motaz.uptake.core.exception.DataNotFoundException;
import com.motaz.uptake.core.model.BacktestReport;
import com.motaz.uptake.core.model.Cohort;
import com.motaz.uptake.core.model.CohortHistory;
import com.motaz.uptake.core.model.LabeledPoint;
import com.motaz.uptake.core.model.LikelyCause;
import com.motaz.uptake.core.model.Observation;
import com.motaz.uptake.core.model.Severity;
import com.motaz.uptake.core.pipeline.CohortPipeline;
import com.motaz.uptake.core.report.ExecutiveSummaryFormatter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CohortReportServiceTest {

    private static final LocalDate START = LocalDate.of(2021, 1, 4);
    private static final Cohort COHORT = Cohort.of("Drug_A", "North");

    @Mock
    private CohortCatalogService catalogService;

    @Mock
    private PrescriptionQueryService queryService;

    private CohortReportService service;

    @BeforeEach
    void setUp() {
        service = new CohortReportService(catalogService, queryService,
                CohortPipeline.of(new DetectionProperties()), new ExecutiveSummaryFormatter("₹"));
    }

    /** 160 weeks of yearly-seasonal volume with a four week supply collapse from week 90. */
    private static CohortHistory historyWithRecall() {
        Random rnd = new Random(7);
        List<Observation> observations = new ArrayList<>();
        List<LabeledPoint> labels = new ArrayList<>();
        for (int i = 0; i < 160; i++) {
            LocalDate week = START.plusWeeks(i);
            double base = 1000.0 + 200.0 * Math.sin(2.0 * Math.PI * week.toEpochDay() / 365.25);
            double v = base * (1.0 + 0.03 * rnd.nextGaussian());
            boolean recall = i >= 90 && i < 94;
            observations.add(Observation.of(week, recall ? v * 0.4 : v));
            labels.add(LabeledPoint.of(week, recall ? "supply_issue" : "none"));
        }
        return new CohortHistory(COHORT, observations, labels);
    }

    @Test
    void reportRanksTheRecallFirstAndSummarisesIt() {
        when(catalogService.resolve("Drug_A", "North")).thenReturn(COHORT);
        when(catalogService.priceFor("Drug_A")).thenReturn(450.0);
        when(queryService.loadHistory(COHORT)).thenReturn(historyWithRecall());

        CohortReportDto report = service.report("Drug_A", "North");

        assertThat(report.getAnomalies()).hasSize(160);
        assertThat(report.getTopEvent()).isNotNull();
        assertThat(report.getTopEvent().getStartDate()).isBetween(START.plusWeeks(89), START.plusWeeks(91));
        assertThat(report.getTopEvent().getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(report.getTopEvent().getLikelyCause()).isEqualTo(LikelyCause.SUPPLY_ISSUE);
        assertThat(report.getTopEvent().getTotalRevenueImpact()).isNegative();
        assertThat(report.getSummary())
                .contains("**Drug_A**", "**North**", "Supply Issue / Recall", "₹");
    }

    @Test
    void backtestFindsTheLabelledRecall() {
        when(catalogService.resolve("Drug_A", "North")).thenReturn(COHORT);
        when(queryService.loadHistory(COHORT)).thenReturn(historyWithRecall());

        BacktestReport report = service.backtest("Drug_A", "North");

        assertThat(report.getMetrics().getGroundTruthCount()).isEqualTo(1);
        assertThat(report.getMetrics().getRecall()).isEqualTo(1.0);
        assertThat(report.getMatches()).hasSize(1);
        assertThat(report.getMatches().get(0).getGroundTruthLabel()).isEqualTo("supply_issue");
    }

    @Test
    void unknownCohortNeverReachesTheStore() {
        when(catalogService.resolve("Drug_Z", "North")).thenThrow(new UnknownCohortException("Unknown product: Drug_Z"));

        assertThatThrownBy(() -> service.analyze("Drug_Z", "North")).isInstanceOf(UnknownCohortException.class);
        verify(queryService, never()).loadHistory(COHORT);
    }

    @Test
    void emptyCohortPropagatesNotFound() {
        when(catalogService.resolve("Drug_A", "North")).thenReturn(COHORT);
        when(catalogService.priceFor("Drug_A")).thenReturn(450.0);
        when(queryService.loadHistory(COHORT)).thenThrow(new DataNotFoundException("No data found for Drug_A - North"));

        assertThatThrownBy(() -> service.report("Drug_A", "North")).isInstanceOf(DataNotFoundException.class);
    }
}

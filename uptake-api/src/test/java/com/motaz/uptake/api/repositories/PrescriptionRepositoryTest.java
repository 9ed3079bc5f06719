package com.motaz.uptake.api.repositories;

import com.motaz.uptake.api.model.entities.PrescriptionEntity;
import com.motaz.uptake.api.services.PrescriptionQueryService;
import com.motaz.uptake.core.exception.DataNotFoundException;
import com.motaz.uptake.core.model.Cohort;
import com.motaz.uptake.core.model.CohortHistory;
import com.motaz.uptake.core.model.LabeledPoint;
import com.motaz.uptake.core.model.Observation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import(PrescriptionQueryService.class)
class PrescriptionRepositoryTest {

    private static final LocalDate START = LocalDate.of(2021, 1, 4);

    @Autowired
    private PrescriptionRepository repository;

    @Autowired
    private PrescriptionQueryService queryService;

    private static PrescriptionEntity row(String product, String region, int week, long units, String eventType) {
        PrescriptionEntity p = new PrescriptionEntity();
        p.setDate(START.plusWeeks(week));
        p.setProduct(product);
        p.setRegion(region);
        p.setUnits(units);
        p.setPricePerUnit(450.0);
        p.setRevenue(units * 450.0);
        p.setEventType(eventType);
        return p;
    }

    @BeforeEach
    void setUp() {
        // inserted out of order on purpose
        repository.saveAll(List.of(
                row("Drug_B", "South", 1, 700, "none"),
                row("Drug_A", "North", 1, 980, "promotion"),
                row("Drug_A", "South", 0, 600, "none"),
                row("Drug_A", "North", 0, 1000, "none"),
                row("Drug_B", "North", 0, 800, "none")));
    }

    @Test
    void cohortRowsAreReturnedInDateOrder() {
        List<PrescriptionEntity> rows = repository.findAllByProductAndRegionOrderByDateAsc("Drug_A", "North");

        assertThat(rows).extracting(PrescriptionEntity::getUnits).containsExactly(1000L, 980L);
    }

    @Test
    void productFilterOrdersByRegionThenDate() {
        assertThat(queryService.read("Drug_A", null))
                .extracting(PrescriptionEntity::getRegion)
                .containsExactly("North", "North", "South");
    }

    @Test
    void regionFilterOrdersByProductThenDate() {
        assertThat(queryService.read(null, "North"))
                .extracting(PrescriptionEntity::getProduct)
                .containsExactly("Drug_A", "Drug_A", "Drug_B");
    }

    @Test
    void noFilterReturnsEverythingSorted() {
        assertThat(queryService.findRows(null, null))
                .extracting(r -> r.getProduct() + "/" + r.getRegion() + "/" + r.getDate())
                .containsExactly(
                        "Drug_A/North/2021-01-04",
                        "Drug_A/North/2021-01-11",
                        "Drug_A/South/2021-01-04",
                        "Drug_B/North/2021-01-04",
                        "Drug_B/South/2021-01-11");
    }

    @Test
    void historyCarriesVolumesAndLabels() {
        CohortHistory history = queryService.loadHistory(Cohort.of("Drug_A", "North"));

        assertThat(history.getObservations()).extracting(Observation::getActual).containsExactly(1000.0, 980.0);
        assertThat(history.getGroundTruth()).extracting(LabeledPoint::getLabel).containsExactly("none", "promotion");
    }

    @Test
    void emptyCohortIsNotFound() {
        assertThatThrownBy(() -> queryService.loadHistory(Cohort.of("Drug_B", "West")))
                .isInstanceOf(DataNotFoundException.class)
                .hasMessageContaining("Drug_B - West");
    }
}

package com.motaz.uptake.batch.service;

import com.motaz.uptake.batch.model.PrescriptionEntity;
import com.motaz.uptake.batch.repository.PrescriptionRepository;
import com.motaz.uptake.core.exception.DataQualityException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({PrescriptionIngestService.class, PrescriptionCsvLoader.class})
class PrescriptionIngestServiceTest {

    private static final String HEADER = "date,product,region,units,price_per_unit,revenue,event_type\n";

    @Autowired
    private PrescriptionIngestService ingestService;

    @Autowired
    private PrescriptionRepository repository;

    @TempDir
    Path dir;

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    void ingestionReplacesTheWholeTable() throws IOException {
        ingestService.ingest(write("first.csv", HEADER
                + "2021-01-04,Drug_A,North,1200,450.0,540000.0,none\n"
                + "2021-01-04,Drug_B,North,800,300.0,240000.0,none\n"));

        int written = ingestService.ingest(write("second.csv", HEADER
                + "2021-01-11,Drug_A,South,1100,450.0,495000.0,supply_issue\n"));

        assertThat(written).isEqualTo(1);
        assertThat(repository.findAll())
                .extracting(PrescriptionEntity::getRegion)
                .containsExactly("South");
    }

    @Test
    void invalidFileLeavesTheStoreUntouched() throws IOException {
        ingestService.ingest(write("good.csv", HEADER + "2021-01-04,Drug_A,North,1200,450.0,540000.0,none\n"));

        Path bad = write("bad.csv", HEADER
                + "2021-01-04,Drug_A,North,1200,450.0,540000.0,none\n"
                + "2021-01-11,Drug_A,North,-3,450.0,0.0,none\n");

        assertThatThrownBy(() -> ingestService.ingest(bad)).isInstanceOf(DataQualityException.class);
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    void storedRowsReadBackPerCohortInDateOrder() throws IOException {
        ingestService.ingest(write("rows.csv", HEADER
                + "2021-01-18,Drug_A,North,1150,450.0,517500.0,promotion\n"
                + "2021-01-04,Drug_A,North,1200,450.0,540000.0,none\n"
                + "2021-01-11,Drug_A,North,1180,450.0,531000.0,none\n"));

        assertThat(repository.findAllByProductAndRegionOrderByDateAsc("Drug_A", "North"))
                .extracting(PrescriptionEntity::getUnits)
                .containsExactly(1200L, 1180L, 1150L);
        assertThat(repository.findDistinctCohorts()).hasSize(1);
    }
}

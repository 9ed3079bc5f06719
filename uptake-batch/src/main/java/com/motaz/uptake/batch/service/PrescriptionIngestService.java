package com.motaz.uptake.batch.service;

import com.motaz.uptake.batch.model.PrescriptionEntity;
import com.motaz.uptake.batch.model.PrescriptionRow;
import com.motaz.uptake.batch.repository.PrescriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Path;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class PrescriptionIngestService {

    private final PrescriptionCsvLoader csvLoader;
    private final PrescriptionRepository prescriptionRepository;

    /** Validates the whole file before touching the store, then replaces its contents. */
    @Transactional
    public int ingest(Path csvPath) {
        List<PrescriptionRow> rows = csvLoader.load(csvPath);
        replaceAll(rows);
        return rows.size();
    }

    @Transactional
    public void replaceAll(List<PrescriptionRow> rows) {
        prescriptionRepository.deleteAllInBatch();
        List<PrescriptionEntity> entities = rows.stream().map(PrescriptionRow::toEntity).toList();
        prescriptionRepository.saveAll(entities);
        log.info("Replaced t_prescriptions with {} rows", entities.size());
    }
}

package com.motaz.uptake.api.services;

import com.motaz.uptake.api.dto.PrescriptionDto;
import com.motaz.uptake.api.model.entities.PrescriptionEntity;
import com.motaz.uptake.api.repositories.PrescriptionRepository;
import com.motaz.uptake.core.exception.DataNotFoundException;
import com.motaz.uptake.core.model.Cohort;
import com.motaz.uptake.core.model.CohortHistory;
import com.motaz.uptake.core.model.LabeledPoint;
import com.motaz.uptake.core.model.Observation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class PrescriptionQueryService {

    private final PrescriptionRepository prescriptionRepository;

    /** Rows for the given filters; a null filter is not applied, so no filters returns the whole table. */
    @Transactional(readOnly = true)
    public List<PrescriptionEntity> read(String product, String region) {
        if (product != null && region != null) {
            return prescriptionRepository.findAllByProductAndRegionOrderByDateAsc(product, region);
        }
        if (product != null) {
            return prescriptionRepository.findAllByProductOrderByRegionAscDateAsc(product);
        }
        if (region != null) {
            return prescriptionRepository.findAllByRegionOrderByProductAscDateAsc(region);
        }
        return prescriptionRepository.findAllByOrderByProductAscRegionAscDateAsc();
    }

    @Transactional(readOnly = true)
    public List<PrescriptionDto> findRows(String product, String region) {
        return read(product, region).stream()
                .map(p -> PrescriptionDto.builder()
                        .date(p.getDate())
                        .product(p.getProduct())
                        .region(p.getRegion())
                        .units(p.getUnits())
                        .pricePerUnit(p.getPricePerUnit())
                        .revenue(p.getRevenue())
                        .eventType(p.getEventType())
                        .build())
                .toList();
    }

    @Transactional(readOnly = true)
    public CohortHistory loadHistory(Cohort cohort) {
        List<PrescriptionEntity> rows = read(cohort.getProduct(), cohort.getRegion());
        if (rows.isEmpty()) {
            throw new DataNotFoundException("No data found for " + cohort);
        }
        log.info("Loaded {} weekly rows for {}", rows.size(), cohort);
        List<Observation> observations = rows.stream()
                .map(p -> Observation.of(p.getDate(), p.getUnits()))
                .toList();
        List<LabeledPoint> labels = rows.stream()
                .map(p -> LabeledPoint.of(p.getDate(), p.getEventType()))
                .toList();
        return new CohortHistory(cohort, observations, labels);
    }
}

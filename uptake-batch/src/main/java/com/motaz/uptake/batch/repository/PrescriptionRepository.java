package com.motaz.uptake.batch.repository;

import com.motaz.uptake.batch.model.PrescriptionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PrescriptionRepository extends JpaRepository<PrescriptionEntity, Long> {

    List<PrescriptionEntity> findAllByProductAndRegionOrderByDateAsc(String product, String region);

    @Query("select distinct p.product, p.region from PrescriptionEntity p order by p.product, p.region")
    List<Object[]> findDistinctCohorts();
}

package com.motaz.uptake.api.repositories;


import com.motaz.uptake.api.model.entities.PrescriptionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PrescriptionRepository extends JpaRepository<PrescriptionEntity, Long> {

    List<PrescriptionEntity> findAllByProductAndRegionOrderByDateAsc(String product, String region);

    List<PrescriptionEntity> findAllByProductOrderByRegionAscDateAsc(String product);

    List<PrescriptionEntity> findAllByRegionOrderByProductAscDateAsc(String region);

    List<PrescriptionEntity> findAllByOrderByProductAscRegionAscDateAsc();

}

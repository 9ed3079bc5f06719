package com.motaz.uptake.api.model.entities;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;

@Getter
@Setter
@Entity
@Table(name = "t_prescriptions", schema = "public")
public class PrescriptionEntity {

    @Id
    @Column(name = "id", nullable = false)
    @GeneratedValue(strategy = GenerationType.SEQUENCE, generator = "prescriptions_entity_seq_generator")
    @SequenceGenerator(name = "prescriptions_entity_seq_generator", sequenceName = "prescriptions_id_seq", allocationSize = 100)
    private Long id;

    @Column(name = "week_start", nullable = false)
    private LocalDate date;

    @Column(name = "product", nullable = false, length = 64)
    private String product;

    @Column(name = "region", nullable = false, length = 64)
    private String region;

    @Column(name = "units", nullable = false)
    private Long units;

    @Column(name = "price_per_unit", nullable = false)
    private Double pricePerUnit;

    @Column(name = "revenue", nullable = false)
    private Double revenue;

    @Column(name = "event_type", nullable = false, length = 32)
    private String eventType;

}

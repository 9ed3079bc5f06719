package com.motaz.uptake.batch.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/** One validated CSV line. */
@Value
@Builder
public class PrescriptionRow {
    LocalDate date;
    String product;
    String region;
    long units;
    double pricePerUnit;
    double revenue;
    String eventType;

    public PrescriptionEntity toEntity() {
        PrescriptionEntity entity = new PrescriptionEntity();
        entity.setDate(date);
        entity.setProduct(product);
        entity.setRegion(region);
        entity.setUnits(units);
        entity.setPricePerUnit(pricePerUnit);
        entity.setRevenue(revenue);
        entity.setEventType(eventType);
        return entity;
    }
}

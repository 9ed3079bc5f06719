package com.motaz.uptake.api.dto;

import com.motaz.uptake.core.model.AnomalyRecord;
import com.motaz.uptake.core.model.ImpactEvent;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class CohortReportDto {
    private String product;
    private String region;
    private double pricePerUnit;
    private List<AnomalyRecord> anomalies;
    private List<ImpactEvent> impacts;
    private ImpactEvent topEvent;
    private String summary;
}

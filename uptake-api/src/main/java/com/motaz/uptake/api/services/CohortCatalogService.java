package com.motaz.uptake.api.services;

import com.motaz.uptake.api.config.CohortProperties;
import com.motaz.uptake.api.dto.CohortCatalogDto;
import com.motaz.uptake.core.model.Cohort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CohortCatalogService {

    private final CohortProperties cohortProperties;

    public Cohort resolve(String product, String region) {
        if (!cohortProperties.getProducts().contains(product)) {
            throw new UnknownCohortException("Unknown product: " + product);
        }
        if (!cohortProperties.getRegions().contains(region)) {
            throw new UnknownCohortException("Unknown region: " + region);
        }
        return Cohort.of(product, region);
    }

    public double priceFor(String product) {
        Double price = cohortProperties.getPrices().get(product);
        if (price == null) {
            throw new UnknownCohortException("No unit price configured for product " + product);
        }
        return price;
    }

    public CohortCatalogDto catalog() {
        return CohortCatalogDto.builder()
                .products(cohortProperties.getProducts())
                .regions(cohortProperties.getRegions())
                .prices(cohortProperties.getPrices())
                .build();
    }
}

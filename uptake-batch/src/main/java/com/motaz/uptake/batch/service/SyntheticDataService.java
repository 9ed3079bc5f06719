package com.motaz.uptake.batch.service;

import com.motaz.uptake.batch.config.BatchProperties;
import com.motaz.uptake.batch.model.PrescriptionRow;
import com.motaz.uptake.core.events.TemporalEventGrouper;
import com.motaz.uptake.core.exception.UptakeException;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Seeded generator of weekly prescription volumes per product/region with a
 * yearly cycle, slow growth and one or two injected, labelled events.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyntheticDataService {

    static final String SUPPLY_ISSUE = "supply_issue";
    static final String COMPETITOR_ENTRY = "competitor_entry";
    static final String PROMOTION = "promotion";
    private static final String[] EVENT_TYPES = {SUPPLY_ISSUE, COMPETITOR_ENTRY, PROMOTION};

    /** Events start at least this many weeks after the first and before the last week. */
    static final int EVENT_MARGIN_WEEKS = 20;

    private final BatchProperties batchProperties;

    public List<PrescriptionRow> generate() {
        Random rnd = new Random(batchProperties.getSeed());
        int weeks = batchProperties.getWeeks();
        List<PrescriptionRow> rows = new ArrayList<>();
        for (String product : batchProperties.getProducts()) {
            double base = batchProperties.getBaseVolumes().get(product);
            double price = batchProperties.getPrices().get(product);
            for (String region : batchProperties.getRegions()) {
                double[] series = baseline(base, weeks, rnd);
                Map<Integer, String> eventMap = new HashMap<>();
                for (int start : eventWeeks(weeks, rnd)) {
                    String type = EVENT_TYPES[rnd.nextInt(EVENT_TYPES.length)];
                    int duration = inject(series, type, start, rnd);
                    for (int d = 0; d < duration; d++) {
                        eventMap.put(start + d, type);
                    }
                    log.debug("{} - {}: {} at week {} for {} weeks", product, region, type, start, duration);
                }
                for (int i = 0; i < weeks; i++) {
                    long units = Math.round(series[i]);
                    rows.add(PrescriptionRow.builder()
                            .date(batchProperties.getStartDate().plusWeeks(i))
                            .product(product)
                            .region(region)
                            .units(units)
                            .pricePerUnit(price)
                            .revenue(units * price)
                            .eventType(eventMap.getOrDefault(i, TemporalEventGrouper.INACTIVE))
                            .build());
                }
            }
        }
        return rows;
    }

    public void writeCsv(Path target) {
        List<PrescriptionRow> rows = generate();
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            try (CSVWriter writer = new CSVWriter(Files.newBufferedWriter(target, StandardCharsets.UTF_8))) {
                writer.writeNext(PrescriptionCsvLoader.REQUIRED_COLUMNS.toArray(new String[0]), false);
                for (PrescriptionRow row : rows) {
                    writer.writeNext(new String[]{
                            row.getDate().toString(),
                            row.getProduct(),
                            row.getRegion(),
                            Long.toString(row.getUnits()),
                            Double.toString(row.getPricePerUnit()),
                            Double.toString(row.getRevenue()),
                            row.getEventType()
                    }, false);
                }
            }
        } catch (IOException e) {
            throw new UptakeException("Failed to write synthetic data to " + target, e);
        }
        log.info("Synthetic prescription data generated: {} rows at {}", rows.size(), target);
    }

    static double[] baseline(double base, int weeks, Random rnd) {
        double[] series = new double[weeks];
        for (int t = 0; t < weeks; t++) {
            double trend = 1 + 0.015 * t / 52.0;
            double seasonality = 1 + 0.25 * Math.sin(2 * Math.PI * t / 52.0);
            double noise = rnd.nextGaussian() * 0.08;
            series[t] = Math.max(base * trend * seasonality * (1 + noise), 0);
        }
        return series;
    }

    /** One or two distinct start weeks in [margin, weeks - margin). */
    static int[] eventWeeks(int weeks, Random rnd) {
        int count = 1 + rnd.nextInt(2);
        int span = weeks - 2 * EVENT_MARGIN_WEEKS;
        int first = EVENT_MARGIN_WEEKS + rnd.nextInt(span);
        if (count == 1) {
            return new int[]{first};
        }
        int second;
        do {
            second = EVENT_MARGIN_WEEKS + rnd.nextInt(span);
        } while (second == first);
        return new int[]{first, second};
    }

    /** Applies the event in place and returns its duration in weeks. */
    static int inject(double[] series, String type, int start, Random rnd) {
        int duration;
        switch (type) {
            case SUPPLY_ISSUE -> {
                duration = 3 + rnd.nextInt(4);
                double impact = 0.35 + rnd.nextDouble() * 0.20;
                scale(series, start, duration, 1 - impact);
            }
            case COMPETITOR_ENTRY -> {
                duration = 8 + rnd.nextInt(7);
                for (int i = 0; i < duration && start + i < series.length; i++) {
                    double decay = 0.1 + 0.3 * i / (duration - 1);
                    series[start + i] *= (1 - decay);
                }
            }
            case PROMOTION -> {
                duration = 2 + rnd.nextInt(3);
                double lift = 0.25 + rnd.nextDouble() * 0.15;
                scale(series, start, duration, 1 + lift);
            }
            default -> throw new IllegalArgumentException("Unknown event type: " + type + ", expected one of "
                    + Arrays.toString(EVENT_TYPES));
        }
        return Math.min(duration, series.length - start);
    }

    private static void scale(double[] series, int start, int duration, double factor) {
        for (int i = start; i < start + duration && i < series.length; i++) {
            series[i] *= factor;
        }
    }
}

package com.motaz.uptake.batch;

import com.motaz.uptake.batch.service.BacktestRunnerService;
import com.motaz.uptake.batch.service.PrescriptionIngestService;
import com.motaz.uptake.batch.service.SyntheticDataService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Dispatches on the first program argument:
 * {@code generate <csv>}, {@code ingest <csv>},
 * {@code backtest <product> <region> <price_per_unit>} and {@code backtest-all}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchCommands implements CommandLineRunner {

    static final String USAGE = "usage: generate <csv> | ingest <csv> | backtest <product> <region> <price_per_unit> | backtest-all";

    private final SyntheticDataService syntheticDataService;
    private final PrescriptionIngestService ingestService;
    private final BacktestRunnerService backtestRunnerService;

    @Override
    public void run(String... args) {
        if (args.length == 0) {
            log.info(USAGE);
            return;
        }
        switch (args[0]) {
            case "generate" -> {
                requireArgs(args, 2);
                log.info("Generating synthetic prescriptions...");
                syntheticDataService.writeCsv(Path.of(args[1]));
                log.info("Generating synthetic prescriptions Completed...");
            }
            case "ingest" -> {
                requireArgs(args, 2);
                log.info("Ingesting {}...", args[1]);
                int rows = ingestService.ingest(Path.of(args[1]));
                log.info("Ingestion Completed: {} rows written", rows);
            }
            case "backtest" -> {
                requireArgs(args, 4);
                backtestRunnerService.runBacktest(args[1], args[2], parsePrice(args[3]));
            }
            case "backtest-all" -> backtestRunnerService.backtestAll();
            default -> throw new IllegalArgumentException("Unknown command '" + args[0] + "'. " + USAGE);
        }
    }

    private static void requireArgs(String[] args, int count) {
        if (args.length < count) {
            throw new IllegalArgumentException(USAGE);
        }
    }

    private static double parsePrice(String value) {
        try {
            double price = Double.parseDouble(value);
            if (price <= 0) {
                throw new IllegalArgumentException("price_per_unit must be positive: " + value);
            }
            return price;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("price_per_unit is not a number: " + value, e);
        }
    }
}

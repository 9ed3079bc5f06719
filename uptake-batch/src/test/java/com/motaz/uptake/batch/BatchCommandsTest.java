package com.motaz.uptake.batch;

import com.motaz.uptake.batch.service.BacktestRunnerService;
import com.motaz.uptake.batch.service.PrescriptionIngestService;
import com.motaz.uptake.batch.service.SyntheticDataService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class BatchCommandsTest {

    @Mock
    private SyntheticDataService syntheticDataService;

    @Mock
    private PrescriptionIngestService ingestService;

    @Mock
    private BacktestRunnerService backtestRunnerService;

    @InjectMocks
    private BatchCommands commands;

    @Test
    void noArgumentsDoesNothing() {
        commands.run();

        verifyNoInteractions(syntheticDataService, ingestService, backtestRunnerService);
    }

    @Test
    void dispatchesEachCommand() {
        commands.run("generate", "data/prescriptions.csv");
        commands.run("ingest", "data/prescriptions.csv");
        commands.run("backtest", "Drug_A", "North", "450");
        commands.run("backtest-all");

        verify(syntheticDataService).writeCsv(Path.of("data/prescriptions.csv"));
        verify(ingestService).ingest(Path.of("data/prescriptions.csv"));
        verify(backtestRunnerService).runBacktest("Drug_A", "North", 450.0);
        verify(backtestRunnerService).backtestAll();
    }

    @Test
    void rejectsUnknownCommandsAndBadPrices() {
        assertThatThrownBy(() -> commands.run("train")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> commands.run("backtest", "Drug_A", "North")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> commands.run("backtest", "Drug_A", "North", "free"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("free");
        assertThatThrownBy(() -> commands.run("backtest", "Drug_A", "North", "-1"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

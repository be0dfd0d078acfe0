package org.nowstart.crossover.backtest.runner;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.crossover.backtest.model.BacktestMetrics;
import org.nowstart.crossover.backtest.model.CrossoverParams;
import org.nowstart.crossover.backtest.model.GridSearchRow;
import org.nowstart.crossover.backtest.model.PricePoint;
import org.nowstart.crossover.backtest.model.PriceSeries;
import org.nowstart.crossover.backtest.model.WindowGrid;
import org.nowstart.crossover.backtest.service.BacktestEngineFactory;
import org.nowstart.crossover.backtest.service.MetricsCalculator;
import org.nowstart.crossover.backtest.service.MetricsReportFormatter;
import org.nowstart.crossover.backtest.service.PriceSeriesCsvLoader;
import org.nowstart.crossover.backtest.service.ReturnsSimulator;
import org.nowstart.crossover.backtest.service.SignalGenerator;
import org.nowstart.crossover.backtest.service.WindowGridSearchService;
import org.nowstart.crossover.data.exception.InsufficientDataException;
import org.nowstart.crossover.data.property.BacktestProperties;
import org.springframework.boot.DefaultApplicationArguments;

@ExtendWith(MockitoExtension.class)
class BacktestRunnerTest {

    @Mock
    private PriceSeriesCsvLoader csvLoader;

    @Mock
    private WindowGridSearchService gridSearchService;

    private final BacktestEngineFactory engineFactory = new BacktestEngineFactory(
            new SignalGenerator(),
            new ReturnsSimulator(),
            new MetricsCalculator()
    );

    @Test
    void run_skipsWhenDisabled() {
        BacktestRunner runner = runner(properties(false, "prices.csv", 2, 5, false));

        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(csvLoader, gridSearchService);
    }

    @Test
    void run_requiresCsvPathWhenEnabled() {
        BacktestRunner runner = runner(properties(true, " ", 2, 5, false));

        assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("csv-path");
        verifyNoInteractions(csvLoader);
    }

    @Test
    void run_loadsCsvAndRunsBacktestWithoutGrid() {
        when(csvLoader.load(Path.of("prices.csv"))).thenReturn(rising(40));
        MetricsReportFormatter formatter = spy(new MetricsReportFormatter());
        BacktestRunner runner = new BacktestRunner(
                properties(true, "prices.csv", 2, 5, false),
                csvLoader,
                engineFactory,
                gridSearchService,
                formatter
        );

        runner.run(new DefaultApplicationArguments());

        verify(csvLoader).load(Path.of("prices.csv"));
        verify(formatter).formatReport(any(BacktestMetrics.class));
        verifyNoInteractions(gridSearchService);
    }

    @Test
    void run_executesGridSearchWhenEnabled() {
        PriceSeries series = rising(40);
        when(csvLoader.load(Path.of("prices.csv"))).thenReturn(series);
        when(gridSearchService.search(eq(series), any(WindowGrid.class), eq(0.001), eq(3), eq(2), eq(5)))
                .thenReturn(List.of(new GridSearchRow(CrossoverParams.of(2, 10), new BacktestMetrics(0.4, 0.2, 3.1, 0.0), 1)));
        BacktestRunner runner = runner(properties(true, "prices.csv", 2, 5, true));

        runner.run(new DefaultApplicationArguments());

        verify(gridSearchService).search(
                eq(series),
                eq(WindowGrid.parse("2:4:1", "5:20:5")),
                eq(0.001),
                eq(3),
                eq(2),
                eq(5)
        );
    }

    @Test
    void run_propagatesEngineFailure() {
        when(csvLoader.load(Path.of("prices.csv"))).thenReturn(rising(10));
        BacktestRunner runner = runner(properties(true, "prices.csv", 5, 50, false));

        assertThatThrownBy(() -> runner.run(new DefaultApplicationArguments()))
                .isInstanceOf(InsufficientDataException.class);
    }

    private BacktestRunner runner(BacktestProperties properties) {
        return new BacktestRunner(properties, csvLoader, engineFactory, gridSearchService, new MetricsReportFormatter());
    }

    private BacktestProperties properties(boolean enabled, String csvPath, int shortWindow, int longWindow, boolean gridEnabled) {
        return new BacktestProperties(
                enabled,
                csvPath,
                "TEST",
                shortWindow,
                longWindow,
                0.001,
                gridEnabled,
                "2:4:1",
                "5:20:5",
                3,
                2,
                5
        );
    }

    private PriceSeries rising(int n) {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        List<PricePoint> points = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            points.add(new PricePoint(start.plus(i, ChronoUnit.DAYS), 100.0 + i));
        }
        return PriceSeries.of(points);
    }
}

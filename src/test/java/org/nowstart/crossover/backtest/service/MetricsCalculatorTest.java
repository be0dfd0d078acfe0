package org.nowstart.crossover.backtest.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.crossover.backtest.model.BacktestMetrics;
import org.nowstart.crossover.backtest.model.ReturnsRow;
import org.nowstart.crossover.data.exception.BacktestStateException;

class MetricsCalculatorTest {

    private final MetricsCalculator calculator = new MetricsCalculator();

    @Test
    void calculate_totalReturnIsLastCumulativeReturn() {
        List<ReturnsRow> rows = rows(new double[]{0.0, 0.1, 0.1}, new double[]{0.0, 0.1, 0.21});

        BacktestMetrics metrics = calculator.calculate(rows, 504);

        assertThat(metrics.totalReturn()).isCloseTo(0.21, within(1e-9));
        assertThat(metrics.annualizedReturn()).isCloseTo(Math.pow(1.21, 0.5) - 1.0, within(1e-12));
    }

    @Test
    void annualizedReturn_usesFullSeriesLength() {
        List<ReturnsRow> rows = rows(new double[]{0.0, 0.1}, new double[]{0.0, 0.1});

        assertThat(calculator.calculate(rows, 252).annualizedReturn()).isCloseTo(0.1, within(1e-12));
        assertThat(calculator.calculate(rows, 126).annualizedReturn()).isCloseTo(0.21, within(1e-12));
    }

    @Test
    void sharpeRatio_usesSampleStandardDeviation() {
        List<ReturnsRow> rows = rows(new double[]{0.01, 0.02, 0.03}, new double[]{0.0, 0.0, 0.0});

        assertThat(calculator.sharpeRatio(rows)).isCloseTo(Math.sqrt(252) * 2.0, within(1e-9));
    }

    @Test
    void sharpeRatio_passesThroughZeroVarianceResult() {
        List<ReturnsRow> zeros = rows(new double[]{0.0, 0.0, 0.0}, new double[]{0.0, 0.0, 0.0});
        List<ReturnsRow> constant = rows(new double[]{0.01, 0.01}, new double[]{0.01, 0.0201});
        List<ReturnsRow> single = rows(new double[]{0.01}, new double[]{0.01});

        assertThat(calculator.sharpeRatio(zeros)).isNaN();
        assertThat(calculator.sharpeRatio(constant)).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(calculator.sharpeRatio(single)).isNaN();
    }

    @Test
    void maxDrawdown_measuresLargestDropFromRunningPeak() {
        List<ReturnsRow> rows = rows(new double[4], new double[]{0.1, 0.21, 0.0, 0.05});

        assertThat(calculator.maxDrawdown(rows)).isCloseTo(1.0 / 1.21 - 1.0, within(1e-12));
    }

    @Test
    void maxDrawdown_isSeededByFirstRow() {
        List<ReturnsRow> rows = rows(new double[2], new double[]{-0.1, -0.2});

        assertThat(calculator.maxDrawdown(rows)).isCloseTo(0.8 / 0.9 - 1.0, within(1e-12));
    }

    @Test
    void maxDrawdown_isZeroForNonDecreasingCurve() {
        List<ReturnsRow> rows = rows(new double[4], new double[]{0.0, 0.0, 0.05, 0.1});

        assertThat(calculator.maxDrawdown(rows)).isZero();
    }

    @Test
    void calculate_skipsFirstRowInSharpeAndDrawdown() {
        List<ReturnsRow> rows = rows(new double[]{0.0, 0.01, 0.02, 0.03}, new double[]{0.0, -0.1, -0.2, -0.15});

        BacktestMetrics metrics = calculator.calculate(rows, 4);

        assertThat(metrics.sharpeRatio()).isCloseTo(Math.sqrt(252) * 2.0, within(1e-9));
        assertThat(metrics.maxDrawdown()).isCloseTo(0.8 / 0.9 - 1.0, within(1e-12));
        assertThat(metrics.totalReturn()).isCloseTo(-0.15, within(1e-12));
    }

    @Test
    void calculate_singleRowHasNoObservations() {
        BacktestMetrics metrics = calculator.calculate(rows(new double[]{0.0}, new double[]{0.0}), 5);

        assertThat(metrics.sharpeRatio()).isNaN();
        assertThat(metrics.maxDrawdown()).isZero();
        assertThat(calculator.maxDrawdown(List.of())).isZero();
    }

    @Test
    void calculate_requiresCompletedRows() {
        assertThatThrownBy(() -> calculator.calculate(null, 10))
                .isInstanceOf(BacktestStateException.class)
                .hasMessage("Backtest not run yet.");
        assertThatThrownBy(() -> calculator.calculate(List.of(), 10))
                .isInstanceOf(BacktestStateException.class);
    }

    @Test
    void calculate_rejectsSeriesShorterThanRows() {
        List<ReturnsRow> rows = rows(new double[3], new double[3]);

        assertThatThrownBy(() -> calculator.calculate(rows, 2))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private List<ReturnsRow> rows(double[] netReturns, double[] cumulativeReturns) {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        List<ReturnsRow> rows = new ArrayList<>();
        for (int i = 0; i < netReturns.length; i++) {
            rows.add(new ReturnsRow(
                    start.plusSeconds(86_400L * i),
                    100.0,
                    100.0,
                    100.0,
                    -1,
                    0,
                    0.0,
                    netReturns[i],
                    0.0,
                    netReturns[i],
                    cumulativeReturns[i],
                    0.0
            ));
        }
        return rows;
    }
}

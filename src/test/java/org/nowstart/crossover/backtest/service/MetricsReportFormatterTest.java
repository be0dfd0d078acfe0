package org.nowstart.crossover.backtest.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;
import org.nowstart.crossover.backtest.model.BacktestMetrics;

class MetricsReportFormatterTest {

    private final MetricsReportFormatter formatter = new MetricsReportFormatter();

    @Test
    void format_rendersReturnsAsPercentAndSharpeAsRatio() {
        Map<String, String> report = formatter.format(new BacktestMetrics(0.1234, 0.05, 1.5, -0.2));

        assertThat(report).containsExactly(
                Map.entry("Total Return", "12.34%"),
                Map.entry("Annualized Return", "5.00%"),
                Map.entry("Sharpe Ratio", "1.50"),
                Map.entry("Max Drawdown", "-20.00%")
        );
    }

    @Test
    void format_passesNonFiniteValuesThrough() {
        Map<String, String> report = formatter.format(new BacktestMetrics(0.0, 0.0, Double.NaN, 0.0));

        assertThat(report).containsEntry("Sharpe Ratio", "NaN");
        assertThat(formatter.formatPercent(Double.NEGATIVE_INFINITY)).isEqualTo("-Infinity");
    }

    @Test
    void formatReport_padsNamesIntoColumn() {
        String report = formatter.formatReport(new BacktestMetrics(0.1, 0.1, 2.0, -0.05));

        assertThat(report).contains("Total Return         10.00%");
        assertThat(report).contains("Max Drawdown         -5.00%");
        assertThat(report.lines()).hasSize(4);
    }
}

package org.nowstart.crossover.backtest.model;

import java.util.List;

public record BacktestResult(
        CrossoverParams params,
        int seriesLength,
        List<ReturnsRow> rows,
        BacktestMetrics metrics,
        int positionChanges
) {
    public BacktestResult {
        rows = List.copyOf(rows);
    }

    public List<ChartPoint> chartData() {
        return rows.stream().map(ChartPoint::from).toList();
    }

    public String range() {
        return rows.get(0).timestamp() + " -> " + rows.get(rows.size() - 1).timestamp();
    }
}

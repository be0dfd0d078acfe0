package org.nowstart.crossover.data.dto;

import java.util.List;
import org.nowstart.crossover.backtest.model.BacktestMetrics;
import org.nowstart.crossover.backtest.model.BacktestResult;
import org.nowstart.crossover.backtest.model.ChartPoint;
import org.nowstart.crossover.backtest.model.CrossoverParams;

public record BacktestResponse(
        String ticker,
        CrossoverParams params,
        int seriesLength,
        int positionChanges,
        BacktestMetrics metrics,
        List<ChartPoint> chart
) {
    public static BacktestResponse of(String ticker, BacktestResult result) {
        return new BacktestResponse(
                ticker,
                result.params(),
                result.seriesLength(),
                result.positionChanges(),
                result.metrics(),
                result.chartData()
        );
    }
}

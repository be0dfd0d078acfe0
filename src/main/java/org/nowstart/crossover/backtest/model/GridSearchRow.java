package org.nowstart.crossover.backtest.model;

public record GridSearchRow(
        CrossoverParams params,
        BacktestMetrics metrics,
        int positionChanges
) {}

package org.nowstart.crossover.backtest.model;

public record BacktestMetrics(
        double totalReturn,
        double annualizedReturn,
        double sharpeRatio,
        double maxDrawdown
) {}

package org.nowstart.crossover.backtest.model;

public record CrossoverParams(
        int shortWindow,
        int longWindow,
        double costRate
) {
    public static final double DEFAULT_COST_RATE = 0.001;

    public static CrossoverParams of(int shortWindow, int longWindow) {
        return new CrossoverParams(shortWindow, longWindow, DEFAULT_COST_RATE);
    }
}

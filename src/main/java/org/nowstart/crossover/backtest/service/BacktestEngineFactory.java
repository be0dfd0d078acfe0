package org.nowstart.crossover.backtest.service;

import lombok.RequiredArgsConstructor;
import org.nowstart.crossover.backtest.model.PriceSeries;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class BacktestEngineFactory {

    private final SignalGenerator signalGenerator;
    private final ReturnsSimulator returnsSimulator;
    private final MetricsCalculator metricsCalculator;

    public BacktestEngine create(PriceSeries series) {
        return new BacktestEngine(series, signalGenerator, returnsSimulator, metricsCalculator);
    }
}

package org.nowstart.crossover.backtest.service;

import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.crossover.backtest.model.BacktestMetrics;
import org.nowstart.crossover.backtest.model.BacktestResult;
import org.nowstart.crossover.backtest.model.ChartPoint;
import org.nowstart.crossover.backtest.model.CrossoverParams;
import org.nowstart.crossover.backtest.model.PriceSeries;
import org.nowstart.crossover.backtest.model.ReturnsRow;
import org.nowstart.crossover.backtest.model.SignalRow;
import org.nowstart.crossover.data.exception.BacktestStateException;
import org.nowstart.crossover.data.exception.InsufficientDataException;
import org.nowstart.crossover.data.exception.InvalidParameterException;

/**
 * Runs the crossover simulation over one price series and keeps the latest result.
 * Instances are not shared between threads running different backtests; create one per series.
 */
@Slf4j
public class BacktestEngine {

    private final PriceSeries priceSeries;
    private final SignalGenerator signalGenerator;
    private final ReturnsSimulator returnsSimulator;
    private final MetricsCalculator metricsCalculator;

    private volatile BacktestResult lastResult;

    public BacktestEngine(
            PriceSeries priceSeries,
            SignalGenerator signalGenerator,
            ReturnsSimulator returnsSimulator,
            MetricsCalculator metricsCalculator
    ) {
        if (priceSeries == null) {
            throw new IllegalArgumentException("price series is required");
        }
        this.priceSeries = priceSeries;
        this.signalGenerator = signalGenerator;
        this.returnsSimulator = returnsSimulator;
        this.metricsCalculator = metricsCalculator;
    }

    public BacktestEngine(PriceSeries priceSeries) {
        this(priceSeries, new SignalGenerator(), new ReturnsSimulator(), new MetricsCalculator());
    }

    public BacktestResult run(int shortWindow, int longWindow) {
        return run(shortWindow, longWindow, CrossoverParams.DEFAULT_COST_RATE);
    }

    public BacktestResult run(int shortWindow, int longWindow, double costRate) {
        return run(new CrossoverParams(shortWindow, longWindow, costRate));
    }

    public BacktestResult run(CrossoverParams params) {
        validate(params);

        List<SignalRow> signals = signalGenerator.generate(priceSeries, params.shortWindow(), params.longWindow());
        List<SignalRow> retained = signalGenerator.retain(signals);
        if (retained.isEmpty()) {
            throw new InsufficientDataException(
                    "no rows remain after warm-up: series=" + priceSeries.size() + " params=" + params);
        }

        List<ReturnsRow> rows = returnsSimulator.simulate(retained, priceSeries, params.costRate());
        BacktestMetrics metrics = metricsCalculator.calculate(rows, priceSeries.size());
        int positionChanges = (int) rows.stream().filter(row -> row.positionChange() != 0).count();

        BacktestResult result = new BacktestResult(params, priceSeries.size(), rows, metrics, positionChanges);
        lastResult = result;
        log.debug("[Backtest][RUN] params={} series={} retained={} metrics={}",
                params, priceSeries.size(), rows.size(), metrics);
        return result;
    }

    public Optional<BacktestResult> lastResult() {
        return Optional.ofNullable(lastResult);
    }

    public BacktestMetrics metrics() {
        return requireResult().metrics();
    }

    public List<ReturnsRow> results() {
        return requireResult().rows();
    }

    public List<ChartPoint> chartData() {
        return requireResult().chartData();
    }

    private BacktestResult requireResult() {
        return lastResult().orElseThrow(() -> new BacktestStateException("Backtest not run yet."));
    }

    private void validate(CrossoverParams params) {
        if (params == null) {
            throw new InvalidParameterException("crossover params are required");
        }
        if (params.shortWindow() < 1 || params.longWindow() < 1) {
            throw new InvalidParameterException(
                    "windows must be >= 1, got short=" + params.shortWindow() + " long=" + params.longWindow());
        }
        if (!Double.isFinite(params.costRate()) || params.costRate() < 0.0) {
            throw new InvalidParameterException("cost rate must be a finite value >= 0, got: " + params.costRate());
        }
        int n = priceSeries.size();
        if (params.shortWindow() > n || params.longWindow() > n) {
            throw new InsufficientDataException(
                    "series has " + n + " rows, shorter than window short=" + params.shortWindow() + " long=" + params.longWindow());
        }
    }
}

package org.nowstart.crossover.backtest.service;

import java.util.List;
import org.nowstart.crossover.backtest.model.BacktestMetrics;
import org.nowstart.crossover.backtest.model.ReturnsRow;
import org.nowstart.crossover.data.exception.BacktestStateException;
import org.springframework.stereotype.Service;

@Service
public class MetricsCalculator {

    public static final int TRADING_DAYS_PER_YEAR = 252;

    public BacktestMetrics calculate(List<ReturnsRow> rows, int seriesLength) {
        if (rows == null || rows.isEmpty()) {
            throw new BacktestStateException("Backtest not run yet.");
        }
        if (seriesLength < rows.size()) {
            throw new IllegalArgumentException("series length " + seriesLength + " is shorter than " + rows.size() + " result rows");
        }

        double totalReturn = rows.get(rows.size() - 1).cumulativeReturn();
        // The first row holds no lagged position, so it is not a return observation.
        List<ReturnsRow> observed = rows.subList(1, rows.size());
        return new BacktestMetrics(
                totalReturn,
                annualizedReturn(totalReturn, seriesLength),
                sharpeRatio(observed),
                maxDrawdown(observed)
        );
    }

    double annualizedReturn(double totalReturn, int seriesLength) {
        // Annualized over the full input length, warm-up rows included, not over the simulated rows.
        return Math.pow(1.0 + totalReturn, (double) TRADING_DAYS_PER_YEAR / seriesLength) - 1.0;
    }

    double sharpeRatio(List<ReturnsRow> rows) {
        int n = rows.size();
        double sum = 0.0;
        for (ReturnsRow row : rows) {
            sum += row.netReturn();
        }
        double mean = sum / n;

        double squares = 0.0;
        for (ReturnsRow row : rows) {
            double diff = row.netReturn() - mean;
            squares += diff * diff;
        }
        // Sample deviation; zero or undefined deviation, or an empty sample, yields NaN or infinity.
        double stddev = Math.sqrt(squares / (n - 1));
        return Math.sqrt(TRADING_DAYS_PER_YEAR) * mean / stddev;
    }

    double maxDrawdown(List<ReturnsRow> rows) {
        if (rows.isEmpty()) {
            return 0.0;
        }
        double peak = 1.0 + rows.get(0).cumulativeReturn();
        double mdd = 0.0;
        for (ReturnsRow row : rows) {
            double wealth = 1.0 + row.cumulativeReturn();
            peak = Math.max(peak, wealth);
            mdd = Math.min(mdd, wealth / peak - 1.0);
        }
        return mdd;
    }
}

package org.nowstart.crossover.backtest.service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.nowstart.crossover.backtest.model.PriceSeries;
import org.nowstart.crossover.backtest.model.SignalRow;
import org.nowstart.crossover.data.exception.InvalidParameterException;
import org.springframework.stereotype.Service;

@Service
public class SignalGenerator {

    public static final int LONG = 1;
    public static final int SHORT = -1;

    // Position assumed before the first defined signal; a missing average never compares greater.
    static final int WARMUP_POSITION = SHORT;

    public double[] movingAverage(PriceSeries series, int window) {
        int n = series.size();
        if (window < 1 || window > n) {
            throw new InvalidParameterException("window must be in [1, " + n + "], got: " + window);
        }

        double[] prices = series.prices();
        double[] ma = new double[n];
        Arrays.fill(ma, Double.NaN);
        for (int i = window - 1; i < n; i++) {
            double sum = 0.0;
            for (int k = i - window + 1; k <= i; k++) {
                sum += prices[k];
            }
            ma[i] = sum / window;
        }
        return ma;
    }

    public Integer signal(double shortMa, double longMa) {
        if (Double.isNaN(shortMa) || Double.isNaN(longMa)) {
            return null;
        }
        // Strict comparison: equal averages stay short.
        return shortMa > longMa ? LONG : SHORT;
    }

    public Integer[] positionChange(Integer[] signals) {
        Integer[] changes = new Integer[signals.length];
        for (int i = 1; i < signals.length; i++) {
            if (signals[i] == null) {
                continue;
            }
            int previous = signals[i - 1] != null ? signals[i - 1] : WARMUP_POSITION;
            changes[i] = signals[i] - previous;
        }
        return changes;
    }

    public List<SignalRow> generate(PriceSeries series, int shortWindow, int longWindow) {
        double[] shortMa = movingAverage(series, shortWindow);
        double[] longMa = movingAverage(series, longWindow);

        int n = series.size();
        Integer[] signals = new Integer[n];
        for (int i = 0; i < n; i++) {
            signals[i] = signal(shortMa[i], longMa[i]);
        }
        Integer[] changes = positionChange(signals);

        List<SignalRow> rows = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            rows.add(new SignalRow(
                    i,
                    series.timestamp(i),
                    series.price(i),
                    shortMa[i],
                    longMa[i],
                    signals[i],
                    changes[i]
            ));
        }
        return List.copyOf(rows);
    }

    public List<SignalRow> retain(List<SignalRow> rows) {
        return rows.stream().filter(SignalRow::retained).toList();
    }
}

package org.nowstart.crossover.backtest.service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.nowstart.crossover.backtest.model.BacktestMetrics;
import org.springframework.stereotype.Component;

@Component
public class MetricsReportFormatter {

    public Map<String, String> format(BacktestMetrics metrics) {
        Map<String, String> out = new LinkedHashMap<>();
        out.put("Total Return", formatPercent(metrics.totalReturn()));
        out.put("Annualized Return", formatPercent(metrics.annualizedReturn()));
        out.put("Sharpe Ratio", formatRatio(metrics.sharpeRatio()));
        out.put("Max Drawdown", formatPercent(metrics.maxDrawdown()));
        return out;
    }

    public String formatReport(BacktestMetrics metrics) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : format(metrics).entrySet()) {
            sb.append(String.format(Locale.US, "%-20s %s%n", entry.getKey(), entry.getValue()));
        }
        return sb.toString();
    }

    public String formatPercent(double value) {
        if (!Double.isFinite(value)) {
            return String.valueOf(value);
        }
        return String.format(Locale.US, "%.2f%%", value * 100.0);
    }

    public String formatRatio(double value) {
        if (!Double.isFinite(value)) {
            return String.valueOf(value);
        }
        return String.format(Locale.US, "%.2f", value);
    }
}

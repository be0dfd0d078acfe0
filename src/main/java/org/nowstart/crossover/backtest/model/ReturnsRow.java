package org.nowstart.crossover.backtest.model;

import java.time.Instant;

public record ReturnsRow(
        Instant timestamp,
        double price,
        double shortMa,
        double longMa,
        int signal,
        int positionChange,
        double priceReturn,
        double strategyReturn,
        double transactionCost,
        double netReturn,
        double cumulativeReturn,
        double buyAndHoldReturn
) {}

package org.nowstart.crossover.backtest.model;

import java.time.Instant;

public record ChartPoint(
        Instant timestamp,
        double price,
        double shortMa,
        double longMa,
        int signal,
        double cumulativeReturn,
        double buyAndHoldReturn,
        boolean buy,
        boolean sell
) {

    public static ChartPoint from(ReturnsRow row) {
        return new ChartPoint(
                row.timestamp(),
                row.price(),
                row.shortMa(),
                row.longMa(),
                row.signal(),
                row.cumulativeReturn(),
                row.buyAndHoldReturn(),
                row.positionChange() > 0,
                row.positionChange() < 0
        );
    }
}

package org.nowstart.crossover.backtest.model;

import java.time.Instant;

public record PricePoint(
        Instant timestamp,
        double price
) {}

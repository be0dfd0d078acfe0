package org.nowstart.crossover.backtest.model;

import java.time.Instant;

/**
 * One row of the signal pass. Undefined averages are NaN, an undefined signal or
 * position change is {@code null}.
 */
public record SignalRow(
        int index,
        Instant timestamp,
        double price,
        double shortMa,
        double longMa,
        Integer signal,
        Integer positionChange
) {

    public boolean hasShortMa() {
        return !Double.isNaN(shortMa);
    }

    public boolean hasLongMa() {
        return !Double.isNaN(longMa);
    }

    public boolean hasSignal() {
        return signal != null;
    }

    public boolean hasPositionChange() {
        return positionChange != null;
    }

    /**
     * Rows kept for simulation: both averages and the position change are defined.
     */
    public boolean retained() {
        return hasShortMa() && hasLongMa() && hasPositionChange();
    }
}

package org.nowstart.crossover.data.dto;

import java.util.List;
import org.nowstart.crossover.backtest.model.GridSearchRow;

public record GridSearchResponse(
        String ticker,
        int seriesLength,
        List<GridSearchRow> candidates
) {
}

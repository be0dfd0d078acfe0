package org.nowstart.crossover.data.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record BacktestRequest(
        String ticker,
        @NotEmpty(message = "prices are required")
        List<@Valid @NotNull(message = "price row must not be null") PricePointRequest> prices,
        @NotNull(message = "shortWindow is required")
        Integer shortWindow,
        @NotNull(message = "longWindow is required")
        Integer longWindow,
        Double costRate
) {
}

package org.nowstart.crossover.data.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.util.List;

public record GridSearchRequest(
        String ticker,
        @NotEmpty(message = "prices are required")
        List<@Valid @NotNull(message = "price row must not be null") PricePointRequest> prices,
        @NotBlank(message = "shortWindows is required")
        String shortWindows,
        @NotBlank(message = "longWindows is required")
        String longWindows,
        Double costRate,
        @Positive(message = "topK must be greater than zero")
        Integer topK
) {
}

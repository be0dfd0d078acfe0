package org.nowstart.crossover.data.dto;

import jakarta.validation.constraints.NotNull;
import java.time.Instant;

public record PricePointRequest(
        @NotNull(message = "timestamp is required")
        Instant timestamp,
        @NotNull(message = "price is required")
        Double price
) {
}

package com.quantpricer.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FutureValueProfileRequest {

    @Valid
    @NotNull(message = "Future is required")
    private FuturePricingRequest future;

    @NotNull(message = "Valuation time is required")
    @PositiveOrZero(message = "Valuation time must not be negative")
    private Double valuationTime;

    @NotEmpty(message = "At least one spot level is required")
    private List<@NotNull(message = "Spot levels must not contain nulls") Double> spots;
}

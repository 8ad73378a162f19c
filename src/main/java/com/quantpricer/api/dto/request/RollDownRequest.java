package com.quantpricer.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RollDownRequest {

    @Valid
    @NotNull(message = "Bond is required")
    private BondPricingRequest bond;

    /** Years to roll forward. */
    @NotNull(message = "Horizon is required")
    @PositiveOrZero(message = "Horizon must not be negative")
    private Double horizon;
}

package com.quantpricer.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for an equity future. {@code valuationTime} and {@code spotAtValuation} are
 * optional; when both are present the response carries long and short position values.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FuturePricingRequest {

    @NotNull(message = "Spot is required")
    @Positive(message = "Spot must be positive")
    private Double spot;

    /** Read off the curve at maturity when absent. */
    private Double rate;

    private Double dividendYield;

    @NotNull(message = "Maturity is required")
    @Positive(message = "Maturity must be positive")
    private Double maturity;

    @PositiveOrZero(message = "Valuation time must not be negative")
    private Double valuationTime;

    @Positive(message = "Spot at valuation must be positive")
    private Double spotAtValuation;
}

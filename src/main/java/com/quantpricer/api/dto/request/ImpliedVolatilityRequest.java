package com.quantpricer.api.dto.request;

import com.quantpricer.domain.enums.OptionType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for solving the volatility implied by an observed option price.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImpliedVolatilityRequest {

    @NotNull(message = "Option type is required")
    private OptionType type;

    @NotNull(message = "Strike is required")
    @Positive(message = "Strike must be positive")
    private Double strike;

    @NotNull(message = "Maturity is required")
    @Positive(message = "Maturity must be positive")
    private Double maturity;

    @NotNull(message = "Spot is required")
    @Positive(message = "Spot must be positive")
    private Double spot;

    private Double rate;
    private Double dividendYield;
    private Double repoRate;

    @NotNull(message = "Market price is required")
    private Double marketPrice;
}

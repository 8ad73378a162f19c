package com.quantpricer.api.dto.request;

import com.quantpricer.domain.enums.OptionType;
import com.quantpricer.domain.enums.PricingModelType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for pricing a European option with Greeks.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptionPricingRequest {

    @NotNull(message = "Option type is required")
    private OptionType type;

    @NotNull(message = "Strike is required")
    @Positive(message = "Strike must be positive")
    private Double strike;

    /** Years to expiry. */
    @NotNull(message = "Maturity is required")
    @Positive(message = "Maturity must be positive")
    private Double maturity;

    @NotNull(message = "Spot is required")
    @Positive(message = "Spot must be positive")
    private Double spot;

    /** Continuously compounded rate as a decimal. Read off the curve at maturity when absent. */
    private Double rate;

    @NotNull(message = "Volatility is required")
    @Positive(message = "Volatility must be positive")
    private Double volatility;

    /** Defaults to 0. */
    private Double dividendYield;

    /** Defaults to 0. */
    private Double repoRate;

    /** Defaults to ANALYTIC. */
    private PricingModelType model;

    /** Monte Carlo only. */
    @Positive(message = "Path count must be positive")
    private Integer paths;

    /** Monte Carlo only. */
    private Long seed;
}

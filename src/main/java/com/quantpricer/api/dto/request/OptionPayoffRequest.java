package com.quantpricer.api.dto.request;

import com.quantpricer.domain.enums.OptionType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payoff at expiry across spot levels from 50% to 150% of {@code spot}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OptionPayoffRequest {

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

    /** Defaults to 200. */
    @Min(value = 2, message = "A payoff profile needs at least two points")
    @Max(value = 2000, message = "A payoff profile has at most 2000 points")
    private Integer points;
}

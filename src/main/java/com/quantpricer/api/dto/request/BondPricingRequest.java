package com.quantpricer.api.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BondPricingRequest {

    @NotNull(message = "Nominal is required")
    @Positive(message = "Nominal must be positive")
    private Double nominal;

    /** Annual coupon rate as a decimal (0.05 = 5%). */
    @NotNull(message = "Coupon rate is required")
    @PositiveOrZero(message = "Coupon rate must not be negative")
    private Double couponRate;

    @NotNull(message = "Maturity is required")
    @Positive(message = "Maturity must be positive")
    private Double maturity;

    /** Coupons per year. Defaults to 1. */
    @Min(value = 1, message = "Payment frequency must be at least 1")
    private Integer paymentFrequency;

    /** Years from today. Defaults to 0. */
    @PositiveOrZero(message = "Valuation time must not be negative")
    private Double valuationTime;
}

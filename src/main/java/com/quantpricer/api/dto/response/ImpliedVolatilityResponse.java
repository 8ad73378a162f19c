package com.quantpricer.api.dto.response;

import lombok.Builder;
import lombok.Data;

/**
 * Implied volatility solve result. {@code volatility} is null when {@code available} is
 * false, i.e. the market price is outside what any volatility in the solver's bracket can
 * produce.
 */
@Data
@Builder
public class ImpliedVolatilityResponse {

    private boolean available;
    private Double volatility;
    private int evaluations;
    private double marketPrice;

    /** Rate the option was priced at, either quoted or read off the curve. */
    private double rate;
}

package com.quantpricer.domain.model;

import lombok.Value;

/**
 * Result of inverting the analytic model against a market price.
 *
 * <p>When the observed price cannot be reproduced by any volatility in the solver's bracket
 * (price outside no-arbitrage bounds, or the evaluation budget ran out) the solver returns
 * the {@link #UNAVAILABLE} sentinel instead of throwing. An unpriceable quote is an expected
 * market condition, so check {@link #isAvailable()} before using the value.
 */
@Value
public class ImpliedVolatility {

    public static final ImpliedVolatility UNAVAILABLE = new ImpliedVolatility(Double.NaN, 0);

    /** Volatility as a decimal (0.2 = 20%), NaN when unavailable. */
    double volatility;

    /** Pricing-function evaluations spent by the root finder. */
    int evaluations;

    public static ImpliedVolatility of(double volatility, int evaluations) {
        return new ImpliedVolatility(volatility, evaluations);
    }

    public boolean isAvailable() {
        return this != UNAVAILABLE && volatility > 0;
    }
}

package com.quantpricer.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * First and second order option sensitivities.
 *
 * <p>Units are per unit change of the input: vega is dPrice/dSigma for sigma as a decimal
 * (not per 1% vol), rho is dPrice/dRate for the rate as a decimal.
 */
@Value
@Builder
public class Greeks {

    /** dPrice/dSpot. */
    double delta;

    /** d2Price/dSpot2. */
    double gamma;

    /** dPrice/dVolatility. */
    double vega;

    /** dPrice/dRate. */
    double rho;
}

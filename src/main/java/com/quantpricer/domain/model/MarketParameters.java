package com.quantpricer.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Market state a pricing model is constructed with. Dividend yield and repo (borrow) rate
 * both reduce the risk-neutral drift of the underlying.
 *
 * <p>The {@code with*} copies are how finite-difference Greeks bump a single input without
 * touching the model's base state.
 */
@Value
@With
@Builder(toBuilder = true)
public class MarketParameters {

    double spot;
    double rate;
    double volatility;
    double dividendYield;
    double repoRate;

    /** Combined continuous carry yield paid by the underlying. */
    public double carryYield() {
        return dividendYield + repoRate;
    }
}

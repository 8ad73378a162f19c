package com.quantpricer.domain.model;

import com.quantpricer.domain.enums.PricingModelType;
import lombok.Builder;
import lombok.Value;

/**
 * Price and sensitivities of one option under one model.
 *
 * <p>{@code standardError} and {@code paths} are only set for Monte Carlo valuations.
 */
@Value
@Builder
public class OptionValuation {

    PricingModelType model;
    Option option;
    double price;
    Greeks greeks;

    /** Rate the option was priced at, either quoted or read off the curve. */
    double rate;

    double volatility;
    Double standardError;
    Integer paths;
}

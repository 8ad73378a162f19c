package com.quantpricer.domain.enums;

/** Option pricing model selected per request. */
public enum PricingModelType {
    ANALYTIC,
    MONTE_CARLO
}

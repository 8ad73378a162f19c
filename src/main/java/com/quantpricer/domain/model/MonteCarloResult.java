package com.quantpricer.domain.model;

import lombok.Value;

/**
 * Monte Carlo estimate with its sampling error. The standard error is the discounted
 * payoff standard deviation over {@code sqrt(paths)}.
 */
@Value
public class MonteCarloResult {

    double price;
    double standardError;
    int paths;
}

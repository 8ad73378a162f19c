package com.quantpricer.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Numerical settings for the pricing models.
 *
 * <p>Binds to the {@code quantpricer.pricing.*} prefix in application.properties.
 */
@Configuration
@ConfigurationProperties(prefix = "quantpricer.pricing")
@Getter
@Setter
public class PricingProperties {

    /** Paths per Monte Carlo price when a request does not ask for a specific count. */
    private int monteCarloPaths = 100_000;

    /** Upper limit on paths a single request may ask for. */
    private int maxMonteCarloPaths = 2_000_000;

    /** Seed of the per-pricer random stream. Same seed and inputs give the same price. */
    private long monteCarloSeed = 42L;

    /** Whether Monte Carlo Greeks reuse one set of draws across base and bumped prices. */
    private boolean commonRandomNumbers = true;

    /** Finite-difference bump for Monte Carlo Greeks, in the units of the bumped input. */
    private double greekBump = 1e-4;

    /** Lower end of the implied volatility bracket. */
    private double ivLowerBound = 1e-6;

    /** Upper end of the implied volatility bracket (500%). */
    private double ivUpperBound = 5.0;

    /** Absolute accuracy of the Brent solve, in volatility units. */
    private double ivAbsoluteAccuracy = 1e-8;

    /** Pricing-function evaluations allowed per implied volatility solve. */
    private int ivMaxEvaluations = 100;
}

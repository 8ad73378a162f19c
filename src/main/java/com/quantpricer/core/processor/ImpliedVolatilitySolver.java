package com.quantpricer.core.processor;

import com.quantpricer.config.PricingProperties;
import com.quantpricer.domain.model.ImpliedVolatility;
import com.quantpricer.domain.model.Option;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.exception.NoBracketingException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.springframework.stereotype.Component;

/**
 * Implied volatility by Brent's method on {@code model.price(option, sigma) - marketPrice}.
 *
 * <p>The search is bracketed on {@code [ivLowerBound, ivUpperBound]} (default 1e-6 to 500%)
 * with a fixed evaluation budget, so the solve always terminates. When the objective does
 * not change sign across the bracket the observed price is outside what any volatility in
 * range can produce; the solver then returns {@link ImpliedVolatility#UNAVAILABLE} rather
 * than throwing. The failure is reported, not retried: the inputs are deterministic and a
 * retry would fail identically.
 *
 * <p>Stateless and thread-safe; a fresh {@link BrentSolver} is created per solve.
 */
@Slf4j
@Component
public class ImpliedVolatilitySolver {

    private final double lowerBound;
    private final double upperBound;
    private final double absoluteAccuracy;
    private final int maxEvaluations;

    public ImpliedVolatilitySolver(PricingProperties properties) {
        this.lowerBound = properties.getIvLowerBound();
        this.upperBound = properties.getIvUpperBound();
        this.absoluteAccuracy = properties.getIvAbsoluteAccuracy();
        this.maxEvaluations = properties.getIvMaxEvaluations();
    }

    /**
     * Solves the volatility that reprices {@code option} under {@code model} to
     * {@code marketPrice}. Spot, rate and carry are taken from the model.
     *
     * @return the solved volatility, or {@link ImpliedVolatility#UNAVAILABLE}
     */
    public ImpliedVolatility solve(Option option, double marketPrice, BlackScholesModel model) {
        if (!(marketPrice > 0) || !Double.isFinite(marketPrice)) {
            log.debug("Market price {} is not positive, no implied volatility for {}", marketPrice, option);
            return ImpliedVolatility.UNAVAILABLE;
        }

        UnivariateFunction objective = vol -> model.price(option, vol) - marketPrice;
        BrentSolver solver = new BrentSolver(absoluteAccuracy);

        try {
            double vol = solver.solve(maxEvaluations, objective, lowerBound, upperBound);
            return ImpliedVolatility.of(vol, solver.getEvaluations());
        } catch (NoBracketingException e) {
            log.debug(
                    "Price {} for {} not bracketed by vol in [{}, {}], returning UNAVAILABLE",
                    marketPrice,
                    option,
                    lowerBound,
                    upperBound);
            return ImpliedVolatility.UNAVAILABLE;
        } catch (TooManyEvaluationsException e) {
            log.debug("Brent solver hit {} evaluations for {} at price {}", maxEvaluations, option, marketPrice);
            return ImpliedVolatility.UNAVAILABLE;
        }
    }
}

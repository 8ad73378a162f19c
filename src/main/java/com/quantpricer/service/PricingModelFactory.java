package com.quantpricer.service;

import com.quantpricer.config.PricingProperties;
import com.quantpricer.core.processor.BlackScholesModel;
import com.quantpricer.core.processor.MonteCarloPricer;
import com.quantpricer.domain.model.MarketParameters;
import com.quantpricer.exception.ValidationException;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Creates pricing models for a given market state.
 *
 * <p>Models are cheap to build and are created per request rather than cached: the analytic
 * model is stateless, and each Monte Carlo pricer must own its random stream so concurrent
 * requests never interleave draws.
 */
@Component
public class PricingModelFactory {

    private final PricingProperties properties;

    public PricingModelFactory(PricingProperties properties) {
        this.properties = properties;
    }

    public BlackScholesModel analytic(MarketParameters market) {
        return new BlackScholesModel(market);
    }

    public MonteCarloPricer monteCarlo(MarketParameters market) {
        return monteCarlo(market, null, null);
    }

    /**
     * Monte Carlo pricer with optional per-request path count and seed; nulls fall back to
     * the configured defaults.
     */
    public MonteCarloPricer monteCarlo(MarketParameters market, Integer paths, Long seed) {
        int pathCount = paths != null ? paths : properties.getMonteCarloPaths();
        if (pathCount > properties.getMaxMonteCarloPaths()) {
            throw new ValidationException(
                    "Requested path count exceeds the configured maximum",
                    Map.of("paths", pathCount, "max", properties.getMaxMonteCarloPaths()));
        }
        long streamSeed = seed != null ? seed : properties.getMonteCarloSeed();
        return new MonteCarloPricer(
                market, pathCount, streamSeed, properties.isCommonRandomNumbers(), properties.getGreekBump());
    }
}

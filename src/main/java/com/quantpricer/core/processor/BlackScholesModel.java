package com.quantpricer.core.processor;

import com.quantpricer.domain.model.Greeks;
import com.quantpricer.domain.model.MarketParameters;
import com.quantpricer.domain.model.Option;
import com.quantpricer.exception.PricingDomainException;
import java.util.Map;
import lombok.Getter;
import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Closed-form Black-Scholes pricer for European options on an underlying paying a
 * continuous carry yield (dividend yield plus repo/borrow rate).
 *
 * <p>Key formulas, with {@code c = q + repo}:
 * <ul>
 *   <li>d1 = [ln(S/K) + (r - c + sigma^2/2) * T] / (sigma * sqrt(T))
 *   <li>d2 = d1 - sigma * sqrt(T)
 *   <li>Call: S * e^(-cT) * N(d1) - K * e^(-rT) * N(d2)
 *   <li>Put: K * e^(-rT) * N(-d2) - S * e^(-cT) * N(-d1)
 *   <li>Delta: e^(-cT) * N(d1) for calls, e^(-cT) * [N(d1) - 1] for puts
 *   <li>Gamma: e^(-cT) * n(d1) / (S * sigma * sqrt(T))
 *   <li>Vega: S * e^(-cT) * n(d1) * sqrt(T)
 *   <li>Rho: K * T * e^(-rT) * N(d2) for calls, -K * T * e^(-rT) * N(-d2) for puts
 * </ul>
 * With zero carry these reduce to the textbook forms {@code S * N(d1) - K * e^(-rT) * N(d2)}
 * and {@code delta = N(d1)}.
 *
 * <p>Instances are immutable and thread-safe. Every method is a pure function of the
 * construction parameters and its arguments.
 */
@Getter
public class BlackScholesModel {

    // Reusable standard normal distribution (thread-safe for cdf/density)
    private static final NormalDistribution NORM = new NormalDistribution();

    private final MarketParameters market;

    public BlackScholesModel(MarketParameters market) {
        if (!(market.getSpot() > 0)) {
            throw new PricingDomainException("Spot must be positive", Map.of("spot", market.getSpot()));
        }
        this.market = market;
    }

    public double d1(Option option, double vol) {
        requirePositiveVolatility(vol);
        double t = option.getMaturity();
        double drift = market.getRate() - market.carryYield() + 0.5 * vol * vol;
        return (Math.log(market.getSpot() / option.getStrike()) + drift * t) / (vol * Math.sqrt(t));
    }

    public double d2(Option option, double vol) {
        return d1(option, vol) - vol * Math.sqrt(option.getMaturity());
    }

    public double price(Option option) {
        return price(option, market.getVolatility());
    }

    /**
     * Price at an explicit volatility, leaving every other input at the model's state.
     * This is the function the implied volatility solver inverts.
     */
    public double price(Option option, double vol) {
        double d1 = d1(option, vol);
        double d2 = d1 - vol * Math.sqrt(option.getMaturity());
        double carriedSpot = market.getSpot() * carryDiscount(option);
        double discountedStrike = option.getStrike() * rateDiscount(option);

        return switch (option.getType()) {
            case CALL -> carriedSpot * NORM.cumulativeProbability(d1)
                    - discountedStrike * NORM.cumulativeProbability(d2);
            case PUT -> discountedStrike * NORM.cumulativeProbability(-d2)
                    - carriedSpot * NORM.cumulativeProbability(-d1);
        };
    }

    public double delta(Option option) {
        double nd1 = NORM.cumulativeProbability(d1(option, market.getVolatility()));
        return switch (option.getType()) {
            case CALL -> carryDiscount(option) * nd1;
            case PUT -> carryDiscount(option) * (nd1 - 1.0);
        };
    }

    // Gamma and vega are the same for calls and puts
    public double gamma(Option option) {
        double vol = market.getVolatility();
        double d1 = d1(option, vol);
        return carryDiscount(option) * NORM.density(d1) / (market.getSpot() * vol * Math.sqrt(option.getMaturity()));
    }

    public double vega(Option option) {
        double d1 = d1(option, market.getVolatility());
        return market.getSpot() * carryDiscount(option) * NORM.density(d1) * Math.sqrt(option.getMaturity());
    }

    public double rho(Option option) {
        double d2 = d2(option, market.getVolatility());
        double strikeTerm = option.getStrike() * option.getMaturity() * rateDiscount(option);
        return switch (option.getType()) {
            case CALL -> strikeTerm * NORM.cumulativeProbability(d2);
            case PUT -> -strikeTerm * NORM.cumulativeProbability(-d2);
        };
    }

    public Greeks greeks(Option option) {
        return Greeks.builder()
                .delta(delta(option))
                .gamma(gamma(option))
                .vega(vega(option))
                .rho(rho(option))
                .build();
    }

    private double carryDiscount(Option option) {
        return Math.exp(-market.carryYield() * option.getMaturity());
    }

    private double rateDiscount(Option option) {
        return Math.exp(-market.getRate() * option.getMaturity());
    }

    private static void requirePositiveVolatility(double vol) {
        if (!(vol > 0) || !Double.isFinite(vol)) {
            throw new PricingDomainException("Volatility must be positive", Map.of("volatility", vol));
        }
    }
}

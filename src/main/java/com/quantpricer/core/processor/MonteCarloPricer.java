package com.quantpricer.core.processor;

import com.quantpricer.domain.model.Greeks;
import com.quantpricer.domain.model.MarketParameters;
import com.quantpricer.domain.model.MonteCarloResult;
import com.quantpricer.domain.model.Option;
import com.quantpricer.exception.PricingDomainException;
import com.quantpricer.exception.ValidationException;
import java.util.Map;
import lombok.AccessLevel;
import lombok.Getter;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

/**
 * Monte Carlo pricer for European options under Black-Scholes dynamics.
 *
 * <p>The terminal price is sampled from the exact solution of
 * {@code dS = S * ((r - q) dt + sigma dW)}:
 * <pre>
 *   S_T = S_0 * exp((r - q - sigma^2/2) * T + sigma * sqrt(T) * Z),   Z ~ N(0, 1)
 * </pre>
 * one draw per path, and the price is {@code e^(-rT) * mean(payoff(S_T))}.
 *
 * <p>Greeks are central finite differences of re-simulated prices. With
 * {@code commonRandomNumbers} on, the base and bumped prices of one Greek share the same
 * normal draws, so sampling noise cancels in the difference and the estimate behaves like a
 * pathwise derivative. With it off every price draws a fresh sample, which is unbiased but
 * needs a bump far larger than the default for the difference to rise above the noise.
 *
 * <p>The Greek methods without an explicit bump size it from the configured {@code bump}:
 * <ul>
 *   <li>common random numbers: delta, vega and rho use {@code bump}; gamma uses
 *       {@code max(bump, 1% of spot)}, since only paths ending within the spot bump of a
 *       payoff kink contribute to the second difference</li>
 *   <li>independent samples: spot bumps are {@code max(bump, 10% of spot)}, the volatility
 *       bump {@code max(bump, 10% of volatility)} and the rate bump {@code max(bump, 1%)}</li>
 * </ul>
 * The overloads taking a bump use it exactly.
 *
 * <p>Each instance owns a private seeded {@link Well19937c} stream: two pricers built with
 * the same seed and parameters return identical prices. The stream is mutable state, so an
 * instance must not be shared between concurrent callers without external serialization.
 */
@Getter
public class MonteCarloPricer {

    public static final double DEFAULT_BUMP = 1e-4;

    static final double GAMMA_SPOT_FRACTION = 0.01;
    static final double INDEPENDENT_SPOT_FRACTION = 0.10;
    static final double INDEPENDENT_VOLATILITY_FRACTION = 0.10;
    static final double INDEPENDENT_RATE_BUMP = 0.01;

    private final MarketParameters market;
    private final int paths;
    private final long seed;
    private final boolean commonRandomNumbers;

    /** Base bump for the Greek methods that take no explicit bump, scaled as described above. */
    private final double bump;

    @Getter(AccessLevel.NONE)
    private final RandomGenerator random;

    public MonteCarloPricer(MarketParameters market, int paths, long seed, boolean commonRandomNumbers) {
        this(market, paths, seed, commonRandomNumbers, DEFAULT_BUMP);
    }

    public MonteCarloPricer(
            MarketParameters market, int paths, long seed, boolean commonRandomNumbers, double bump) {
        if (paths < 1) {
            throw new ValidationException("Monte Carlo needs at least one path", Map.of("paths", paths));
        }
        if (!(bump > 0) || !Double.isFinite(bump)) {
            throw new ValidationException("Greek bump must be positive", Map.of("bump", bump));
        }
        requireValidMarket(market);
        this.market = market;
        this.paths = paths;
        this.seed = seed;
        this.commonRandomNumbers = commonRandomNumbers;
        this.bump = bump;
        this.random = new Well19937c(seed);
    }

    public double price(Option option) {
        return simulate(option).getPrice();
    }

    /**
     * Price with some inputs overridden for this call only. The model's base state is not
     * modified.
     */
    public double price(Option option, MarketParameters overrides) {
        return simulate(option, overrides).getPrice();
    }

    public MonteCarloResult simulate(Option option) {
        return simulate(option, market);
    }

    public MonteCarloResult simulate(Option option, MarketParameters parameters) {
        requireValidMarket(parameters);
        return run(option, parameters, drawNormals());
    }

    public double delta(Option option) {
        return delta(option, commonRandomNumbers ? bump : independentSpotBump());
    }

    public double delta(Option option, double bump) {
        double[] z = sharedDraws();
        double up = bumpedPrice(option, market.withSpot(market.getSpot() + bump), z);
        double down = bumpedPrice(option, market.withSpot(market.getSpot() - bump), z);
        return (up - down) / (2 * bump);
    }

    public double gamma(Option option) {
        double spotBump = commonRandomNumbers
                ? Math.max(bump, GAMMA_SPOT_FRACTION * market.getSpot())
                : independentSpotBump();
        return gamma(option, spotBump);
    }

    public double gamma(Option option, double bump) {
        double[] z = sharedDraws();
        double up = bumpedPrice(option, market.withSpot(market.getSpot() + bump), z);
        double mid = bumpedPrice(option, market, z);
        double down = bumpedPrice(option, market.withSpot(market.getSpot() - bump), z);
        return (up - 2 * mid + down) / (bump * bump);
    }

    public double vega(Option option) {
        return vega(
                option,
                commonRandomNumbers
                        ? bump
                        : Math.max(bump, INDEPENDENT_VOLATILITY_FRACTION * market.getVolatility()));
    }

    public double vega(Option option, double bump) {
        double[] z = sharedDraws();
        double up = bumpedPrice(option, market.withVolatility(market.getVolatility() + bump), z);
        double down = bumpedPrice(option, market.withVolatility(market.getVolatility() - bump), z);
        return (up - down) / (2 * bump);
    }

    public double rho(Option option) {
        return rho(option, commonRandomNumbers ? bump : Math.max(bump, INDEPENDENT_RATE_BUMP));
    }

    public double rho(Option option, double bump) {
        double[] z = sharedDraws();
        double up = bumpedPrice(option, market.withRate(market.getRate() + bump), z);
        double down = bumpedPrice(option, market.withRate(market.getRate() - bump), z);
        return (up - down) / (2 * bump);
    }

    public Greeks greeks(Option option) {
        return Greeks.builder()
                .delta(delta(option))
                .gamma(gamma(option))
                .vega(vega(option))
                .rho(rho(option))
                .build();
    }

    private double independentSpotBump() {
        return Math.max(bump, INDEPENDENT_SPOT_FRACTION * market.getSpot());
    }

    private double bumpedPrice(Option option, MarketParameters parameters, double[] sharedDraws) {
        requireValidMarket(parameters);
        double[] z = sharedDraws != null ? sharedDraws : drawNormals();
        return run(option, parameters, z).getPrice();
    }

    // null when every price of a Greek must draw its own sample
    private double[] sharedDraws() {
        return commonRandomNumbers ? drawNormals() : null;
    }

    private double[] drawNormals() {
        double[] z = new double[paths];
        for (int i = 0; i < paths; i++) {
            z[i] = random.nextGaussian();
        }
        return z;
    }

    private static MonteCarloResult run(Option option, MarketParameters p, double[] z) {
        double t = option.getMaturity();
        double vol = p.getVolatility();
        double drift = (p.getRate() - p.carryYield() - 0.5 * vol * vol) * t;
        double diffusion = vol * Math.sqrt(t);
        double discount = Math.exp(-p.getRate() * t);

        SummaryStatistics stats = new SummaryStatistics();
        for (double draw : z) {
            double terminal = p.getSpot() * Math.exp(drift + diffusion * draw);
            stats.addValue(discount * option.payoff(terminal));
        }
        double standardError = z.length > 1 ? stats.getStandardDeviation() / Math.sqrt(z.length) : Double.NaN;
        return new MonteCarloResult(stats.getMean(), standardError, z.length);
    }

    private static void requireValidMarket(MarketParameters p) {
        if (!(p.getSpot() > 0)) {
            throw new PricingDomainException("Spot must be positive", Map.of("spot", p.getSpot()));
        }
        if (!(p.getVolatility() > 0) || !Double.isFinite(p.getVolatility())) {
            throw new PricingDomainException("Volatility must be positive", Map.of("volatility", p.getVolatility()));
        }
    }
}

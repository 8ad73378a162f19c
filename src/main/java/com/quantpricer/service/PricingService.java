package com.quantpricer.service;

import com.quantpricer.core.processor.BlackScholesModel;
import com.quantpricer.core.processor.ImpliedVolatilitySolver;
import com.quantpricer.core.processor.MonteCarloPricer;
import com.quantpricer.curve.TermStructure;
import com.quantpricer.domain.enums.PricingModelType;
import com.quantpricer.domain.model.BondValuation;
import com.quantpricer.domain.model.CouponBond;
import com.quantpricer.domain.model.EquityFuture;
import com.quantpricer.domain.model.FutureValuation;
import com.quantpricer.domain.model.ImpliedVolatility;
import com.quantpricer.domain.model.InterestRateSwap;
import com.quantpricer.domain.model.MarketParameters;
import com.quantpricer.domain.model.MonteCarloResult;
import com.quantpricer.domain.model.Option;
import com.quantpricer.domain.model.OptionValuation;
import com.quantpricer.domain.model.SwapValuation;
import com.quantpricer.exception.ValidationException;
import com.quantpricer.observability.PricingMetrics;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Values options, bonds, swaps and futures against a {@link PricingContext}.
 *
 * <p>Option valuations take a fully resolved {@link MarketParameters}; callers that have no
 * quoted rate read it off the context with {@link PricingContext#rateFor(Double, double)}.
 * Curve-based products are always discounted on the context's curve.
 *
 * <p>Holds no pricing state of its own. Monte Carlo pricers are created per call by
 * {@link PricingModelFactory}, so concurrent valuations never share a random stream.
 */
@Slf4j
@Service
public class PricingService {

    private final PricingModelFactory modelFactory;
    private final ImpliedVolatilitySolver impliedVolatilitySolver;
    private final PricingMetrics pricingMetrics;

    public PricingService(
            PricingModelFactory modelFactory,
            ImpliedVolatilitySolver impliedVolatilitySolver,
            PricingMetrics pricingMetrics) {
        this.modelFactory = modelFactory;
        this.impliedVolatilitySolver = impliedVolatilitySolver;
        this.pricingMetrics = pricingMetrics;
    }

    public OptionValuation valueOption(Option option, MarketParameters market, PricingModelType modelType) {
        return valueOption(option, market, modelType, null, null);
    }

    /**
     * Prices the option and its Greeks under the requested model.
     *
     * @param paths Monte Carlo path count, null for the configured default (ignored for ANALYTIC)
     * @param seed Monte Carlo seed, null for the configured default (ignored for ANALYTIC)
     */
    public OptionValuation valueOption(
            Option option, MarketParameters market, PricingModelType modelType, Integer paths, Long seed) {
        PricingModelType model = modelType != null ? modelType : PricingModelType.ANALYTIC;
        pricingMetrics.recordRequest("option");

        if (model == PricingModelType.MONTE_CARLO) {
            MonteCarloPricer pricer = modelFactory.monteCarlo(market, paths, seed);
            return pricingMetrics.timeMonteCarlo(() -> {
                MonteCarloResult result = pricer.simulate(option);
                log.debug(
                        "Monte Carlo {} priced at {} (se {}, {} paths)",
                        option,
                        result.getPrice(),
                        result.getStandardError(),
                        result.getPaths());
                return OptionValuation.builder()
                        .model(model)
                        .option(option)
                        .price(result.getPrice())
                        .greeks(pricer.greeks(option))
                        .rate(market.getRate())
                        .volatility(market.getVolatility())
                        .standardError(result.getStandardError())
                        .paths(result.getPaths())
                        .build();
            });
        }

        BlackScholesModel analytic = modelFactory.analytic(market);
        return OptionValuation.builder()
                .model(model)
                .option(option)
                .price(analytic.price(option))
                .greeks(analytic.greeks(option))
                .rate(market.getRate())
                .volatility(market.getVolatility())
                .build();
    }

    /**
     * Volatility that reprices the option to {@code marketPrice} under the analytic model.
     * The volatility in {@code market} is ignored. Returns
     * {@link ImpliedVolatility#UNAVAILABLE} when no volatility in the bracket fits.
     */
    public ImpliedVolatility impliedVolatility(Option option, double marketPrice, MarketParameters market) {
        pricingMetrics.recordRequest("implied-volatility");
        ImpliedVolatility iv = impliedVolatilitySolver.solve(option, marketPrice, modelFactory.analytic(market));
        if (!iv.isAvailable()) {
            pricingMetrics.recordImpliedVolatilityUnavailable();
            log.info("No implied volatility for {} at market price {}", option, marketPrice);
        }
        return iv;
    }

    /**
     * Price at {@code valuationTime} plus Macaulay duration and convexity. Duration and
     * convexity are measured from issue (time 0).
     */
    public BondValuation valueBond(CouponBond bond, double valuationTime, PricingContext context) {
        requireValuationTime(valuationTime);
        pricingMetrics.recordRequest("bond");
        TermStructure curve = context.getCurve();
        return BondValuation.builder()
                .valuationTime(valuationTime)
                .price(bond.price(curve, valuationTime))
                .duration(bond.duration(curve))
                .convexity(bond.convexity(curve))
                .cashflows(bond.cashflows())
                .build();
    }

    public SwapValuation valueSwap(InterestRateSwap swap, double valuationTime, PricingContext context) {
        requireValuationTime(valuationTime);
        pricingMetrics.recordRequest("swap");
        TermStructure curve = context.getCurve();
        return SwapValuation.builder()
                .valuationTime(valuationTime)
                .fixedRate(swap.getFixedRate())
                .fixedLegValue(swap.pvFixedLeg(curve, valuationTime))
                .floatingLegValue(swap.pvFloatingLeg(curve, valuationTime))
                .swapRate(swap.swapRate(curve, valuationTime))
                .value(swap.price(curve, valuationTime))
                .fixedLegCashflows(swap.fixedLegCashflows(curve, valuationTime))
                .build();
    }

    /**
     * Forward price, and the long and short mark-to-market when both {@code valuationTime}
     * and {@code spotAtValuation} are given.
     */
    public FutureValuation valueFuture(
            EquityFuture future, Double valuationTime, Double spotAtValuation, PricingContext context) {
        pricingMetrics.recordRequest("future");
        FutureValuation.FutureValuationBuilder valuation =
                FutureValuation.builder().future(future).price(future.price());

        if (valuationTime == null || spotAtValuation == null) {
            return valuation.build();
        }
        requireValuationTime(valuationTime);
        if (valuationTime > future.getMaturity()) {
            throw new ValidationException(
                    "Valuation time is after the future's maturity",
                    Map.of("valuationTime", valuationTime, "maturity", future.getMaturity()));
        }
        double longValue = future.longValue(valuationTime, spotAtValuation, context.getCurve());
        return valuation
                .valuationTime(valuationTime)
                .spotAtValuation(spotAtValuation)
                .longValue(longValue)
                .shortValue(-longValue)
                .build();
    }

    private static void requireValuationTime(double valuationTime) {
        if (!(valuationTime >= 0) || !Double.isFinite(valuationTime)) {
            throw new ValidationException(
                    "Valuation time must be non-negative", Map.of("valuationTime", valuationTime));
        }
    }
}

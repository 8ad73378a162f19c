package com.quantpricer.domain.model;

import com.quantpricer.curve.TermStructure;
import com.quantpricer.exception.PricingDomainException;
import java.util.Map;
import lombok.Value;

/**
 * Equity (or index) future priced with the cost-of-carry model.
 */
@Value
public class EquityFuture {

    double spot;
    double rate;
    double dividendYield;
    double maturity;

    public EquityFuture(double spot, double rate, double dividendYield, double maturity) {
        if (!(spot > 0) || !Double.isFinite(spot)) {
            throw new PricingDomainException("Spot must be positive", Map.of("spot", spot));
        }
        if (!(maturity > 0) || !Double.isFinite(maturity)) {
            throw new PricingDomainException("Maturity must be positive", Map.of("maturity", maturity));
        }
        this.spot = spot;
        this.rate = rate;
        this.dividendYield = dividendYield;
        this.maturity = maturity;
    }

    /**
     * Forward price {@code F0 = S0 * exp((r - q) * T)}.
     */
    public double price() {
        return spot * Math.exp((rate - dividendYield) * maturity);
    }

    /**
     * Mark-to-market of a long position at time {@code t}, given the spot then prevailing
     * and a curve for the remaining tenor:
     * {@code St * exp(-q * (T - t)) - F0 * DF(T - t)}.
     */
    public double longValue(double t, double spotAtT, TermStructure curve) {
        double remaining = maturity - t;
        return spotAtT * Math.exp(-dividendYield * remaining) - price() * curve.discountFactor(remaining);
    }

    public double shortValue(double t, double spotAtT, TermStructure curve) {
        return -longValue(t, spotAtT, curve);
    }
}

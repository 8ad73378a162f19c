package com.quantpricer.domain.model;

import com.quantpricer.domain.enums.OptionType;
import com.quantpricer.exception.PricingDomainException;
import java.util.Map;
import lombok.Value;

/**
 * Immutable European option contract. The payoff is a pure function of the terminal
 * underlying price and the {@link OptionType}.
 */
@Value
public class Option {

    OptionType type;

    /** Strike price, strictly positive. */
    double strike;

    /** Time to expiry in years, strictly positive. */
    double maturity;

    public Option(OptionType type, double strike, double maturity) {
        if (type == null) {
            throw new PricingDomainException("Option type is required");
        }
        if (!(strike > 0) || !Double.isFinite(strike)) {
            throw new PricingDomainException("Strike must be positive", Map.of("strike", strike));
        }
        if (!(maturity > 0) || !Double.isFinite(maturity)) {
            throw new PricingDomainException("Maturity must be positive", Map.of("maturity", maturity));
        }
        this.type = type;
        this.strike = strike;
        this.maturity = maturity;
    }

    public static Option call(double strike, double maturity) {
        return new Option(OptionType.CALL, strike, maturity);
    }

    public static Option put(double strike, double maturity) {
        return new Option(OptionType.PUT, strike, maturity);
    }

    public double payoff(double terminalPrice) {
        return switch (type) {
            case CALL -> Math.max(terminalPrice - strike, 0.0);
            case PUT -> Math.max(strike - terminalPrice, 0.0);
        };
    }

    public Option withMaturity(double newMaturity) {
        return new Option(type, strike, newMaturity);
    }
}

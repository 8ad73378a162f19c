package com.quantpricer.service;

import com.quantpricer.curve.TermStructure;
import com.quantpricer.exception.ValidationException;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Market state shared by every pricing call: the discount curve plus where it came from.
 *
 * <p>Built once and handed by reference to each call instead of living in a process-wide
 * cache. Immutable, so one instance can serve concurrent requests.
 */
@Value
@Builder
public class PricingContext {

    TermStructure curve;
    String curveSource;
    Instant loadedAt;

    public static PricingContext of(TermStructure curve) {
        return PricingContext.builder()
                .curve(curve)
                .curveSource("in-memory")
                .loadedAt(Instant.now())
                .build();
    }

    /**
     * The quoted rate when one is given, otherwise the curve's zero rate for the maturity.
     */
    public double rateFor(Double quotedRate, double maturity) {
        if (quotedRate != null) {
            if (!Double.isFinite(quotedRate)) {
                throw new ValidationException("Rate must be finite");
            }
            return quotedRate;
        }
        return curve.zeroRate(maturity);
    }
}

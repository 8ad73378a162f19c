package com.quantpricer.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * Micrometer metrics for the pricing service:
 * <ul>
 *   <li><b>pricing.requests</b> (counter, tag {@code instrument}): valuations served
 *   <li><b>pricing.iv.unavailable</b> (counter): quotes the implied volatility solver could
 *       not bracket
 *   <li><b>pricing.monte-carlo.latency</b> (timer): wall time of Monte Carlo valuations,
 *       Greeks included
 * </ul>
 */
@Component
public class PricingMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter ivUnavailableCounter;
    private final Timer monteCarloTimer;

    public PricingMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.ivUnavailableCounter = Counter.builder("pricing.iv.unavailable")
                .description("Implied volatility solves that returned no solution")
                .register(meterRegistry);

        this.monteCarloTimer = Timer.builder("pricing.monte-carlo.latency")
                .description("Monte Carlo valuation wall time including Greeks")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(30))
                .register(meterRegistry);
    }

    public void recordRequest(String instrument) {
        Counter.builder("pricing.requests")
                .description("Valuations served, by instrument")
                .tag("instrument", instrument)
                .register(meterRegistry)
                .increment();
    }

    public void recordImpliedVolatilityUnavailable() {
        ivUnavailableCounter.increment();
    }

    public <T> T timeMonteCarlo(Supplier<T> valuation) {
        return monteCarloTimer.record(valuation);
    }
}

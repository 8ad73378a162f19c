package com.quantpricer.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.quantpricer.observability.PricingMetrics;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PricingMetricsTest {

    private SimpleMeterRegistry meterRegistry;
    private PricingMetrics pricingMetrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        pricingMetrics = new PricingMetrics(meterRegistry);
    }

    @Test
    @DisplayName("Requests are counted per instrument tag")
    void requestCounters() {
        pricingMetrics.recordRequest("bond");
        pricingMetrics.recordRequest("bond");
        pricingMetrics.recordRequest("swap");

        assertThat(meterRegistry.get("pricing.requests").tag("instrument", "bond").counter().count())
                .isEqualTo(2.0);
        assertThat(meterRegistry.get("pricing.requests").tag("instrument", "swap").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Unavailable implied volatilities are counted")
    void ivUnavailableCounter() {
        pricingMetrics.recordImpliedVolatilityUnavailable();

        assertThat(meterRegistry.get("pricing.iv.unavailable").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Monte Carlo timer records the call and passes its result through")
    void monteCarloTimer() {
        double result = pricingMetrics.timeMonteCarlo(() -> 8.9);

        Timer timer = meterRegistry.get("pricing.monte-carlo.latency").timer();
        assertThat(result).isEqualTo(8.9);
        assertThat(timer.count()).isEqualTo(1);
    }
}

package com.quantpricer.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.quantpricer.config.PricingProperties;
import com.quantpricer.core.processor.BlackScholesModel;
import com.quantpricer.core.processor.MonteCarloPricer;
import com.quantpricer.domain.model.MarketParameters;
import com.quantpricer.domain.model.Option;
import com.quantpricer.exception.ValidationException;
import com.quantpricer.service.PricingModelFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PricingModelFactoryTest {

    private static final MarketParameters MARKET =
            MarketParameters.builder().spot(100).rate(0.02).volatility(0.20).build();

    private PricingProperties properties;
    private PricingModelFactory factory;

    @BeforeEach
    void setUp() {
        properties = new PricingProperties();
        properties.setMonteCarloPaths(1_000);
        properties.setMaxMonteCarloPaths(10_000);
        properties.setMonteCarloSeed(7L);
        properties.setCommonRandomNumbers(false);
        properties.setGreekBump(0.5);
        factory = new PricingModelFactory(properties);
    }

    @Test
    @DisplayName("Monte Carlo pricer takes its defaults from configuration")
    void configuredDefaults() {
        MonteCarloPricer pricer = factory.monteCarlo(MARKET);

        assertThat(pricer.getPaths()).isEqualTo(1_000);
        assertThat(pricer.getSeed()).isEqualTo(7L);
        assertThat(pricer.isCommonRandomNumbers()).isFalse();
        assertThat(pricer.getBump()).isEqualTo(0.5);
        assertThat(pricer.getMarket()).isEqualTo(MARKET);
    }

    @Test
    @DisplayName("Greeks from a pricer built on the shipped defaults agree with the analytic model")
    void shippedDefaultsGreeks() {
        MonteCarloPricer pricer = new PricingModelFactory(new PricingProperties()).monteCarlo(MARKET);
        BlackScholesModel analytic = factory.analytic(MARKET);
        Option call = Option.call(100, 1);

        assertThat(pricer.getPaths()).isEqualTo(100_000);
        assertThat(pricer.isCommonRandomNumbers()).isTrue();
        assertThat(pricer.delta(call)).isCloseTo(analytic.delta(call), within(0.01));
        assertThat(pricer.gamma(call)).isCloseTo(analytic.gamma(call), within(0.002));
    }

    @Test
    @DisplayName("Request overrides replace path count and seed")
    void overrides() {
        MonteCarloPricer pricer = factory.monteCarlo(MARKET, 5_000, 11L);

        assertThat(pricer.getPaths()).isEqualTo(5_000);
        assertThat(pricer.getSeed()).isEqualTo(11L);
    }

    @Test
    @DisplayName("Each call returns a fresh pricer")
    void freshInstances() {
        assertThat(factory.monteCarlo(MARKET)).isNotSameAs(factory.monteCarlo(MARKET));
    }

    @Test
    @DisplayName("Path count above the configured maximum is rejected")
    void pathLimit() {
        assertThatThrownBy(() -> factory.monteCarlo(MARKET, 20_000, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("maximum");
    }

    @Test
    @DisplayName("Analytic model is built on the given market")
    void analytic() {
        assertThat(factory.analytic(MARKET).getMarket()).isEqualTo(MARKET);
    }
}

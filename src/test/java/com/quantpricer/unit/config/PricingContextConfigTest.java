package com.quantpricer.unit.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.quantpricer.config.PricingContextConfig;
import com.quantpricer.config.PricingProperties;
import com.quantpricer.curve.TermStructureSnapshotStore;
import com.quantpricer.exception.CurveSnapshotException;
import com.quantpricer.service.PricingContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

class PricingContextConfigTest {

    private final PricingContextConfig config = new PricingContextConfig();

    @Test
    @DisplayName("Builds the context from the configured snapshot location")
    void loadsSnapshot() {
        PricingContext context = config.pricingContext(
                new TermStructureSnapshotStore(), new DefaultResourceLoader(), "classpath:data/test_curve.csv");

        assertThat(context.getCurve().size()).isEqualTo(4);
        assertThat(context.getCurveSource()).isEqualTo("classpath:data/test_curve.csv");
        assertThat(context.getLoadedAt()).isNotNull();
    }

    @Test
    @DisplayName("Missing snapshot fails context creation")
    void missingSnapshot() {
        assertThatThrownBy(() -> config.pricingContext(
                        new TermStructureSnapshotStore(), new DefaultResourceLoader(), "classpath:data/missing.csv"))
                .isInstanceOf(CurveSnapshotException.class);
    }

    @Test
    @DisplayName("Pricing defaults match the documented values")
    void pricingDefaults() {
        PricingProperties properties = new PricingProperties();

        assertThat(properties.getMonteCarloPaths()).isEqualTo(100_000);
        assertThat(properties.getMonteCarloSeed()).isEqualTo(42L);
        assertThat(properties.isCommonRandomNumbers()).isTrue();
        assertThat(properties.getIvLowerBound()).isEqualTo(1e-6);
        assertThat(properties.getIvUpperBound()).isEqualTo(5.0);
        assertThat(properties.getIvMaxEvaluations()).isEqualTo(100);
    }
}

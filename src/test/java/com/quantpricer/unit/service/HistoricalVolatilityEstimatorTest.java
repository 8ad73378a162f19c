package com.quantpricer.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.quantpricer.exception.ValidationException;
import com.quantpricer.service.HistoricalVolatilityEstimator;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HistoricalVolatilityEstimatorTest {

    private final HistoricalVolatilityEstimator estimator = new HistoricalVolatilityEstimator();

    @Test
    @DisplayName("Annualizes the sample standard deviation of simple returns with 252 periods")
    void dailyVolatility() {
        // returns +10%, -10%: sample sd = sqrt(0.02)
        double vol = estimator.estimate(List.of(100.0, 110.0, 99.0));

        assertThat(vol).isCloseTo(Math.sqrt(0.02) * Math.sqrt(252), within(1e-12));
    }

    @Test
    @DisplayName("Scales with the requested periods per year")
    void weeklyVolatility() {
        List<Double> closes = List.of(100.0, 102.0, 101.0, 104.0, 103.5);

        double daily = estimator.estimate(closes, 252);
        double weekly = estimator.estimate(closes, 52);

        assertThat(daily / weekly).isCloseTo(Math.sqrt(252.0 / 52.0), within(1e-12));
    }

    @Test
    @DisplayName("Constant prices have zero volatility")
    void constantPrices() {
        assertThat(estimator.estimate(List.of(50.0, 50.0, 50.0, 50.0))).isZero();
    }

    @Test
    @DisplayName("Rejects fewer than three closes and non-positive prices")
    void rejectsBadSeries() {
        assertThatThrownBy(() -> estimator.estimate(List.of(100.0, 101.0))).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> estimator.estimate(List.of(100.0, 0.0, 101.0)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("positive");
        assertThatThrownBy(() -> estimator.estimate(Arrays.asList(100.0, null, 101.0)))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> estimator.estimate(null)).isInstanceOf(ValidationException.class);
    }
}

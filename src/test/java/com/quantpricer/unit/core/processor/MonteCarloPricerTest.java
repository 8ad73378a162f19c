package com.quantpricer.unit.core.processor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.quantpricer.core.processor.BlackScholesModel;
import com.quantpricer.core.processor.MonteCarloPricer;
import com.quantpricer.domain.model.MarketParameters;
import com.quantpricer.domain.model.MonteCarloResult;
import com.quantpricer.domain.model.Option;
import com.quantpricer.exception.PricingDomainException;
import com.quantpricer.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Monte Carlo prices and Greeks checked against the closed form. Tolerances are a few
 * standard errors for prices; Greeks use common random numbers unless stated otherwise.
 */
class MonteCarloPricerTest {

    private static final int PATHS = 200_000;
    private static final long SEED = 42L;

    private static final MarketParameters MARKET =
            MarketParameters.builder().spot(100).rate(0.02).volatility(0.20).build();

    private static final Option ATM_CALL = Option.call(100, 1);
    private static final Option ATM_PUT = Option.put(100, 1);

    private final BlackScholesModel analytic = new BlackScholesModel(MARKET);

    private static MonteCarloPricer pricer(MarketParameters market, int paths) {
        return new MonteCarloPricer(market, paths, SEED, true);
    }

    @Nested
    @DisplayName("Prices")
    class Prices {

        @Test
        @DisplayName("Call price is within four standard errors of Black-Scholes")
        void callConverges() {
            MonteCarloResult result = pricer(MARKET, PATHS).simulate(ATM_CALL);

            assertThat(result.getPaths()).isEqualTo(PATHS);
            assertThat(result.getStandardError()).isPositive().isLessThan(0.05);
            assertThat(Math.abs(result.getPrice() - analytic.price(ATM_CALL)))
                    .isLessThan(4 * result.getStandardError());
        }

        @Test
        @DisplayName("Put price with dividend carry is within four standard errors of Black-Scholes")
        void putWithCarryConverges() {
            MarketParameters carried = MARKET.withDividendYield(0.02);
            MonteCarloResult result = pricer(carried, PATHS).simulate(ATM_PUT);

            double expected = new BlackScholesModel(carried).price(ATM_PUT);

            assertThat(Math.abs(result.getPrice() - expected)).isLessThan(4 * result.getStandardError());
        }

        @Test
        @DisplayName("Standard error shrinks as paths grow")
        void standardErrorShrinks() {
            double small = pricer(MARKET, 10_000).simulate(ATM_CALL).getStandardError();
            double large = pricer(MARKET, 160_000).simulate(ATM_CALL).getStandardError();

            // ~1/sqrt(n): expect about a quarter
            assertThat(large).isLessThan(small / 2);
        }

        @Test
        @DisplayName("Same seed and inputs give identical prices")
        void deterministicForSeed() {
            double first = new MonteCarloPricer(MARKET, 5_000, 7L, true).price(ATM_CALL);
            double second = new MonteCarloPricer(MARKET, 5_000, 7L, true).price(ATM_CALL);

            assertThat(first).isEqualTo(second);
        }

        @Test
        @DisplayName("Price overrides do not change the pricer's base market")
        void overridesAreLocal() {
            MonteCarloPricer mc = pricer(MARKET, 10_000);

            mc.price(ATM_CALL, MARKET.withVolatility(0.5));

            assertThat(mc.getMarket()).isEqualTo(MARKET);
        }
    }

    @Nested
    @DisplayName("Greeks with common random numbers")
    class CommonRandomNumberGreeks {

        @Test
        @DisplayName("Delta is close to the analytic delta")
        void delta() {
            assertThat(pricer(MARKET, PATHS).delta(ATM_CALL)).isCloseTo(analytic.delta(ATM_CALL), within(0.01));
        }

        @Test
        @DisplayName("Put delta is negative and close to the analytic delta")
        void putDelta() {
            double delta = pricer(MARKET, PATHS).delta(ATM_PUT);

            assertThat(delta).isNegative();
            assertThat(delta).isCloseTo(analytic.delta(ATM_PUT), within(0.01));
        }

        @Test
        @DisplayName("Gamma with a 1.0 spot bump is close to the analytic gamma")
        void gamma() {
            assertThat(pricer(MARKET, PATHS).gamma(ATM_CALL, 1.0)).isCloseTo(analytic.gamma(ATM_CALL), within(0.002));
        }

        @Test
        @DisplayName("Gamma at the default bump widens the spot bump and matches the analytic gamma")
        void defaultBumpGamma() {
            MonteCarloPricer mc = new MonteCarloPricer(MARKET, 100_000, SEED, true);

            assertThat(mc.gamma(ATM_CALL)).isCloseTo(analytic.gamma(ATM_CALL), within(0.002));
            assertThat(mc.gamma(ATM_PUT)).isCloseTo(analytic.gamma(ATM_PUT), within(0.002));
        }

        @Test
        @DisplayName("Vega and rho are close to their analytic values")
        void vegaAndRho() {
            MonteCarloPricer mc = pricer(MARKET, PATHS);

            assertThat(mc.vega(ATM_CALL)).isCloseTo(analytic.vega(ATM_CALL), within(1.0));
            assertThat(mc.rho(ATM_CALL)).isCloseTo(analytic.rho(ATM_CALL), within(1.0));
        }
    }

    @Nested
    @DisplayName("Greeks with independent samples")
    class IndependentGreeks {

        @Test
        @DisplayName("Delta with a wide bump is close to the analytic delta")
        void wideBumpDelta() {
            MonteCarloPricer independent = new MonteCarloPricer(MARKET, PATHS, SEED, false);

            assertThat(independent.delta(ATM_CALL, 5.0)).isCloseTo(analytic.delta(ATM_CALL), within(0.03));
        }

        @Test
        @DisplayName("Greeks at the default bump use widened bumps and stay near the analytic values")
        void defaultBumpGreeks() {
            MonteCarloPricer independent = new MonteCarloPricer(MARKET, PATHS, SEED, false);

            assertThat(independent.delta(ATM_CALL)).isCloseTo(analytic.delta(ATM_CALL), within(0.03));
            assertThat(independent.gamma(ATM_CALL)).isCloseTo(analytic.gamma(ATM_CALL), within(0.005));
            assertThat(independent.vega(ATM_CALL)).isCloseTo(analytic.vega(ATM_CALL), within(5.0));
            assertThat(independent.rho(ATM_CALL)).isCloseTo(analytic.rho(ATM_CALL), within(8.0));
        }
    }

    @Nested
    @DisplayName("Invalid inputs")
    class InvalidInputs {

        @Test
        @DisplayName("Zero paths is a validation error")
        void zeroPaths() {
            assertThatThrownBy(() -> new MonteCarloPricer(MARKET, 0, SEED, true))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Non-positive default bump is a validation error")
        void zeroBump() {
            assertThatThrownBy(() -> new MonteCarloPricer(MARKET, 100, SEED, true, 0.0))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Zero volatility or spot is a domain error")
        void degenerateMarket() {
            assertThatThrownBy(() -> pricer(MARKET.withVolatility(0.0), 100))
                    .isInstanceOf(PricingDomainException.class);
            assertThatThrownBy(() -> pricer(MARKET.withSpot(-1.0), 100)).isInstanceOf(PricingDomainException.class);
        }

        @Test
        @DisplayName("A vega bump that takes volatility to zero is a domain error")
        void bumpThroughZero() {
            MonteCarloPricer lowVol = pricer(MARKET.withVolatility(0.01), 100);

            assertThatThrownBy(() -> lowVol.vega(ATM_CALL, 0.02)).isInstanceOf(PricingDomainException.class);
        }
    }
}

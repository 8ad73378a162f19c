package com.quantpricer.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.quantpricer.curve.TermStructure;
import com.quantpricer.domain.model.InterestRateSwap;
import com.quantpricer.domain.vo.SwapCashflow;
import com.quantpricer.exception.ValidationException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class InterestRateSwapTest {

    private static final TermStructure FLAT_3 = TermStructure.flat(0.03, 0.25, 0.5, 1, 2, 5);
    private static final List<Double> SEMI_ANNUAL_1Y = List.of(0.5, 1.0);

    @Nested
    @DisplayName("Par rate")
    class ParRate {

        @Test
        @DisplayName("Swap struck at its par rate is worth zero")
        void parSwapWorthZero() {
            double parRate = new InterestRateSwap(1_000_000, 0.0, SEMI_ANNUAL_1Y).swapRate(FLAT_3);

            InterestRateSwap par = new InterestRateSwap(1_000_000, parRate, SEMI_ANNUAL_1Y);

            assertThat(par.price(FLAT_3)).isCloseTo(0.0, within(1e-6));
        }

        @Test
        @DisplayName("Par rate matches (DF(0) - DF(tN)) / annuity")
        void parRateFormula() {
            double annuity = 0.5 * Math.exp(-0.015) + 0.5 * Math.exp(-0.03);
            double expected = (1 - Math.exp(-0.03)) / annuity;

            assertThat(new InterestRateSwap(1, 0.0, SEMI_ANNUAL_1Y).swapRate(FLAT_3))
                    .isCloseTo(expected, within(1e-12));
        }

        @Test
        @DisplayName("Par rate is close to the continuously compounded curve rate")
        void parRateNearCurveRate() {
            double parRate = new InterestRateSwap(1, 0.0, SEMI_ANNUAL_1Y).swapRate(FLAT_3);

            // semi-annual equivalent of 3% continuous
            assertThat(parRate).isCloseTo(2 * (Math.exp(0.015) - 1), within(1e-12));
        }
    }

    @Nested
    @DisplayName("Fixed leg breakdown")
    class FixedLegBreakdown {

        private final InterestRateSwap swap = new InterestRateSwap(1_000_000, 0.04, List.of(0.5, 1.0, 2.0));

        @Test
        @DisplayName("One entry per payment with accrual from the previous payment")
        void perPayment() {
            List<SwapCashflow> cashflows = swap.fixedLegCashflows(FLAT_3, 0.0);

            assertThat(cashflows).extracting(SwapCashflow::getTime).containsExactly(0.5, 1.0, 2.0);
            assertThat(cashflows).extracting(SwapCashflow::getAccrual).containsExactly(0.5, 0.5, 1.0);
            assertThat(cashflows.get(2).getAmount()).isCloseTo(40_000.0, within(1e-9));
            assertThat(cashflows.get(2).getDiscountFactor()).isCloseTo(Math.exp(-0.06), within(1e-15));
            assertThat(cashflows.get(2).getPresentValue()).isCloseTo(40_000 * Math.exp(-0.06), within(1e-8));
        }

        @Test
        @DisplayName("Present values sum to the fixed leg value")
        void sumsToFixedLeg() {
            for (double t : new double[] {0.0, 0.25, 1.5}) {
                double total = swap.fixedLegCashflows(FLAT_3, t).stream()
                        .mapToDouble(SwapCashflow::getPresentValue)
                        .sum();

                assertThat(total).as("t=%s", t).isCloseTo(swap.pvFixedLeg(FLAT_3, t), within(1e-8));
            }
        }

        @Test
        @DisplayName("After valuation time only later payments remain, the first accruing from t")
        void remainingOnly() {
            List<SwapCashflow> cashflows = swap.fixedLegCashflows(FLAT_3, 0.75);

            assertThat(cashflows).extracting(SwapCashflow::getTime).containsExactly(1.0, 2.0);
            assertThat(cashflows.get(0).getAccrual()).isCloseTo(0.25, within(1e-15));
            assertThat(cashflows.get(0).getDiscountFactor()).isCloseTo(Math.exp(-0.03 * 0.25), within(1e-15));
            assertThat(swap.fixedLegCashflows(FLAT_3, 3.0)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Legs")
    class Legs {

        @Test
        @DisplayName("Fixed leg is N * K * sum(accrual * DF)")
        void fixedLeg() {
            InterestRateSwap swap = new InterestRateSwap(1_000_000, 0.04, SEMI_ANNUAL_1Y);
            double expected = 1_000_000 * 0.04 * (0.5 * Math.exp(-0.015) + 0.5 * Math.exp(-0.03));

            assertThat(swap.pvFixedLeg(FLAT_3)).isCloseTo(expected, within(1e-6));
        }

        @Test
        @DisplayName("Floating leg is N * (1 - DF(tN))")
        void floatingLeg() {
            InterestRateSwap swap = new InterestRateSwap(1_000_000, 0.04, SEMI_ANNUAL_1Y);

            assertThat(swap.pvFloatingLeg(FLAT_3)).isCloseTo(1_000_000 * (1 - Math.exp(-0.03)), within(1e-6));
        }

        @Test
        @DisplayName("Fixed payer loses when struck above par")
        void aboveParIsNegative() {
            InterestRateSwap swap = new InterestRateSwap(1_000_000, 0.05, SEMI_ANNUAL_1Y);

            assertThat(swap.price(FLAT_3)).isNegative();
        }

        @Test
        @DisplayName("Valuing later drops paid flows and accrues the first period from the valuation time")
        void valuationAfterFirstPayment() {
            InterestRateSwap swap = new InterestRateSwap(100, 0.04, SEMI_ANNUAL_1Y);

            assertThat(swap.annuity(FLAT_3, 0.75)).isCloseTo(0.25 * Math.exp(-0.03 * 0.25), within(1e-12));
            assertThat(swap.pvFloatingLeg(FLAT_3, 0.75)).isCloseTo(100 * (1 - Math.exp(-0.03 * 0.25)), within(1e-10));
        }

        @Test
        @DisplayName("Past every payment both legs are zero and the par rate is undefined")
        void afterLastPayment() {
            InterestRateSwap swap = new InterestRateSwap(100, 0.04, SEMI_ANNUAL_1Y);

            assertThat(swap.pvFixedLeg(FLAT_3, 2.0)).isZero();
            assertThat(swap.pvFloatingLeg(FLAT_3, 2.0)).isZero();
            assertThatThrownBy(() -> swap.swapRate(FLAT_3, 2.0)).isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Rejects empty and unsorted payment schedules")
        void rejectsBadSchedules() {
            assertThatThrownBy(() -> new InterestRateSwap(100, 0.03, List.of()))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> new InterestRateSwap(100, 0.03, List.of(1.0, 0.5)))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> new InterestRateSwap(0, 0.03, SEMI_ANNUAL_1Y))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Payment times are copied and read-only")
        void copiesSchedule() {
            List<Double> times = new ArrayList<>(SEMI_ANNUAL_1Y);
            InterestRateSwap swap = new InterestRateSwap(100, 0.03, times);
            times.add(1.5);

            assertThat(swap.getPaymentTimes()).containsExactly(0.5, 1.0);
            assertThatThrownBy(() -> swap.getPaymentTimes().add(2.0))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }
}

package com.quantpricer.domain.model;

import com.quantpricer.curve.TermStructure;
import com.quantpricer.domain.vo.SwapCashflow;
import com.quantpricer.exception.ValidationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Plain vanilla pay-fixed / receive-floating interest rate swap on a single curve.
 *
 * <p>The curve is used both to discount and to project: the floating leg is valued with the
 * telescoping identity {@code N * (DF(start) - DF(end))} rather than by projecting each
 * floating coupon.
 *
 * <p>Every leg method takes a valuation time {@code t}. Payments dated before {@code t} are
 * excluded, the first remaining period accrues from {@code t}, and discounting is over
 * {@code time - t}.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class InterestRateSwap {

    private final double notional;
    private final double fixedRate;
    private final List<Double> paymentTimes;

    public InterestRateSwap(double notional, double fixedRate, List<Double> paymentTimes) {
        if (!(notional > 0) || !Double.isFinite(notional)) {
            throw new ValidationException("Notional must be positive", Map.of("notional", notional));
        }
        if (!Double.isFinite(fixedRate)) {
            throw new ValidationException("Fixed rate must be finite");
        }
        if (paymentTimes == null || paymentTimes.isEmpty()) {
            throw new ValidationException("Swap needs at least one payment date");
        }
        double previous = 0.0;
        for (int i = 0; i < paymentTimes.size(); i++) {
            Double time = paymentTimes.get(i);
            if (time == null || !(time > previous) || !Double.isFinite(time)) {
                throw new ValidationException(
                        "Payment times must be positive and strictly increasing",
                        Map.of("index", i, "time", String.valueOf(time)));
            }
            previous = time;
        }
        this.notional = notional;
        this.fixedRate = fixedRate;
        this.paymentTimes = Collections.unmodifiableList(new ArrayList<>(paymentTimes));
    }

    public double pvFixedLeg(TermStructure curve) {
        return pvFixedLeg(curve, 0.0);
    }

    public double pvFixedLeg(TermStructure curve, double t) {
        return notional * fixedRate * annuity(curve, t);
    }

    public double pvFloatingLeg(TermStructure curve) {
        return pvFloatingLeg(curve, 0.0);
    }

    /**
     * {@code N * (DF(0) - DF(tN - t))}: the first remaining period starts at {@code t}, which
     * is tenor zero once shifted.
     */
    public double pvFloatingLeg(TermStructure curve, double t) {
        return notional * floatingDiscountSpread(curve, t);
    }

    public double swapRate(TermStructure curve) {
        return swapRate(curve, 0.0);
    }

    /**
     * Par fixed rate: the fixed rate at which both legs have equal value at {@code t}.
     */
    public double swapRate(TermStructure curve, double t) {
        double annuity = annuity(curve, t);
        if (annuity == 0.0) {
            throw new ValidationException("No remaining payment to price a par rate against", Map.of("t", t));
        }
        return floatingDiscountSpread(curve, t) / annuity;
    }

    public double price(TermStructure curve) {
        return price(curve, 0.0);
    }

    /**
     * Value to the fixed payer: floating leg minus fixed leg.
     */
    public double price(TermStructure curve, double t) {
        return pvFloatingLeg(curve, t) - pvFixedLeg(curve, t);
    }

    /**
     * Accrual-weighted sum of discount factors over the remaining payments, per unit notional.
     */
    public double annuity(TermStructure curve, double t) {
        double sum = 0.0;
        for (SwapCashflow cashflow : remainingFixedPayments(curve, t, 1.0)) {
            sum += cashflow.getAccrual() * cashflow.getDiscountFactor();
        }
        return sum;
    }

    /**
     * Remaining fixed-leg payments at {@code t}, each with its accrual, amount and present
     * value. The present values sum to {@link #pvFixedLeg(TermStructure, double)}.
     */
    public List<SwapCashflow> fixedLegCashflows(TermStructure curve, double t) {
        return remainingFixedPayments(curve, t, notional * fixedRate);
    }

    private List<SwapCashflow> remainingFixedPayments(TermStructure curve, double t, double couponPerYear) {
        int first = firstRemainingIndex(t);
        List<SwapCashflow> cashflows = new ArrayList<>(paymentTimes.size() - first);
        for (int i = first; i < paymentTimes.size(); i++) {
            double time = paymentTimes.get(i);
            double accrual = time - (i == first ? t : paymentTimes.get(i - 1));
            double amount = couponPerYear * accrual;
            double df = curve.discountFactor(time - t);
            cashflows.add(new SwapCashflow(time, accrual, amount, df, amount * df));
        }
        return cashflows;
    }

    private double floatingDiscountSpread(TermStructure curve, double t) {
        if (firstRemainingIndex(t) == paymentTimes.size()) {
            return 0.0;
        }
        double lastTime = paymentTimes.get(paymentTimes.size() - 1);
        return curve.discountFactor(0.0) - curve.discountFactor(lastTime - t);
    }

    private int firstRemainingIndex(double t) {
        int i = 0;
        while (i < paymentTimes.size() && paymentTimes.get(i) < t) {
            i++;
        }
        return i;
    }
}

package com.quantpricer.domain.model;

import com.quantpricer.curve.TermStructure;
import com.quantpricer.domain.vo.Cashflow;
import com.quantpricer.exception.ValidationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Plain vanilla fixed-coupon bond valued by discounting its schedule on a zero curve.
 *
 * <p>Schedule: {@code n = floor(maturity * frequency)} coupons of
 * {@code nominal * couponRate / frequency} paid at {@code i / frequency}, i = 1..n, with the
 * nominal repaid together with the last coupon. A maturity that is not a whole number of
 * periods is truncated to the last full period.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class CouponBond {

    // Absorbs representation error in maturity * frequency (0.3 * 10 = 2.9999999999999996)
    private static final double PERIOD_EPSILON = 1e-9;

    private final double nominal;
    private final double couponRate;
    private final double maturity;
    private final int paymentFrequency;

    @Getter(AccessLevel.NONE)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private final List<Cashflow> schedule;

    public CouponBond(double nominal, double couponRate, double maturity, int paymentFrequency) {
        if (!(nominal > 0) || !Double.isFinite(nominal)) {
            throw new ValidationException("Nominal must be positive", Map.of("nominal", nominal));
        }
        if (!(couponRate >= 0) || !Double.isFinite(couponRate)) {
            throw new ValidationException("Coupon rate must be non-negative", Map.of("couponRate", couponRate));
        }
        if (!(maturity > 0) || !Double.isFinite(maturity)) {
            throw new ValidationException("Maturity must be positive", Map.of("maturity", maturity));
        }
        if (paymentFrequency < 1) {
            throw new ValidationException(
                    "Payment frequency must be at least one payment per year",
                    Map.of("paymentFrequency", paymentFrequency));
        }
        this.nominal = nominal;
        this.couponRate = couponRate;
        this.maturity = maturity;
        this.paymentFrequency = paymentFrequency;
        this.schedule = buildSchedule();
    }

    private List<Cashflow> buildSchedule() {
        int payments = (int) Math.floor(maturity * paymentFrequency + PERIOD_EPSILON);
        if (payments < 1) {
            throw new ValidationException(
                    "Maturity is shorter than one coupon period",
                    Map.of("maturity", maturity, "paymentFrequency", paymentFrequency));
        }

        double couponAmount = nominal * couponRate / paymentFrequency;
        List<Cashflow> flows = new ArrayList<>(payments);
        for (int i = 1; i <= payments; i++) {
            double time = (double) i / paymentFrequency;
            double amount = i == payments ? couponAmount + nominal : couponAmount;
            flows.add(new Cashflow(time, amount));
        }
        return Collections.unmodifiableList(flows);
    }

    /**
     * Ordered cashflow schedule, principal included in the last flow.
     */
    public List<Cashflow> cashflows() {
        return schedule;
    }

    public double price(TermStructure curve) {
        return price(curve, 0.0);
    }

    /**
     * Present value at time {@code t}: cashflows paid strictly before {@code t} are excluded,
     * the rest are discounted over their remaining tenor {@code time - t}.
     */
    public double price(TermStructure curve, double t) {
        double pv = 0.0;
        for (Cashflow cf : schedule) {
            if (cf.getTime() >= t) {
                pv += cf.getAmount() * curve.discountFactor(cf.getTime() - t);
            }
        }
        return pv;
    }

    /**
     * Macaulay duration in years: PV-weighted mean time of the cashflows.
     */
    public double duration(TermStructure curve) {
        double weighted = 0.0;
        double pv = 0.0;
        for (Cashflow cf : schedule) {
            double discounted = cf.getAmount() * curve.discountFactor(cf.getTime());
            weighted += cf.getTime() * discounted;
            pv += discounted;
        }
        return weighted / pv;
    }

    /**
     * Discrete convexity {@code sum(cf * DF(t) * t * (t + 1/f)) / sum(cf * DF(t))}.
     */
    public double convexity(TermStructure curve) {
        double period = 1.0 / paymentFrequency;
        double weighted = 0.0;
        double pv = 0.0;
        for (Cashflow cf : schedule) {
            double t = cf.getTime();
            double discounted = cf.getAmount() * curve.discountFactor(t);
            weighted += discounted * t * (t + period);
            pv += discounted;
        }
        return weighted / pv;
    }
}

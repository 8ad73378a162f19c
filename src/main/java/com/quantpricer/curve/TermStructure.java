package com.quantpricer.curve;

import com.quantpricer.exception.ValidationException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Immutable zero-coupon term structure with linear interpolation in rate.
 *
 * <p>Interpolation policy for {@link #zeroRate(double)}:
 * <ul>
 *   <li>Exact knot: the stored rate, bit for bit
 *   <li>Below the first knot: rate scaled linearly with time, {@code r(t) = r0 * t / t0},
 *       so the curve passes through the origin
 *   <li>Above the last knot: flat at the last rate
 *   <li>Between knots: linear, {@code r1 + w * (r2 - r1)} with {@code w = (t - t1) / (t2 - t1)}
 * </ul>
 *
 * <p>Transforms ({@link #shiftRate}, {@link #shiftTime}) return new instances. A curve is
 * built once from the snapshot and shared by reference between all pricing calls; being
 * immutable it needs no synchronization.
 */
@Slf4j
public final class TermStructure {

    static final int MAX_NODES = 10_000;

    private final double[] maturities;
    private final double[] zeroRates;

    public TermStructure(double[] maturities, double[] zeroRates) {
        if (maturities == null || zeroRates == null) {
            throw new ValidationException("Maturities and rates are required");
        }
        if (maturities.length != zeroRates.length) {
            throw new ValidationException(
                    "Maturities and rates must have the same length",
                    Map.of("maturities", maturities.length, "rates", zeroRates.length));
        }
        if (maturities.length == 0) {
            throw new ValidationException("Term structure needs at least one point");
        }
        for (int i = 0; i < maturities.length; i++) {
            if (!(maturities[i] > 0) || !Double.isFinite(maturities[i])) {
                throw new ValidationException(
                        "Maturities must be positive and finite", Map.of("index", i, "maturity", maturities[i]));
            }
            if (i > 0 && maturities[i] <= maturities[i - 1]) {
                throw new ValidationException(
                        "Maturities must be strictly increasing", Map.of("index", i, "maturity", maturities[i]));
            }
            if (!Double.isFinite(zeroRates[i])) {
                throw new ValidationException("Rates must be finite", Map.of("index", i));
            }
        }
        this.maturities = maturities.clone();
        this.zeroRates = zeroRates.clone();
    }

    public static TermStructure of(List<CurvePoint> points) {
        if (points == null) {
            throw new ValidationException("Curve points are required");
        }
        double[] m = new double[points.size()];
        double[] r = new double[points.size()];
        for (int i = 0; i < points.size(); i++) {
            m[i] = points.get(i).getMaturity();
            r[i] = points.get(i).getRate();
        }
        return new TermStructure(m, r);
    }

    /**
     * Curve with the same rate at every given knot. Flat between and beyond the knots,
     * scaled towards zero below the first one.
     */
    public static TermStructure flat(double rate, double... maturities) {
        double[] rates = new double[maturities.length];
        Arrays.fill(rates, rate);
        return new TermStructure(maturities, rates);
    }

    /**
     * Returns the interpolated annualized zero rate for maturity {@code t} (years).
     */
    public double zeroRate(double t) {
        if (Double.isNaN(t)) {
            throw new ValidationException("Maturity must be a number");
        }
        int idx = Arrays.binarySearch(maturities, t);
        if (idx >= 0) {
            return zeroRates[idx];
        }

        int insertion = -idx - 1;
        int last = maturities.length - 1;
        if (insertion == 0) {
            return zeroRates[0] * t / maturities[0];
        }
        if (insertion > last) {
            return zeroRates[last];
        }

        double t1 = maturities[insertion - 1];
        double t2 = maturities[insertion];
        double r1 = zeroRates[insertion - 1];
        double r2 = zeroRates[insertion];
        double w = (t - t1) / (t2 - t1);
        return r1 + w * (r2 - r1);
    }

    /**
     * DF(t) = exp(-r(t) * t).
     */
    public double discountFactor(double t) {
        return Math.exp(-zeroRate(t) * t);
    }

    /**
     * Continuously compounded forward rate between {@code t1} and {@code t2}.
     */
    public double forwardRate(double t1, double t2) {
        if (!(t2 > t1)) {
            throw new ValidationException("Forward period end must be after its start", Map.of("t1", t1, "t2", t2));
        }
        return (zeroRate(t2) * t2 - zeroRate(t1) * t1) / (t2 - t1);
    }

    /**
     * Zero rate, discount factor and period forward rate at every knot.
     */
    public List<CurveNode> nodes() {
        return nodes(maturities);
    }

    /**
     * Zero rate, discount factor and period forward rate at each of {@code times}, which must
     * be positive and strictly increasing.
     */
    public List<CurveNode> nodes(double[] times) {
        List<CurveNode> nodes = new ArrayList<>(times.length);
        double previous = 0.0;
        for (int i = 0; i < times.length; i++) {
            double t = times[i];
            if (!(t > previous) || !Double.isFinite(t)) {
                throw new ValidationException(
                        "Node maturities must be positive and strictly increasing", Map.of("index", i, "t", t));
            }
            nodes.add(new CurveNode(t, zeroRate(t), discountFactor(t), forwardRate(previous, t)));
            previous = t;
        }
        return nodes;
    }

    /**
     * Nodes every {@code step} years up to and including the last knot maturity.
     */
    public List<CurveNode> nodes(double step) {
        if (!(step > 0) || !Double.isFinite(step)) {
            throw new ValidationException("Node step must be positive", Map.of("step", step));
        }
        double last = maturities[maturities.length - 1];
        int count = (int) Math.floor(last / step + 1e-9);
        if (count < 1) {
            throw new ValidationException(
                    "Node step is longer than the curve", Map.of("step", step, "lastMaturity", last));
        }
        if (count > MAX_NODES) {
            throw new ValidationException("Node step is too fine", Map.of("step", step, "max", MAX_NODES));
        }
        double[] times = new double[count];
        for (int i = 0; i < count; i++) {
            times[i] = (i + 1) * step;
        }
        return nodes(times);
    }

    /**
     * Returns a new curve with every rate reduced by {@code delta}. Knots whose shifted rate
     * would be negative are dropped; a shift that drops every knot is rejected.
     */
    public TermStructure shiftRate(double delta) {
        List<CurvePoint> kept = new ArrayList<>(maturities.length);
        for (int i = 0; i < maturities.length; i++) {
            double shifted = zeroRates[i] - delta;
            if (shifted >= 0) {
                kept.add(new CurvePoint(maturities[i], shifted));
            }
        }
        if (kept.isEmpty()) {
            throw new ValidationException(
                    "Rate shift leaves no non-negative knot on the curve", Map.of("delta", delta));
        }
        if (kept.size() < maturities.length) {
            log.debug("Rate shift {} dropped {} negative knot(s)", delta, maturities.length - kept.size());
        }
        return of(kept);
    }

    /**
     * Returns the curve translated along the time axis: each original knot {@code m} whose
     * shifted maturity {@code m - delta} lies in {@code [0, lastMaturity)} is kept with the
     * rate this curve gives at {@code m - delta}.
     */
    public TermStructure shiftTime(double delta) {
        double lastMaturity = maturities[maturities.length - 1];
        List<CurvePoint> kept = new ArrayList<>(maturities.length);
        for (double m : maturities) {
            double shifted = m - delta;
            if (shifted >= 0 && shifted < lastMaturity) {
                kept.add(new CurvePoint(m, zeroRate(shifted)));
            }
        }
        if (kept.isEmpty()) {
            throw new ValidationException("Time shift leaves no knot on the curve", Map.of("delta", delta));
        }
        return of(kept);
    }

    public int size() {
        return maturities.length;
    }

    public double[] maturities() {
        return maturities.clone();
    }

    public double[] zeroRates() {
        return zeroRates.clone();
    }

    public double lastMaturity() {
        return maturities[maturities.length - 1];
    }

    public List<CurvePoint> points() {
        List<CurvePoint> points = new ArrayList<>(maturities.length);
        for (int i = 0; i < maturities.length; i++) {
            points.add(new CurvePoint(maturities[i], zeroRates[i]));
        }
        return Collections.unmodifiableList(points);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TermStructure)) {
            return false;
        }
        TermStructure other = (TermStructure) o;
        return Arrays.equals(maturities, other.maturities) && Arrays.equals(zeroRates, other.zeroRates);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(maturities) + Arrays.hashCode(zeroRates);
    }

    @Override
    public String toString() {
        return "TermStructure{maturities=" + Arrays.toString(maturities) + ", zeroRates="
                + Arrays.toString(zeroRates) + "}";
    }
}

package com.quantpricer.service;

import com.quantpricer.curve.TermStructure;
import com.quantpricer.domain.model.CouponBond;
import com.quantpricer.domain.model.EquityFuture;
import com.quantpricer.domain.model.Option;
import com.quantpricer.domain.vo.FutureValuePoint;
import com.quantpricer.domain.vo.PayoffPoint;
import com.quantpricer.domain.vo.RateShiftPoint;
import com.quantpricer.exception.ValidationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * What-if valuations: bond prices under parallel rate shifts and after roll-down, future
 * position values across spot levels, and option payoffs at expiry.
 */
@Slf4j
@Service
public class ScenarioAnalysisService {

    static final int MAX_PROFILE_POINTS = 2_000;

    /**
     * Bond price under each parallel shift of the curve. A positive shift raises every zero
     * rate, so prices fall as the shift grows.
     *
     * <p>Knots pushed below zero by a negative shift are dropped from the shifted curve; a
     * shift that drops every knot fails with a validation error.
     */
    public List<RateShiftPoint> bondRateLadder(CouponBond bond, PricingContext context, List<Double> shifts) {
        requireLevels("shifts", shifts);
        TermStructure curve = context.getCurve();
        List<RateShiftPoint> ladder = new ArrayList<>(shifts.size());
        for (double shift : shifts) {
            // shiftRate(d) maps r to r - d
            TermStructure shifted = curve.shiftRate(-shift);
            ladder.add(new RateShiftPoint(shift, bond.price(shifted)));
        }
        log.debug("Rate ladder for {} over {} shifts", bond, shifts.size());
        return ladder;
    }

    /**
     * Evenly spaced grid of {@code steps} shifts from {@code -maxShift} to {@code +maxShift}
     * inclusive.
     */
    public List<Double> symmetricShifts(double maxShift, int steps) {
        if (!(maxShift >= 0) || !Double.isFinite(maxShift)) {
            throw new ValidationException("Maximum shift must be non-negative", Map.of("maxShift", maxShift));
        }
        if (steps < 2) {
            throw new ValidationException("A shift grid needs at least two points", Map.of("steps", steps));
        }
        List<Double> shifts = new ArrayList<>(steps);
        double step = 2 * maxShift / (steps - 1);
        for (int i = 0; i < steps; i++) {
            shifts.add(-maxShift + i * step);
        }
        return shifts;
    }

    /**
     * Long and short mark-to-market of the future at time {@code t} for each spot level.
     */
    public List<FutureValuePoint> futureValueProfile(
            EquityFuture future, double t, List<Double> spots, PricingContext context) {
        if (!(t >= 0) || t > future.getMaturity()) {
            throw new ValidationException(
                    "Valuation time must lie between 0 and the future's maturity",
                    Map.of("t", t, "maturity", future.getMaturity()));
        }
        requireLevels("spots", spots);
        TermStructure curve = context.getCurve();
        List<FutureValuePoint> profile = new ArrayList<>(spots.size());
        for (double spot : spots) {
            double longValue = future.longValue(t, spot, curve);
            profile.add(new FutureValuePoint(spot, longValue, -longValue));
        }
        return profile;
    }

    /**
     * Bond price after {@code horizon} years have passed with the curve shape unchanged: each
     * remaining cashflow is discounted at today's zero rate for its shortened tenor.
     */
    public double rollDown(CouponBond bond, PricingContext context, double horizon) {
        if (!(horizon >= 0) || !Double.isFinite(horizon)) {
            throw new ValidationException("Horizon must be non-negative", Map.of("horizon", horizon));
        }
        return bond.price(context.getCurve(), horizon);
    }

    /**
     * Option payoff at expiry for {@code points} spot levels evenly spaced from 50% to 150% of
     * {@code spot}.
     */
    public List<PayoffPoint> optionPayoffProfile(Option option, double spot, int points) {
        if (!(spot > 0) || !Double.isFinite(spot)) {
            throw new ValidationException("Spot must be positive", Map.of("spot", spot));
        }
        if (points < 2 || points > MAX_PROFILE_POINTS) {
            throw new ValidationException(
                    "A payoff profile needs between 2 and " + MAX_PROFILE_POINTS + " points",
                    Map.of("points", points));
        }
        double low = 0.5 * spot;
        double step = spot / (points - 1);
        List<PayoffPoint> profile = new ArrayList<>(points);
        for (int i = 0; i < points; i++) {
            double level = i == points - 1 ? 1.5 * spot : low + i * step;
            profile.add(new PayoffPoint(level, option.payoff(level)));
        }
        return profile;
    }

    private static void requireLevels(String name, List<Double> levels) {
        if (levels == null || levels.isEmpty()) {
            throw new ValidationException("At least one value is required", Map.of("field", name));
        }
        for (int i = 0; i < levels.size(); i++) {
            Double level = levels.get(i);
            if (level == null || !Double.isFinite(level)) {
                throw new ValidationException(
                        "Values must be finite numbers", Map.of("field", name, "index", i));
            }
        }
    }
}

package com.quantpricer.service;

import com.quantpricer.exception.ValidationException;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Component;

/**
 * Annualized close-to-close volatility: sample standard deviation of simple returns
 * {@code P[i] / P[i-1] - 1}, scaled by {@code sqrt(periodsPerYear)}.
 */
@Component
public class HistoricalVolatilityEstimator {

    public static final int TRADING_DAYS_PER_YEAR = 252;

    public double estimate(List<Double> closes) {
        return estimate(closes, TRADING_DAYS_PER_YEAR);
    }

    public double estimate(List<Double> closes, int periodsPerYear) {
        if (closes == null || closes.size() < 3) {
            throw new ValidationException(
                    "At least three closing prices are needed",
                    Map.of("closes", closes == null ? 0 : closes.size()));
        }
        if (periodsPerYear < 1) {
            throw new ValidationException(
                    "Periods per year must be positive", Map.of("periodsPerYear", periodsPerYear));
        }

        DescriptiveStatistics returns = new DescriptiveStatistics();
        double previous = requirePositive(closes.get(0), 0);
        for (int i = 1; i < closes.size(); i++) {
            double close = requirePositive(closes.get(i), i);
            returns.addValue(close / previous - 1.0);
            previous = close;
        }
        return returns.getStandardDeviation() * Math.sqrt(periodsPerYear);
    }

    private static double requirePositive(Double price, int index) {
        if (price == null || !(price > 0) || !Double.isFinite(price)) {
            throw new ValidationException(
                    "Closing prices must be positive", Map.of("index", index, "price", String.valueOf(price)));
        }
        return price;
    }
}

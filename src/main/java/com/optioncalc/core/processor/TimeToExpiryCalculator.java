package com.optioncalc.core.processor;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import org.springframework.stereotype.Component;

/**
 * Converts a valuation date and an exercise date into a year fraction using an
 * actual/365.25 day count.
 *
 * <p>The result is floored at {@link #MIN_T_YEARS} (about 8.76 hours) so that sqrt(T)
 * and the d1 denominator stay strictly positive. Exercise on or before valuation
 * silently yields the floor; callers that must reject such dates check
 * {@link #isExerciseAfterValuation} themselves.
 */
@Component
public class TimeToExpiryCalculator {

    public static final double DAYS_PER_YEAR = 365.25;

    public static final double MIN_T_YEARS = 0.001;

    public double yearFraction(LocalDate valuationDate, LocalDate exerciseDate) {
        long days = ChronoUnit.DAYS.between(valuationDate, exerciseDate);
        return Math.max(days / DAYS_PER_YEAR, MIN_T_YEARS);
    }

    public boolean isExerciseAfterValuation(LocalDate valuationDate, LocalDate exerciseDate) {
        return exerciseDate.isAfter(valuationDate);
    }
}

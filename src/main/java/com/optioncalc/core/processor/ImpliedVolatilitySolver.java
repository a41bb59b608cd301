package com.optioncalc.core.processor;

import com.optioncalc.domain.enums.OptionSide;
import com.optioncalc.domain.model.CalculationFailure;
import com.optioncalc.domain.model.ImpliedVolatilityResult;
import com.optioncalc.domain.model.MarketInputs;
import com.optioncalc.domain.model.PricingResult;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Newton-Raphson implied volatility solver for European options.
 *
 * <p>Inverts the Black-Scholes price in sigma, using un-scaled vega (dC/d-sigma) as
 * the derivative. Standard ATM cases converge in 3-5 iterations. Iterates are clamped
 * to [{@link #SIGMA_MIN}, {@link #SIGMA_MAX}] so a large first step cannot go negative
 * or run off to absurd volatilities.
 *
 * <p>Before iterating, the market price is checked against the discounted intrinsic
 * value (S*e^(-qT) - K*e^(-rT) for calls, mirrored for puts). A price below it admits
 * no volatility at all and is rejected as INVALID_INPUT instead of being sent to the
 * solver. Running out of iterations is reported as NON_CONVERGENCE; neither case is
 * retried here.
 *
 * <p>This class is stateless and thread-safe.
 */
@Slf4j
@Component
public class ImpliedVolatilitySolver {

    static final double INITIAL_GUESS = 0.30; // 30%
    static final double TOLERANCE = 0.0001;
    static final int MAX_ITERATIONS = 100;

    static final double SIGMA_MIN = 0.001;
    static final double SIGMA_MAX = 5.0;

    private final BlackScholesPricer pricer;
    private final TimeToExpiryCalculator timeToExpiryCalculator;

    public ImpliedVolatilitySolver(BlackScholesPricer pricer, TimeToExpiryCalculator timeToExpiryCalculator) {
        this.pricer = pricer;
        this.timeToExpiryCalculator = timeToExpiryCalculator;
    }

    /**
     * Solves the volatility that reprices {@code side} at {@code marketPrice}.
     *
     * @param inputs      market inputs; the volatility field is ignored
     * @param side        CALL or PUT, the side the market price was observed for
     * @param marketPrice observed option premium
     * @return the solved volatility (percent) with a full valuation at it, or a typed failure
     */
    public ImpliedVolatilityResult solve(MarketInputs inputs, OptionSide side, double marketPrice) {
        if (!BlackScholesPricer.isPositive(marketPrice)) {
            return ImpliedVolatilityResult.failed(CalculationFailure.invalidInput("Please enter a valid option price"));
        }
        if (!BlackScholesPricer.isPositive(inputs.getSpotPrice())
                || !BlackScholesPricer.isPositive(inputs.getStrikePrice())) {
            return ImpliedVolatilityResult.failed(
                    CalculationFailure.invalidInput("Spot and strike prices must be positive numbers"));
        }
        if (inputs.getValuationDate() == null
                || inputs.getExerciseDate() == null
                || !timeToExpiryCalculator.isExerciseAfterValuation(
                        inputs.getValuationDate(), inputs.getExerciseDate())) {
            return ImpliedVolatilityResult.failed(
                    CalculationFailure.invalidInput("Exercise date must be after valuation date"));
        }

        double S = inputs.getSpotPrice();
        double K = inputs.getStrikePrice();
        double T = timeToExpiryCalculator.yearFraction(inputs.getValuationDate(), inputs.getExerciseDate());
        double r = inputs.riskFreeRateDecimal();
        double q = inputs.dividendYieldDecimal();

        double intrinsic = discountedIntrinsic(S, K, T, r, q, side);
        if (marketPrice < intrinsic) {
            return ImpliedVolatilityResult.failed(CalculationFailure.invalidInput(String.format(
                    Locale.ROOT,
                    "Price (%.2f) is below intrinsic value (%.2f)", marketPrice, intrinsic)));
        }

        double sigma = INITIAL_GUESS;

        for (int i = 0; i < MAX_ITERATIONS; i++) {
            double theoreticalPrice = pricer.theoreticalPrice(S, K, T, sigma, r, q, side);
            // Vega (un-scaled, not divided by 100) for Newton step
            double vega = pricer.rawVega(S, K, T, sigma, r, q);

            double diff = theoreticalPrice - marketPrice;
            if (Math.abs(diff) < TOLERANCE) {
                PricingResult pricingResult = pricer.price(S, K, T, sigma, r, q);
                log.debug("IV converged to {}% in {} iterations for {} at price {}", sigma * 100, i + 1, side, marketPrice);
                return ImpliedVolatilityResult.solved(sigma * 100, pricingResult, i + 1);
            }

            double next = sigma - diff / vega;
            if (Double.isNaN(next)) {
                // NaN passes straight through Math.max/min, the clamp can't recover it
                log.debug("Newton step undefined at sigma={} for {} at price {}", sigma, side, marketPrice);
                return ImpliedVolatilityResult.failed(nonConvergence(), i + 1);
            }

            // Clamp to prevent negative or absurd values during iteration
            sigma = Math.max(SIGMA_MIN, Math.min(next, SIGMA_MAX));
        }

        log.debug(
                "IV did not converge for S={}, K={}, T={}, price={}, side={}, last sigma={}",
                S,
                K,
                T,
                marketPrice,
                side,
                sigma);
        return ImpliedVolatilityResult.failed(nonConvergence(), MAX_ITERATIONS);
    }

    /**
     * Lower no-arbitrage bound for a European option: the forward intrinsic value
     * discounted to today.
     */
    public double discountedIntrinsic(double S, double K, double T, double r, double q, OptionSide side) {
        double forwardSpot = S * Math.exp(-q * T);
        double pvStrike = K * Math.exp(-r * T);
        return side == OptionSide.CALL
                ? Math.max(0.0, forwardSpot - pvStrike)
                : Math.max(0.0, pvStrike - forwardSpot);
    }

    private static CalculationFailure nonConvergence() {
        return CalculationFailure.nonConvergence("IV calculation did not converge. Try a different price.");
    }
}

package com.optioncalc.core.processor;

import static com.optioncalc.core.processor.NormalDistributionFunctions.cdf;
import static com.optioncalc.core.processor.NormalDistributionFunctions.pdf;

import com.optioncalc.domain.enums.OptionSide;
import com.optioncalc.domain.model.CalculationFailure;
import com.optioncalc.domain.model.MarketInputs;
import com.optioncalc.domain.model.OptionGreeks;
import com.optioncalc.domain.model.PricingOutcome;
import com.optioncalc.domain.model.PricingResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Black-Scholes-Merton pricer for European options with a continuous dividend yield.
 *
 * <p>Key formulas:
 * <ul>
 *   <li>d1 = [ln(S/K) + (r - q + sigma^2/2) * T] / (sigma * sqrt(T))
 *   <li>d2 = d1 - sigma * sqrt(T)
 *   <li>Call: S * e^(-qT) * N(d1) - K * e^(-rT) * N(d2)
 *   <li>Put: K * e^(-rT) * N(-d2) - S * e^(-qT) * N(-d1)
 *   <li>Delta: e^(-qT) * N(d1) for calls, -e^(-qT) * N(-d1) for puts
 *   <li>Gamma: e^(-qT) * n(d1) / (S * sigma * sqrt(T))
 *   <li>Vega: S * e^(-qT) * n(d1) * sqrt(T) / 100 (per 1% vol change)
 *   <li>Theta: per calendar day (separate formulas for calls/puts)
 * </ul>
 *
 * <p>Gamma and vega do not depend on the side and are computed once for both.
 * Values are returned unrounded; formatting is the presentation layer's job.
 *
 * <p>This class is stateless and thread-safe.
 */
@Slf4j
@Component
public class BlackScholesPricer {

    private final TimeToExpiryCalculator timeToExpiryCalculator;

    public BlackScholesPricer(TimeToExpiryCalculator timeToExpiryCalculator) {
        this.timeToExpiryCalculator = timeToExpiryCalculator;
    }

    /**
     * Prices both sides from the trader's inputs. T comes from the valuation and
     * exercise dates (floored, never rejected); volatility must be strictly positive.
     *
     * @param inputs market inputs with volatility, rate and dividend yield in percent
     * @return the full call/put valuation, or an INVALID_INPUT failure
     */
    public PricingOutcome priceOption(MarketInputs inputs) {
        CalculationFailure failure = validate(inputs);
        if (failure != null) {
            log.debug("Rejected pricing inputs {}: {}", inputs, failure.getReason());
            return PricingOutcome.failed(failure);
        }

        double T = timeToExpiryCalculator.yearFraction(inputs.getValuationDate(), inputs.getExerciseDate());
        if (T <= 0) {
            return PricingOutcome.failed(CalculationFailure.invalidInput("Time to expiry must be positive"));
        }

        return PricingOutcome.success(price(
                inputs.getSpotPrice(),
                inputs.getStrikePrice(),
                T,
                inputs.volatilityDecimal(),
                inputs.riskFreeRateDecimal(),
                inputs.dividendYieldDecimal()));
    }

    /**
     * Core valuation from already-validated decimal parameters.
     * Requires S > 0, K > 0, T > 0 and sigma > 0.
     */
    public PricingResult price(double S, double K, double T, double sigma, double r, double q) {
        double sqrtT = Math.sqrt(T);
        double d1 = d1(S, K, T, sigma, r, q);
        double d2 = d1 - sigma * sqrtT;

        double nd1 = pdf(d1);
        double expQT = Math.exp(-q * T);
        double expRT = Math.exp(-r * T);

        double callPrice = S * expQT * cdf(d1) - K * expRT * cdf(d2);
        double putPrice = K * expRT * cdf(-d2) - S * expQT * cdf(-d1);

        double callDelta = expQT * cdf(d1);
        double putDelta = -expQT * cdf(-d1);

        // Gamma and Vega are the same for calls and puts
        double gamma = expQT * nd1 / (S * sigma * sqrtT);
        double vega = S * expQT * nd1 * sqrtT / 100.0;

        // Shared decay term: -S * n(d1) * sigma * e^(-qT) / (2 * sqrt(T))
        double decay = -S * nd1 * sigma * expQT / (2.0 * sqrtT);
        double callTheta = (decay - r * K * expRT * cdf(d2) + q * S * expQT * cdf(d1)) / 365.0;
        double putTheta = (decay + r * K * expRT * cdf(-d2) - q * S * expQT * cdf(-d1)) / 365.0;

        return PricingResult.builder()
                .call(OptionGreeks.builder()
                        .price(callPrice)
                        .delta(callDelta)
                        .gamma(gamma)
                        .vega(vega)
                        .theta(callTheta)
                        .build())
                .put(OptionGreeks.builder()
                        .price(putPrice)
                        .delta(putDelta)
                        .gamma(gamma)
                        .vega(vega)
                        .theta(putTheta)
                        .build())
                .timeToExpiry(T)
                .build();
    }

    /**
     * Theoretical price of one side. Used by the implied volatility solver, which
     * needs the price at every iterate but not the full Greek set.
     */
    public double theoreticalPrice(double S, double K, double T, double sigma, double r, double q, OptionSide side) {
        double d1 = d1(S, K, T, sigma, r, q);
        double d2 = d1 - sigma * Math.sqrt(T);

        if (side == OptionSide.CALL) {
            return S * Math.exp(-q * T) * cdf(d1) - K * Math.exp(-r * T) * cdf(d2);
        }
        return K * Math.exp(-r * T) * cdf(-d2) - S * Math.exp(-q * T) * cdf(-d1);
    }

    /**
     * dPrice/dSigma, not divided by 100. Newton step derivative for the solver.
     */
    public double rawVega(double S, double K, double T, double sigma, double r, double q) {
        double d1 = d1(S, K, T, sigma, r, q);
        return S * Math.exp(-q * T) * pdf(d1) * Math.sqrt(T);
    }

    double d1(double S, double K, double T, double sigma, double r, double q) {
        return (Math.log(S / K) + (r - q + 0.5 * sigma * sigma) * T) / (sigma * Math.sqrt(T));
    }

    private CalculationFailure validate(MarketInputs inputs) {
        if (inputs.getValuationDate() == null || inputs.getExerciseDate() == null) {
            return CalculationFailure.invalidInput("Valuation and exercise dates are required");
        }
        if (!isPositive(inputs.getSpotPrice())) {
            return CalculationFailure.invalidInput("Spot price must be a positive number");
        }
        if (!isPositive(inputs.getStrikePrice())) {
            return CalculationFailure.invalidInput("Strike price must be a positive number");
        }
        if (!isPositive(inputs.getVolatility())) {
            return CalculationFailure.invalidInput("Volatility must be a positive number");
        }
        if (!Double.isFinite(inputs.getRiskFreeRate()) || !Double.isFinite(inputs.getDividendYield())) {
            return CalculationFailure.invalidInput("Risk-free rate and dividend yield must be numbers");
        }
        return null;
    }

    static boolean isPositive(double value) {
        return Double.isFinite(value) && value > 0;
    }
}

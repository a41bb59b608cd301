package com.optioncalc.core.processor;

/**
 * Standard normal distribution functions used by the Black-Scholes pricer.
 *
 * <p>The CDF is the Abramowitz-Stegun 26.2.17 rational approximation (absolute
 * error below 7.5e-8), which is well inside pricing precision and keeps every
 * price, Greek and implied volatility consistent with each other.
 */
public final class NormalDistributionFunctions {

    private static final double P = 0.2316419;
    private static final double B1 = 0.3193815;
    private static final double B2 = -0.3565638;
    private static final double B3 = 1.781478;
    private static final double B4 = -1.821256;
    private static final double B5 = 1.330274;

    // 1 / sqrt(2*pi), rounded as in the approximation's tables
    private static final double DENSITY_FACTOR = 0.3989423;

    private static final double SQRT_TWO_PI = Math.sqrt(2.0 * Math.PI);

    private NormalDistributionFunctions() {}

    /**
     * P(Z <= x) for a standard normal Z. Antisymmetric: cdf(-x) == 1 - cdf(x).
     */
    public static double cdf(double x) {
        double t = 1.0 / (1.0 + P * Math.abs(x));
        double d = DENSITY_FACTOR * Math.exp(-x * x / 2.0);
        double tail = d * t * (B1 + t * (B2 + t * (B3 + t * (B4 + t * B5))));
        return x > 0 ? 1.0 - tail : tail;
    }

    /**
     * Standard normal density, exact.
     */
    public static double pdf(double x) {
        return Math.exp(-0.5 * x * x) / SQRT_TWO_PI;
    }
}

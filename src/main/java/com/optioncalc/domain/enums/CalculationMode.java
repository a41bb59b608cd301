package com.optioncalc.domain.enums;

/**
 * Which engine entry point a calculation request goes through.
 * PRICE prices from a known volatility, IMPLIED_VOLATILITY solves volatility
 * from an observed market price first.
 */
public enum CalculationMode {
    PRICE,
    IMPLIED_VOLATILITY
}

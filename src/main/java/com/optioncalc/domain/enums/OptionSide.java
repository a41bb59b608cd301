package com.optioncalc.domain.enums;

/**
 * Side of a European vanilla option. Selects the sign conventions in the
 * Black-Scholes formulas and the intrinsic value definition.
 */
public enum OptionSide {
    CALL,
    PUT
}

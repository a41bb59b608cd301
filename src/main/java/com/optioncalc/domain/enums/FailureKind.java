package com.optioncalc.domain.enums;

/**
 * Why a calculation produced no result.
 */
public enum FailureKind {
    /** Bad or economically impossible inputs (non-positive price, below intrinsic, etc). */
    INVALID_INPUT,
    /** The implied volatility solver ran out of iterations. */
    NON_CONVERGENCE
}

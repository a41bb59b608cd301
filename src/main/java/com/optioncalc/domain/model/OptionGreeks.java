package com.optioncalc.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Theoretical price and sensitivities of one option side.
 */
@Value
@Builder
public class OptionGreeks {

    double price;

    /** Price sensitivity to the underlying. Call in [0, e^-qT], put in [-e^-qT, 0]. */
    double delta;

    /** Rate of change of delta. Same for call and put. */
    double gamma;

    /** Price change for a 1 point (1%) volatility move. Same for call and put. */
    double vega;

    /** Time decay per calendar day. */
    double theta;
}

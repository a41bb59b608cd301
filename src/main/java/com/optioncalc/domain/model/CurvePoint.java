package com.optioncalc.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * One row of the payoff/P&L sweep. Payoff, current and intrinsic series are
 * already multiplied by the position sign; the Greeks are not.
 */
@Value
@Builder
public class CurvePoint {

    double spot;

    double callPayoff;
    double putPayoff;

    double callCurrentPnl;
    double putCurrentPnl;

    double callIntrinsic;
    double putIntrinsic;

    double callDelta;
    double putDelta;
    double gamma;
    double vega;
}

package com.optioncalc.domain.model;

import com.optioncalc.domain.enums.CalculationMode;
import com.optioncalc.domain.enums.OptionSide;
import com.optioncalc.domain.enums.PositionType;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Everything the presentation layer needs after one recompute: the valuation of both
 * sides, the selected position's view, and the payoff/P&L curve.
 *
 * <p>Replaced wholesale on every recompute.
 */
@Value
@Builder
public class OptionAnalysis {

    CalculationMode mode;
    OptionSide side;
    PositionType direction;

    /** Volatility the valuation used. In IMPLIED_VOLATILITY mode this is the solved value. */
    double volatilityPercent;

    PricingResult pricingResult;
    PositionView position;
    List<CurvePoint> curve;

    /** Solver iterations, null in PRICE mode. */
    Integer ivIterations;
}

package com.optioncalc.domain.model;

import com.optioncalc.domain.enums.OptionSide;
import com.optioncalc.domain.enums.PositionType;
import lombok.Builder;
import lombok.Value;

/**
 * The selected side seen from the trader's position: premium paid or received and
 * Greeks multiplied by the position sign.
 */
@Value
@Builder
public class PositionView {

    OptionSide side;
    PositionType direction;

    /** Theoretical premium, unsigned. */
    double premium;

    /** True for LONG (premium is paid), false for SHORT (premium is received). */
    boolean premiumPaid;

    double delta;
    double gamma;
    double vega;
    double theta;

    public static PositionView of(OptionGreeks greeks, OptionSide side, PositionType direction) {
        int sign = direction.sign();
        return PositionView.builder()
                .side(side)
                .direction(direction)
                .premium(greeks.getPrice())
                .premiumPaid(direction == PositionType.LONG)
                .delta(greeks.getDelta() * sign)
                .gamma(greeks.getGamma() * sign)
                .vega(greeks.getVega() * sign)
                .theta(greeks.getTheta() * sign)
                .build();
    }
}

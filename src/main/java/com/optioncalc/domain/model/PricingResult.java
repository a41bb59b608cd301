package com.optioncalc.domain.model;

import com.optioncalc.domain.enums.OptionSide;
import lombok.Builder;
import lombok.Value;

/**
 * Call and put valuation at a single set of inputs, plus the year fraction used.
 */
@Value
@Builder
public class PricingResult {

    OptionGreeks call;
    OptionGreeks put;

    /** Year fraction (actual/365.25), never below the 0.001 floor. */
    double timeToExpiry;

    public OptionGreeks forSide(OptionSide side) {
        return side == OptionSide.CALL ? call : put;
    }

    public long getDaysToExpiry() {
        return Math.round(timeToExpiry * 365.25);
    }
}

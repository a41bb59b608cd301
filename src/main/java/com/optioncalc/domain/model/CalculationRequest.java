package com.optioncalc.domain.model;

import com.optioncalc.domain.enums.CalculationMode;
import com.optioncalc.domain.enums.OptionSide;
import com.optioncalc.domain.enums.PositionType;
import lombok.Builder;
import lombok.Value;

/**
 * One recompute request. {@code mode} picks the entry point; {@code marketPrice} is
 * only read in IMPLIED_VOLATILITY mode, and {@code inputs.volatility} only in PRICE mode.
 */
@Value
@Builder
public class CalculationRequest {

    CalculationMode mode;
    MarketInputs inputs;
    OptionSide side;
    PositionType direction;
    Double marketPrice;

    public static CalculationRequest price(MarketInputs inputs, OptionSide side, PositionType direction) {
        return CalculationRequest.builder()
                .mode(CalculationMode.PRICE)
                .inputs(inputs)
                .side(side)
                .direction(direction)
                .build();
    }

    public static CalculationRequest impliedVolatility(
            MarketInputs inputs, OptionSide side, PositionType direction, double marketPrice) {
        return CalculationRequest.builder()
                .mode(CalculationMode.IMPLIED_VOLATILITY)
                .inputs(inputs)
                .side(side)
                .direction(direction)
                .marketPrice(marketPrice)
                .build();
    }
}

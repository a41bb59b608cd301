package com.optioncalc.domain.model;

import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of the market inputs for one calculation.
 *
 * <p>Rates and volatility are whole-number percentages (25 = 25%) as entered by the
 * trader. The engine works in decimals, see the {@code *Decimal()} accessors.
 */
@Value
@Builder(toBuilder = true)
public class MarketInputs {

    double spotPrice;
    double strikePrice;
    LocalDate valuationDate;
    LocalDate exerciseDate;

    /** Volatility in percent. Ignored by the implied volatility solver. */
    double volatility;

    double riskFreeRate;
    double dividendYield;

    public double volatilityDecimal() {
        return volatility / 100.0;
    }

    public double riskFreeRateDecimal() {
        return riskFreeRate / 100.0;
    }

    public double dividendYieldDecimal() {
        return dividendYield / 100.0;
    }

    public MarketInputs withVolatility(double volatilityPercent) {
        return toBuilder().volatility(volatilityPercent).build();
    }
}

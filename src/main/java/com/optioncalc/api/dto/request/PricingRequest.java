package com.optioncalc.api.dto.request;

import com.optioncalc.domain.enums.OptionSide;
import com.optioncalc.domain.enums.PositionType;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for pricing from a known volatility. Percent fields are whole numbers
 * (25 = 25%). Value ranges are checked by the pricer so its reason reaches the trader.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PricingRequest {

    @NotNull(message = "Spot price is required")
    private Double spotPrice;

    @NotNull(message = "Strike price is required")
    private Double strikePrice;

    @NotNull(message = "Valuation date is required")
    private LocalDate valuationDate;

    @NotNull(message = "Exercise date is required")
    private LocalDate exerciseDate;

    @NotNull(message = "Volatility is required")
    private Double volatility;

    @NotNull(message = "Risk-free rate is required")
    private Double riskFreeRate;

    /** Defaults to 0 when omitted. */
    private Double dividendYield;

    /** CALL or PUT. Defaults to CALL on the controller if null. */
    private OptionSide side;

    /** LONG or SHORT. Defaults to LONG on the controller if null. */
    private PositionType direction;
}

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
 * Request DTO for solving implied volatility from an observed option premium.
 * Same market inputs as {@link PricingRequest} minus volatility.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImpliedVolatilityRequest {

    @NotNull(message = "Spot price is required")
    private Double spotPrice;

    @NotNull(message = "Strike price is required")
    private Double strikePrice;

    @NotNull(message = "Valuation date is required")
    private LocalDate valuationDate;

    @NotNull(message = "Exercise date is required")
    private LocalDate exerciseDate;

    @NotNull(message = "Risk-free rate is required")
    private Double riskFreeRate;

    private Double dividendYield;

    /** Observed premium of {@code side}. Positivity and arbitrage bounds are checked by the solver. */
    @NotNull(message = "Market price is required")
    private Double marketPrice;

    private OptionSide side;

    private PositionType direction;
}

package com.optioncalc.api.dto.request;

import com.optioncalc.domain.enums.PositionType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a payoff/P&L sweep with caller-supplied entry premiums
 * (e.g. the prices actually traded rather than the theoretical ones).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CurveRequest {

    @Valid
    @NotNull(message = "Market inputs are required")
    private PricingRequest inputs;

    @NotNull(message = "Entry call price is required")
    private Double entryCallPrice;

    @NotNull(message = "Entry put price is required")
    private Double entryPutPrice;

    private PositionType direction;
}

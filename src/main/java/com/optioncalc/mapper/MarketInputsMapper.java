package com.optioncalc.mapper;

import com.optioncalc.api.dto.request.ImpliedVolatilityRequest;
import com.optioncalc.api.dto.request.PricingRequest;
import com.optioncalc.domain.model.MarketInputs;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper from API request DTOs to the engine's {@link MarketInputs} snapshot.
 * A missing dividend yield maps to 0.
 */
@Mapper
public interface MarketInputsMapper {

    @Mapping(target = "dividendYield", defaultValue = "0")
    MarketInputs toMarketInputs(PricingRequest request);

    @Mapping(target = "volatility", ignore = true)
    @Mapping(target = "dividendYield", defaultValue = "0")
    MarketInputs toMarketInputs(ImpliedVolatilityRequest request);
}

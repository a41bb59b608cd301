package com.optioncalc.api.controller;

import com.optioncalc.api.dto.request.CurveRequest;
import com.optioncalc.api.dto.request.ImpliedVolatilityRequest;
import com.optioncalc.api.dto.request.PricingRequest;
import com.optioncalc.domain.enums.OptionSide;
import com.optioncalc.domain.enums.PositionType;
import com.optioncalc.domain.model.AnalysisOutcome;
import com.optioncalc.domain.model.CalculationRequest;
import com.optioncalc.domain.model.CurvePoint;
import com.optioncalc.domain.model.MarketInputs;
import com.optioncalc.domain.model.OptionAnalysis;
import com.optioncalc.domain.model.PricingOutcome;
import com.optioncalc.exception.CalculationException;
import com.optioncalc.mapper.MarketInputsMapper;
import com.optioncalc.service.OptionCalculatorService;
import jakarta.validation.Valid;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the option calculator.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/options/defaults -- starting inputs for a new form</li>
 *   <li>POST /api/options/price -- price, Greeks and curve from a known volatility</li>
 *   <li>POST /api/options/implied-volatility -- solve volatility from a market price, then price</li>
 *   <li>POST /api/options/curve -- payoff/P&L sweep with caller-supplied entry premiums</li>
 * </ul>
 *
 * <p>Engine failures come back as values; this controller turns them into
 * {@link CalculationException} so the global handler renders the reason verbatim.
 */
@RestController
@RequestMapping("/api/options")
public class OptionCalculatorController {

    private static final Logger log = LoggerFactory.getLogger(OptionCalculatorController.class);

    private final OptionCalculatorService optionCalculatorService;
    private final MarketInputsMapper marketInputsMapper = Mappers.getMapper(MarketInputsMapper.class);

    public OptionCalculatorController(OptionCalculatorService optionCalculatorService) {
        this.optionCalculatorService = optionCalculatorService;
    }

    @GetMapping("/defaults")
    public ResponseEntity<MarketInputs> getDefaults() {
        return ResponseEntity.ok(optionCalculatorService.defaultInputs());
    }

    @PostMapping("/price")
    public ResponseEntity<OptionAnalysis> price(@Valid @RequestBody PricingRequest request) {
        MarketInputs inputs = marketInputsMapper.toMarketInputs(request);
        CalculationRequest calculation = CalculationRequest.price(
                inputs, sideOrDefault(request.getSide()), directionOrDefault(request.getDirection()));

        return ResponseEntity.ok(unwrap(optionCalculatorService.analyze(calculation)));
    }

    @PostMapping("/implied-volatility")
    public ResponseEntity<OptionAnalysis> impliedVolatility(@Valid @RequestBody ImpliedVolatilityRequest request) {
        log.info("IV solve requested: side={}, marketPrice={}", request.getSide(), request.getMarketPrice());

        MarketInputs inputs = marketInputsMapper.toMarketInputs(request);
        CalculationRequest calculation = CalculationRequest.impliedVolatility(
                inputs,
                sideOrDefault(request.getSide()),
                directionOrDefault(request.getDirection()),
                request.getMarketPrice());

        return ResponseEntity.ok(unwrap(optionCalculatorService.analyze(calculation)));
    }

    @PostMapping("/curve")
    public ResponseEntity<List<CurvePoint>> curve(@Valid @RequestBody CurveRequest request) {
        MarketInputs inputs = marketInputsMapper.toMarketInputs(request.getInputs());

        // Same input checks as pricing, so a bad volatility fails loudly instead of yielding an empty curve
        PricingOutcome outcome = optionCalculatorService.priceOption(inputs);
        if (!outcome.isSuccess()) {
            throw new CalculationException(outcome.getFailure());
        }

        List<CurvePoint> curve = optionCalculatorService.buildCurve(
                inputs,
                directionOrDefault(request.getDirection()),
                request.getEntryCallPrice(),
                request.getEntryPutPrice());
        return ResponseEntity.ok(curve);
    }

    private OptionAnalysis unwrap(AnalysisOutcome outcome) {
        if (!outcome.isSuccess()) {
            throw new CalculationException(outcome.getFailure());
        }
        return outcome.getAnalysis();
    }

    private static OptionSide sideOrDefault(OptionSide side) {
        return side != null ? side : OptionSide.CALL;
    }

    private static PositionType directionOrDefault(PositionType direction) {
        return direction != null ? direction : PositionType.LONG;
    }
}

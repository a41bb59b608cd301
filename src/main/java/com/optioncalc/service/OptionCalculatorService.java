package com.optioncalc.service;

import com.optioncalc.config.CalculatorDefaultsConfig;
import com.optioncalc.core.processor.BlackScholesPricer;
import com.optioncalc.core.processor.ImpliedVolatilitySolver;
import com.optioncalc.core.processor.PayoffCurveGenerator;
import com.optioncalc.domain.enums.CalculationMode;
import com.optioncalc.domain.enums.OptionSide;
import com.optioncalc.domain.enums.PositionType;
import com.optioncalc.domain.model.AnalysisOutcome;
import com.optioncalc.domain.model.CalculationFailure;
import com.optioncalc.domain.model.CalculationRequest;
import com.optioncalc.domain.model.CurvePoint;
import com.optioncalc.domain.model.ImpliedVolatilityResult;
import com.optioncalc.domain.model.MarketInputs;
import com.optioncalc.domain.model.OptionAnalysis;
import com.optioncalc.domain.model.PositionView;
import com.optioncalc.domain.model.PricingOutcome;
import com.optioncalc.domain.model.PricingResult;
import com.optioncalc.observability.CalculatorMetricsService;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for the presentation layer. Every call recomputes from scratch:
 * nothing is cached and no reference to the inputs is kept.
 *
 * <p>{@link #analyze} is the recompute function. The request's {@link CalculationMode}
 * decides whether volatility is taken as given (PRICE) or solved from a market price
 * first (IMPLIED_VOLATILITY). Either way the result is a complete {@link OptionAnalysis}
 * or a typed failure, never a partial result.
 */
@Slf4j
@Service
public class OptionCalculatorService {

    private final BlackScholesPricer pricer;
    private final PayoffCurveGenerator curveGenerator;
    private final ImpliedVolatilitySolver ivSolver;
    private final CalculatorDefaultsConfig defaultsConfig;
    private final CalculatorMetricsService metrics;

    public OptionCalculatorService(
            BlackScholesPricer pricer,
            PayoffCurveGenerator curveGenerator,
            ImpliedVolatilitySolver ivSolver,
            CalculatorDefaultsConfig defaultsConfig,
            CalculatorMetricsService metrics) {
        this.pricer = pricer;
        this.curveGenerator = curveGenerator;
        this.ivSolver = ivSolver;
        this.defaultsConfig = defaultsConfig;
        this.metrics = metrics;
    }

    public PricingOutcome priceOption(MarketInputs inputs) {
        return pricer.priceOption(inputs);
    }

    public List<CurvePoint> buildCurve(
            MarketInputs inputs, PositionType direction, double entryCallPrice, double entryPutPrice) {
        return metrics.timeCurve(() -> curveGenerator.buildCurve(inputs, direction, entryCallPrice, entryPutPrice));
    }

    public ImpliedVolatilityResult solveImpliedVolatility(MarketInputs inputs, OptionSide side, double marketPrice) {
        ImpliedVolatilityResult result = ivSolver.solve(inputs, side, marketPrice);
        if (result.isSolved()) {
            metrics.recordIvSolved(result.getIterations());
        } else {
            metrics.recordIvFailed(result.getFailure().getKind());
            log.debug("IV solve failed for {} at price {}: {}", side, marketPrice, result.getFailure().getReason());
        }
        return result;
    }

    /**
     * Recomputes the full analysis for one request.
     */
    public AnalysisOutcome analyze(CalculationRequest request) {
        if (request.getMode() == CalculationMode.IMPLIED_VOLATILITY) {
            return analyzeFromMarketPrice(request);
        }
        return analyzeFromVolatility(request);
    }

    /**
     * Starting inputs for a new session: configured spot/strike/rates, valuation today,
     * exercise one tenor later.
     */
    public MarketInputs defaultInputs() {
        LocalDate today = LocalDate.now(ZoneId.of(defaultsConfig.getTimeZone()));
        return MarketInputs.builder()
                .spotPrice(defaultsConfig.getSpotPrice())
                .strikePrice(defaultsConfig.getStrikePrice())
                .valuationDate(today)
                .exerciseDate(today.plusMonths(defaultsConfig.getTenorMonths()))
                .volatility(defaultsConfig.getVolatility())
                .riskFreeRate(defaultsConfig.getRiskFreeRate())
                .dividendYield(defaultsConfig.getDividendYield())
                .build();
    }

    private AnalysisOutcome analyzeFromVolatility(CalculationRequest request) {
        PricingOutcome outcome = pricer.priceOption(request.getInputs());
        if (!outcome.isSuccess()) {
            log.debug("Pricing rejected: {}", outcome.getFailure().getReason());
            return AnalysisOutcome.failed(outcome.getFailure());
        }
        metrics.recordPricing();

        OptionAnalysis analysis = assemble(request, request.getInputs(), outcome.getResult(), null);
        log.debug(
                "Priced {} {} at vol {}%: call={}, put={}",
                request.getDirection(),
                request.getSide(),
                request.getInputs().getVolatility(),
                outcome.getResult().getCall().getPrice(),
                outcome.getResult().getPut().getPrice());
        return AnalysisOutcome.success(analysis);
    }

    private AnalysisOutcome analyzeFromMarketPrice(CalculationRequest request) {
        if (request.getMarketPrice() == null) {
            return AnalysisOutcome.failed(CalculationFailure.invalidInput("Please enter a valid option price"));
        }

        ImpliedVolatilityResult result =
                solveImpliedVolatility(request.getInputs(), request.getSide(), request.getMarketPrice());
        if (!result.isSolved()) {
            return AnalysisOutcome.failed(result.getFailure());
        }

        // The curve and position view are rebuilt at the solved volatility
        MarketInputs solvedInputs = request.getInputs().withVolatility(result.getVolatilityPercent());
        OptionAnalysis analysis =
                assemble(request, solvedInputs, result.getPricingResult(), result.getIterations());
        return AnalysisOutcome.success(analysis);
    }

    private OptionAnalysis assemble(
            CalculationRequest request, MarketInputs inputs, PricingResult pricingResult, Integer ivIterations) {
        List<CurvePoint> curve = buildCurve(
                inputs,
                request.getDirection(),
                pricingResult.getCall().getPrice(),
                pricingResult.getPut().getPrice());

        return OptionAnalysis.builder()
                .mode(request.getMode())
                .side(request.getSide())
                .direction(request.getDirection())
                .volatilityPercent(inputs.getVolatility())
                .pricingResult(pricingResult)
                .position(PositionView.of(
                        pricingResult.forSide(request.getSide()), request.getSide(), request.getDirection()))
                .curve(curve)
                .ivIterations(ivIterations)
                .build();
    }
}

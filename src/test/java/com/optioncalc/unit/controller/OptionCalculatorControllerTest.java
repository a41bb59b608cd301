package com.optioncalc.unit.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.optioncalc.api.controller.OptionCalculatorController;
import com.optioncalc.api.dto.response.ApiErrorResponse;
import com.optioncalc.config.ApiResponseAdvice;
import com.optioncalc.domain.enums.CalculationMode;
import com.optioncalc.domain.enums.OptionSide;
import com.optioncalc.domain.enums.PositionType;
import com.optioncalc.domain.model.AnalysisOutcome;
import com.optioncalc.domain.model.CalculationFailure;
import com.optioncalc.domain.model.CalculationRequest;
import com.optioncalc.domain.model.CurvePoint;
import com.optioncalc.domain.model.MarketInputs;
import com.optioncalc.domain.model.OptionAnalysis;
import com.optioncalc.domain.model.OptionGreeks;
import com.optioncalc.domain.model.PositionView;
import com.optioncalc.domain.model.PricingOutcome;
import com.optioncalc.domain.model.PricingResult;
import com.optioncalc.exception.GlobalExceptionHandler;
import com.optioncalc.service.OptionCalculatorService;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Standalone MockMvc tests for the OptionCalculatorController: request mapping,
 * response wrapping and failure-to-status translation.
 */
@ExtendWith(MockitoExtension.class)
class OptionCalculatorControllerTest {

    private static final String PRICING_BODY = """
            {
              "spotPrice": 100,
              "strikePrice": 105,
              "valuationDate": "2024-03-15",
              "exerciseDate": "2024-12-20",
              "volatility": 22.5,
              "riskFreeRate": 4.5,
              "side": "PUT",
              "direction": "SHORT"
            }
            """;

    private MockMvc mockMvc;

    @Mock
    private OptionCalculatorService optionCalculatorService;

    @BeforeEach
    void setUp() {
        OptionCalculatorController controller = new OptionCalculatorController(optionCalculatorService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
    }

    private static PricingResult pricingResult() {
        OptionGreeks call = OptionGreeks.builder()
                .price(6.12)
                .delta(0.45)
                .gamma(0.021)
                .vega(0.33)
                .theta(-0.02)
                .build();
        OptionGreeks put = OptionGreeks.builder()
                .price(9.73)
                .delta(-0.55)
                .gamma(0.021)
                .vega(0.33)
                .theta(-0.008)
                .build();
        return PricingResult.builder().call(call).put(put).timeToExpiry(280 / 365.25).build();
    }

    private static OptionAnalysis analysis(CalculationMode mode, double volatilityPercent, Integer iterations) {
        PricingResult result = pricingResult();
        return OptionAnalysis.builder()
                .mode(mode)
                .side(OptionSide.PUT)
                .direction(PositionType.SHORT)
                .volatilityPercent(volatilityPercent)
                .pricingResult(result)
                .position(PositionView.of(result.getPut(), OptionSide.PUT, PositionType.SHORT))
                .curve(List.of())
                .ivIterations(iterations)
                .build();
    }

    @Test
    @DisplayName("GET /api/options/defaults returns configured starting inputs")
    void getDefaults() throws Exception {
        when(optionCalculatorService.defaultInputs())
                .thenReturn(MarketInputs.builder()
                        .spotPrice(100)
                        .strikePrice(100)
                        .valuationDate(LocalDate.of(2024, 3, 15))
                        .exerciseDate(LocalDate.of(2025, 3, 15))
                        .volatility(25)
                        .riskFreeRate(5)
                        .dividendYield(0)
                        .build());

        mockMvc.perform(get("/api/options/defaults"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.spotPrice").value(100.0))
                .andExpect(jsonPath("$.data.volatility").value(25.0))
                .andExpect(jsonPath("$.data.riskFreeRate").value(5.0));
    }

    @Test
    @DisplayName("POST /api/options/price maps the body and returns the analysis")
    void priceReturnsAnalysis() throws Exception {
        when(optionCalculatorService.analyze(any(CalculationRequest.class)))
                .thenReturn(AnalysisOutcome.success(analysis(CalculationMode.PRICE, 22.5, null)));

        mockMvc.perform(post("/api/options/price")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PRICING_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.mode").value("PRICE"))
                .andExpect(jsonPath("$.data.pricingResult.call.price").value(6.12))
                .andExpect(jsonPath("$.data.pricingResult.put.delta").value(-0.55))
                .andExpect(jsonPath("$.data.pricingResult.daysToExpiry").value(280))
                .andExpect(jsonPath("$.data.position.premiumPaid").value(false))
                .andExpect(jsonPath("$.data.position.delta").value(0.55));

        ArgumentCaptor<CalculationRequest> captor = ArgumentCaptor.forClass(CalculationRequest.class);
        verify(optionCalculatorService).analyze(captor.capture());
        CalculationRequest request = captor.getValue();
        assertThat(request.getMode()).isEqualTo(CalculationMode.PRICE);
        assertThat(request.getSide()).isEqualTo(OptionSide.PUT);
        assertThat(request.getDirection()).isEqualTo(PositionType.SHORT);
        assertThat(request.getMarketPrice()).isNull();

        MarketInputs inputs = request.getInputs();
        assertThat(inputs.getSpotPrice()).isEqualTo(100.0);
        assertThat(inputs.getStrikePrice()).isEqualTo(105.0);
        assertThat(inputs.getExerciseDate()).isEqualTo(LocalDate.of(2024, 12, 20));
        assertThat(inputs.getVolatility()).isEqualTo(22.5);
        assertThat(inputs.getRiskFreeRate()).isEqualTo(4.5);
        assertThat(inputs.getDividendYield()).isZero();
    }

    @Test
    @DisplayName("POST /api/options/price defaults to a long call")
    void priceDefaultsSideAndDirection() throws Exception {
        when(optionCalculatorService.analyze(any(CalculationRequest.class)))
                .thenReturn(AnalysisOutcome.success(analysis(CalculationMode.PRICE, 22.5, null)));
        String body = """
                {
                  "spotPrice": 100,
                  "strikePrice": 105,
                  "valuationDate": "2024-03-15",
                  "exerciseDate": "2024-12-20",
                  "volatility": 22.5,
                  "riskFreeRate": 4.5,
                  "dividendYield": 1.25
                }
                """;

        mockMvc.perform(post("/api/options/price")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk());

        ArgumentCaptor<CalculationRequest> captor = ArgumentCaptor.forClass(CalculationRequest.class);
        verify(optionCalculatorService).analyze(captor.capture());
        assertThat(captor.getValue().getSide()).isEqualTo(OptionSide.CALL);
        assertThat(captor.getValue().getDirection()).isEqualTo(PositionType.LONG);
        assertThat(captor.getValue().getInputs().getDividendYield()).isEqualTo(1.25);
    }

    @Test
    @DisplayName("POST /api/options/price with a missing field returns 400 without calling the engine")
    void priceMissingFieldRejected() throws Exception {
        String body = """
                {
                  "spotPrice": 100,
                  "valuationDate": "2024-03-15",
                  "exerciseDate": "2024-12-20",
                  "volatility": 22.5,
                  "riskFreeRate": 4.5
                }
                """;

        mockMvc.perform(post("/api/options/price")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.fieldErrors.strikePrice").exists());

        verify(optionCalculatorService, never()).analyze(any());
    }

    @Test
    @DisplayName("POST /api/options/price with invalid input reports the engine's reason as 400")
    void priceInvalidInputReturns400() throws Exception {
        when(optionCalculatorService.analyze(any(CalculationRequest.class)))
                .thenReturn(AnalysisOutcome.failed(CalculationFailure.invalidInput("Volatility must be positive")));

        mockMvc.perform(post("/api/options/price")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PRICING_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.message").value("Volatility must be positive"))
                .andExpect(jsonPath("$.error.kind").value("INVALID_INPUT"))
                .andExpect(jsonPath("$.error.path").value("/api/options/price"));
    }

    @Test
    @DisplayName("POST /api/options/implied-volatility passes the market price through")
    void impliedVolatilityReturnsAnalysis() throws Exception {
        when(optionCalculatorService.analyze(any(CalculationRequest.class)))
                .thenReturn(AnalysisOutcome.success(analysis(CalculationMode.IMPLIED_VOLATILITY, 27.4, 4)));
        String body = """
                {
                  "spotPrice": 100,
                  "strikePrice": 105,
                  "valuationDate": "2024-03-15",
                  "exerciseDate": "2024-12-20",
                  "riskFreeRate": 4.5,
                  "marketPrice": 9.73,
                  "side": "PUT"
                }
                """;

        mockMvc.perform(post("/api/options/implied-volatility")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.mode").value("IMPLIED_VOLATILITY"))
                .andExpect(jsonPath("$.data.volatilityPercent").value(27.4))
                .andExpect(jsonPath("$.data.ivIterations").value(4));

        ArgumentCaptor<CalculationRequest> captor = ArgumentCaptor.forClass(CalculationRequest.class);
        verify(optionCalculatorService).analyze(captor.capture());
        assertThat(captor.getValue().getMode()).isEqualTo(CalculationMode.IMPLIED_VOLATILITY);
        assertThat(captor.getValue().getMarketPrice()).isEqualTo(9.73);
        assertThat(captor.getValue().getSide()).isEqualTo(OptionSide.PUT);
    }

    @Test
    @DisplayName("POST /api/options/implied-volatility without a market price returns 400")
    void impliedVolatilityMissingPrice() throws Exception {
        String body = """
                {
                  "spotPrice": 100,
                  "strikePrice": 105,
                  "valuationDate": "2024-03-15",
                  "exerciseDate": "2024-12-20",
                  "riskFreeRate": 4.5
                }
                """;

        mockMvc.perform(post("/api/options/implied-volatility")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.fieldErrors.marketPrice").exists());
    }

    @Test
    @DisplayName("POST /api/options/implied-volatility non-convergence returns 422")
    void impliedVolatilityNonConvergence() throws Exception {
        when(optionCalculatorService.analyze(any(CalculationRequest.class)))
                .thenReturn(AnalysisOutcome.failed(
                        CalculationFailure.nonConvergence("IV calculation did not converge. Try a different price.")));
        String body = """
                {
                  "spotPrice": 100,
                  "strikePrice": 105,
                  "valuationDate": "2024-03-15",
                  "exerciseDate": "2024-12-20",
                  "riskFreeRate": 4.5,
                  "marketPrice": 400
                }
                """;

        mockMvc.perform(post("/api/options/implied-volatility")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error.code").value("IV_NOT_CONVERGED"))
                .andExpect(jsonPath("$.error.message").value("IV calculation did not converge. Try a different price."))
                .andExpect(jsonPath("$.error.kind").value("NON_CONVERGENCE"));
    }

    @Test
    @DisplayName("POST /api/options/curve uses the caller's entry premiums")
    void curveUsesEntryPrices() throws Exception {
        when(optionCalculatorService.priceOption(any(MarketInputs.class)))
                .thenReturn(PricingOutcome.success(pricingResult()));
        CurvePoint point = CurvePoint.builder()
                .spot(100)
                .callPayoff(-5.0)
                .putPayoff(0.0)
                .callCurrentPnl(1.12)
                .putCurrentPnl(-0.27)
                .callIntrinsic(0)
                .putIntrinsic(5)
                .callDelta(0.45)
                .putDelta(-0.55)
                .gamma(0.021)
                .vega(0.33)
                .build();
        when(optionCalculatorService.buildCurve(any(MarketInputs.class), eq(PositionType.LONG), anyDouble(), anyDouble()))
                .thenReturn(List.of(point));
        String body = """
                {
                  "inputs": {
                    "spotPrice": 100,
                    "strikePrice": 105,
                    "valuationDate": "2024-03-15",
                    "exerciseDate": "2024-12-20",
                    "volatility": 22.5,
                    "riskFreeRate": 4.5
                  },
                  "entryCallPrice": 5.0,
                  "entryPutPrice": 10.0
                }
                """;

        mockMvc.perform(post("/api/options/curve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].spot").value(100.0))
                .andExpect(jsonPath("$.data[0].callCurrentPnl").value(1.12))
                .andExpect(jsonPath("$.data[0].putIntrinsic").value(5.0));

        verify(optionCalculatorService).buildCurve(any(MarketInputs.class), eq(PositionType.LONG), eq(5.0), eq(10.0));
    }

    @Test
    @DisplayName("POST /api/options/curve rejects unpriceable inputs instead of returning an empty curve")
    void curveInvalidInputsRejected() throws Exception {
        when(optionCalculatorService.priceOption(any(MarketInputs.class)))
                .thenReturn(PricingOutcome.failed(CalculationFailure.invalidInput("Volatility must be positive")));
        String body = """
                {
                  "inputs": {
                    "spotPrice": 100,
                    "strikePrice": 105,
                    "valuationDate": "2024-03-15",
                    "exerciseDate": "2024-12-20",
                    "volatility": 0,
                    "riskFreeRate": 4.5
                  },
                  "entryCallPrice": 5.0,
                  "entryPutPrice": 10.0,
                  "direction": "SHORT"
                }
                """;

        mockMvc.perform(post("/api/options/curve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.message").value("Volatility must be positive"));

        verify(optionCalculatorService, never()).buildCurve(any(), any(), anyDouble(), anyDouble());
    }

    @Test
    @DisplayName("Malformed JSON returns 400 MALFORMED_REQUEST")
    void malformedBody() throws Exception {
        mockMvc.perform(post("/api/options/price")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{ \"spotPrice\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("MALFORMED_REQUEST"));
    }

    @Test
    @DisplayName("Unknown option side is reported against its field")
    void unknownSideNamesField() throws Exception {
        String body = PRICING_BODY.replace("\"PUT\"", "\"STRADDLE\"");

        mockMvc.perform(post("/api/options/price")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("MALFORMED_REQUEST"))
                .andExpect(jsonPath("$.error.fieldErrors.side").value("Invalid value 'STRADDLE'"));

        verify(optionCalculatorService, never()).analyze(any());
    }

    @Test
    @DisplayName("Unknown path returns 404 NOT_FOUND")
    void unknownPathNotFound() throws Exception {
        mockMvc.perform(get("/api/options/greeks"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"))
                .andExpect(jsonPath("$.error.path").value("/api/options/greeks"));
    }

    @Test
    @DisplayName("Missing static resource maps to 404 NOT_FOUND")
    void missingResourceNotFound() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/favicon.ico");

        ResponseEntity<ApiErrorResponse> response = new GlobalExceptionHandler()
                .handleNotFound(new NoResourceFoundException(HttpMethod.GET, "favicon.ico"), request);

        assertThat(response.getStatusCode().value()).isEqualTo(404);
        assertThat(response.getBody().getError().getCode().name()).isEqualTo("NOT_FOUND");
        assertThat(response.getBody().getError().getPath()).isEqualTo("/favicon.ico");
    }

    @Test
    @DisplayName("GET on a POST endpoint returns 405 with the allowed method")
    void wrongMethodNotAllowed() throws Exception {
        mockMvc.perform(get("/api/options/price"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(header().string("Allow", "POST"))
                .andExpect(jsonPath("$.error.code").value("METHOD_NOT_ALLOWED"));

        verify(optionCalculatorService, never()).analyze(any());
    }

    @Test
    @DisplayName("Non-JSON body returns 415 UNSUPPORTED_MEDIA_TYPE")
    void plainTextBodyUnsupported() throws Exception {
        mockMvc.perform(post("/api/options/price")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("spot=100"))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.error.code").value("UNSUPPORTED_MEDIA_TYPE"));

        verify(optionCalculatorService, never()).analyze(any());
    }
}

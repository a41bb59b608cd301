package com.optioncalc.core.processor;

import com.optioncalc.domain.enums.PositionType;
import com.optioncalc.domain.model.CurvePoint;
import com.optioncalc.domain.model.MarketInputs;
import com.optioncalc.domain.model.OptionGreeks;
import com.optioncalc.domain.model.PricingResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds the payoff / P&L curves by re-pricing the option across a grid of
 * hypothetical spot prices.
 *
 * <p>The grid spans S +/- 50% (lower end floored at 1) in {@link #STEPS} equal steps,
 * i.e. {@link #POINT_COUNT} points in ascending spot order. Strike, T, volatility,
 * rate and dividend yield stay at the current inputs: the curve answers "what if only
 * spot moved right now", it does not roll time forward.
 *
 * <p>Per point and side:
 * <ul>
 *   <li>payoff = (intrinsic - entry) * sign
 *   <li>current P&L = (Black-Scholes value - entry) * sign
 *   <li>intrinsic series = intrinsic * sign
 * </ul>
 * where sign is +1 for LONG and -1 for SHORT. Greeks on each point are the raw
 * instrument Greeks and are not signed.
 */
@Slf4j
@Component
public class PayoffCurveGenerator {

    public static final int STEPS = 200;
    public static final int POINT_COUNT = STEPS + 1;

    static final double RANGE_FRACTION = 0.5;
    static final double MIN_SPOT = 1.0;

    private final BlackScholesPricer pricer;
    private final TimeToExpiryCalculator timeToExpiryCalculator;

    public PayoffCurveGenerator(BlackScholesPricer pricer, TimeToExpiryCalculator timeToExpiryCalculator) {
        this.pricer = pricer;
        this.timeToExpiryCalculator = timeToExpiryCalculator;
    }

    /**
     * Sweeps spot and returns {@link #POINT_COUNT} points in ascending spot order.
     *
     * @param inputs         current market inputs (volatility in percent)
     * @param direction      LONG or SHORT, applied to the P&L series only
     * @param entryCallPrice call premium at the current spot
     * @param entryPutPrice  put premium at the current spot
     * @return the curve, or an empty list if the inputs cannot be priced
     */
    public List<CurvePoint> buildCurve(
            MarketInputs inputs, PositionType direction, double entryCallPrice, double entryPutPrice) {
        double S = inputs.getSpotPrice();
        double K = inputs.getStrikePrice();
        double sigma = inputs.volatilityDecimal();

        if (!BlackScholesPricer.isPositive(S) || !BlackScholesPricer.isPositive(K) || !BlackScholesPricer.isPositive(sigma)) {
            log.warn("Cannot build payoff curve for S={}, K={}, sigma={}", S, K, sigma);
            return Collections.emptyList();
        }

        double T = timeToExpiryCalculator.yearFraction(inputs.getValuationDate(), inputs.getExerciseDate());
        double r = inputs.riskFreeRateDecimal();
        double q = inputs.dividendYieldDecimal();
        int sign = direction.sign();

        double range = S * RANGE_FRACTION;
        double upper = S + range;
        double lower = Math.max(MIN_SPOT, S - range);
        if (lower > upper) {
            // Sub-unit spot: the floor would invert the grid
            lower = S - range;
        }
        double step = (upper - lower) / STEPS;

        List<CurvePoint> curve = new ArrayList<>(POINT_COUNT);
        for (int i = 0; i <= STEPS; i++) {
            // Pin the last point so rounding can't leave it short of S + range
            double spot = i == STEPS ? upper : lower + i * step;
            PricingResult valuation = pricer.price(spot, K, T, sigma, r, q);
            OptionGreeks call = valuation.getCall();
            OptionGreeks put = valuation.getPut();

            double callIntrinsic = Math.max(0.0, spot - K);
            double putIntrinsic = Math.max(0.0, K - spot);

            curve.add(CurvePoint.builder()
                    .spot(spot)
                    .callPayoff((callIntrinsic - entryCallPrice) * sign)
                    .putPayoff((putIntrinsic - entryPutPrice) * sign)
                    .callCurrentPnl((call.getPrice() - entryCallPrice) * sign)
                    .putCurrentPnl((put.getPrice() - entryPutPrice) * sign)
                    .callIntrinsic(callIntrinsic * sign)
                    .putIntrinsic(putIntrinsic * sign)
                    .callDelta(call.getDelta())
                    .putDelta(put.getDelta())
                    .gamma(call.getGamma())
                    .vega(call.getVega())
                    .build());
        }
        return curve;
    }
}

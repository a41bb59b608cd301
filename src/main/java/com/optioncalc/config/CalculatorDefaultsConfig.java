package com.optioncalc.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Starting values for a fresh calculator form.
 *
 * <p>Percent fields are whole numbers (25 = 25%). The exercise date is derived as
 * valuation date + {@code tenorMonths}. Properties are read from the
 * {@code optioncalc.defaults} prefix.
 */
@Configuration
@ConfigurationProperties(prefix = "optioncalc.defaults")
@Getter
@Setter
public class CalculatorDefaultsConfig {

    private double spotPrice = 100.0;

    private double strikePrice = 100.0;

    /** Volatility in percent. */
    private double volatility = 25.0;

    /** Risk-free rate in percent. */
    private double riskFreeRate = 5.0;

    /** Continuous dividend yield in percent. */
    private double dividendYield = 0.0;

    /** Months from valuation to exercise. */
    private int tenorMonths = 12;

    /** Zone used to resolve "today" for the valuation date. */
    private String timeZone = "UTC";
}

package com.optiontrader.indicator;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Indicator periods and signal thresholds, bound from application.yml under
 * {@code optiontrader.indicators}.
 *
 * <p>Setting {@code enabled=false} removes the ta4j backend, and the signal engine
 * then reports every analysis as unavailable.
 */
@Data
@ConfigurationProperties(prefix = "optiontrader.indicators")
public class IndicatorConfig {

    private boolean enabled = true;

    private int rsiPeriod = 14;
    private double rsiOversold = 30.0;
    private double rsiOverbought = 70.0;

    private int bollingerPeriod = 20;
    private double bollingerMultiplier = 2.0;

    private int macdFast = 12;
    private int macdSlow = 26;
    private int macdSignal = 9;

    /** MACD and signal lines closer than this count as a recent crossover. */
    private double macdCrossoverTolerance = 0.1;

    private int atrPeriod = 14;
}

package com.optiontrader.indicator;

/**
 * Bollinger band levels with the current price's normalized position.
 *
 * <p>{@code position} is 0 at the lower band and 1 at the upper band. It is not clipped:
 * prices outside the bands give values below 0 or above 1, which reads as a breakout.
 */
public record BollingerBands(
        double upper, double middle, double lower, double width, double position, BandSignal signal) {

    public static BollingerBands of(double upper, double middle, double lower, double price) {
        double width = upper - lower;
        double position = width > 0 ? (price - lower) / width : 0.5;
        return new BollingerBands(upper, middle, lower, width, position, BandSignal.classify(position));
    }
}

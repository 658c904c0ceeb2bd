package com.questrail.wavemeter.state;

/**
 * Deviation (regulation output) settings of one channel.
 *
 * <p>{@code sourceChannel} is the channel whose error signal drives this
 * output; {@code 0} means regulation is unassigned.</p>
 */
public record DeviationSettings(
        int polarity,
        double sensitivityFactor,
        int sensitivityDimension,
        int sensitivityExponent,
        int unit,
        int sourceChannel
) {
    public static DeviationSettings defaults() {
        return new DeviationSettings(1, 1.0, 0, 0, 0, 0);
    }

    public DeviationSettings withPolarity(int v) { return new DeviationSettings(v, sensitivityFactor, sensitivityDimension, sensitivityExponent, unit, sourceChannel); }
    public DeviationSettings withSensitivityFactor(double v) { return new DeviationSettings(polarity, v, sensitivityDimension, sensitivityExponent, unit, sourceChannel); }
    public DeviationSettings withSensitivityDimension(int v) { return new DeviationSettings(polarity, sensitivityFactor, v, sensitivityExponent, unit, sourceChannel); }
    public DeviationSettings withSensitivityExponent(int v) { return new DeviationSettings(polarity, sensitivityFactor, sensitivityDimension, v, unit, sourceChannel); }
    public DeviationSettings withUnit(int v) { return new DeviationSettings(polarity, sensitivityFactor, sensitivityDimension, sensitivityExponent, v, sourceChannel); }
    public DeviationSettings withSourceChannel(int v) { return new DeviationSettings(polarity, sensitivityFactor, sensitivityDimension, sensitivityExponent, unit, v); }
}

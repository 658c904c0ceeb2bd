package com.questrail.wavemeter.state;

/**
 * Instrument-wide readings and modes.
 */
public record GlobalReadings(
        double temperature,
        double pressure,
        boolean autocalibration,
        boolean deviationMode
) {
    public static GlobalReadings initial() {
        return new GlobalReadings(0.0, 0.0, false, false);
    }

    public GlobalReadings withTemperature(double v) { return new GlobalReadings(v, pressure, autocalibration, deviationMode); }
    public GlobalReadings withPressure(double v) { return new GlobalReadings(temperature, v, autocalibration, deviationMode); }
    public GlobalReadings withAutocalibration(boolean v) { return new GlobalReadings(temperature, pressure, v, deviationMode); }
    public GlobalReadings withDeviationMode(boolean v) { return new GlobalReadings(temperature, pressure, autocalibration, v); }
}

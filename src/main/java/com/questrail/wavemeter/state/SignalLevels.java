package com.questrail.wavemeter.state;

/**
 * Exposure times (ms) and peak amplitudes of the two CCD arrays, as of the
 * last fast poll that read them.
 */
public record SignalLevels(double exposure1Millis, double exposure2Millis, double amplitude1, double amplitude2) {

    private static final SignalLevels UNKNOWN = new SignalLevels(0.0, 0.0, 0.0, 0.0);

    public static SignalLevels unknown() {
        return UNKNOWN;
    }

    public SignalLevels withExposure(double first, double second) {
        return new SignalLevels(first, second, amplitude1, amplitude2);
    }

    public SignalLevels withAmplitude(double first, double second) {
        return new SignalLevels(exposure1Millis, exposure2Millis, first, second);
    }
}

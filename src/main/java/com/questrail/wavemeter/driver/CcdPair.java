package com.questrail.wavemeter.driver;

/**
 * One reading per CCD array of the interferometer.
 */
public record CcdPair(double first, double second) {
}

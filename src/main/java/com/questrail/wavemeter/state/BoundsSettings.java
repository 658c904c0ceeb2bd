package com.questrail.wavemeter.state;

/**
 * Output bounds of one channel's regulator.
 *
 * @param referenceCentered {@code true} if the reference point is
 *                          auto-centered between min and max, {@code false}
 *                          if {@code referencePoint} is used explicitly
 */
public record BoundsSettings(
        double min,
        double max,
        double referencePoint,
        boolean referenceCentered
) {
    public static BoundsSettings defaults() {
        return new BoundsSettings(0.0, 0.0, 0.0, true);
    }

    public BoundsSettings withMin(double v) { return new BoundsSettings(v, max, referencePoint, referenceCentered); }
    public BoundsSettings withMax(double v) { return new BoundsSettings(min, v, referencePoint, referenceCentered); }
    public BoundsSettings withReferencePoint(double v) { return new BoundsSettings(min, max, v, referenceCentered); }
    public BoundsSettings withReferenceCentered(boolean v) { return new BoundsSettings(min, max, referencePoint, v); }
}

package com.questrail.wavemeter.observer;

/**
 * Rendering callback of a local display.
 *
 * <p>Called on the observer's scheduler thread; a GUI implementation hands the
 * state to its own UI thread. Must never block.</p>
 */
public interface DisplayView
{
    /**
     * Which part of the display a refresh is meant for.
     */
    enum Refresh {
        /** Frequencies, control voltages, lock flags. */
        MEASUREMENTS,
        /** Setpoints, switcher, PID, bounds and instrument readings. */
        STATUS
    }

    void render(DisplayState state, Refresh refresh);
}

package com.questrail.wavemeter.state;

/**
 * PID regulator settings of one channel.
 *
 * <p>{@code useTa} selects between the two derived-gain formulas of the
 * regulator (time-constant based vs. sample-interval based).</p>
 */
public record PidSettings(
        double p,
        double i,
        double d,
        double t,
        double dt,
        boolean useTa,
        boolean constDt,
        boolean autoClearHistory,
        boolean clearHistoryOnRangeExceed
) {
    public static PidSettings defaults() {
        return new PidSettings(0.0, 0.0, 0.0, 0.0, 0.0, false, false, false, false);
    }

    public PidSettings withP(double v) { return new PidSettings(v, i, d, t, dt, useTa, constDt, autoClearHistory, clearHistoryOnRangeExceed); }
    public PidSettings withI(double v) { return new PidSettings(p, v, d, t, dt, useTa, constDt, autoClearHistory, clearHistoryOnRangeExceed); }
    public PidSettings withD(double v) { return new PidSettings(p, i, v, t, dt, useTa, constDt, autoClearHistory, clearHistoryOnRangeExceed); }
    public PidSettings withT(double v) { return new PidSettings(p, i, d, v, dt, useTa, constDt, autoClearHistory, clearHistoryOnRangeExceed); }
    public PidSettings withDt(double v) { return new PidSettings(p, i, d, t, v, useTa, constDt, autoClearHistory, clearHistoryOnRangeExceed); }
    public PidSettings withUseTa(boolean v) { return new PidSettings(p, i, d, t, dt, v, constDt, autoClearHistory, clearHistoryOnRangeExceed); }
    public PidSettings withConstDt(boolean v) { return new PidSettings(p, i, d, t, dt, useTa, v, autoClearHistory, clearHistoryOnRangeExceed); }
    public PidSettings withAutoClearHistory(boolean v) { return new PidSettings(p, i, d, t, dt, useTa, constDt, v, clearHistoryOnRangeExceed); }
    public PidSettings withClearHistoryOnRangeExceed(boolean v) { return new PidSettings(p, i, d, t, dt, useTa, constDt, autoClearHistory, v); }
}

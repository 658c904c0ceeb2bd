package com.questrail.wavemeter.api;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Quantity
 * -----------------------------------------------------------------------------
 * Catalogue of every observable or programmable quantity of the wavemeter.
 *
 * <p>Every value crosses layer boundaries as a {@code double}. Boolean
 * quantities are encoded as {@code 0.0}/{@code 1.0} and integer quantities as
 * integral doubles; {@link Kind} tells callers how to interpret them.</p>
 *
 * <p>The {@link #wireName()} is used by the command protocol and by the saved
 * settings file. The command protocol also accepts the enum constant name.</p>
 */
public enum Quantity
{
    // ---- per-channel measurements (fast poll) -------------------------------
    FREQUENCY("Frequency", Scope.CHANNEL, Kind.DOUBLE, false, false),
    CONTROL_VOLTAGE("Voltage", Scope.CHANNEL, Kind.DOUBLE, true, false),
    LOCKED("Locked", Scope.CHANNEL, Kind.BOOLEAN, false, false),

    // ---- per-channel status (slow poll) -------------------------------------
    SETPOINT("Setpoint", Scope.CHANNEL, Kind.DOUBLE, true, true),
    LOCK_ENABLED("LockEnabled", Scope.CHANNEL, Kind.BOOLEAN, true, false),
    SWITCHER_USE("Use", Scope.CHANNEL, Kind.BOOLEAN, true, false),
    SWITCHER_SHOW("Show", Scope.CHANNEL, Kind.BOOLEAN, true, false),

    // ---- PID gains ----------------------------------------------------------
    PID_P("P", Scope.CHANNEL, Kind.DOUBLE, true, true),
    PID_I("I", Scope.CHANNEL, Kind.DOUBLE, true, true),
    PID_D("D", Scope.CHANNEL, Kind.DOUBLE, true, true),
    PID_T("T", Scope.CHANNEL, Kind.DOUBLE, true, true),
    PID_DT("dt", Scope.CHANNEL, Kind.DOUBLE, true, true),
    PID_USE_TA("UseTa", Scope.CHANNEL, Kind.BOOLEAN, true, true),
    PID_CONST_DT("Constdt", Scope.CHANNEL, Kind.BOOLEAN, true, true),
    PID_AUTO_CLEAR_HISTORY("AutoClearHistory", Scope.CHANNEL, Kind.BOOLEAN, true, true),
    PID_CLEAR_HISTORY_ON_RANGE_EXCEED("ClearHistoryOnRangeExceed", Scope.CHANNEL, Kind.BOOLEAN, true, true),

    // ---- deviation (regulation) settings ------------------------------------
    DEVIATION_POLARITY("Polarity", Scope.CHANNEL, Kind.INTEGER, true, true),
    DEVIATION_SENSITIVITY_FACTOR("SensitivityFactor", Scope.CHANNEL, Kind.DOUBLE, true, true),
    DEVIATION_SENSITIVITY_DIMENSION("SensitivityDim", Scope.CHANNEL, Kind.INTEGER, true, true),
    DEVIATION_SENSITIVITY_EXPONENT("SensitivityEx", Scope.CHANNEL, Kind.INTEGER, true, true),
    DEVIATION_UNIT("Unit", Scope.CHANNEL, Kind.INTEGER, true, true),
    DEVIATION_CHANNEL("DeviationChannel", Scope.CHANNEL, Kind.INTEGER, true, true),

    // ---- bounds -------------------------------------------------------------
    BOUNDS_MIN("BoundsMin", Scope.CHANNEL, Kind.DOUBLE, true, true),
    BOUNDS_MAX("BoundsMax", Scope.CHANNEL, Kind.DOUBLE, true, true),
    BOUNDS_REF_AT("RefAt", Scope.CHANNEL, Kind.DOUBLE, true, true),
    BOUNDS_REF_MID("RefMid", Scope.CHANNEL, Kind.BOOLEAN, true, true),

    // ---- global readings ----------------------------------------------------
    TEMPERATURE("Temperature", Scope.GLOBAL, Kind.DOUBLE, false, false),
    PRESSURE("Pressure", Scope.GLOBAL, Kind.DOUBLE, false, false),
    AUTOCALIBRATION("Autocal", Scope.GLOBAL, Kind.BOOLEAN, true, false),
    DEVIATION_MODE("DeviationMode", Scope.GLOBAL, Kind.BOOLEAN, true, false);

    /**
     * Whether the quantity belongs to one channel or to the instrument.
     */
    public enum Scope { CHANNEL, GLOBAL }

    /**
     * How the {@code double} carrier value is interpreted.
     */
    public enum Kind { DOUBLE, INTEGER, BOOLEAN }

    private final String wireName;
    private final Scope scope;
    private final Kind kind;
    private final boolean writable;
    private final boolean persisted;

    Quantity(String wireName, Scope scope, Kind kind, boolean writable, boolean persisted) {
        this.wireName = wireName;
        this.scope = scope;
        this.kind = kind;
        this.writable = writable;
        this.persisted = persisted;
    }

    public String wireName() {
        return wireName;
    }

    public Scope scope() {
        return scope;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * {@code true} if the quantity can be the target of a write request.
     */
    public boolean writable() {
        return writable;
    }

    /**
     * {@code true} if the quantity is part of the saved settings record.
     */
    public boolean persisted() {
        return persisted;
    }

    /**
     * Resolves a wire name or constant name, ignoring case.
     */
    public static Optional<Quantity> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        return Arrays.stream(values())
                .filter(q -> q.wireName.equalsIgnoreCase(trimmed)
                        || q.name().equals(trimmed.toUpperCase(Locale.ROOT)))
                .findFirst();
    }

    public static double encode(boolean value) {
        return value ? 1.0 : 0.0;
    }

    public static boolean decodeBoolean(double value) {
        return value != 0.0;
    }
}

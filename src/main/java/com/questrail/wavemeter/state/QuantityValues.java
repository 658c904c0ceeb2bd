package com.questrail.wavemeter.state;

import com.questrail.wavemeter.api.ChannelId;
import com.questrail.wavemeter.api.Quantity;

import java.util.Objects;

import static com.questrail.wavemeter.api.Quantity.decodeBoolean;
import static com.questrail.wavemeter.api.Quantity.encode;

/**
 * QuantityValues
 * -----------------------------------------------------------------------------
 * Maps each {@link Quantity} onto the field of a {@link WavemeterSnapshot}
 * that holds it, in both directions.
 *
 * <p>For {@link Quantity.Scope#GLOBAL} quantities the channel argument is
 * ignored and may be {@code null}. For channel quantities it is required.</p>
 */
public final class QuantityValues
{
    private QuantityValues() {
    }

    /**
     * Reads the stored value of {@code quantity}, encoded as a {@code double}.
     */
    public static double read(WavemeterSnapshot snapshot, ChannelId channel, Quantity quantity) {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(quantity, "quantity");

        if (quantity.scope() == Quantity.Scope.GLOBAL) {
            GlobalReadings g = snapshot.globals();
            return switch (quantity) {
                case TEMPERATURE -> g.temperature();
                case PRESSURE -> g.pressure();
                case AUTOCALIBRATION -> encode(g.autocalibration());
                case DEVIATION_MODE -> encode(g.deviationMode());
                default -> throw new IllegalStateException("Unhandled global quantity " + quantity);
            };
        }

        ChannelState c = snapshot.channel(Objects.requireNonNull(channel, "channel"));
        PidSettings pid = c.pid();
        DeviationSettings dev = c.deviation();
        BoundsSettings bounds = c.bounds();
        return switch (quantity) {
            case FREQUENCY -> c.displayedFrequency();
            case CONTROL_VOLTAGE -> c.controlVoltage();
            case LOCKED -> encode(c.locked());
            case SETPOINT -> c.setpoint();
            case LOCK_ENABLED -> encode(c.lockEnabled());
            case SWITCHER_USE -> encode(c.switcherUse());
            case SWITCHER_SHOW -> encode(c.switcherShow());
            case PID_P -> pid.p();
            case PID_I -> pid.i();
            case PID_D -> pid.d();
            case PID_T -> pid.t();
            case PID_DT -> pid.dt();
            case PID_USE_TA -> encode(pid.useTa());
            case PID_CONST_DT -> encode(pid.constDt());
            case PID_AUTO_CLEAR_HISTORY -> encode(pid.autoClearHistory());
            case PID_CLEAR_HISTORY_ON_RANGE_EXCEED -> encode(pid.clearHistoryOnRangeExceed());
            case DEVIATION_POLARITY -> dev.polarity();
            case DEVIATION_SENSITIVITY_FACTOR -> dev.sensitivityFactor();
            case DEVIATION_SENSITIVITY_DIMENSION -> dev.sensitivityDimension();
            case DEVIATION_SENSITIVITY_EXPONENT -> dev.sensitivityExponent();
            case DEVIATION_UNIT -> dev.unit();
            case DEVIATION_CHANNEL -> dev.sourceChannel();
            case BOUNDS_MIN -> bounds.min();
            case BOUNDS_MAX -> bounds.max();
            case BOUNDS_REF_AT -> bounds.referencePoint();
            case BOUNDS_REF_MID -> encode(bounds.referenceCentered());
            default -> throw new IllegalStateException("Unhandled channel quantity " + quantity);
        };
    }

    /**
     * Returns a snapshot in which {@code quantity} holds {@code value}.
     *
     * <p>Measurement-only quantities ({@link Quantity#FREQUENCY},
     * {@link Quantity#LOCKED}) are written through the frequency
     * normalisation path instead and are rejected here.</p>
     *
     * <p>{@link Quantity#LOCK_ENABLED} and {@link Quantity#DEVIATION_CHANNEL}
     * are two views of one regulator register: a channel is armed exactly when
     * its deviation channel points at itself. Storing either keeps both
     * consistent.</p>
     *
     * @throws IllegalArgumentException for quantities that cannot be stored directly
     */
    public static WavemeterSnapshot apply(WavemeterSnapshot snapshot, ChannelId channel, Quantity quantity, double value) {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(quantity, "quantity");

        if (quantity.scope() == Quantity.Scope.GLOBAL) {
            return snapshot.withGlobals(g -> switch (quantity) {
                case TEMPERATURE -> g.withTemperature(value);
                case PRESSURE -> g.withPressure(value);
                case AUTOCALIBRATION -> g.withAutocalibration(decodeBoolean(value));
                case DEVIATION_MODE -> g.withDeviationMode(decodeBoolean(value));
                default -> throw new IllegalStateException("Unhandled global quantity " + quantity);
            });
        }

        Objects.requireNonNull(channel, "channel");
        int asInt = (int) Math.round(value);
        boolean asBool = decodeBoolean(value);
        return snapshot.withChannel(channel, c -> switch (quantity) {
            case FREQUENCY, LOCKED ->
                    throw new IllegalArgumentException(quantity + " is a measurement and cannot be stored directly");
            case CONTROL_VOLTAGE -> c.withControlVoltage(value);
            case SETPOINT -> c.withSetpoint(value);
            case LOCK_ENABLED -> c.withLockEnabled(asBool)
                    .withDeviation(c.deviation().withSourceChannel(asBool ? channel.value() : 0));
            case SWITCHER_USE -> c.withSwitcherUse(asBool);
            case SWITCHER_SHOW -> c.withSwitcherShow(asBool);
            case PID_P -> c.withPid(c.pid().withP(value));
            case PID_I -> c.withPid(c.pid().withI(value));
            case PID_D -> c.withPid(c.pid().withD(value));
            case PID_T -> c.withPid(c.pid().withT(value));
            case PID_DT -> c.withPid(c.pid().withDt(value));
            case PID_USE_TA -> c.withPid(c.pid().withUseTa(asBool));
            case PID_CONST_DT -> c.withPid(c.pid().withConstDt(asBool));
            case PID_AUTO_CLEAR_HISTORY -> c.withPid(c.pid().withAutoClearHistory(asBool));
            case PID_CLEAR_HISTORY_ON_RANGE_EXCEED -> c.withPid(c.pid().withClearHistoryOnRangeExceed(asBool));
            case DEVIATION_POLARITY -> c.withDeviation(c.deviation().withPolarity(asInt));
            case DEVIATION_SENSITIVITY_FACTOR -> c.withDeviation(c.deviation().withSensitivityFactor(value));
            case DEVIATION_SENSITIVITY_DIMENSION -> c.withDeviation(c.deviation().withSensitivityDimension(asInt));
            case DEVIATION_SENSITIVITY_EXPONENT -> c.withDeviation(c.deviation().withSensitivityExponent(asInt));
            case DEVIATION_UNIT -> c.withDeviation(c.deviation().withUnit(asInt));
            case DEVIATION_CHANNEL -> c.withDeviation(c.deviation().withSourceChannel(asInt))
                    .withLockEnabled(asInt == channel.value());
            case BOUNDS_MIN -> c.withBounds(c.bounds().withMin(value));
            case BOUNDS_MAX -> c.withBounds(c.bounds().withMax(value));
            case BOUNDS_REF_AT -> c.withBounds(c.bounds().withReferencePoint(value));
            case BOUNDS_REF_MID -> c.withBounds(c.bounds().withReferenceCentered(asBool));
            default -> throw new IllegalStateException("Unhandled channel quantity " + quantity);
        });
    }
}

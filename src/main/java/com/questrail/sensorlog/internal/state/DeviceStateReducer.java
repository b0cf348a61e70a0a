package com.questrail.sensorlog.internal.state;

import com.questrail.sensorlog.api.SensorRecord;
import com.questrail.sensorlog.fault.FaultDecoder;

import java.util.Objects;

/**
 * DeviceStateReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic per-sensor transition function.
 *
 * <p>Given the current {@link DeviceState} of a sensor and one of its records,
 * the reducer computes the next state. It holds no per-sensor data and
 * performs no I/O; the {@link DeviceAggregator} owns the state map.</p>
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>{@code "DD"}: a non-faulty sensor becomes {@link DeviceState.Faulty}
 *       with the reason decoded from this record. An already faulty sensor is
 *       unchanged.</li>
 *   <li>{@code "02"}: a faulty sensor is unchanged; otherwise the healthy
 *       occurrence count is incremented (or started at 1).</li>
 *   <li>Any other state code leaves the sensor unchanged.</li>
 * </ul>
 *
 * <p>"Unchanged" means the exact same instance is returned, so callers can
 * detect no-ops by identity.</p>
 */
public final class DeviceStateReducer
{
    public static final String HEALTHY_STATE = "02";
    public static final String FAULTY_STATE = "DD";

    private final FaultDecoder faultDecoder;

    public DeviceStateReducer() {
        this(new FaultDecoder());
    }

    public DeviceStateReducer(FaultDecoder faultDecoder) {
        this.faultDecoder = Objects.requireNonNull(faultDecoder, "faultDecoder");
    }

    /**
     * Applies a single record to a sensor's current state.
     *
     * @param current the sensor's state, {@link DeviceState#UNSEEN} if new
     * @param record  a record for that sensor
     * @return the next state
     */
    public DeviceState apply(DeviceState current, SensorRecord record) {
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(record, "record");

        return switch (record.state()) {
            case FAULTY_STATE -> onFaulty(current, record);
            case HEALTHY_STATE -> onHealthy(current);
            default -> current;
        };
    }

    private DeviceState onFaulty(DeviceState current, SensorRecord record) {
        if (current instanceof DeviceState.Faulty) {
            // First "DD" wins; its reason is frozen.
            return current;
        }
        return new DeviceState.Faulty(faultDecoder.decode(record.sp1(), record.sp2()));
    }

    private DeviceState onHealthy(DeviceState current) {
        if (current instanceof DeviceState.Faulty) {
            return current;
        }
        if (current instanceof DeviceState.Healthy healthy) {
            return healthy.incremented();
        }
        return new DeviceState.Healthy(1);
    }
}

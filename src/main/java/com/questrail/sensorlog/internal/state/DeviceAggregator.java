package com.questrail.sensorlog.internal.state;

import com.questrail.sensorlog.api.DeviceSummary;
import com.questrail.sensorlog.api.FaultReason;
import com.questrail.sensorlog.api.SensorRecord;
import com.questrail.sensorlog.observability.DeviceTransitionEvent;
import com.questrail.sensorlog.observability.NullObservabilitySink;
import com.questrail.sensorlog.observability.SensorLogObservabilitySink;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * DeviceAggregator
 * -----------------------------------------------------------------------------
 * Single-pass fold of {@link SensorRecord}s into per-sensor classification
 * state.
 *
 * <p>Each sensor maps to exactly one {@link DeviceState}, so the healthy and
 * faulty views can never overlap. A sensor that turns faulty after some
 * healthy reports loses its healthy count at that moment; no end-of-stream
 * sweep is needed.</p>
 *
 * <p>Instances are owned by a single run and are not thread-safe.</p>
 */
public final class DeviceAggregator
{
    private final DeviceStateReducer reducer;
    private final SensorLogObservabilitySink observabilitySink;

    /* Insertion order: first "02" for healthy sensors, first "DD" for faulty ones. */
    private final Map<String, DeviceState> devices = new LinkedHashMap<>();

    public DeviceAggregator() {
        this(new DeviceStateReducer(), NullObservabilitySink.INSTANCE);
    }

    public DeviceAggregator(DeviceStateReducer reducer,
                            SensorLogObservabilitySink observabilitySink) {
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    /**
     * Folds one record into the aggregate.
     */
    public void apply(SensorRecord record) {
        Objects.requireNonNull(record, "record");

        final String sensorId = record.sensorId();
        final DeviceState previous = devices.getOrDefault(sensorId, DeviceState.UNSEEN);
        final DeviceState next = reducer.apply(previous, record);

        if (next == previous) {
            return;
        }

        if (next instanceof DeviceState.Faulty && previous instanceof DeviceState.Healthy) {
            // Re-insert so faulty sensors keep first-"DD" order.
            devices.remove(sensorId);
        }
        devices.put(sensorId, next);

        if (next.getClass() != previous.getClass()) {
            observabilitySink.onDeviceTransition(new DeviceTransitionEvent(sensorId, previous, next));
        }
    }

    /**
     * Folds every record of {@code records}, in iteration order.
     *
     * @return the summary after the last record
     */
    public DeviceSummary foldAll(Iterable<SensorRecord> records) {
        Objects.requireNonNull(records, "records");
        for (SensorRecord record : records) {
            apply(record);
        }
        return summary();
    }

    /**
     * Returns the current state of a sensor, {@link DeviceState#UNSEEN} if it
     * has not been classified.
     */
    public DeviceState stateOf(String sensorId) {
        return devices.getOrDefault(sensorId, DeviceState.UNSEEN);
    }

    /**
     * Materializes an immutable snapshot of the aggregate.
     *
     * <p>May be called repeatedly; later records do not affect a summary that
     * was already returned.</p>
     */
    public DeviceSummary summary() {
        final Map<String, FaultReason> faulty = new LinkedHashMap<>();
        final Map<String, Integer> healthy = new LinkedHashMap<>();

        for (Map.Entry<String, DeviceState> entry : devices.entrySet()) {
            final DeviceState state = entry.getValue();
            if (state instanceof DeviceState.Faulty f) {
                faulty.put(entry.getKey(), f.reason());
            }
            else if (state instanceof DeviceState.Healthy h) {
                healthy.put(entry.getKey(), h.occurrences());
            }
        }
        return DeviceSummary.of(faulty, healthy);
    }
}

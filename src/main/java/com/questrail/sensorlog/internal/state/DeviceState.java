package com.questrail.sensorlog.internal.state;

import com.questrail.sensorlog.api.FaultReason;

import java.util.Objects;

/**
 * DeviceState
 * -----------------------------------------------------------------------------
 * Classification state for a single sensor.
 *
 * <pre>
 *   Unseen ──"02"──▶ Healthy(n) ──"02"──▶ Healthy(n + 1)
 *     │                  │
 *     └──────"DD"────────┴──"DD"──▶ Faulty(reason)   (terminal)
 * </pre>
 *
 * <p>{@link Faulty} is sticky: no record moves a sensor out of it, and its
 * reason is the one decoded from the first {@code "DD"} record.</p>
 */
public sealed interface DeviceState
        permits DeviceState.Unseen, DeviceState.Healthy, DeviceState.Faulty {

    DeviceState UNSEEN = new Unseen();

    /**
     * Sensor has not produced a classifying record yet.
     */
    record Unseen() implements DeviceState {}

    /**
     * Sensor has reported only healthy records so far.
     *
     * @param occurrences number of {@code "02"} records seen, at least 1
     */
    record Healthy(int occurrences) implements DeviceState {
        public Healthy {
            if (occurrences < 1) {
                throw new IllegalArgumentException("occurrences must be >= 1");
            }
        }

        public Healthy incremented() {
            return new Healthy(occurrences + 1);
        }
    }

    /**
     * Sensor reported at least one faulty record.
     */
    record Faulty(FaultReason reason) implements DeviceState {
        public Faulty {
            Objects.requireNonNull(reason, "reason");
        }
    }
}

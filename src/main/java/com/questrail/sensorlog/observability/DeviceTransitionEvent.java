package com.questrail.sensorlog.observability;

import com.questrail.sensorlog.internal.state.DeviceState;

/**
 * Record representing a change of classification for one sensor.
 */
public record DeviceTransitionEvent(
    String sensorId,
    DeviceState previous,
    DeviceState next
) {
    /**
     * Checks whether this transition marks the sensor as faulty.
     */
    public boolean isFault() {
        return next instanceof DeviceState.Faulty;
    }
}

package com.questrail.sensorlog.observability;

import java.time.Instant;

/**
 * Record representing a failure outside the parsing/classification core.
 */
public record SensorLogErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}

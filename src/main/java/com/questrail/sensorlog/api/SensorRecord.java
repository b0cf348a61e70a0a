package com.questrail.sensorlog.api;

import java.util.Locale;
import java.util.Objects;

/**
 * SensorRecord
 * -----------------------------------------------------------------------------
 * Immutable, structured view of a single accepted telemetry line.
 *
 * <p>A {@code SensorRecord} is produced by the line parser for exactly one raw
 * line and is consumed once by the device aggregator. Only the fields the
 * classification logic needs are retained:</p>
 * <ul>
 *   <li>{@code sensorId}: reporting device, upper-cased and never empty</li>
 *   <li>{@code sp1}, {@code sp2}: packed status fields used for fault decoding</li>
 *   <li>{@code state}: device state code ({@code "02"}, {@code "DD"}, ...)</li>
 * </ul>
 */
public record SensorRecord(
        String sensorId,
        String sp1,
        String sp2,
        String state
) {
    public SensorRecord {
        Objects.requireNonNull(sensorId, "sensorId");
        Objects.requireNonNull(sp1, "sp1");
        Objects.requireNonNull(sp2, "sp2");
        Objects.requireNonNull(state, "state");

        if (sensorId.isEmpty()) {
            throw new IllegalArgumentException("sensorId must not be empty");
        }
        if (!sensorId.equals(sensorId.toUpperCase(Locale.ROOT))) {
            throw new IllegalArgumentException("sensorId must be upper-case: " + sensorId);
        }
    }
}

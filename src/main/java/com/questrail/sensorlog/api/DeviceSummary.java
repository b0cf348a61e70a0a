package com.questrail.sensorlog.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * DeviceSummary
 * -----------------------------------------------------------------------------
 * Immutable end-of-stream result of a single aggregation run.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>The key sets of {@link #faultyDevices()} and {@link #healthyDevices()}
 *       are disjoint.</li>
 *   <li>{@link #totalDevices()} equals {@link #healthyCount()} plus
 *       {@link #faultyCount()}.</li>
 * </ul>
 *
 * <p>Both maps iterate in insertion order: faulty devices in the order their
 * first {@code "DD"} record arrived, healthy devices in the order their first
 * {@code "02"} record arrived.</p>
 */
public final class DeviceSummary
{
    private static final DeviceSummary EMPTY = new DeviceSummary(Map.of(), Map.of());

    private final Map<String, FaultReason> faultyDevices;
    private final Map<String, Integer> healthyDevices;

    private DeviceSummary(Map<String, FaultReason> faultyDevices,
                          Map<String, Integer> healthyDevices) {
        this.faultyDevices = Collections.unmodifiableMap(new LinkedHashMap<>(faultyDevices));
        this.healthyDevices = Collections.unmodifiableMap(new LinkedHashMap<>(healthyDevices));
    }

    /**
     * Creates a summary from the given per-device maps.
     *
     * @throws IllegalArgumentException if a sensor appears in both maps
     */
    public static DeviceSummary of(Map<String, FaultReason> faultyDevices,
                                   Map<String, Integer> healthyDevices) {
        Objects.requireNonNull(faultyDevices, "faultyDevices");
        Objects.requireNonNull(healthyDevices, "healthyDevices");

        for (String sensorId : faultyDevices.keySet()) {
            if (healthyDevices.containsKey(sensorId)) {
                throw new IllegalArgumentException(
                        "Sensor " + sensorId + " cannot be both healthy and faulty");
            }
        }
        return new DeviceSummary(faultyDevices, healthyDevices);
    }

    public static DeviceSummary empty() {
        return EMPTY;
    }

    public int totalDevices() {
        return faultyDevices.size() + healthyDevices.size();
    }

    public int healthyCount() {
        return healthyDevices.size();
    }

    public int faultyCount() {
        return faultyDevices.size();
    }

    /**
     * Faulty sensors and the reason decoded from their first {@code "DD"} record.
     */
    public Map<String, FaultReason> faultyDevices() {
        return faultyDevices;
    }

    /**
     * Healthy sensors and how many {@code "02"} records each reported.
     */
    public Map<String, Integer> healthyDevices() {
        return healthyDevices;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DeviceSummary other)) {
            return false;
        }
        return faultyDevices.equals(other.faultyDevices)
                && healthyDevices.equals(other.healthyDevices);
    }

    @Override
    public int hashCode() {
        return Objects.hash(faultyDevices, healthyDevices);
    }

    @Override
    public String toString() {
        return "DeviceSummary[" +
                "total=" + totalDevices() +
                ", healthy=" + healthyCount() +
                ", faulty=" + faultyCount() +
                ']';
    }
}

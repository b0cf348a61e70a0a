package com.questrail.sensorlog.api;

/**
 * Dominant fault reported for a faulty device.
 *
 * <p>Only one reason is ever surfaced per device, even when the packed status
 * fields carry several flags at once. Declaration order is the priority order
 * used by the fault decoder.</p>
 */
public enum FaultReason {
    BATTERY("Battery device error"),
    TEMPERATURE("Temperature device error"),
    THRESHOLD("Threshold central error"),
    UNKNOWN("Unknown device error");

    private final String description;

    FaultReason(String description) {
        this.description = description;
    }

    /**
     * Human-readable text used in reports.
     */
    public String description() {
        return description;
    }
}

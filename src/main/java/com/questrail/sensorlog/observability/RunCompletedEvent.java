package com.questrail.sensorlog.observability;

import com.questrail.sensorlog.api.DeviceSummary;
import com.questrail.sensorlog.api.RunStatistics;

/**
 * Record representing the end of an ingestion run.
 */
public record RunCompletedEvent(
    RunStatistics statistics,
    DeviceSummary summary
) {
}

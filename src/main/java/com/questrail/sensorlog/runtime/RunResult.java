package com.questrail.sensorlog.runtime;

import com.questrail.sensorlog.api.DeviceSummary;
import com.questrail.sensorlog.api.RunStatistics;

import java.util.Objects;

/**
 * Terminal result of one ingestion run.
 */
public record RunResult(
    DeviceSummary summary,
    RunStatistics statistics
) {
    public RunResult {
        Objects.requireNonNull(summary, "summary");
        Objects.requireNonNull(statistics, "statistics");
    }
}

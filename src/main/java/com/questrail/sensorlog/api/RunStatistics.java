package com.questrail.sensorlog.api;

import java.time.Duration;
import java.util.Objects;

/**
 * Line-level counters for one ingestion run.
 *
 * @param linesRead     every line handed to the pipeline
 * @param linesRejected lines the parser rejected
 * @param elapsed       monotonic time between run start and completion
 */
public record RunStatistics(
        long linesRead,
        long linesRejected,
        Duration elapsed
) {
    public RunStatistics {
        Objects.requireNonNull(elapsed, "elapsed");
        if (linesRejected > linesRead) {
            throw new IllegalArgumentException("linesRejected exceeds linesRead");
        }
    }

    public long linesAccepted() {
        return linesRead - linesRejected;
    }
}

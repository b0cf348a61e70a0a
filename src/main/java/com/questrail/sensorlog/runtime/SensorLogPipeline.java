package com.questrail.sensorlog.runtime;

import com.questrail.sensorlog.api.DeviceSummary;
import com.questrail.sensorlog.api.RunStatistics;
import com.questrail.sensorlog.internal.state.DeviceAggregator;
import com.questrail.sensorlog.internal.state.DeviceStateReducer;
import com.questrail.sensorlog.internal.time.MonotonicClock;
import com.questrail.sensorlog.observability.LineRejectedEvent;
import com.questrail.sensorlog.observability.RunCompletedEvent;
import com.questrail.sensorlog.observability.SensorLogObservabilitySink;
import com.questrail.sensorlog.parse.LogLineParser;
import com.questrail.sensorlog.parse.ParseResult;

import java.time.Duration;
import java.util.Objects;

/**
 * SensorLogPipeline
 * =============================================================================
 * Line-at-a-time wiring of the parser and the aggregator for one run.
 *
 * <pre>
 *   raw line
 *        → LogLineParser
 *            → Accepted: DeviceAggregator.apply(record)
 *            → Rejected: observability only
 * </pre>
 *
 * <p>A pipeline instance represents exactly one run. {@link #accept(String)}
 * and {@link #summary()} share a monitor so a live source (e.g. a datagram
 * event loop) can write while another thread takes a snapshot; with a single
 * writer this adds no ordering effects.</p>
 */
public final class SensorLogPipeline
{
    private final LogLineParser parser;
    private final DeviceAggregator aggregator;
    private final SensorLogObservabilitySink observabilitySink;
    private final MonotonicClock clock;
    private final long startedAtNanos;

    private long linesRead;
    private long linesRejected;
    private RunResult completed;

    public SensorLogPipeline(LogLineParser parser,
                             SensorLogObservabilitySink observabilitySink,
                             MonotonicClock clock) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.aggregator = new DeviceAggregator(new DeviceStateReducer(), observabilitySink);
        this.startedAtNanos = clock.nowNanos();
    }

    /**
     * Parses one raw line and folds it into the aggregate if accepted.
     *
     * @throws IllegalStateException if the run has already been completed
     */
    public synchronized void accept(String line) {
        if (completed != null) {
            throw new IllegalStateException("Pipeline run already completed");
        }

        linesRead++;
        final ParseResult result = parser.parse(line);

        if (result instanceof ParseResult.Accepted accepted) {
            aggregator.apply(accepted.sensorRecord());
        }
        else if (result instanceof ParseResult.Rejected rejected) {
            linesRejected++;
            observabilitySink.onLineRejected(new LineRejectedEvent(linesRead, rejected.reason()));
        }
    }

    /**
     * Snapshot of the aggregate so far.
     */
    public synchronized DeviceSummary summary() {
        return aggregator.summary();
    }

    /**
     * Ends the run and reports it. Idempotent: later calls return the same result.
     */
    public synchronized RunResult complete() {
        if (completed == null) {
            final Duration elapsed = Duration.ofNanos(clock.nowNanos() - startedAtNanos);
            completed = new RunResult(
                    aggregator.summary(),
                    new RunStatistics(linesRead, linesRejected, elapsed));
            observabilitySink.onRunCompleted(new RunCompletedEvent(completed.statistics(), completed.summary()));
        }
        return completed;
    }
}

package com.questrail.sensorlog.runtime;

import com.questrail.sensorlog.config.SensorLogRuntimeConfig;
import com.questrail.sensorlog.observability.SensorLogErrorEvent;
import com.questrail.sensorlog.observability.SensorLogObservabilitySink;
import com.questrail.sensorlog.parse.DefaultLogLineParser;
import com.questrail.sensorlog.parse.LogLineParser;
import com.questrail.sensorlog.source.LogFileSource;
import com.questrail.sensorlog.source.SensorLogSourceException;
import com.questrail.sensorlog.transport.DatagramEndpoint;
import com.questrail.sensorlog.transport.udp.UdpLineIngestAdapter;
import com.questrail.sensorlog.transport.udp.netty.NettyUdpDatagramEndpoint;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * SensorLogRuntime
 * =============================================================================
 * Composition root for one ingestion run.
 *
 * <p>Chooses the line source from {@link SensorLogRuntimeConfig}, builds a fresh
 * {@link SensorLogPipeline}, drains the source into it and completes the run.</p>
 */
public final class SensorLogRuntime {
    private final SensorLogRuntimeConfig config;
    private final LogLineParser parser;

    public SensorLogRuntime(SensorLogRuntimeConfig config) {
        this(config, new DefaultLogLineParser());
    }

    public SensorLogRuntime(SensorLogRuntimeConfig config, LogLineParser parser) {
        this.config = Objects.requireNonNull(config, "config");
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    /**
     * Runs against the configured source: UDP when a bind address is set,
     * the log file otherwise.
     *
     * @throws SensorLogSourceException if the source cannot be acquired or read
     */
    public RunResult run() {
        if (config.udp().isPresent()) {
            return listen(new NettyUdpDatagramEndpoint(config.udp().get()), config.udpListenWindow());
        }
        return runFile();
    }

    /**
     * Reads the configured log file to its end.
     *
     * @throws SensorLogSourceException if the file is missing or unreadable
     */
    public RunResult runFile() {
        final SensorLogPipeline pipeline = newPipeline();
        final LogFileSource source = new LogFileSource(config.logFile());
        try {
            source.forEachLine(pipeline::accept);
        }
        catch (SensorLogSourceException e) {
            reportError(e);
            throw e;
        }
        return pipeline.complete();
    }

    /**
     * Receives datagrams on {@code endpoint} for {@code window}, then stops the
     * endpoint and completes the run.
     */
    public RunResult listen(DatagramEndpoint endpoint, Duration window) {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(window, "window");

        final SensorLogPipeline pipeline = newPipeline();
        final UdpLineIngestAdapter adapter =
                new UdpLineIngestAdapter(endpoint, pipeline::accept, config.observabilitySink());

        adapter.start();
        try {
            if (!adapter.isUp()) {
                SensorLogSourceException e = new SensorLogSourceException("UDP endpoint did not come up");
                reportError(e);
                throw e;
            }
            Thread.sleep(window.toMillis());
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        finally {
            adapter.stop();
        }
        return pipeline.complete();
    }

    private SensorLogPipeline newPipeline() {
        return new SensorLogPipeline(parser, config.observabilitySink(), config.clock());
    }

    private void reportError(SensorLogSourceException e) {
        SensorLogObservabilitySink sink = config.observabilitySink();
        sink.onError(new SensorLogErrorEvent(Instant.now(), e.getMessage(), e.getCause()));
    }
}

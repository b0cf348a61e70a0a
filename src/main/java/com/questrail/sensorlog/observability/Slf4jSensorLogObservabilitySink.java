package com.questrail.sensorlog.observability;

import com.questrail.sensorlog.internal.state.DeviceState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of SensorLogObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jSensorLogObservabilitySink implements SensorLogObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jSensorLogObservabilitySink.class);

    @Override
    public void onLineRejected(LineRejectedEvent event) {
        log.debug("Line {} rejected: {}", event.lineNumber(), event.reason());
    }

    @Override
    public void onDeviceTransition(DeviceTransitionEvent event) {
        if (event.next() instanceof DeviceState.Faulty faulty) {
            log.info("Sensor {}: {} -> FAULTY ({})",
                event.sensorId(),
                describe(event.previous()),
                faulty.reason().description());
        } else {
            log.debug("Sensor {}: {} -> {}",
                event.sensorId(),
                describe(event.previous()),
                describe(event.next()));
        }
    }

    @Override
    public void onRunCompleted(RunCompletedEvent event) {
        var stats = event.statistics();
        log.info("Processed {} lines ({} rejected) in {} ms: {} devices, {} healthy, {} faulty",
            stats.linesRead(),
            stats.linesRejected(),
            stats.elapsed().toMillis(),
            event.summary().totalDevices(),
            event.summary().healthyCount(),
            event.summary().faultyCount());
    }

    @Override
    public void onError(SensorLogErrorEvent event) {
        log.error("Sensor log error: {}", event.message(), event.cause());
    }

    private static String describe(DeviceState state) {
        if (state instanceof DeviceState.Healthy) {
            return "HEALTHY";
        }
        if (state instanceof DeviceState.Faulty) {
            return "FAULTY";
        }
        return "UNSEEN";
    }
}

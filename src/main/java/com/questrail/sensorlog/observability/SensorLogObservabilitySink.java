package com.questrail.sensorlog.observability;

/**
 * Main interface for receiving sensor log pipeline observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface SensorLogObservabilitySink {
    /**
     * Called when the parser drops a line.
     * @param event the rejected line details
     */
    void onLineRejected(LineRejectedEvent event);

    /**
     * Called when a sensor changes classification (first seen, or turned faulty).
     * Repeated healthy reports do not produce events.
     * @param event the transition details
     */
    void onDeviceTransition(DeviceTransitionEvent event);

    /**
     * Called once when an ingestion run has consumed its whole source.
     * @param event the run counters
     */
    void onRunCompleted(RunCompletedEvent event);

    /**
     * Called when a source or transport fails.
     * @param event the error event
     */
    void onError(SensorLogErrorEvent event);
}

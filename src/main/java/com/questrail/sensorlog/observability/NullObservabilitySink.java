package com.questrail.sensorlog.observability;

/**
 * No-op implementation of SensorLogObservabilitySink.
 */
public final class NullObservabilitySink implements SensorLogObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onLineRejected(LineRejectedEvent event) {}

    @Override
    public void onDeviceTransition(DeviceTransitionEvent event) {}

    @Override
    public void onRunCompleted(RunCompletedEvent event) {}

    @Override
    public void onError(SensorLogErrorEvent event) {}
}

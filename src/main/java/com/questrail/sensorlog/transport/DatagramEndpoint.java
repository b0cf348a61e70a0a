package com.questrail.sensorlog.transport;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a receive-only datagram transport (UDP-style).
 *
 * <p>Higher layers are responsible for turning payloads into log lines and
 * feeding them into the pipeline. Implementations may be backed by Netty,
 * java.nio, or a test harness.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Start the endpoint and begin receiving datagrams.
     *
     * <p>On successful activation, the endpoint MUST notify its listener via
     * {@link DatagramEndpointListener#onTransportUp()} exactly once per transition.</p>
     */
    void start();

    /**
     * Stop the endpoint and release all transport resources.
     *
     * <p>When this method returns, no further {@code onDatagram} callbacks are
     * delivered.</p>
     */
    void stop();

    /**
     * Register the listener that receives inbound datagrams and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(DatagramEndpointListener listener);
}

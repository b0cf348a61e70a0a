package com.questrail.sensorlog.transport.udp;

import com.questrail.sensorlog.observability.SensorLogErrorEvent;
import com.questrail.sensorlog.observability.SensorLogObservabilitySink;
import com.questrail.sensorlog.transport.DatagramEndpoint;
import com.questrail.sensorlog.transport.DatagramEndpointListener;

import java.net.SocketAddress;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * UdpLineIngestAdapter
 * =============================================================================
 * Translates inbound datagrams into log lines.
 *
 * <h2>Inbound path</h2>
 *
 * <pre>
 *   DatagramEndpoint
 *        → UdpLineIngestAdapter   (UTF-8 decode, split on line breaks)
 *            → line consumer      (normally SensorLogPipeline::accept)
 * </pre>
 *
 * <p>A datagram may carry one line or several separated by {@code \n} or
 * {@code \r\n}. Blank lines are skipped. Lines are never reassembled across
 * datagrams.</p>
 *
 * <p>This class MUST NOT parse records or classify devices; it only frames
 * lines.</p>
 */
public class UdpLineIngestAdapter implements DatagramEndpointListener {

    private static final Pattern LINE_BREAK = Pattern.compile("\r?\n");

    private final DatagramEndpoint endpoint;
    private final Consumer<String> lineConsumer;
    private final SensorLogObservabilitySink observabilitySink;
    private final Charset charset;

    private volatile boolean up;
    private long datagramsReceived;

    public UdpLineIngestAdapter(DatagramEndpoint endpoint,
                                Consumer<String> lineConsumer,
                                SensorLogObservabilitySink observabilitySink) {
        this(endpoint, lineConsumer, observabilitySink, StandardCharsets.UTF_8);
    }

    public UdpLineIngestAdapter(DatagramEndpoint endpoint,
                                Consumer<String> lineConsumer,
                                SensorLogObservabilitySink observabilitySink,
                                Charset charset) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.lineConsumer = Objects.requireNonNull(lineConsumer, "lineConsumer");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.charset = Objects.requireNonNull(charset, "charset");

        // The endpoint is the raw I/O surface; this adapter is the translation layer.
        this.endpoint.setListener(this);
    }

    public void start() {
        endpoint.start();
    }

    public void stop() {
        endpoint.stop();
    }

    public boolean isUp() {
        return up;
    }

    /**
     * Datagrams received so far. Read after {@link #stop()} for a stable value.
     */
    public synchronized long datagramsReceived() {
        return datagramsReceived;
    }

    // -------------------------------------------------------------------------
    // DatagramEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        up = true;
    }

    @Override
    public void onTransportDown(Throwable cause) {
        up = false;
        if (cause != null) {
            observabilitySink.onError(new SensorLogErrorEvent(
                    Instant.now(), "UDP transport down", cause));
        }
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        synchronized (this) {
            datagramsReceived++;
        }

        for (String line : LINE_BREAK.split(new String(payload, charset))) {
            if (!line.isBlank()) {
                lineConsumer.accept(line);
            }
        }
    }
}

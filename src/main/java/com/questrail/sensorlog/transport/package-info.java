/**
 * Datagram Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty UDP, a simulator, or a
 * test double) and the line ingestion wiring.
 *
 * <p>Everything above the transport adapter sees only:</p>
 * <ul>
 *   <li>Raw datagram payloads as {@code byte[]}</li>
 *   <li>Remote endpoints as standard {@link java.net.SocketAddress}</li>
 *   <li>Transport lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <p>Implementations of these ports perform transport I/O only. They do not
 * split lines, parse records or touch the aggregator.</p>
 */
package com.questrail.sensorlog.transport;

/**
 * Telemetry Line Parsing
 * =============================================================================
 *
 * <p>This package turns raw text lines into {@code SensorRecord} values. It is
 * the only place that knows the line layout:</p>
 *
 * <pre>
 *   &lt;prefix&gt;&gt; 'BIG;f1;sensor;f3;f4;f5;sp1;...;sp2;...;state;last'
 * </pre>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   raw line
 *        → LogLineParser        (layout rules applied here)
 *            → SensorRecord
 *                → DeviceAggregator
 * </pre>
 *
 * <p>Lines that do not match the layout are rejected, never raised. The
 * rejection reason is reported for observability only and carries no
 * classification meaning.</p>
 */
package com.questrail.sensorlog.parse;

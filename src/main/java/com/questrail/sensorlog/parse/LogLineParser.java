package com.questrail.sensorlog.parse;

/**
 * LogLineParser
 * -----------------------------------------------------------------------------
 * Text-level parser for a single telemetry log line.
 *
 * <p>This interface defines the inbound boundary between a raw line of text
 * (from a file, a datagram, or any other source) and a structured
 * {@link com.questrail.sensorlog.api.SensorRecord}.</p>
 *
 * <p>The parser is responsible only for:</p>
 * <ul>
 *   <li>Locating the message body after the {@code "> "} marker</li>
 *   <li>Splitting it into fields and checking the minimum field count</li>
 *   <li>Checking the handler tag</li>
 *   <li>Extracting and normalizing the fields the aggregator consumes</li>
 * </ul>
 *
 * <p>The parser is <strong>not</strong> responsible for interpreting device
 * state codes or decoding faults.</p>
 */
public interface LogLineParser
{
    /**
     * Parse one raw line.
     *
     * <p>Parsing is total: every input, including {@code null}, yields either
     * {@link ParseResult.Accepted} or {@link ParseResult.Rejected}. This method
     * never throws.</p>
     *
     * @param line raw line as read from the source
     * @return the parse outcome
     */
    ParseResult parse(String line);
}

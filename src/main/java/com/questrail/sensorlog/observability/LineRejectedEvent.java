package com.questrail.sensorlog.observability;

import com.questrail.sensorlog.parse.RejectionReason;

/**
 * Record representing a line dropped by the parser.
 *
 * @param lineNumber 1-based position of the line within the run
 * @param reason     why it was dropped
 */
public record LineRejectedEvent(
    long lineNumber,
    RejectionReason reason
) {
}

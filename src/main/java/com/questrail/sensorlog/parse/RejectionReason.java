package com.questrail.sensorlog.parse;

/**
 * Why a line was dropped by the parser.
 */
public enum RejectionReason {
    /** No {@code "> "} marker in the line (also used for {@code null}). */
    MISSING_MARKER,
    /** Fewer fields than the message layout requires. */
    TOO_FEW_FIELDS,
    /** Field 0 is not the {@code BIG} handler tag. */
    WRONG_HANDLER,
    /** The sensor id field is blank. */
    EMPTY_SENSOR_ID
}

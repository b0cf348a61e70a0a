package com.questrail.sensorlog.fault;

/**
 * Indicates that the packed status fields of a record could not be read as
 * three decimal pairs.
 *
 * <p>This never escapes {@link FaultDecoder#decode(String, String)}; the
 * decoder maps it to {@code UNKNOWN}.</p>
 */
public final class FaultDecodeException extends RuntimeException
{
    public FaultDecodeException(String message) {
        super(message);
    }
}

package com.questrail.sensorlog.source;

/**
 * Indicates that a line source could not be acquired or read.
 *
 * <p>Raised before or while lines reach the parser; the parsing and
 * classification core itself never raises this.</p>
 */
public final class SensorLogSourceException extends RuntimeException
{
    public SensorLogSourceException(String message) {
        super(message);
    }

    public SensorLogSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.questrail.sensorlog.parse;

import com.questrail.sensorlog.api.SensorRecord;

import java.util.Locale;

/**
 * DefaultLogLineParser
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link LogLineParser} for {@code BIG} handler
 * messages.
 *
 * <p>This parser performs the following steps, in order:</p>
 * <ol>
 *   <li>Locate the first {@code "> "} marker and keep everything after it</li>
 *   <li>Trim whitespace, then one enclosing single quote on each side</li>
 *   <li>Split on {@code ';'} (trailing empty fields are kept)</li>
 *   <li>Check field count and handler tag</li>
 *   <li>Extract sensor id, status pair and state</li>
 * </ol>
 *
 * <p>Message layout (0-indexed fields):</p>
 * <pre>
 *   0   handler tag, must be "BIG"
 *   2   sensor id
 *   6   S_P_1 (status part 1, last character is a checksum)
 *   15  S_P_2 (status part 2, may carry a leading '-')
 *   n-2 device state
 * </pre>
 */
public final class DefaultLogLineParser implements LogLineParser
{
    public static final String MARKER = "> ";
    public static final String HANDLER_TAG = "BIG";
    public static final int MIN_FIELD_COUNT = 18;

    private static final String FIELD_SEPARATOR = ";";
    private static final char QUOTE = '\'';

    private static final int SENSOR_ID_FIELD = 2;
    private static final int SP1_FIELD = 6;
    private static final int SP2_FIELD = 15;

    @Override
    public ParseResult parse(String line)
    {
        if (line == null) {
            return new ParseResult.Rejected(RejectionReason.MISSING_MARKER);
        }

        final int markerAt = line.indexOf(MARKER);
        if (markerAt < 0) {
            return new ParseResult.Rejected(RejectionReason.MISSING_MARKER);
        }

        final String body = stripQuotes(line.substring(markerAt + MARKER.length()).strip());

        // -1 keeps trailing empty fields so "...;DD;" still has a last field.
        final String[] fields = body.split(FIELD_SEPARATOR, -1);
        if (fields.length < MIN_FIELD_COUNT) {
            return new ParseResult.Rejected(RejectionReason.TOO_FEW_FIELDS);
        }

        if (!HANDLER_TAG.equals(fields[0].strip())) {
            return new ParseResult.Rejected(RejectionReason.WRONG_HANDLER);
        }

        final String sensorId = fields[SENSOR_ID_FIELD].strip().toUpperCase(Locale.ROOT);
        if (sensorId.isEmpty()) {
            return new ParseResult.Rejected(RejectionReason.EMPTY_SENSOR_ID);
        }

        return new ParseResult.Accepted(new SensorRecord(
                sensorId,
                fields[SP1_FIELD].strip(),
                fields[SP2_FIELD].strip(),
                fields[fields.length - 2].strip()
        ));
    }

    static String stripQuotes(String body)
    {
        int begin = 0;
        int end = body.length();

        if (begin < end && body.charAt(begin) == QUOTE) {
            begin++;
        }
        if (begin < end && body.charAt(end - 1) == QUOTE) {
            end--;
        }
        return body.substring(begin, end);
    }
}

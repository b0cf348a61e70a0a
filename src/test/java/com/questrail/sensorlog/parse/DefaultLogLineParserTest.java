package com.questrail.sensorlog.parse;

import com.questrail.sensorlog.TelemetryLines;
import com.questrail.sensorlog.api.SensorRecord;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultLogLineParserTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultLogLineParser}.
 *
 * <p>These tests exercise the text-level rules only: marker, quoting, field
 * count, handler tag and field extraction. No classification is performed.</p>
 */
final class DefaultLogLineParserTest
{
    private final DefaultLogLineParser parser = new DefaultLogLineParser();

    @Test
    void parsesMinimalBigMessage()
    {
        String line = "dev> 'BIG;x;ab;x;x;x;12;x;x;x;x;x;x;x;x;03;x;02;x'";

        SensorRecord record = parser.parse(line).record().orElseThrow();

        assertEquals("AB", record.sensorId());
        assertEquals("12", record.sp1());
        assertEquals("03", record.sp2());
        assertEquals("02", record.state());
    }

    @Test
    void upperCasesSensorIdRegardlessOfInputCase()
    {
        assertEquals("SENSOR-7B",
                parser.parse(TelemetryLines.healthy("sEnSoR-7b")).record().orElseThrow().sensorId());
        assertEquals("SENSOR-7B",
                parser.parse(TelemetryLines.healthy("SENSOR-7B")).record().orElseThrow().sensorId());
    }

    @Test
    void trimsExtractedFields()
    {
        String line = "x> 'BIG ;1; s1 ;a;b;c; 451 ;x;x;x;x;x;x;x;x; -12 ;y; DD ;end'";

        SensorRecord record = parser.parse(line).record().orElseThrow();

        assertEquals("S1", record.sensorId());
        assertEquals("451", record.sp1());
        assertEquals("-12", record.sp2());
        assertEquals("DD", record.state());
    }

    @Test
    void usesOnlyTheFirstMarker()
    {
        // A later "> " belongs to the message body, not to the prefix.
        String line = "a> BIG;1;s1;a;b;c;1;x;x;x;x;x;x;x;x;2;y;02;tail> more";

        SensorRecord record = parser.parse(line).record().orElseThrow();
        assertEquals("S1", record.sensorId());
        assertEquals("02", record.state());
    }

    @Test
    void acceptsUnquotedBody()
    {
        String line = "a> " + TelemetryLines.body("s9", "1", "2", "02") + "   ";
        assertTrue(parser.parse(line) instanceof ParseResult.Accepted);
    }

    @Test
    void stripsOnlyOneLayerOfQuotes()
    {
        // Inner quotes survive: field 0 becomes "'BIG" and the handler check fails.
        String line = "a> ''" + TelemetryLines.body("s1", "1", "2", "02") + "''";
        assertEquals(new ParseResult.Rejected(RejectionReason.WRONG_HANDLER), parser.parse(line));
    }

    @Test
    void stateIsSecondToLastFieldEvenWhenLastIsEmpty()
    {
        String line = "a> 'BIG;1;s1;a;b;c;1;x;x;x;x;x;x;x;x;2;y;DD;'";
        assertEquals("DD", parser.parse(line).record().orElseThrow().state());
    }

    @Test
    void stateFollowsLongerMessages()
    {
        String line = "a> 'BIG;1;s1;a;b;c;1;x;x;x;x;x;x;x;x;2;y;z;z;z;02;end'";
        assertEquals("02", parser.parse(line).record().orElseThrow().state());
    }

    @Test
    void rejectsLineWithoutMarker()
    {
        String line = TelemetryLines.body("s1", "1", "2", "02");
        assertEquals(new ParseResult.Rejected(RejectionReason.MISSING_MARKER), parser.parse(line));
    }

    @Test
    void rejectsMarkerWithoutTrailingSpace()
    {
        String line = "a>" + TelemetryLines.body("s1", "1", "2", "02");
        assertEquals(new ParseResult.Rejected(RejectionReason.MISSING_MARKER), parser.parse(line));
    }

    @Test
    void rejectsTooFewFields()
    {
        // 17 fields
        String line = "a> 'BIG;1;s1;a;b;c;1;x;x;x;x;x;x;x;x;2;02'";
        assertEquals(new ParseResult.Rejected(RejectionReason.TOO_FEW_FIELDS), parser.parse(line));
    }

    @Test
    void acceptsExactlyEighteenFields()
    {
        String line = "a> 'BIG;1;s1;a;b;c;1;x;x;x;x;x;x;x;x;2;02;end'";
        SensorRecord record = parser.parse(line).record().orElseThrow();
        assertEquals("02", record.state());
    }

    @Test
    void rejectsOtherHandlers()
    {
        String line = "a> '" + TelemetryLines.body("s1", "1", "2", "02").replace("BIG", "SMALL") + "'";
        assertEquals(new ParseResult.Rejected(RejectionReason.WRONG_HANDLER), parser.parse(line));
    }

    @Test
    void handlerTagIsCaseSensitive()
    {
        String line = "a> '" + TelemetryLines.body("s1", "1", "2", "02").replace("BIG", "big") + "'";
        assertTrue(parser.parse(line) instanceof ParseResult.Rejected);
    }

    @Test
    void rejectsBlankSensorId()
    {
        String line = TelemetryLines.line("   ", "1", "2", "02");
        assertEquals(new ParseResult.Rejected(RejectionReason.EMPTY_SENSOR_ID), parser.parse(line));
    }

    @Test
    void neverThrowsOnDegenerateInput()
    {
        String[] inputs = { null, "", "> ", ">  ", "> '", "> ''", ";;;;", "> ;;;;;;;;;;;;;;;;;;;;" };
        for (String input : inputs) {
            ParseResult result = assertDoesNotThrow(() -> parser.parse(input));
            assertTrue(result.record().isEmpty(), "expected rejection for: " + input);
        }
    }

    @Test
    void stripQuotesRemovesEachSideIndependently()
    {
        assertEquals("abc", DefaultLogLineParser.stripQuotes("'abc'"));
        assertEquals("abc", DefaultLogLineParser.stripQuotes("'abc"));
        assertEquals("abc", DefaultLogLineParser.stripQuotes("abc'"));
        assertEquals("", DefaultLogLineParser.stripQuotes("'"));
        assertEquals("", DefaultLogLineParser.stripQuotes(""));
    }
}

package com.questrail.sensorlog.api;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class DeviceSummaryTest
{
    @Test
    void rejectsOverlappingSensors()
    {
        assertThrows(IllegalArgumentException.class, () -> DeviceSummary.of(
                Map.of("A", FaultReason.BATTERY),
                Map.of("A", 1)));
    }

    @Test
    void countsDerivedFromMaps()
    {
        DeviceSummary summary = DeviceSummary.of(
                Map.of("A", FaultReason.BATTERY, "B", FaultReason.THRESHOLD),
                Map.of("C", 3));

        assertEquals(3, summary.totalDevices());
        assertEquals(1, summary.healthyCount());
        assertEquals(2, summary.faultyCount());
    }

    @Test
    void sensorRecordRequiresNormalizedId()
    {
        assertThrows(IllegalArgumentException.class, () -> new SensorRecord("", "1", "2", "02"));
        assertThrows(IllegalArgumentException.class, () -> new SensorRecord("ab", "1", "2", "02"));
        assertEquals("AB", new SensorRecord("AB", "1", "2", "02").sensorId());
    }

    @Test
    void runStatisticsCountsAcceptedLines()
    {
        RunStatistics stats = new RunStatistics(10, 4, Duration.ofMillis(5));
        assertEquals(6, stats.linesAccepted());
        assertThrows(IllegalArgumentException.class, () -> new RunStatistics(1, 2, Duration.ZERO));
    }

    @Test
    void faultReasonTexts()
    {
        assertEquals("Battery device error", FaultReason.BATTERY.description());
        assertEquals("Temperature device error", FaultReason.TEMPERATURE.description());
        assertEquals("Threshold central error", FaultReason.THRESHOLD.description());
        assertEquals("Unknown device error", FaultReason.UNKNOWN.description());
    }
}

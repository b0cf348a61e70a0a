package com.questrail.sensorlog;

import com.questrail.sensorlog.config.SensorLogRuntimeConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SensorLogApplicationTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return SensorLogApplication.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    void printsReportForLogFile() throws Exception {
        Path log = dir.resolve("sensors.log");
        Files.write(log, List.of(
                TelemetryLines.healthy("s1"),
                TelemetryLines.healthy("s1"),
                TelemetryLines.faulty("s2", "99", "-50")
        ), StandardCharsets.UTF_8);

        assertEquals(0, run(log.toString()));

        String report = out.toString(StandardCharsets.UTF_8);
        assertTrue(report.startsWith("All big messages: 2\n"));
        assertTrue(report.contains("S2: Temperature device error\n"));
        assertTrue(report.contains("Success messages count:\nS1: 2\n"));
        assertTrue(report.contains("Processing took "));
    }

    @Test
    void missingFileExitsWithOne() {
        Path missing = dir.resolve("absent.log");

        assertEquals(1, run(missing.toString()));
        assertEquals("Error: File '" + missing + "' not found.",
                err.toString(StandardCharsets.UTF_8).strip());
        assertEquals("", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void badArgumentsExitWithTwo() {
        assertEquals(2, run("--udp", "localhost"));
        assertEquals(2, run("--udp", "localhost:notaport", "5"));
        assertEquals(2, run("--udp", "localhost:9000", "-1"));
        assertEquals(2, run("a.log", "b.log"));
    }

    @Test
    void defaultsToAppLog() {
        SensorLogRuntimeConfig config = SensorLogApplication.parseArguments(new String[0]);

        assertEquals(SensorLogRuntimeConfig.DEFAULT_LOG_FILE, config.logFile());
        assertTrue(config.udp().isEmpty());
    }

    @Test
    void parsesUdpArguments() {
        SensorLogRuntimeConfig config =
                SensorLogApplication.parseArguments(new String[] { "--udp", "127.0.0.1:5140", "30" });

        assertEquals(5140, config.udp().orElseThrow().getPort());
        assertEquals(Duration.ofSeconds(30), config.udpListenWindow());
    }
}

package com.questrail.sensorlog;

import com.questrail.sensorlog.config.SensorLogRuntimeConfig;
import com.questrail.sensorlog.report.PlainTextReportFormatter;
import com.questrail.sensorlog.report.ReportFormatter;
import com.questrail.sensorlog.runtime.RunResult;
import com.questrail.sensorlog.runtime.SensorLogRuntime;
import com.questrail.sensorlog.source.SensorLogSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

/**
 * Command-line entry point.
 *
 * <pre>
 *   sensorlog [logFile]                       read a log file (default app_2.log)
 *   sensorlog --udp &lt;host:port&gt; &lt;seconds&gt;   listen for datagrams
 * </pre>
 *
 * <p>Prints the report and the run time to standard output. Exits with status
 * 1 when the source cannot be read and 2 on bad arguments.</p>
 */
public final class SensorLogApplication {
    private static final Logger log = LoggerFactory.getLogger(SensorLogApplication.class);

    private SensorLogApplication() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        final SensorLogRuntimeConfig config;
        try {
            config = parseArguments(args);
        }
        catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println("Usage: sensorlog [logFile] | sensorlog --udp <host:port> <seconds>");
            return 2;
        }

        final RunResult result;
        try {
            result = new SensorLogRuntime(config).run();
        }
        catch (SensorLogSourceException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        ReportFormatter formatter = new PlainTextReportFormatter();
        out.print(formatter.format(result.summary()));
        out.println("Processing took "
                + String.format(Locale.ROOT, "%.3f", seconds(result.statistics().elapsed()))
                + " seconds.");
        return 0;
    }

    static SensorLogRuntimeConfig parseArguments(String[] args) {
        SensorLogRuntimeConfig.Builder builder = SensorLogRuntimeConfig.builder();

        if (args.length == 0) {
            return builder.build();
        }
        if (!"--udp".equals(args[0])) {
            if (args.length > 1) {
                throw new IllegalArgumentException("Unexpected arguments after log file");
            }
            return builder.withLogFile(Path.of(args[0])).build();
        }
        if (args.length != 3) {
            throw new IllegalArgumentException("--udp requires <host:port> and <seconds>");
        }

        final InetSocketAddress bind = parseHostPort(args[1]);
        final long windowSeconds;
        try {
            windowSeconds = Long.parseLong(args[2]);
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid listen window: " + args[2], e);
        }
        if (windowSeconds < 0) {
            throw new IllegalArgumentException("Listen window must not be negative");
        }

        log.info("Listening for telemetry on {} for {} s", bind, windowSeconds);
        return builder
                .withUdpBindAddress(bind)
                .withUdpListenWindow(Duration.ofSeconds(windowSeconds))
                .build();
    }

    private static InetSocketAddress parseHostPort(String value) {
        final int colon = value.lastIndexOf(':');
        if (colon <= 0 || colon == value.length() - 1) {
            throw new IllegalArgumentException("Expected <host:port>, got: " + value);
        }
        try {
            final int port = Integer.parseInt(value.substring(colon + 1));
            return new InetSocketAddress(value.substring(0, colon), port);
        }
        catch (IllegalArgumentException e) {
            // NumberFormatException is an IllegalArgumentException; so is an out-of-range port.
            throw new IllegalArgumentException("Invalid address: " + value, e);
        }
    }

    private static double seconds(Duration elapsed) {
        return elapsed.toNanos() / 1_000_000_000.0;
    }
}

package com.questrail.sensorlog.config;

import com.questrail.sensorlog.internal.time.MonotonicClock;
import com.questrail.sensorlog.internal.time.SystemMonotonicClock;
import com.questrail.sensorlog.observability.SensorLogObservabilitySink;
import com.questrail.sensorlog.observability.Slf4jSensorLogObservabilitySink;

import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated configuration for the sensor log runtime.
 *
 * <p>{@code udpBindAddress} is optional; when present the runtime listens for
 * datagrams for {@code udpListenWindow} instead of reading {@code logFile}.</p>
 */
public record SensorLogRuntimeConfig(
    Path logFile,
    InetSocketAddress udpBindAddress,
    Duration udpListenWindow,
    SensorLogObservabilitySink observabilitySink,
    MonotonicClock clock
) {
    public static final Path DEFAULT_LOG_FILE = Path.of("app_2.log");
    public static final Duration DEFAULT_LISTEN_WINDOW = Duration.ofSeconds(60);

    public SensorLogRuntimeConfig {
        Objects.requireNonNull(logFile, "logFile");
        Objects.requireNonNull(udpListenWindow, "udpListenWindow");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(clock, "clock");
        if (udpListenWindow.isNegative()) {
            throw new IllegalArgumentException("udpListenWindow must not be negative");
        }
    }

    public Optional<InetSocketAddress> udp() {
        return Optional.ofNullable(udpBindAddress);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path logFile = DEFAULT_LOG_FILE;
        private InetSocketAddress udpBindAddress;
        private Duration udpListenWindow = DEFAULT_LISTEN_WINDOW;
        private SensorLogObservabilitySink observabilitySink = new Slf4jSensorLogObservabilitySink();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;

        public Builder withLogFile(Path logFile) {
            this.logFile = logFile;
            return this;
        }

        public Builder withUdpBindAddress(InetSocketAddress udpBindAddress) {
            this.udpBindAddress = udpBindAddress;
            return this;
        }

        public Builder withUdpListenWindow(Duration udpListenWindow) {
            this.udpListenWindow = udpListenWindow;
            return this;
        }

        public Builder withObservabilitySink(SensorLogObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public SensorLogRuntimeConfig build() {
            return new SensorLogRuntimeConfig(logFile, udpBindAddress, udpListenWindow, observabilitySink, clock);
        }
    }
}

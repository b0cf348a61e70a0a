package com.questrail.sensorlog.runtime;

import com.questrail.sensorlog.TelemetryLines;
import com.questrail.sensorlog.api.FaultReason;
import com.questrail.sensorlog.observability.LineRejectedEvent;
import com.questrail.sensorlog.observability.RecordingObservabilitySink;
import com.questrail.sensorlog.observability.RunCompletedEvent;
import com.questrail.sensorlog.parse.DefaultLogLineParser;
import com.questrail.sensorlog.parse.RejectionReason;
import com.questrail.sensorlog.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class SensorLogPipelineTest {

    private RecordingObservabilitySink sink;
    private ManualMonotonicClock clock;
    private SensorLogPipeline pipeline;

    @BeforeEach
    void setUp() {
        sink = new RecordingObservabilitySink();
        clock = new ManualMonotonicClock();
        pipeline = new SensorLogPipeline(new DefaultLogLineParser(), sink, clock);
    }

    @Test
    void foldsAcceptedLinesAndCountsRejected() {
        pipeline.accept(TelemetryLines.healthy("s1"));
        pipeline.accept("garbage without marker");
        pipeline.accept(TelemetryLines.faulty("s2", "99", "-50"));
        pipeline.accept(TelemetryLines.healthy("S1"));
        pipeline.accept("x> 'SMALL;1;2'");

        clock.advanceMillis(250);
        RunResult result = pipeline.complete();

        assertEquals(Map.of("S1", 2), result.summary().healthyDevices());
        assertEquals(Map.of("S2", FaultReason.TEMPERATURE), result.summary().faultyDevices());
        assertEquals(5, result.statistics().linesRead());
        assertEquals(2, result.statistics().linesRejected());
        assertEquals(Duration.ofMillis(250), result.statistics().elapsed());
    }

    @Test
    void rejectionsCarryLineNumberAndReason() {
        pipeline.accept(TelemetryLines.healthy("s1"));
        pipeline.accept("no marker");
        pipeline.accept("x> 'BIG;1;2'");

        List<LineRejectedEvent> rejected = sink.eventsOfType(LineRejectedEvent.class);
        assertEquals(List.of(
                new LineRejectedEvent(2, RejectionReason.MISSING_MARKER),
                new LineRejectedEvent(3, RejectionReason.TOO_FEW_FIELDS)), rejected);
    }

    @Test
    void completeIsIdempotentAndReportedOnce() {
        pipeline.accept(TelemetryLines.healthy("s1"));

        RunResult first = pipeline.complete();
        clock.advanceMillis(10);
        RunResult second = pipeline.complete();

        assertSame(first, second);
        assertEquals(1, sink.eventsOfType(RunCompletedEvent.class).size());
    }

    @Test
    void acceptAfterCompleteIsRejected() {
        pipeline.complete();
        assertThrows(IllegalStateException.class, () -> pipeline.accept(TelemetryLines.healthy("s1")));
    }

    @Test
    void concreteHealthyScenario() {
        pipeline.accept("dev> 'BIG;x;ab;x;x;x;12;x;x;x;x;x;x;x;x;03;x;02;x'");

        assertEquals(Map.of("AB", 1), pipeline.summary().healthyDevices());
        assertEquals(1, pipeline.summary().totalDevices());
    }
}

package com.questrail.sensorlog.parse;

import com.questrail.sensorlog.api.SensorRecord;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of parsing one raw line: either a record or a rejection signal.
 */
public sealed interface ParseResult
        permits ParseResult.Accepted, ParseResult.Rejected {

    /**
     * Returns the record for an accepted line, empty otherwise.
     */
    Optional<SensorRecord> record();

    record Accepted(SensorRecord sensorRecord) implements ParseResult {
        public Accepted {
            Objects.requireNonNull(sensorRecord, "sensorRecord");
        }

        @Override
        public Optional<SensorRecord> record() {
            return Optional.of(sensorRecord);
        }
    }

    record Rejected(RejectionReason reason) implements ParseResult {
        public Rejected {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public Optional<SensorRecord> record() {
            return Optional.empty();
        }
    }
}

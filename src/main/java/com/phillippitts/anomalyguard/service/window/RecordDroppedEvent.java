package com.phillippitts.anomalyguard.service.window;

import com.phillippitts.anomalyguard.domain.SeriesKey;

import java.time.Instant;

/**
 * Published when the buffer rejects a record.
 *
 * @param seriesKey       series of the dropped record
 * @param recordTimestamp timestamp carried by the record
 * @param boundary        instant the record was compared against: the seal boundary for
 *                        {@link DropReason#OUT_OF_ORDER}, the latest acceptable timestamp for
 *                        {@link DropReason#CLOCK_SKEW}
 * @param droppedAt       when the buffer dropped it
 * @param reason          why it was dropped
 */
public record RecordDroppedEvent(
        SeriesKey seriesKey,
        Instant recordTimestamp,
        Instant boundary,
        Instant droppedAt,
        DropReason reason
) {

    public enum DropReason {
        /** Older than the seal boundary minus the grace period. */
        OUT_OF_ORDER,
        /** Stamped further ahead of the buffer clock than the allowed skew. */
        CLOCK_SKEW
    }
}

package com.phillippitts.anomalyguard.service.window;

import com.phillippitts.anomalyguard.domain.SealedWindow;
import com.phillippitts.anomalyguard.domain.SeriesKey;
import com.phillippitts.anomalyguard.domain.TelemetryRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Per-series state of the window buffer: the open window plus drop and idleness bookkeeping.
 *
 * <p>Appends take the read lock, so concurrent producers for the same series only contend on
 * the lock-free record queue. Sealing takes the write lock; it is the only point where producers
 * of one series wait for each other.
 */
final class SeriesBuffer {

    private final SeriesKey seriesKey;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong nextWindowId = new AtomicLong(1);
    private final AtomicLong dropped = new AtomicLong();

    private volatile OpenWindow open;
    private volatile Instant lastRecordAt;
    private volatile boolean retired;

    SeriesBuffer(SeriesKey seriesKey, Instant start, Instant end, Instant createdAt) {
        this.seriesKey = seriesKey;
        this.open = new OpenWindow(start, end);
        this.lastRecordAt = createdAt;
    }

    SeriesKey seriesKey() {
        return seriesKey;
    }

    ReentrantReadWriteLock lock() {
        return lock;
    }

    OpenWindow open() {
        return open;
    }

    long incrementDropped() {
        return dropped.incrementAndGet();
    }

    long dropped() {
        return dropped.get();
    }

    Instant lastRecordAt() {
        return lastRecordAt;
    }

    void touch(Instant at) {
        lastRecordAt = at;
        retired = false;
    }

    boolean isRetired() {
        return retired;
    }

    void retire() {
        retired = true;
    }

    /**
     * Seals the open window and opens {@code [nextStart, nextEnd)}. Caller must hold the write lock.
     *
     * @param sealedEnd exclusive end of the sealed window
     */
    SealedWindow sealLocked(Instant sealedEnd, Instant nextStart, Instant nextEnd) {
        OpenWindow current = open;
        List<TelemetryRecord> records = new ArrayList<>(current.records);
        // stable sort keeps arrival order for equal timestamps
        records.sort(Comparator.comparing(TelemetryRecord::timestamp));
        SealedWindow sealed = new SealedWindow(seriesKey, nextWindowId.getAndIncrement(),
                current.start, sealedEnd, records);
        open = new OpenWindow(nextStart, nextEnd);
        return sealed;
    }

    /**
     * Window currently accepting records.
     */
    static final class OpenWindow {
        final Instant start;
        final Instant end;
        final ConcurrentLinkedQueue<TelemetryRecord> records = new ConcurrentLinkedQueue<>();
        final AtomicInteger count = new AtomicInteger();

        OpenWindow(Instant start, Instant end) {
            this.start = start;
            this.end = end;
        }

        int append(TelemetryRecord record) {
            records.add(record);
            return count.incrementAndGet();
        }

        Instant latestTimestamp() {
            Instant latest = start;
            for (TelemetryRecord r : records) {
                if (r.timestamp().isAfter(latest)) {
                    latest = r.timestamp();
                }
            }
            return latest;
        }
    }
}

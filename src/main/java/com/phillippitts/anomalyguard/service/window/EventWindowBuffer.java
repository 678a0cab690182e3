package com.phillippitts.anomalyguard.service.window;

import com.phillippitts.anomalyguard.config.properties.WindowProperties;
import com.phillippitts.anomalyguard.domain.SealedWindow;
import com.phillippitts.anomalyguard.domain.SeriesKey;
import com.phillippitts.anomalyguard.domain.TelemetryRecord;
import com.phillippitts.anomalyguard.exception.ClockSkewRejectedException;
import com.phillippitts.anomalyguard.exception.OutOfOrderRejectedException;
import com.phillippitts.anomalyguard.service.metrics.PipelineMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;

/**
 * Accumulates records into fixed-duration windows per series and seals them.
 *
 * <p>Windows are aligned to multiples of {@code pipeline.window.duration}. The seal boundary of a
 * series is the start of its open window; a record older than {@code boundary - gracePeriod} is
 * dropped with {@link OutOfOrderRejectedException}, a record inside the grace period joins the
 * open window. A record stamped more than {@code max-clock-skew} ahead of the buffer clock is
 * dropped with {@link ClockSkewRejectedException} before it can move the boundary. Every sealed window is published as a {@link WindowSealedEvent} while the series'
 * write lock is held, so windows of one series reach listeners in order.
 *
 * <p><b>Seal triggers:</b>
 * <ul>
 *   <li>{@link #sealDue(Instant)} - fixed cadence, seals windows whose end has passed (empty ones too)</li>
 *   <li>{@code max-records} reached - seals immediately, the next window continues to the nominal end</li>
 *   <li>a record at or past the window end - seals, then opens the window containing the record</li>
 *   <li>{@link #seal(SeriesKey)} - explicit</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> {@link #ingest(TelemetryRecord)} may be called concurrently from many
 * producers; producers of different series never contend.
 */
@Component
public class EventWindowBuffer {

    private static final Logger LOG = LogManager.getLogger(EventWindowBuffer.class);

    private final WindowProperties props;
    private final Clock clock;
    private final ApplicationEventPublisher publisher;
    private final PipelineMetrics metrics;

    private final ConcurrentMap<SeriesKey, SeriesBuffer> series = new ConcurrentHashMap<>();
    private final AtomicLong totalDropped = new AtomicLong();

    public EventWindowBuffer(WindowProperties props,
                             Clock clock,
                             ApplicationEventPublisher publisher,
                             PipelineMetrics metrics) {
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Accepts a record into the open window of its series, creating the series on first sight.
     *
     * @param record record to append
     * @throws OutOfOrderRejectedException if the record is older than the seal boundary minus the
     *         grace period; the record is dropped and counted
     * @throws ClockSkewRejectedException if the record is stamped further ahead of the buffer
     *         clock than {@code max-clock-skew}; the record is dropped and counted
     */
    public void ingest(TelemetryRecord record) {
        Objects.requireNonNull(record, "record");
        Instant ts = record.timestamp();
        Instant now = clock.instant();
        if (ts.isAfter(now.plus(props.getMaxClockSkew()))) {
            rejectFuture(record, now);
        }
        SeriesBuffer buffer = series.computeIfAbsent(record.seriesKey(), key -> {
            Instant start = align(ts);
            LOG.info("New series observed: {}", key);
            return new SeriesBuffer(key, start, start.plus(props.getDuration()), clock.instant());
        });

        while (true) {
            SeriesBuffer.OpenWindow target;
            int size;
            Lock read = buffer.lock().readLock();
            read.lock();
            try {
                target = buffer.open();
                Instant boundary = target.start;
                if (ts.isBefore(boundary.minus(props.getGracePeriod()))) {
                    reject(buffer, record, boundary);
                }
                if (!ts.isBefore(target.end)) {
                    size = -1;
                } else {
                    size = target.append(record);
                    buffer.touch(clock.instant());
                }
            } finally {
                read.unlock();
            }

            if (size < 0) {
                rollTo(buffer, ts);
                continue;
            }
            metrics.incrementIngested();
            if (size >= props.getMaxRecords()) {
                sealFull(buffer, target);
            }
            return;
        }
    }

    /**
     * Seals the open window of a series at its nominal end and opens the next one.
     *
     * @param seriesKey series to seal
     * @return the sealed window, or empty when the series is unknown
     */
    public Optional<SealedWindow> seal(SeriesKey seriesKey) {
        SeriesBuffer buffer = series.get(seriesKey);
        if (buffer == null) {
            return Optional.empty();
        }
        Lock write = buffer.lock().writeLock();
        write.lock();
        try {
            SeriesBuffer.OpenWindow current = buffer.open();
            Instant nextStart = current.end;
            return Optional.of(sealAndPublish(buffer, current.end, nextStart,
                    nextStart.plus(props.getDuration()), WindowSealedEvent.SealReason.EXPLICIT));
        } finally {
            write.unlock();
        }
    }

    /**
     * Seals every active series whose open window ended at or before {@code now}. Windows without
     * records are sealed too so that a metric that stopped reporting is still scored.
     *
     * @param now current time
     * @return number of windows sealed
     */
    public int sealDue(Instant now) {
        int sealed = 0;
        for (SeriesBuffer buffer : series.values()) {
            if (buffer.isRetired() || now.isBefore(buffer.open().end)) {
                continue;
            }
            Lock write = buffer.lock().writeLock();
            write.lock();
            try {
                SeriesBuffer.OpenWindow current = buffer.open();
                if (now.isBefore(current.end)) {
                    continue;
                }
                Instant nextStart = now.isBefore(current.end.plus(props.getDuration())) ? current.end : align(now);
                sealAndPublish(buffer, current.end, nextStart, nextStart.plus(props.getDuration()),
                        WindowSealedEvent.SealReason.CADENCE);
                sealed++;
            } finally {
                write.unlock();
            }
        }
        return sealed;
    }

    /**
     * Retires series that have not received a record for {@code pipeline.window.idle-ttl}. Retired
     * series are no longer sealed on cadence; their next record revives them.
     *
     * @param now current time
     * @return number of series retired by this call
     */
    public int retireIdle(Instant now) {
        int retired = 0;
        Duration ttl = props.getIdleTtl();
        for (SeriesBuffer buffer : series.values()) {
            if (!buffer.isRetired() && !now.isBefore(buffer.lastRecordAt().plus(ttl))) {
                buffer.retire();
                retired++;
                LOG.info("Series {} retired after {} idle", buffer.seriesKey(), ttl);
            }
        }
        return retired;
    }

    public Set<SeriesKey> knownSeries() {
        return Set.copyOf(series.keySet());
    }

    public boolean isRetired(SeriesKey seriesKey) {
        SeriesBuffer buffer = series.get(seriesKey);
        return buffer != null && buffer.isRetired();
    }

    public long droppedCount(SeriesKey seriesKey) {
        SeriesBuffer buffer = series.get(seriesKey);
        return buffer == null ? 0 : buffer.dropped();
    }

    public long totalDropped() {
        return totalDropped.get();
    }

    /**
     * @return start of the open window of a series, i.e. its current seal boundary
     */
    public Optional<Instant> sealBoundary(SeriesKey seriesKey) {
        SeriesBuffer buffer = series.get(seriesKey);
        return buffer == null ? Optional.empty() : Optional.of(buffer.open().start);
    }

    private void reject(SeriesBuffer buffer, TelemetryRecord record, Instant boundary) {
        buffer.incrementDropped();
        totalDropped.incrementAndGet();
        metrics.incrementDropped("out_of_order");
        Instant now = clock.instant();
        publisher.publishEvent(new RecordDroppedEvent(record.seriesKey(), record.timestamp(), boundary, now,
                RecordDroppedEvent.DropReason.OUT_OF_ORDER));
        throw new OutOfOrderRejectedException(record.seriesKey(), record.timestamp(), boundary,
                props.getGracePeriod());
    }

    private void rejectFuture(TelemetryRecord record, Instant now) {
        SeriesBuffer buffer = series.get(record.seriesKey());
        if (buffer != null) {
            buffer.incrementDropped();
        }
        totalDropped.incrementAndGet();
        metrics.incrementDropped("clock_skew");
        Duration skew = props.getMaxClockSkew();
        publisher.publishEvent(new RecordDroppedEvent(record.seriesKey(), record.timestamp(), now.plus(skew), now,
                RecordDroppedEvent.DropReason.CLOCK_SKEW));
        throw new ClockSkewRejectedException(record.seriesKey(), record.timestamp(), now, skew);
    }

    private void rollTo(SeriesBuffer buffer, Instant ts) {
        Lock write = buffer.lock().writeLock();
        write.lock();
        try {
            SeriesBuffer.OpenWindow current = buffer.open();
            if (ts.isBefore(current.end)) {
                return; // another producer already rolled the window
            }
            Instant nextStart = ts.isBefore(current.end.plus(props.getDuration())) ? current.end : align(ts);
            sealAndPublish(buffer, current.end, nextStart, nextStart.plus(props.getDuration()),
                    WindowSealedEvent.SealReason.ROLLOVER);
        } finally {
            write.unlock();
        }
    }

    private void sealFull(SeriesBuffer buffer, SeriesBuffer.OpenWindow full) {
        Lock write = buffer.lock().writeLock();
        write.lock();
        try {
            if (buffer.open() != full) {
                return;
            }
            Instant sealedEnd = full.latestTimestamp().plusMillis(1);
            if (sealedEnd.isAfter(full.end)) {
                sealedEnd = full.end;
            }
            Instant nextEnd = sealedEnd.isBefore(full.end) ? full.end : full.end.plus(props.getDuration());
            sealAndPublish(buffer, sealedEnd, sealedEnd, nextEnd, WindowSealedEvent.SealReason.CAPACITY);
        } finally {
            write.unlock();
        }
    }

    /** Caller must hold the series' write lock. */
    private SealedWindow sealAndPublish(SeriesBuffer buffer, Instant sealedEnd, Instant nextStart,
                                        Instant nextEnd, WindowSealedEvent.SealReason reason) {
        SealedWindow sealed = buffer.sealLocked(sealedEnd, nextStart, nextEnd);
        metrics.incrementWindowsSealed(sealed.emptyWindow());
        LOG.debug("Sealed window {} of {} [{} - {}) with {} records ({})",
                sealed.windowId(), sealed.seriesKey(), sealed.start(), sealed.end(), sealed.size(), reason);
        publisher.publishEvent(new WindowSealedEvent(sealed, clock.instant(), reason));
        return sealed;
    }

    private Instant align(Instant ts) {
        long durationMs = props.getDuration().toMillis();
        long aligned = Math.floorDiv(ts.toEpochMilli(), durationMs) * durationMs;
        return Instant.ofEpochMilli(aligned);
    }
}

package com.phillippitts.anomalyguard.service.pipeline;

import com.phillippitts.anomalyguard.service.retraining.RetrainingScheduler;
import com.phillippitts.anomalyguard.service.retraining.SweepReport;
import com.phillippitts.anomalyguard.service.window.EventWindowBuffer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * In-process triggers for the seal cadence and the retraining sweep.
 *
 * <p>Disabled with {@code pipeline.scheduling.enabled=false} when an external scheduler drives
 * {@link EventWindowBuffer#sealDue} and {@link RetrainingScheduler#runSweep()}, and in tests.
 */
@Component
@ConditionalOnProperty(prefix = "pipeline.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PipelineTimers {

    private static final Logger LOG = LogManager.getLogger(PipelineTimers.class);

    private final EventWindowBuffer buffer;
    private final RetrainingScheduler retrainingScheduler;
    private final Clock clock;

    public PipelineTimers(EventWindowBuffer buffer, RetrainingScheduler retrainingScheduler, Clock clock) {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
        this.retrainingScheduler = Objects.requireNonNull(retrainingScheduler, "retrainingScheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Scheduled(fixedDelayString = "${pipeline.window.seal-tick:PT1S}")
    void sealTick() {
        Instant now = clock.instant();
        int sealed = buffer.sealDue(now);
        int retired = buffer.retireIdle(now);
        if (sealed > 0 || retired > 0) {
            LOG.debug("Seal tick: sealed={}, retired={}", sealed, retired);
        }
    }

    @Scheduled(fixedDelayString = "${pipeline.retraining.interval:PT5M}",
            initialDelayString = "${pipeline.retraining.interval:PT5M}")
    void sweep() {
        SweepReport report = retrainingScheduler.runSweep();
        if (report.scheduled() > 0) {
            LOG.info("Retraining sweep scheduled {} of {} series", report.scheduled(), report.examined());
        }
    }
}

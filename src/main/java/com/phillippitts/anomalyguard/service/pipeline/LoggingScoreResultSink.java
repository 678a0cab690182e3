package com.phillippitts.anomalyguard.service.pipeline;

import com.phillippitts.anomalyguard.domain.ScoreResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Writes score results to the {@code anomalyguard.audit} logger. Anomalous results log at INFO,
 * the rest at DEBUG.
 */
@Component
public class LoggingScoreResultSink implements ScoreResultSink {

    static final String AUDIT_LOGGER = "anomalyguard.audit";

    private static final Logger AUDIT = LogManager.getLogger(AUDIT_LOGGER);

    @Override
    public void accept(ScoreResult result) {
        if (result.decision()) {
            AUDIT.info("score series={} window={} start={} end={} score={} anomalous=true model={}",
                    result.seriesKey(), result.windowId(), result.windowStart(), result.windowEnd(),
                    result.score(), source(result));
        } else if (AUDIT.isDebugEnabled()) {
            AUDIT.debug("score series={} window={} start={} end={} score={} anomalous=false model={}",
                    result.seriesKey(), result.windowId(), result.windowStart(), result.windowEnd(),
                    result.score(), source(result));
        }
    }

    private static String source(ScoreResult result) {
        return result.usedBaseline() ? "baseline" : "v" + result.modelVersion();
    }
}

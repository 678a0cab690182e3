package com.phillippitts.anomalyguard.service.health;

import com.phillippitts.anomalyguard.config.properties.RetrainingProperties;
import com.phillippitts.anomalyguard.domain.SeriesKey;
import com.phillippitts.anomalyguard.service.retraining.RetrainingScheduler;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;

/**
 * Health indicator for model training.
 *
 * <ul>
 *   <li>UP: no series has a sustained training failure streak</li>
 *   <li>DEGRADED: at least one series failed {@code failure-streak-threshold} times in a row;
 *       those series keep scoring with their previous model or the baseline</li>
 * </ul>
 *
 * <p>Never reports DOWN: training failures do not stop detection.
 */
@Component
public class TrainingHealthIndicator implements HealthIndicator {

    private final RetrainingScheduler scheduler;
    private final RetrainingProperties props;

    public TrainingHealthIndicator(RetrainingScheduler scheduler, RetrainingProperties props) {
        this.scheduler = scheduler;
        this.props = props;
    }

    @Override
    public Health health() {
        Map<SeriesKey, Integer> degraded = scheduler.degradedSeries();
        Health.Builder builder = new Health.Builder();
        if (degraded.isEmpty()) {
            return builder.up()
                    .withDetail("status", "Training healthy")
                    .build();
        }
        Map<String, Integer> streaks = new TreeMap<>();
        degraded.forEach((key, streak) -> streaks.put(key.canonical(), streak));
        return builder.status("DEGRADED")
                .withDetail("status", degraded.size() + " series failing to train")
                .withDetail("failureStreakThreshold", props.getFailureStreakThreshold())
                .withDetail("series", streaks)
                .build();
    }
}

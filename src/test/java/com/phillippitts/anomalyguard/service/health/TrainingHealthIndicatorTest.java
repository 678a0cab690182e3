package com.phillippitts.anomalyguard.service.health;

import com.phillippitts.anomalyguard.config.properties.RetrainingProperties;
import com.phillippitts.anomalyguard.domain.SeriesKey;
import com.phillippitts.anomalyguard.service.retraining.RetrainingScheduler;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TrainingHealthIndicatorTest {

    @Test
    void shouldReportUpWhenNoSeriesIsDegraded() {
        RetrainingScheduler scheduler = mock(RetrainingScheduler.class);
        when(scheduler.degradedSeries()).thenReturn(Map.of());

        Health health = new TrainingHealthIndicator(scheduler, new RetrainingProperties()).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("status", "Training healthy");
    }

    @Test
    void shouldReportDegradedWithFailingSeries() {
        RetrainingScheduler scheduler = mock(RetrainingScheduler.class);
        when(scheduler.degradedSeries()).thenReturn(Map.of(
                SeriesKey.of("cpu.usage", Map.of("host", "a")), 3,
                SeriesKey.of("mem.used"), 5));

        Health health = new TrainingHealthIndicator(scheduler, new RetrainingProperties()).health();

        assertThat(health.getStatus()).isEqualTo(new Status("DEGRADED"));
        assertThat(health.getDetails()).containsEntry("status", "2 series failing to train");
        assertThat(health.getDetails()).containsEntry("failureStreakThreshold", 3);
        assertThat(health.getDetails()).containsEntry("series", Map.of("cpu.usage{host=a}", 3, "mem.used", 5));
    }

    @Test
    void shouldNeverReportDown() {
        RetrainingScheduler scheduler = mock(RetrainingScheduler.class);
        when(scheduler.degradedSeries()).thenReturn(Map.of(SeriesKey.of("cpu.usage"), 100));

        Health health = new TrainingHealthIndicator(scheduler, new RetrainingProperties()).health();

        assertThat(health.getStatus()).isNotEqualTo(Status.DOWN);
    }
}

package com.phillippitts.anomalyguard.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the retraining scheduler and model staleness policy.
 */
@ConfigurationProperties(prefix = "pipeline.retraining")
@Validated
public class RetrainingProperties {

    /** Interval between sweeps when the in-process trigger is enabled. */
    @NotNull
    private Duration interval = Duration.ofMinutes(5);

    /** Number of most recent windows (M) read for training. */
    @Positive
    private int historyWindows = 500;

    /** Minimum number of windows a model may be trained from. */
    @Positive
    private int minSampleSize = 30;

    /** Models older than this are stale. */
    @NotNull
    private Duration maxModelAge = Duration.ofHours(24);

    /** EWMA of model scores above which the model is considered drifted. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double driftThreshold = 0.8;

    /** EWMA smoothing factor for the drift heuristic. */
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private double driftAlpha = 0.1;

    /** Percentile of training scores used as the adaptive decision threshold. */
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("100.0")
    private double thresholdPercentile = 99.5;

    /** Training taking longer than this is cancelled and counted as a failure. */
    @NotNull
    private Duration trainingTimeout = Duration.ofSeconds(30);

    /** Previous model versions kept for rollback. */
    @Positive
    private int retainedVersions = 2;

    /** Consecutive training failures after which a series is reported as degraded. */
    @Positive
    private int failureStreakThreshold = 3;

    /** Samples processed between cancellation checks. */
    @Positive
    private int batchSize = 64;

    public Duration getInterval() {
        return interval;
    }

    public void setInterval(Duration interval) {
        this.interval = interval;
    }

    public int getHistoryWindows() {
        return historyWindows;
    }

    public void setHistoryWindows(int historyWindows) {
        this.historyWindows = historyWindows;
    }

    public int getMinSampleSize() {
        return minSampleSize;
    }

    public void setMinSampleSize(int minSampleSize) {
        this.minSampleSize = minSampleSize;
    }

    public Duration getMaxModelAge() {
        return maxModelAge;
    }

    public void setMaxModelAge(Duration maxModelAge) {
        this.maxModelAge = maxModelAge;
    }

    public double getDriftThreshold() {
        return driftThreshold;
    }

    public void setDriftThreshold(double driftThreshold) {
        this.driftThreshold = driftThreshold;
    }

    public double getDriftAlpha() {
        return driftAlpha;
    }

    public void setDriftAlpha(double driftAlpha) {
        this.driftAlpha = driftAlpha;
    }

    public double getThresholdPercentile() {
        return thresholdPercentile;
    }

    public void setThresholdPercentile(double thresholdPercentile) {
        this.thresholdPercentile = thresholdPercentile;
    }

    public Duration getTrainingTimeout() {
        return trainingTimeout;
    }

    public void setTrainingTimeout(Duration trainingTimeout) {
        this.trainingTimeout = trainingTimeout;
    }

    public int getRetainedVersions() {
        return retainedVersions;
    }

    public void setRetainedVersions(int retainedVersions) {
        this.retainedVersions = retainedVersions;
    }

    public int getFailureStreakThreshold() {
        return failureStreakThreshold;
    }

    public void setFailureStreakThreshold(int failureStreakThreshold) {
        this.failureStreakThreshold = failureStreakThreshold;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }
}

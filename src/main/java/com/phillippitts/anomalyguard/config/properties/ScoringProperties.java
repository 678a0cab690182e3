package com.phillippitts.anomalyguard.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the anomaly scorer and its bootstrap baseline.
 */
@ConfigurationProperties(prefix = "pipeline.scoring")
@Validated
public class ScoringProperties {

    public enum Algorithm { ROBUST_ZSCORE, GAUSSIAN }

    /** Algorithm used to train and score per-series models. */
    @NotNull
    private Algorithm algorithm = Algorithm.ROBUST_ZSCORE;

    /** Threshold applied to model scores when adaptive thresholds are disabled. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double defaultThreshold = 0.95;

    /** Use the per-model threshold computed at training time. */
    private boolean adaptiveThreshold = true;

    /** Lower bound for adaptive thresholds so a very quiet corpus cannot produce a hair trigger. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double minThreshold = 0.9;

    /** Number of recent windows (K) in the bootstrap baseline. */
    @Positive
    private int baselineWindows = 60;

    /** Windows required before the baseline may flag anything. */
    @Positive
    private int baselineMinWindows = 10;

    /** z-score at or above which the baseline flags a window. */
    @Positive
    private double baselineZThreshold = 4.0;

    public Algorithm getAlgorithm() {
        return algorithm;
    }

    public void setAlgorithm(Algorithm algorithm) {
        this.algorithm = algorithm;
    }

    public double getDefaultThreshold() {
        return defaultThreshold;
    }

    public void setDefaultThreshold(double defaultThreshold) {
        this.defaultThreshold = defaultThreshold;
    }

    public boolean isAdaptiveThreshold() {
        return adaptiveThreshold;
    }

    public void setAdaptiveThreshold(boolean adaptiveThreshold) {
        this.adaptiveThreshold = adaptiveThreshold;
    }

    public double getMinThreshold() {
        return minThreshold;
    }

    public void setMinThreshold(double minThreshold) {
        this.minThreshold = minThreshold;
    }

    public int getBaselineWindows() {
        return baselineWindows;
    }

    public void setBaselineWindows(int baselineWindows) {
        this.baselineWindows = baselineWindows;
    }

    public int getBaselineMinWindows() {
        return baselineMinWindows;
    }

    public void setBaselineMinWindows(int baselineMinWindows) {
        this.baselineMinWindows = baselineMinWindows;
    }

    public double getBaselineZThreshold() {
        return baselineZThreshold;
    }

    public void setBaselineZThreshold(double baselineZThreshold) {
        this.baselineZThreshold = baselineZThreshold;
    }
}

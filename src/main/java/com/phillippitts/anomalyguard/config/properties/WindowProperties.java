package com.phillippitts.anomalyguard.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the event window buffer.
 */
@ConfigurationProperties(prefix = "pipeline.window")
@Validated
public class WindowProperties {

    /** Length of one window. Windows are aligned to multiples of this duration. */
    @NotNull
    private Duration duration = Duration.ofSeconds(60);

    /** A window seals early once it holds this many records. */
    @Positive(message = "Max records per window must be positive")
    private int maxRecords = 10_000;

    /** How far behind the last seal boundary a record may be and still be accepted. */
    @NotNull
    private Duration gracePeriod = Duration.ofSeconds(5);

    /** How far ahead of the buffer clock a record may be stamped and still be accepted. */
    @NotNull
    private Duration maxClockSkew = Duration.ofSeconds(5);

    /** Series without records for this long are retired until their next record. */
    @NotNull
    private Duration idleTtl = Duration.ofMinutes(30);

    /** How often the in-process timer checks for windows due to seal. */
    @NotNull
    private Duration sealTick = Duration.ofSeconds(1);

    public Duration getDuration() {
        return duration;
    }

    public void setDuration(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException("pipeline.window.duration must be positive");
        }
        this.duration = duration;
    }

    public int getMaxRecords() {
        return maxRecords;
    }

    public void setMaxRecords(int maxRecords) {
        this.maxRecords = maxRecords;
    }

    public Duration getGracePeriod() {
        return gracePeriod;
    }

    public void setGracePeriod(Duration gracePeriod) {
        if (gracePeriod == null || gracePeriod.isNegative()) {
            throw new IllegalArgumentException("pipeline.window.grace-period must not be negative");
        }
        this.gracePeriod = gracePeriod;
    }

    public Duration getMaxClockSkew() {
        return maxClockSkew;
    }

    public void setMaxClockSkew(Duration maxClockSkew) {
        if (maxClockSkew == null || maxClockSkew.isNegative()) {
            throw new IllegalArgumentException("pipeline.window.max-clock-skew must not be negative");
        }
        this.maxClockSkew = maxClockSkew;
    }

    public Duration getIdleTtl() {
        return idleTtl;
    }

    public void setIdleTtl(Duration idleTtl) {
        this.idleTtl = idleTtl;
    }

    public Duration getSealTick() {
        return sealTick;
    }

    public void setSealTick(Duration sealTick) {
        this.sealTick = sealTick;
    }
}

package com.phillippitts.anomalyguard.service.alert;

import com.phillippitts.anomalyguard.domain.Alert;

import java.time.Instant;

/**
 * Alert lifecycle transition published to downstream notification channels.
 */
public record AlertEvent(Type type, Alert alert, Instant at) {

    public enum Type { CREATED, UPDATED, ACKNOWLEDGED, RESOLVED }
}

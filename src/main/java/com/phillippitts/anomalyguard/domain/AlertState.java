package com.phillippitts.anomalyguard.domain;

/** Lifecycle of an alert. OPEN and ACKNOWLEDGED alerts are active; RESOLVED is terminal. */
public enum AlertState {
    OPEN,
    ACKNOWLEDGED,
    RESOLVED;

    public boolean isActive() {
        return this != RESOLVED;
    }
}

package me.golemcore.cognition.domain.model;

public enum CycleOutcome {
    COMPLETED, SKIPPED_BUSY, SKIPPED_PRESSURE, FAILED
}

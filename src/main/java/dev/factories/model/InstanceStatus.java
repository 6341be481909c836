package dev.factories.model;

import java.util.Locale;

/**
 * Lifecycle of an instance or component.
 * <p>
 * Transitions only move forward along {@code SUBMITTED → STARTING → RUNNING},
 * may skip ahead, and may end in any terminal state from any live one.
 * Nothing leaves a terminal state.
 */
public enum InstanceStatus {
    SUBMITTED,
    STARTING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELED;
    }

    public boolean canTransitionTo(InstanceStatus next) {
        if (next == null || next == this || isTerminal()) {
            return false;
        }
        return next.isTerminal() || next.ordinal() > ordinal();
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}

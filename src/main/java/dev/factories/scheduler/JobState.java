package dev.factories.scheduler;

/**
 * Scheduler-independent job state. {@link #UNKNOWN} covers anything the
 * scheduler reported that is not understood; it is neither running nor terminal.
 */
public enum JobState {
    PENDING,
    STARTING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELED,
    UNKNOWN;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELED;
    }
}

package dev.factories.scheduler;

import java.util.Locale;
import java.util.Map;

/**
 * The single translation point from SLURM state strings to {@link JobState}.
 * Unrecognised states map to {@link JobState#UNKNOWN}, an empty state to
 * {@link JobState#COMPLETED} (the job has been reaped).
 */
public final class SchedulerStates {

    private static final Map<String, JobState> TABLE = Map.ofEntries(
        Map.entry("PENDING", JobState.PENDING),
        Map.entry("QUEUED", JobState.PENDING),
        Map.entry("REQUEUED", JobState.PENDING),
        Map.entry("REQUEUE_HOLD", JobState.PENDING),
        Map.entry("REQUEUE_FED", JobState.PENDING),
        Map.entry("CONFIGURING", JobState.STARTING),
        Map.entry("LAUNCHING", JobState.STARTING),
        Map.entry("RESIZING", JobState.STARTING),
        Map.entry("RUNNING", JobState.RUNNING),
        Map.entry("COMPLETED", JobState.COMPLETED),
        Map.entry("COMPLETING", JobState.COMPLETED),
        Map.entry("FAILED", JobState.FAILED),
        Map.entry("TIMEOUT", JobState.FAILED),
        Map.entry("NODE_FAIL", JobState.FAILED),
        Map.entry("NODE_FAILURE", JobState.FAILED),
        Map.entry("OUT_OF_MEMORY", JobState.FAILED),
        Map.entry("BOOT_FAIL", JobState.FAILED),
        Map.entry("DEADLINE", JobState.FAILED),
        Map.entry("PREEMPTED", JobState.FAILED),
        Map.entry("CANCELLED", JobState.CANCELED),
        Map.entry("CANCELED", JobState.CANCELED)
    );

    private SchedulerStates() {}

    public static JobState map(String rawState) {
        if (rawState == null || rawState.isBlank()) {
            return JobState.COMPLETED;
        }
        // squeue/sacct print e.g. "CANCELLED by 1234"
        String key = rawState.trim().split("\\s+")[0]
            .toUpperCase(Locale.ROOT)
            .replace('-', '_');
        return TABLE.getOrDefault(key, JobState.UNKNOWN);
    }
}

package dev.factories.scheduler;

/**
 * Answer to a status query: the mapped state and, once placed, the node the job runs on.
 */
public record JobStatus(JobState state, String node) {

    /** The scheduler no longer knows the job; it ran to the end and was reaped. */
    public static JobStatus gone() {
        return new JobStatus(JobState.COMPLETED, null);
    }

    public boolean hasNode() {
        return node != null && !node.isBlank() && !"(null)".equals(node);
    }

    public boolean isPlaced() {
        return state == JobState.RUNNING && hasNode();
    }
}

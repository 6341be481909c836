package dev.factories.scheduler;

/**
 * Abstraction over the external batch scheduler.
 * <p>
 * Implementations never leak their native state vocabulary: every status
 * leaves this interface as a {@link JobState}.
 */
public interface SchedulerGateway {

    /**
     * Submit a job and return the scheduler-assigned handle.
     *
     * @throws dev.factories.error.SchedulerException when the scheduler rejects the job
     *         or answers without a well-formed handle
     */
    String submit(JobDescription job);

    /**
     * Cancel a job. Idempotent.
     *
     * @return true if the job was cancelled, false if the scheduler no longer knows it
     * @throws dev.factories.error.SchedulerException when the cancellation itself failed
     */
    boolean cancel(String handle);

    /**
     * Current state of a job. A handle the scheduler no longer knows is reported
     * as {@link JobState#COMPLETED}.
     *
     * @throws dev.factories.error.SchedulerException when the scheduler could not be queried
     */
    JobStatus queryStatus(String handle);

    /** Display name, used in logs. */
    String getName();
}

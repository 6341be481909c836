package dev.factories.engine;

import dev.factories.error.SchedulerException;
import dev.factories.scheduler.JobDescription;
import dev.factories.scheduler.JobState;
import dev.factories.scheduler.JobStatus;
import dev.factories.scheduler.SchedulerGateway;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory scheduler. Handles count up from 1000; a handle with no scripted
 * status reports PENDING. The last scripted status of a handle repeats.
 */
class FakeSchedulerGateway implements SchedulerGateway {

    final List<JobDescription> submitted = new ArrayList<>();
    final List<String> cancelled = new ArrayList<>();

    private final Deque<String> submitFailures = new ArrayDeque<>();
    private final Map<String, Deque<JobStatus>> statuses = new HashMap<>();
    private final Set<String> failingCancels = new HashSet<>();
    private final Set<String> failingQueries = new HashSet<>();
    private int nextHandle = 1000;
    private int queries;

    void failNextSubmit(String message) {
        submitFailures.add(message);
    }

    void failCancel(String handle) {
        failingCancels.add(handle);
    }

    void failQueries(String handle) {
        failingQueries.add(handle);
    }

    void status(String handle, JobStatus... sequence) {
        statuses.put(handle, new ArrayDeque<>(List.of(sequence)));
    }

    void running(String handle, String node) {
        status(handle, new JobStatus(JobState.RUNNING, node));
    }

    int queries() {
        return queries;
    }

    @Override
    public String submit(JobDescription job) {
        submitted.add(job);
        if (!submitFailures.isEmpty()) {
            throw new SchedulerException(submitFailures.poll());
        }
        return String.valueOf(nextHandle++);
    }

    @Override
    public boolean cancel(String handle) {
        cancelled.add(handle);
        if (failingCancels.contains(handle)) {
            throw new SchedulerException("scancel: error: Kill job error on job id " + handle);
        }
        return true;
    }

    @Override
    public JobStatus queryStatus(String handle) {
        queries++;
        if (failingQueries.contains(handle)) {
            throw new SchedulerException("squeue: error: slurm_load_jobs error: Socket timed out");
        }
        Deque<JobStatus> sequence = statuses.get(handle);
        if (sequence == null || sequence.isEmpty()) {
            return new JobStatus(JobState.PENDING, null);
        }
        return sequence.size() > 1 ? sequence.poll() : sequence.peek();
    }

    @Override
    public String getName() {
        return "fake";
    }
}

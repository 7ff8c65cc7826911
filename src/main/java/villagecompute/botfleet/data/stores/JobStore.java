package villagecompute.botfleet.data.stores;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import villagecompute.botfleet.data.models.Job;
import villagecompute.botfleet.data.models.Job.JobStatus;
import villagecompute.botfleet.jobs.JobType;

/**
 * Persistence contract behind the job queue.
 *
 * <p>
 * Every method is its own unit of work: no implementation may hold a row lock after returning, so handlers run without
 * any queue lock held. {@link #claimReady} hands out a job to exactly one caller; every later transition names the
 * attempt it belongs to, so an outcome reported by a worker whose claim has been superseded changes nothing.
 */
public interface JobStore {

    /**
     * Persists a new job and returns it with its id assigned.
     */
    Job create(Job job);

    /**
     * Atomically claims up to {@code limit} jobs with status QUEUED or RETRY and {@code runAt <= now}, earliest
     * {@code runAt} first. Each claimed job is moved to RUNNING with {@code lockedAt = now} and its attempt counter
     * incremented. Concurrent callers never receive the same job and never wait on each other's locks.
     *
     * @param limit
     *            maximum jobs to claim
     * @param now
     *            claim time
     * @return claimed jobs in their post-claim state
     */
    List<Job> claimReady(int limit, Instant now);

    Optional<Job> findById(Long jobId);

    /**
     * Moves a job to SUCCEEDED and clears its lock, but only while it is still RUNNING under the given attempt.
     *
     * @param attempt
     *            attempt number the caller claimed the job with
     * @return false when the job is missing, not RUNNING, or has been claimed again since
     */
    boolean markSucceeded(Long jobId, int attempt, Instant now);

    /**
     * Moves a job to RETRY with a new {@code runAt}, under the same RUNNING-and-attempt condition as
     * {@link #markSucceeded}.
     */
    boolean markRetry(Long jobId, int attempt, Instant runAt, String error, Instant now);

    /**
     * Moves a job to FAILED without touching {@code runAt}, under the same RUNNING-and-attempt condition as
     * {@link #markSucceeded}.
     */
    boolean markFailed(Long jobId, int attempt, String error, Instant now);

    /**
     * Returns whether a QUEUED, RUNNING or RETRY job of the given type exists for the bot (null bot id matches
     * aggregate jobs).
     */
    boolean hasPendingJob(UUID botId, JobType jobType);

    /**
     * Finds RUNNING jobs whose lock is older than the given instant.
     */
    List<Job> findStuck(Instant lockedBefore);

    long countByStatus(JobStatus status);
}

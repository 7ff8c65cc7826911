package villagecompute.botfleet.services;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.botfleet.api.types.EnqueueRequestType;
import villagecompute.botfleet.api.types.JobProcessResultType;
import villagecompute.botfleet.data.models.Job;
import villagecompute.botfleet.data.stores.JobStore;
import villagecompute.botfleet.exceptions.ValidationException;
import villagecompute.botfleet.jobs.JobHandler;
import villagecompute.botfleet.jobs.JobType;
import villagecompute.botfleet.observability.LoggingConfig;

/**
 * Central orchestrator for the database-backed job queue.
 *
 * <p>
 * This service owns the job lifecycle:
 * <ul>
 * <li>Enqueueing with an optional future {@code run_at} and attempt cap</li>
 * <li>Atomic claiming through {@link JobStore#claimReady} (skip-locked, so workers never wait on each other)</li>
 * <li>Dispatch to the {@link JobHandler} registered for the job's type, inside an OpenTelemetry span</li>
 * <li>Success, retry with exponential backoff, and permanent failure</li>
 * <li>Reaping jobs stuck in RUNNING after a worker crash</li>
 * </ul>
 *
 * <p>
 * <b>Retry Strategy:</b> a failed job with {@code attempts < max_attempts} goes to RETRY with
 * {@code run_at = now + base * 2^(attempts-1)} (30s, 60s, 120s, ...), capped at
 * {@code botfleet.jobs.max-backoff-seconds}. Once attempts are exhausted the job is FAILED and stays there.
 *
 * <p>
 * <b>Locking:</b> the claim transaction commits before any handler runs. Handlers spend seconds to minutes on provider
 * calls, and none of that time is spent holding a row lock. Outcomes are recorded against the claimed attempt number,
 * so a worker that outlived its lease cannot overwrite the state of the worker that claimed the job after it.
 *
 * @see JobHandler for handler contract
 * @see JobType for job type definitions
 */
@ApplicationScoped
public class JobQueueService {

    private static final Logger LOG = Logger.getLogger(JobQueueService.class);

    /**
     * Registry mapping JobType → JobHandler for CDI-based handler discovery.
     */
    private final Map<JobType, JobHandler> handlerRegistry;

    @Inject
    JobStore jobStore;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry registry;

    @ConfigProperty(
            name = "botfleet.jobs.default-max-attempts",
            defaultValue = "5")
    int defaultMaxAttempts = 5;

    @ConfigProperty(
            name = "botfleet.jobs.backoff-base-seconds",
            defaultValue = "30")
    long backoffBaseSeconds = 30;

    @ConfigProperty(
            name = "botfleet.jobs.max-backoff-seconds",
            defaultValue = "3600")
    long maxBackoffSeconds = 3600;

    @ConfigProperty(
            name = "botfleet.jobs.lease-timeout",
            defaultValue = "15m")
    Duration leaseTimeout = Duration.ofMinutes(15);

    Clock clock = Clock.systemUTC();

    @Inject
    public JobQueueService(Instance<JobHandler> handlers) {
        this((Iterable<JobHandler>) handlers);
    }

    JobQueueService(Iterable<? extends JobHandler> handlers) {
        this.handlerRegistry = buildHandlerRegistry(handlers);
        LOG.infof("Initialized JobQueueService with %d registered handlers", handlerRegistry.size());
    }

    /**
     * Builds the type → handler map.
     *
     * @throws IllegalStateException
     *             if two handlers register for the same JobType
     */
    private Map<JobType, JobHandler> buildHandlerRegistry(Iterable<? extends JobHandler> handlers) {
        Map<JobType, JobHandler> registry = new EnumMap<>(JobType.class);
        for (JobHandler handler : handlers) {
            JobType type = handler.handlesType();
            if (registry.containsKey(type)) {
                throw new IllegalStateException("Duplicate handlers registered for JobType." + type + ": "
                        + registry.get(type).getClass().getName() + " and " + handler.getClass().getName());
            }
            registry.put(type, handler);
            LOG.debugf("Registered handler %s for JobType.%s", handler.getClass().getSimpleName(), type);
        }
        return registry;
    }

    /**
     * Enqueues a job due now with the default attempt cap.
     *
     * @return generated job id
     */
    public Long enqueue(JobType jobType, UUID botId, Map<String, Object> payload) {
        return enqueue(jobType, botId, payload, null, null);
    }

    /**
     * Enqueues a new job in QUEUED.
     *
     * @param jobType
     *            the job type
     * @param botId
     *            bot the job acts for, null for aggregate jobs
     * @param payload
     *            job parameters (serialized as JSONB), null for none
     * @param runAt
     *            earliest execution time, null for now
     * @param maxAttempts
     *            attempt cap, null for {@code botfleet.jobs.default-max-attempts}
     * @return generated job id
     * @throws ValidationException
     *             if the type is missing, a bot-scoped type has no bot, or the attempt cap is below 1
     */
    public Long enqueue(JobType jobType, UUID botId, Map<String, Object> payload, Instant runAt, Integer maxAttempts) {
        if (jobType == null) {
            throw new ValidationException("Job type is required");
        }
        if (jobType.requiresBot() && botId == null) {
            throw new ValidationException("JobType." + jobType + " requires a bot id");
        }
        int attemptsCap = maxAttempts != null ? maxAttempts : defaultMaxAttempts;
        if (attemptsCap < 1) {
            throw new ValidationException("maxAttempts must be at least 1, got " + attemptsCap);
        }

        Instant now = clock.instant();
        Job job = Job.newQueued(jobType, botId, payload != null ? payload : Map.of(), runAt != null ? runAt : now,
                attemptsCap, now);
        Job saved = jobStore.create(job);
        LOG.infof("Enqueued job %d (type: %s, bot: %s, runAt: %s, maxAttempts: %d)", saved.id, jobType, botId,
                saved.runAt, attemptsCap);
        return saved.id;
    }

    /**
     * Enqueues several jobs; each one is its own write.
     *
     * @return generated ids in request order
     */
    public List<Long> enqueueAll(List<EnqueueRequestType> requests) {
        List<Long> ids = new ArrayList<>(requests.size());
        for (EnqueueRequestType request : requests) {
            ids.add(enqueue(request.jobType(), request.botId(), request.payload(), request.runAt(),
                    request.maxAttempts()));
        }
        return ids;
    }

    /**
     * Returns whether the bot already has a QUEUED, RUNNING or RETRY job of this type.
     */
    public boolean hasPendingJob(UUID botId, JobType jobType) {
        return jobStore.hasPendingJob(botId, jobType);
    }

    /**
     * Claims up to {@code limit} due jobs. Safe under any number of concurrent callers.
     */
    public List<Job> claim(int limit) {
        List<Job> claimed = jobStore.claimReady(limit, clock.instant());
        if (!claimed.isEmpty()) {
            LOG.debugf("Claimed %d of up to %d jobs", claimed.size(), limit);
        }
        return claimed;
    }

    /**
     * Marks a RUNNING job SUCCEEDED under its current attempt. No-op for missing jobs and jobs that are not RUNNING,
     * so a second call changes nothing.
     */
    public void succeed(Long jobId) {
        Job job = findRunning(jobId, "succeed");
        if (job != null) {
            succeed(jobId, job.attempts);
        }
    }

    /**
     * Marks a job SUCCEEDED if it is still RUNNING under the given attempt. A worker whose claim was reaped and handed
     * to another worker gets a no-op.
     *
     * @param jobId
     *            job primary key
     * @param attempt
     *            the {@code attempts} value the job was claimed with
     */
    public void succeed(Long jobId, int attempt) {
        if (jobStore.markSucceeded(jobId, attempt, clock.instant())) {
            LOG.debugf("Job %d succeeded on attempt %d", (Object) jobId, (Object) attempt);
        } else {
            LOG.debugf("succeed(%d, attempt %d) ignored: claim is no longer current", (Object) jobId, (Object) attempt);
        }
    }

    /**
     * Records a failed attempt for a RUNNING job under its current attempt. No-op for missing jobs and jobs that are
     * not RUNNING.
     *
     * @param jobId
     *            job primary key
     * @param errorMessage
     *            stored in {@code last_error}
     */
    public void fail(Long jobId, String errorMessage) {
        Job job = findRunning(jobId, "fail");
        if (job != null) {
            recordFailure(job, job.attempts, errorMessage);
        }
    }

    /**
     * Records a failed attempt: RETRY with backoff while attempts remain, FAILED otherwise. Only applies while the job
     * is still RUNNING under the given attempt.
     *
     * @param jobId
     *            job primary key
     * @param attempt
     *            the {@code attempts} value the job was claimed with
     * @param errorMessage
     *            stored in {@code last_error}
     */
    public void fail(Long jobId, int attempt, String errorMessage) {
        Job job = jobStore.findById(jobId).orElse(null);
        if (job == null) {
            LOG.debugf("fail(%d) ignored: job no longer exists", jobId);
            return;
        }
        recordFailure(job, attempt, errorMessage);
    }

    private void recordFailure(Job job, int attempt, String errorMessage) {
        if (job.status != Job.JobStatus.RUNNING || job.attempts != attempt) {
            LOG.debugf("fail(%d, attempt %d) ignored: job is %s on attempt %d", job.id, attempt, job.status,
                    job.attempts);
            return;
        }

        Instant now = clock.instant();
        boolean applied;
        if (attempt < job.maxAttempts) {
            Duration delay = calculateBackoffDelay(attempt);
            applied = jobStore.markRetry(job.id, attempt, now.plus(delay), errorMessage, now);
            if (applied) {
                LOG.warnf("Job %d (type: %s) failed attempt %d/%d, retrying in %ds: %s", job.id, job.jobType, attempt,
                        job.maxAttempts, delay.toSeconds(), errorMessage);
            }
        } else {
            applied = jobStore.markFailed(job.id, attempt, errorMessage, now);
            if (applied) {
                LOG.errorf("Job %d (type: %s) permanently failed after %d attempts: %s", job.id, job.jobType, attempt,
                        errorMessage);
            }
        }
        if (!applied) {
            LOG.debugf("fail(%d, attempt %d) ignored: claim changed concurrently", (Object) job.id, (Object) attempt);
        }
    }

    private Job findRunning(Long jobId, String operation) {
        Job job = jobStore.findById(jobId).orElse(null);
        if (job == null) {
            LOG.debugf("%s(%d) ignored: job no longer exists", operation, jobId);
            return null;
        }
        if (job.status != Job.JobStatus.RUNNING) {
            LOG.debugf("%s(%d) ignored: job is %s", operation, jobId, job.status);
            return null;
        }
        return job;
    }

    /**
     * Claims up to {@code limit} jobs and runs them one after another.
     *
     * @return counts of processed, succeeded and failed jobs plus one error line per failure
     */
    public JobProcessResultType processJobs(int limit) {
        List<Job> jobs = claim(limit);
        if (jobs.isEmpty()) {
            return JobProcessResultType.EMPTY;
        }

        int succeeded = 0;
        List<String> errors = new ArrayList<>();
        for (Job job : jobs) {
            try {
                executeJob(job);
                succeed(job.id, job.attempts);
                succeeded++;
                countProcessed(job.jobType, "succeeded");
            } catch (Exception e) {
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                fail(job.id, job.attempts, message);
                errors.add("Job " + job.id + ": " + message);
                countProcessed(job.jobType, "failed");
            }
        }
        LOG.infof("Processed %d jobs: %d succeeded, %d failed", jobs.size(), succeeded, errors.size());
        return new JobProcessResultType(jobs.size(), succeeded, errors.size(), List.copyOf(errors));
    }

    /**
     * Dispatches one claimed job to its handler inside a {@code job.execute} span with job MDC fields set.
     *
     * @throws Exception
     *             whatever the handler throws, or {@link IllegalStateException} when no handler is registered
     */
    void executeJob(Job job) throws Exception {
        JobHandler handler = handlerRegistry.get(job.jobType);
        if (handler == null) {
            throw new IllegalStateException("No handler registered for JobType." + job.jobType);
        }
        if (job.jobType.requiresBot() && job.botId == null) {
            throw new ValidationException("JobType." + job.jobType + " requires a bot id");
        }

        Span span = tracer.spanBuilder("job.execute").setAttribute("job.id", job.id)
                .setAttribute("job.type", job.jobType.name()).setAttribute("job.attempt", job.attempts).startSpan();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setJobContext(job.id, job.jobType, job.botId);

            handler.execute(job.id, job.botId, job.payload != null ? job.payload : Map.of());
            span.addEvent("job.completed");
            LOG.infof("Job %d (type: %s) completed successfully on attempt %d", job.id, job.jobType, job.attempts);

        } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            span.addEvent("job.failed");
            LOG.errorf(e, "Job %d (type: %s) failed on attempt %d", job.id, job.jobType, job.attempts);
            throw e;

        } finally {
            span.end();
            LoggingConfig.clearMDC();
        }
    }

    /**
     * Calculates the retry delay after the given number of attempts.
     *
     * <p>
     * <b>Formula:</b> {@code delay = base * 2^(attempts-1)}, capped at the configured maximum. Attempts below 1 are
     * treated as 1.
     *
     * @param attempts
     *            attempts made so far (1-indexed)
     * @return delay before the next attempt
     */
    public Duration calculateBackoffDelay(int attempts) {
        int exponent = Math.max(0, attempts - 1);
        long cap = Math.max(backoffBaseSeconds, maxBackoffSeconds);
        if (exponent >= 62 || backoffBaseSeconds > (cap >> exponent)) {
            return Duration.ofSeconds(cap);
        }
        return Duration.ofSeconds(backoffBaseSeconds << exponent);
    }

    /**
     * Fails RUNNING jobs whose lock is older than the lease timeout, through the normal {@link #fail} path.
     *
     * @return number of jobs reaped
     */
    public int reapStuckJobs() {
        Instant lockedBefore = clock.instant().minus(leaseTimeout);
        List<Job> stuck = jobStore.findStuck(lockedBefore);
        for (Job job : stuck) {
            LOG.warnf("Reaping job %d (type: %s) locked since %s", job.id, job.jobType, job.lockedAt);
            fail(job.id, job.attempts, "Lease expired after " + leaseTimeout.toMinutes() + " minutes (worker lost)");
        }
        return stuck.size();
    }

    private void countProcessed(JobType type, String outcome) {
        Counter.builder("botfleet.jobs.processed").description("Jobs dispatched by outcome")
                .tag("type", type.name()).tag("outcome", outcome).register(registry).increment();
    }
}

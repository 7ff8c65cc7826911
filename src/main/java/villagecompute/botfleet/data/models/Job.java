package villagecompute.botfleet.data.models;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import villagecompute.botfleet.jobs.JobType;

/**
 * Panache entity for the database-backed job queue.
 *
 * <p>
 * Workers claim rows atomically with {@code SELECT ... FOR UPDATE SKIP LOCKED} (see
 * {@link villagecompute.botfleet.data.stores.PanacheJobStore}), so the {@code (status, run_at)} index is the hot path.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (BIGSERIAL, PK) - Primary identifier</li>
 * <li>{@code job_type} (TEXT) - JobType enum value</li>
 * <li>{@code bot_id} (UUID, nullable) - Bot the job acts for; null for aggregate jobs</li>
 * <li>{@code payload} (JSONB) - Job parameters deserialized by handler</li>
 * <li>{@code status} (TEXT) - QUEUED, RUNNING, RETRY, SUCCEEDED, FAILED</li>
 * <li>{@code run_at} (TIMESTAMPTZ) - Earliest execution time (moved forward by retry backoff)</li>
 * <li>{@code attempts} (INT) - Claims so far; incremented on every claim, never decremented</li>
 * <li>{@code max_attempts} (INT) - Attempt cap before FAILED</li>
 * <li>{@code locked_at} (TIMESTAMPTZ) - Set while RUNNING</li>
 * <li>{@code last_error} (TEXT) - Error message from the last failed attempt</li>
 * <li>{@code created_at}/{@code updated_at} (TIMESTAMPTZ) - Audit timestamps</li>
 * </ul>
 *
 * <p>
 * Rows are never deleted by the queue; retention is an operational concern.
 *
 * @see JobType for job type definitions
 * @see villagecompute.botfleet.services.JobQueueService for the lifecycle
 */
@Entity
@Table(
        name = "jobs",
        indexes = {@Index(
                name = "idx_jobs_status_run_at",
                columnList = "status, run_at"),
                @Index(
                        name = "idx_jobs_bot_type_status",
                        columnList = "bot_id, job_type, status")})
public class Job extends PanacheEntityBase {

    /** Statuses a worker may claim. */
    public static final List<JobStatus> CLAIMABLE_STATUSES = List.of(JobStatus.QUEUED, JobStatus.RETRY);

    /** Statuses that count as "already has work in flight" for duplicate suppression. */
    public static final List<JobStatus> PENDING_STATUSES = List.of(JobStatus.QUEUED, JobStatus.RUNNING,
            JobStatus.RETRY);

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "job_type",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public JobType jobType;

    @Column(
            name = "bot_id")
    public UUID botId;

    @Column(
            name = "payload",
            nullable = false,
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> payload;

    @Column(
            name = "status",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public JobStatus status;

    @Column(
            name = "run_at",
            nullable = false)
    public Instant runAt;

    @Column(
            name = "attempts",
            nullable = false)
    public int attempts;

    @Column(
            name = "max_attempts",
            nullable = false)
    public int maxAttempts;

    @Column(
            name = "locked_at")
    public Instant lockedAt;

    @Column(
            name = "last_error")
    public String lastError;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Job lifecycle statuses.
     *
     * <p>
     * QUEUED/RETRY → RUNNING → {SUCCEEDED | RETRY | FAILED}. SUCCEEDED and FAILED are terminal.
     */
    public enum JobStatus {
        /**
         * Job created, awaiting its first claim.
         */
        QUEUED,

        /**
         * Job claimed by exactly one worker.
         */
        RUNNING,

        /**
         * Job failed and waits for its backed-off {@code run_at}.
         */
        RETRY,

        /**
         * Job completed successfully.
         */
        SUCCEEDED,

        /**
         * Job failed after exhausting its attempts.
         */
        FAILED;

        /**
         * Returns whether no further transition is allowed out of this status.
         */
        public boolean isTerminal() {
            return this == SUCCEEDED || this == FAILED;
        }
    }

    /**
     * Builds an unsaved QUEUED job.
     *
     * @param jobType
     *            the job type
     * @param botId
     *            bot the job acts for, may be null
     * @param payload
     *            job parameters (serialized as JSONB)
     * @param runAt
     *            earliest execution time
     * @param maxAttempts
     *            attempt cap
     * @param now
     *            creation timestamp
     * @return the new, not yet persisted job
     */
    public static Job newQueued(JobType jobType, UUID botId, Map<String, Object> payload, Instant runAt,
            int maxAttempts, Instant now) {
        Job job = new Job();
        job.jobType = jobType;
        job.botId = botId;
        job.payload = payload;
        job.status = JobStatus.QUEUED;
        job.runAt = runAt;
        job.attempts = 0;
        job.maxAttempts = maxAttempts;
        job.createdAt = now;
        job.updatedAt = now;
        return job;
    }

    /**
     * Counts pending jobs of one type for one bot. A null bot id matches aggregate jobs.
     *
     * @param botId
     *            the bot, or null for aggregate jobs
     * @param jobType
     *            the job type
     * @return number of QUEUED, RUNNING or RETRY jobs
     */
    public static long countPending(UUID botId, JobType jobType) {
        if (botId == null) {
            return count("botId is null and jobType = ?1 and status in ?2", jobType, PENDING_STATUSES);
        }
        return count("botId = ?1 and jobType = ?2 and status in ?3", botId, jobType, PENDING_STATUSES);
    }

    /**
     * Finds RUNNING jobs whose lock is older than the given threshold.
     *
     * @param lockedBefore
     *            lease expiry threshold
     * @return stuck jobs, oldest lock first
     */
    public static List<Job> findStuck(Instant lockedBefore) {
        return list("status = ?1 and lockedAt < ?2 order by lockedAt", JobStatus.RUNNING, lockedBefore);
    }

    /**
     * Loads jobs by id ordered by {@code run_at}.
     *
     * @param ids
     *            primary keys
     * @return matching jobs
     */
    public static List<Job> findByIds(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return list("id in ?1 order by runAt", ids);
    }
}

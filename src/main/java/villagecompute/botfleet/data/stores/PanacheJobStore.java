package villagecompute.botfleet.data.stores;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;

import org.jboss.logging.Logger;

import villagecompute.botfleet.data.models.Job;
import villagecompute.botfleet.data.models.Job.JobStatus;
import villagecompute.botfleet.jobs.JobType;

/**
 * PostgreSQL-backed {@link JobStore} built on the {@link Job} Panache entity.
 *
 * <p>
 * <b>Claim:</b> candidate ids are selected with {@code FOR UPDATE SKIP LOCKED}, so a worker never blocks on a row
 * another worker is claiming; it moves on to the next candidate. The selected rows are then flipped to RUNNING in the
 * same transaction and the transaction commits before {@link #claimReady} returns.
 *
 * <p>
 * <b>Outcomes:</b> each transition is a single conditional {@code UPDATE} on {@code (id, status, attempts)}. A worker
 * whose job was reaped and claimed again reports against a stale attempt number and updates zero rows.
 */
@ApplicationScoped
public class PanacheJobStore implements JobStore {

    private static final Logger LOG = Logger.getLogger(PanacheJobStore.class);

    private static final String CLAIM_CANDIDATES_SQL = "SELECT id FROM jobs WHERE status IN ('QUEUED', 'RETRY') "
            + "AND run_at <= :now ORDER BY run_at ASC LIMIT :limit FOR UPDATE SKIP LOCKED";

    /** Outcome updates only apply to the claim that is still current. */
    private static final String WHERE_CLAIMED = "where id = ?3 and status = ?4 and attempts = ?5";

    @Override
    @Transactional
    public Job create(Job job) {
        job.persist();
        return job;
    }

    @Override
    @Transactional
    @SuppressWarnings("unchecked")
    public List<Job> claimReady(int limit, Instant now) {
        if (limit <= 0) {
            return List.of();
        }

        List<Number> rows = Job.getEntityManager().createNativeQuery(CLAIM_CANDIDATES_SQL)
                .setParameter("now", OffsetDateTime.ofInstant(now, ZoneOffset.UTC)).setParameter("limit", limit)
                .getResultList();
        if (rows.isEmpty()) {
            return List.of();
        }
        List<Long> ids = rows.stream().map(Number::longValue).collect(Collectors.toList());

        int updated = Job.update(
                "status = ?1, lockedAt = ?2, attempts = attempts + 1, updatedAt = ?2 where id in ?3",
                JobStatus.RUNNING, now, ids);
        LOG.debugf("Claimed %d jobs (%d candidates)", updated, ids.size());

        // bulk update bypasses the persistence context
        Job.getEntityManager().clear();
        return Job.findByIds(ids);
    }

    @Override
    @Transactional
    public Optional<Job> findById(Long jobId) {
        return Job.findByIdOptional(jobId);
    }

    @Override
    @Transactional
    public boolean markSucceeded(Long jobId, int attempt, Instant now) {
        return Job.update("status = ?1, lockedAt = null, updatedAt = ?2 " + WHERE_CLAIMED, JobStatus.SUCCEEDED,
                now, jobId, JobStatus.RUNNING, attempt) == 1;
    }

    @Override
    @Transactional
    public boolean markRetry(Long jobId, int attempt, Instant runAt, String error, Instant now) {
        return Job.update("status = ?1, lockedAt = null, updatedAt = ?2, runAt = ?6, lastError = ?7 " + WHERE_CLAIMED,
                JobStatus.RETRY, now, jobId, JobStatus.RUNNING, attempt, runAt, error) == 1;
    }

    @Override
    @Transactional
    public boolean markFailed(Long jobId, int attempt, String error, Instant now) {
        return Job.update("status = ?1, lockedAt = null, updatedAt = ?2, lastError = ?6 " + WHERE_CLAIMED,
                JobStatus.FAILED, now, jobId, JobStatus.RUNNING, attempt, error) == 1;
    }

    @Override
    @Transactional
    public boolean hasPendingJob(UUID botId, JobType jobType) {
        return Job.countPending(botId, jobType) > 0;
    }

    @Override
    @Transactional
    public List<Job> findStuck(Instant lockedBefore) {
        return Job.findStuck(lockedBefore);
    }

    @Override
    @Transactional
    public long countByStatus(JobStatus status) {
        return Job.count("status", status);
    }
}

package villagecompute.botfleet.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.trace.TracerProvider;
import villagecompute.botfleet.api.types.EnqueueRequestType;
import villagecompute.botfleet.api.types.JobProcessResultType;
import villagecompute.botfleet.data.models.Job;
import villagecompute.botfleet.data.models.Job.JobStatus;
import villagecompute.botfleet.exceptions.ValidationException;
import villagecompute.botfleet.jobs.JobHandler;
import villagecompute.botfleet.jobs.JobType;
import villagecompute.botfleet.testing.InMemoryJobStore;
import villagecompute.botfleet.testing.MutableClock;

/**
 * Unit tests for {@link JobQueueService}: enqueue validation, claim semantics, the retry/backoff lifecycle and
 * handler dispatch.
 */
class JobQueueServiceTest {

    private static final UUID BOT_ID = UUID.randomUUID();

    private InMemoryJobStore store;
    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private RecordingHandler postHandler;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore();
        clock = MutableClock.at("2025-06-01T12:00:00Z");
        registry = new SimpleMeterRegistry();
        postHandler = new RecordingHandler(JobType.GENERATE_POST);
    }

    private JobQueueService newService(JobHandler... handlers) {
        JobQueueService service = new JobQueueService(List.of(handlers));
        service.jobStore = store;
        service.tracer = TracerProvider.noop().get("test");
        service.registry = registry;
        service.clock = clock;
        return service;
    }

    @Test
    void testEnqueue_defaults() {
        JobQueueService service = newService(postHandler);

        Long id = service.enqueue(JobType.GENERATE_POST, BOT_ID, null);

        Job job = store.findById(id).orElseThrow();
        assertEquals(JobStatus.QUEUED, job.status);
        assertEquals(0, job.attempts);
        assertEquals(5, job.maxAttempts);
        assertEquals(clock.instant(), job.runAt);
        assertEquals(Map.of(), job.payload);
        assertNull(job.lastError);
    }

    @Test
    void testEnqueue_validation() {
        JobQueueService service = newService(postHandler);

        assertThrows(ValidationException.class, () -> service.enqueue(null, BOT_ID, Map.of()));
        assertThrows(ValidationException.class, () -> service.enqueue(JobType.GENERATE_POST, null, Map.of()));
        assertThrows(ValidationException.class,
                () -> service.enqueue(JobType.GENERATE_POST, BOT_ID, Map.of(), null, 0));
    }

    @Test
    void testEnqueue_aggregateJobWithoutBot() {
        JobQueueService service = newService(postHandler);

        Long id = service.enqueue(JobType.CREW_INTERACTION, null, Map.of("trigger", "test"));

        assertNull(store.findById(id).orElseThrow().botId);
        assertTrue(service.hasPendingJob(null, JobType.CREW_INTERACTION));
        assertFalse(service.hasPendingJob(BOT_ID, JobType.CREW_INTERACTION));
    }

    @Test
    void testEnqueueAll_preservesOrder() {
        JobQueueService service = newService(postHandler);
        UUID other = UUID.randomUUID();

        List<Long> ids = service.enqueueAll(List.of(EnqueueRequestType.of(JobType.GENERATE_POST, BOT_ID),
                EnqueueRequestType.of(JobType.GENERATE_POST, other)));

        assertEquals(2, ids.size());
        assertEquals(BOT_ID, store.findById(ids.get(0)).orElseThrow().botId);
        assertEquals(other, store.findById(ids.get(1)).orElseThrow().botId);
    }

    @Test
    void testClaim_skipsFutureJobs() {
        JobQueueService service = newService(postHandler);
        service.enqueue(JobType.GENERATE_POST, BOT_ID, Map.of(), clock.instant().plusSeconds(60), null);

        assertTrue(service.claim(10).isEmpty());

        clock.advance(Duration.ofSeconds(60));
        List<Job> claimed = service.claim(10);
        assertEquals(1, claimed.size());
        assertEquals(JobStatus.RUNNING, claimed.get(0).status);
        assertEquals(1, claimed.get(0).attempts);
        assertEquals(clock.instant(), claimed.get(0).lockedAt);
    }

    @Test
    void testClaim_earliestRunAtFirst() {
        JobQueueService service = newService(postHandler);
        Instant now = clock.instant();
        Long late = service.enqueue(JobType.GENERATE_POST, BOT_ID, Map.of(), now.minusSeconds(10), null);
        Long early = service.enqueue(JobType.GENERATE_POST, BOT_ID, Map.of(), now.minusSeconds(100), null);

        List<Job> claimed = service.claim(1);

        assertEquals(1, claimed.size());
        assertEquals(early, claimed.get(0).id);
        assertEquals(JobStatus.QUEUED, store.findById(late).orElseThrow().status);
    }

    @Test
    void testClaim_jobIsNotClaimedTwice() {
        JobQueueService service = newService(postHandler);
        service.enqueue(JobType.GENERATE_POST, BOT_ID, Map.of());

        assertEquals(1, service.claim(10).size());
        assertTrue(service.claim(10).isEmpty());
    }

    @Test
    void testFail_retryThenPermanentFailure() {
        JobQueueService service = newService(postHandler);
        Long id = service.enqueue(JobType.GENERATE_POST, BOT_ID, Map.of(), null, 3);
        assertEquals(JobStatus.QUEUED, store.findById(id).orElseThrow().status);

        // attempt 1 -> RETRY in 30s
        assertClaimedRunning(service.claim(1), id, 1);
        service.fail(id, "first");
        Job job = store.findById(id).orElseThrow();
        assertEquals(JobStatus.RETRY, job.status);
        assertEquals(clock.instant().plusSeconds(30), job.runAt);
        assertNull(job.lockedAt);
        assertEquals("first", job.lastError);

        // attempt 2 -> RETRY in 60s
        clock.advance(Duration.ofSeconds(30));
        assertClaimedRunning(service.claim(1), id, 2);
        service.fail(id, "second");
        job = store.findById(id).orElseThrow();
        assertEquals(JobStatus.RETRY, job.status);
        assertEquals(2, job.attempts);
        assertEquals(clock.instant().plusSeconds(60), job.runAt);

        // attempt 3 -> FAILED, runAt untouched
        clock.advance(Duration.ofSeconds(60));
        assertClaimedRunning(service.claim(1), id, 3);
        Instant runAtBeforeFinalFailure = store.findById(id).orElseThrow().runAt;
        clock.advance(Duration.ofSeconds(5));
        service.fail(id, "third");
        job = store.findById(id).orElseThrow();
        assertEquals(JobStatus.FAILED, job.status);
        assertEquals(3, job.attempts);
        assertEquals(runAtBeforeFinalFailure, job.runAt);
        assertNull(job.lockedAt);
        assertEquals("third", job.lastError);

        // terminal: no longer claimable, no further transitions
        clock.advance(Duration.ofHours(1));
        assertTrue(service.claim(1).isEmpty());
        service.succeed(id);
        assertEquals(JobStatus.FAILED, store.findById(id).orElseThrow().status);
    }

    private void assertClaimedRunning(List<Job> claimed, Long id, int attempt) {
        assertEquals(1, claimed.size());
        assertEquals(id, claimed.get(0).id);
        Job stored = store.findById(id).orElseThrow();
        assertEquals(JobStatus.RUNNING, stored.status);
        assertEquals(attempt, stored.attempts);
        assertEquals(clock.instant(), stored.lockedAt);
    }

    @Test
    void testFail_unclaimedJobIsNoOp() {
        JobQueueService service = newService(postHandler);
        Long id = service.enqueue(JobType.GENERATE_POST, BOT_ID, Map.of());

        service.fail(id, "never claimed");
        service.fail(id, 0, "never claimed");
        service.succeed(id);

        Job job = store.findById(id).orElseThrow();
        assertEquals(JobStatus.QUEUED, job.status);
        assertEquals(0, job.attempts);
        assertEquals(clock.instant(), job.runAt);
        assertNull(job.lastError);
    }

    @Test
    void testReapedJob_lateOutcomeFromFirstWorkerIsIgnored() {
        JobQueueService service = newService(postHandler);
        Long id = service.enqueue(JobType.GENERATE_POST, BOT_ID, Map.of());

        Job first = service.claim(1).get(0);
        clock.advance(Duration.ofMinutes(16));
        assertEquals(1, service.reapStuckJobs());
        clock.advance(Duration.ofMinutes(1));
        Job second = service.claim(1).get(0);
        assertEquals(2, second.attempts);

        // the first worker finally reports back
        service.fail(first.id, first.attempts, "slow provider");
        service.succeed(first.id, first.attempts);

        Job job = store.findById(id).orElseThrow();
        assertEquals(JobStatus.RUNNING, job.status);
        assertEquals(2, job.attempts);
        assertEquals(clock.instant(), job.lockedAt);

        clock.advance(Duration.ofMinutes(5));
        assertTrue(service.claim(1).isEmpty(), "job must stay with the second worker");

        service.succeed(second.id, second.attempts);
        assertEquals(JobStatus.SUCCEEDED, store.findById(id).orElseThrow().status);
    }

    @Test
    void testFail_afterSuccessIsNoOp() {
        JobQueueService service = newService(postHandler);
        Long id = service.enqueue(JobType.GENERATE_POST, BOT_ID, Map.of());
        Job claimed = service.claim(1).get(0);
        service.succeed(claimed.id, claimed.attempts);

        // the reaper read the job before it finished
        service.fail(id, claimed.attempts, "lease expired");

        assertEquals(JobStatus.SUCCEEDED, store.findById(id).orElseThrow().status);
    }

    @Test
    void testFail_singleAttemptFailsImmediately() {
        JobQueueService service = newService(postHandler);
        Long id = service.enqueue(JobType.GENERATE_POST, BOT_ID, Map.of(), null, 1);

        service.claim(1);
        service.fail(id, "boom");

        assertEquals(JobStatus.FAILED, store.findById(id).orElseThrow().status);
    }

    @Test
    void testSucceed_idempotent() {
        JobQueueService service = newService(postHandler);
        Long id = service.enqueue(JobType.GENERATE_POST, BOT_ID, Map.of());
        service.claim(1);

        service.succeed(id);
        Instant succeededAt = store.findById(id).orElseThrow().updatedAt;
        clock.advance(Duration.ofMinutes(1));
        service.succeed(id);
        service.fail(id, "late failure");

        Job job = store.findById(id).orElseThrow();
        assertEquals(JobStatus.SUCCEEDED, job.status);
        assertEquals(succeededAt, job.updatedAt);
        assertNull(job.lastError);
    }

    @Test
    void testSucceedAndFail_missingJobIsNoOp() {
        JobQueueService service = newService(postHandler);

        service.succeed(999L);
        service.fail(999L, "nothing");

        assertTrue(store.all().isEmpty());
    }

    @Test
    void testCalculateBackoffDelay() {
        JobQueueService service = newService(postHandler);

        assertEquals(Duration.ofSeconds(30), service.calculateBackoffDelay(1));
        assertEquals(Duration.ofSeconds(60), service.calculateBackoffDelay(2));
        assertEquals(Duration.ofSeconds(120), service.calculateBackoffDelay(3));
        assertEquals(Duration.ofSeconds(240), service.calculateBackoffDelay(4));
        assertEquals(Duration.ofSeconds(30), service.calculateBackoffDelay(0));
    }

    @Test
    void testCalculateBackoffDelay_capped() {
        JobQueueService service = newService(postHandler);

        assertEquals(Duration.ofSeconds(1920), service.calculateBackoffDelay(7));
        assertEquals(Duration.ofSeconds(3600), service.calculateBackoffDelay(8));
        assertEquals(Duration.ofSeconds(3600), service.calculateBackoffDelay(100));
    }

    @Test
    void testProcessJobs_successAndFailure() {
        RecordingHandler failing = new RecordingHandler(JobType.RESPOND_TO_COMMENT);
        failing.failure = new IllegalStateException("provider down");
        JobQueueService service = newService(postHandler, failing);
        Long ok = service.enqueue(JobType.GENERATE_POST, BOT_ID, Map.of("trigger", "test"));
        Long bad = service.enqueue(JobType.RESPOND_TO_COMMENT, BOT_ID, Map.of());

        JobProcessResultType result = service.processJobs(10);

        assertEquals(2, result.processed());
        assertEquals(1, result.succeeded());
        assertEquals(1, result.failed());
        assertEquals(List.of("Job " + bad + ": provider down"), result.errors());
        assertEquals(JobStatus.SUCCEEDED, store.findById(ok).orElseThrow().status);
        assertEquals(JobStatus.RETRY, store.findById(bad).orElseThrow().status);
        assertEquals(Map.of("trigger", "test"), postHandler.payloads.get(0));
        assertEquals(1.0, registry.get("botfleet.jobs.processed").tag("outcome", "succeeded").counter().count());
        assertEquals(1.0, registry.get("botfleet.jobs.processed").tag("outcome", "failed").counter().count());
    }

    @Test
    void testProcessJobs_emptyQueue() {
        JobQueueService service = newService(postHandler);

        assertEquals(JobProcessResultType.EMPTY, service.processJobs(5));
    }

    @Test
    void testProcessJobs_missingHandlerFailsThroughBackoff() {
        JobQueueService service = newService(postHandler);
        Long id = service.enqueue(JobType.CREW_INTERACTION, null, Map.of());

        JobProcessResultType result = service.processJobs(10);

        assertEquals(1, result.failed());
        Job job = store.findById(id).orElseThrow();
        assertEquals(JobStatus.RETRY, job.status);
        assertTrue(job.lastError.contains("No handler registered"));
    }

    @Test
    void testDuplicateHandlersRejected() {
        assertThrows(IllegalStateException.class,
                () -> new JobQueueService(List.of(postHandler, new RecordingHandler(JobType.GENERATE_POST))));
    }

    @Test
    void testReapStuckJobs() {
        JobQueueService service = newService(postHandler);
        Long stuck = service.enqueue(JobType.GENERATE_POST, BOT_ID, Map.of());
        Long fresh = service.enqueue(JobType.GENERATE_POST, UUID.randomUUID(), Map.of());
        service.claim(10);
        store.setLockedAt(stuck, clock.instant().minus(Duration.ofMinutes(20)));

        int reaped = service.reapStuckJobs();

        assertEquals(1, reaped);
        Job job = store.findById(stuck).orElseThrow();
        assertEquals(JobStatus.RETRY, job.status);
        assertTrue(job.lastError.startsWith("Lease expired"));
        assertEquals(JobStatus.RUNNING, store.findById(fresh).orElseThrow().status);
    }

    /**
     * Handler that records payloads and optionally throws.
     */
    static class RecordingHandler implements JobHandler {

        final JobType type;
        final List<Map<String, Object>> payloads = new ArrayList<>();
        RuntimeException failure;

        RecordingHandler(JobType type) {
            this.type = type;
        }

        @Override
        public JobType handlesType() {
            return type;
        }

        @Override
        public void execute(Long jobId, UUID botId, Map<String, Object> payload) {
            payloads.add(payload);
            if (failure != null) {
                throw failure;
            }
        }
    }
}

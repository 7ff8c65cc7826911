package villagecompute.botfleet.jobs;

import org.jboss.logging.Logger;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.botfleet.services.JobQueueService;

/**
 * Returns jobs orphaned in RUNNING by a crashed worker to the retry path.
 *
 * @see JobQueueService#reapStuckJobs()
 */
@ApplicationScoped
public class StuckJobReaper {

    private static final Logger LOG = Logger.getLogger(StuckJobReaper.class);

    @Inject
    JobQueueService jobQueueService;

    @Scheduled(
            every = "5m",
            delayed = "1m",
            identity = "stuck-job-reaper",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void reap() {
        try {
            int reaped = jobQueueService.reapStuckJobs();
            if (reaped > 0) {
                LOG.warnf("Reaped %d stuck jobs", reaped);
            }
        } catch (Exception e) {
            LOG.errorf(e, "Stuck job reaper failed");
        }
    }
}

package villagecompute.botfleet.jobs;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.botfleet.api.types.JobProcessResultType;
import villagecompute.botfleet.services.JobQueueService;

/**
 * Poll loop that claims and runs due jobs.
 *
 * <p>
 * Every pod runs this worker; claims are skip-locked, so pods split the backlog without coordination. Within a pod the
 * trigger is skipped while the previous batch is still running.
 *
 * @see JobQueueService#processJobs(int)
 */
@ApplicationScoped
public class JobWorker {

    private static final Logger LOG = Logger.getLogger(JobWorker.class);

    @Inject
    JobQueueService jobQueueService;

    @ConfigProperty(
            name = "botfleet.worker.batch-size",
            defaultValue = "10")
    int batchSize;

    @Scheduled(
            every = "${botfleet.worker.poll-interval:30s}",
            identity = "job-worker",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void poll() {
        try {
            JobProcessResultType result = jobQueueService.processJobs(batchSize);
            if (result.failed() > 0) {
                LOG.warnf("Worker batch finished with %d/%d failures", result.failed(), result.processed());
            }
        } catch (Exception e) {
            LOG.errorf(e, "Job worker poll failed");
        }
    }
}

package villagecompute.botfleet.jobs;

import org.jboss.logging.Logger;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.botfleet.api.types.SchedulerTickResultType;
import villagecompute.botfleet.services.PostingScheduleService;

/**
 * Periodic trigger for the posting scheduler.
 *
 * <p>
 * The tick only enqueues {@link JobType#GENERATE_POST} jobs for due bots; the generation itself happens later in
 * {@link JobWorker}.
 *
 * @see PostingScheduleService#tick()
 */
@ApplicationScoped
public class PostScheduler {

    private static final Logger LOG = Logger.getLogger(PostScheduler.class);

    @Inject
    PostingScheduleService scheduleService;

    @Scheduled(
            every = "${botfleet.scheduler.tick-interval:5m}",
            identity = "post-scheduler",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduleDuePosts() {
        try {
            SchedulerTickResultType result = scheduleService.tick();
            if (!result.errors().isEmpty()) {
                LOG.warnf("Scheduler tick finished with errors: %s", result.errors());
            }
        } catch (Exception e) {
            LOG.errorf(e, "Failed to run scheduler tick");
        }
    }

    /**
     * Runs a tick outside the timer, e.g. after bots were bulk-enabled.
     *
     * @return the tick result
     */
    public SchedulerTickResultType triggerImmediately() {
        LOG.info("Manually triggering scheduler tick");
        return scheduleService.tick();
    }
}

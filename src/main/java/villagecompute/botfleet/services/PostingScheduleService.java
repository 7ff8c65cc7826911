package villagecompute.botfleet.services;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import villagecompute.botfleet.api.types.SchedulerTickResultType;
import villagecompute.botfleet.data.models.Bot;
import villagecompute.botfleet.data.stores.BotStore;
import villagecompute.botfleet.exceptions.ResourceNotFoundException;
import villagecompute.botfleet.jobs.JobType;

/**
 * Decides when bots post and turns due bots into queued {@link JobType#GENERATE_POST} jobs.
 *
 * <p>
 * A tick never calls an AI provider. It reads due bots, skips any that already hold a pending post job, enqueues one
 * job per remaining bot and, if anything was enqueued, one aggregate {@link JobType#CREW_INTERACTION} job. Each bot is
 * handled independently: a failure for one is logged and collected, and the tick moves on.
 *
 * <p>
 * <b>Cadence:</b> posts are spread over the active window ({@code botfleet.scheduler.active-start-hour} to
 * {@code active-end-hour}, 08:00-23:00 by default). The next post is {@code window / postsPerDay} hours away, plus or
 * minus a uniform jitter of 30% of that interval. Times landing outside the window move to the next window start plus a
 * random offset of up to {@value #MORNING_SPREAD_HOURS} hours.
 */
@ApplicationScoped
public class PostingScheduleService {

    private static final Logger LOG = Logger.getLogger(PostingScheduleService.class);

    public static final double DEFAULT_JITTER_FRACTION = 0.3;

    static final int MORNING_SPREAD_HOURS = 3;

    @Inject
    BotStore botStore;

    @Inject
    JobQueueService jobQueueService;

    @Inject
    MeterRegistry registry;

    @ConfigProperty(
            name = "botfleet.scheduler.zone",
            defaultValue = "UTC")
    ZoneId zone = ZoneId.of("UTC");

    @ConfigProperty(
            name = "botfleet.scheduler.active-start-hour",
            defaultValue = "8")
    int activeStartHour = 8;

    @ConfigProperty(
            name = "botfleet.scheduler.active-end-hour",
            defaultValue = "23")
    int activeEndHour = 23;

    @ConfigProperty(
            name = "botfleet.scheduler.failure-retry-minutes",
            defaultValue = "30")
    int failureRetryMinutes = 30;

    Clock clock = Clock.systemUTC();

    Random random = new Random();

    /**
     * Computes the next post time with the default 30% jitter.
     */
    public Instant computeNextRunTime(int postsPerDay) {
        return computeNextRunTime(postsPerDay, DEFAULT_JITTER_FRACTION);
    }

    /**
     * Computes the next post time.
     *
     * @param postsPerDay
     *            posts per day, at least 1
     * @param jitterFraction
     *            jitter as a fraction of the interval, in [0, 1)
     * @return next due time, always inside the active window
     * @throws IllegalArgumentException
     *             for a non-positive cadence or an out-of-range jitter
     */
    public Instant computeNextRunTime(int postsPerDay, double jitterFraction) {
        if (postsPerDay < 1) {
            throw new IllegalArgumentException("postsPerDay must be at least 1, got " + postsPerDay);
        }
        if (jitterFraction < 0 || jitterFraction >= 1) {
            throw new IllegalArgumentException("jitterFraction must be in [0, 1), got " + jitterFraction);
        }

        double intervalHours = (double) activeWindowHours() / postsPerDay;
        double jitterHours = intervalHours * jitterFraction * (random.nextDouble() * 2 - 1);
        long offsetSeconds = Math.round((intervalHours + jitterHours) * 3600);

        ZonedDateTime next = clock.instant().plusSeconds(offsetSeconds).atZone(zone);
        if (isInsideActiveWindow(next)) {
            return next.toInstant();
        }
        return rollToNextWindow(next).toInstant();
    }

    /**
     * Enqueues post jobs for every due bot, then one crew interaction job if any post job was enqueued.
     */
    public SchedulerTickResultType tick() {
        Instant now = clock.instant();
        List<Bot> dueBots = botStore.findDueForPosting(now);
        List<String> errors = new ArrayList<>();
        int enqueued = 0;
        int skipped = 0;

        for (Bot bot : dueBots) {
            try {
                if (jobQueueService.hasPendingJob(bot.id, JobType.GENERATE_POST)) {
                    LOG.debugf("Bot @%s already has a pending post job, skipping", bot.handle);
                    skipped++;
                    continue;
                }
                jobQueueService.enqueue(JobType.GENERATE_POST, bot.id, Map.of("trigger", "scheduler"));
                enqueued++;
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to schedule bot @%s", bot.handle);
                errors.add("Bot " + bot.handle + ": " + e.getMessage());
            }
        }

        boolean crewEnqueued = false;
        if (enqueued > 0) {
            try {
                crewEnqueued = enqueueCrewInteractionIfIdle("scheduler");
            } catch (RuntimeException e) {
                LOG.errorf(e, "Failed to enqueue crew interaction");
                errors.add("[crew] " + e.getMessage());
            }
        }

        if (enqueued > 0) {
            Counter.builder("botfleet.scheduler.enqueued").description("Post jobs enqueued by the scheduler")
                    .register(registry).increment(enqueued);
        }
        LOG.infof("Scheduler tick: %d due, %d enqueued, %d skipped, crew=%s, %d errors", dueBots.size(), enqueued,
                skipped, crewEnqueued, errors.size());
        return new SchedulerTickResultType(dueBots.size(), enqueued, skipped, crewEnqueued, List.copyOf(errors));
    }

    /**
     * Enqueues the aggregate crew interaction job unless one is already pending.
     *
     * @param trigger
     *            recorded in the payload
     * @return whether a job was enqueued
     */
    public boolean enqueueCrewInteractionIfIdle(String trigger) {
        if (jobQueueService.hasPendingJob(null, JobType.CREW_INTERACTION)) {
            LOG.debug("Crew interaction already pending");
            return false;
        }
        jobQueueService.enqueue(JobType.CREW_INTERACTION, null, Map.of("trigger", trigger));
        return true;
    }

    /**
     * Turns scheduling on for a bot and sets its first post time.
     *
     * @return the next post time
     * @throws ResourceNotFoundException
     *             if the bot does not exist
     */
    public Instant enableScheduling(UUID botId) {
        Bot bot = botStore.findById(botId).orElseThrow(() -> new ResourceNotFoundException("Bot not found: " + botId));
        Instant next = computeNextRunTime(postsPerDay(bot));
        botStore.updateScheduling(botId, true, next);
        LOG.infof("Scheduling enabled for bot @%s, next post at %s", bot.handle, next);
        return next;
    }

    /**
     * Turns scheduling off for a bot and clears its next post time.
     *
     * @throws ResourceNotFoundException
     *             if the bot does not exist
     */
    public void disableScheduling(UUID botId) {
        if (!botStore.updateScheduling(botId, false, null)) {
            throw new ResourceNotFoundException("Bot not found: " + botId);
        }
        LOG.infof("Scheduling disabled for bot %s", botId);
    }

    /**
     * Sets the bot's next post time after a successful post.
     */
    public Instant rescheduleAfterPost(Bot bot) {
        Instant next = computeNextRunTime(postsPerDay(bot));
        botStore.updateNextPostAt(bot.id, next);
        return next;
    }

    /**
     * Pushes the bot's next post time out by the failure retry delay.
     */
    public Instant rescheduleAfterFailure(UUID botId) {
        Instant next = clock.instant().plus(Duration.ofMinutes(failureRetryMinutes));
        botStore.updateNextPostAt(botId, next);
        return next;
    }

    /**
     * Returns the bot's daily post count, at least 1. Stored values below 1 are treated as one post a day.
     */
    public int postsPerDay(Bot bot) {
        if (bot.postsPerDay < 1) {
            LOG.warnf("Bot @%s has postsPerDay=%d, treating it as 1", bot.handle, bot.postsPerDay);
            return 1;
        }
        return bot.postsPerDay;
    }

    /**
     * Returns midnight of the current day in the scheduling zone, the boundary for daily post limits.
     */
    public Instant startOfToday() {
        return clock.instant().atZone(zone).toLocalDate().atStartOfDay(zone).toInstant();
    }

    int activeWindowHours() {
        return activeEndHour - activeStartHour;
    }

    private boolean isInsideActiveWindow(ZonedDateTime time) {
        int hour = time.getHour();
        return hour >= activeStartHour && hour < activeEndHour;
    }

    private ZonedDateTime rollToNextWindow(ZonedDateTime time) {
        ZonedDateTime windowStart = time.with(LocalTime.of(activeStartHour, 0));
        if (time.getHour() >= activeEndHour) {
            windowStart = windowStart.plusDays(1);
        }
        int spreadMinutes = Math.min(MORNING_SPREAD_HOURS, activeWindowHours()) * 60;
        return windowStart.plusMinutes(random.nextInt(spreadMinutes));
    }
}

package villagecompute.botfleet.api.types;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import villagecompute.botfleet.jobs.JobType;

/**
 * One entry of a batch enqueue.
 *
 * @param jobType
 *            the job type
 * @param botId
 *            bot the job acts for, null for aggregate jobs
 * @param payload
 *            job parameters, null for none
 * @param runAt
 *            earliest execution time, null for now
 * @param maxAttempts
 *            attempt cap, null for the configured default
 */
public record EnqueueRequestType(JobType jobType, UUID botId, Map<String, Object> payload, Instant runAt,
        Integer maxAttempts) {

    public static EnqueueRequestType of(JobType jobType, UUID botId) {
        return new EnqueueRequestType(jobType, botId, null, null, null);
    }
}

package villagecompute.botfleet.jobs;

import java.util.Map;
import java.util.UUID;

/**
 * Contract for async job handler implementations.
 *
 * <p>
 * Handlers must be CDI-managed beans annotated with {@code @ApplicationScoped} and implement this interface. The
 * {@link villagecompute.botfleet.services.JobQueueService} discovers handlers at startup and routes claimed jobs based
 * on their {@link JobType}.
 *
 * <p>
 * <b>Execution Model:</b>
 * <ul>
 * <li>The job is already marked RUNNING and its claim transaction committed before {@link #execute} is called, so
 * slow provider calls never hold a queue lock</li>
 * <li>Returning normally marks the job SUCCEEDED; throwing schedules a retry with exponential backoff, or marks the
 * job FAILED once attempts are exhausted</li>
 * <li>Handlers are the only callers of the {@link villagecompute.botfleet.services.CapabilityRouterService}</li>
 * </ul>
 *
 * @see JobType for supported job types
 */
public interface JobHandler {

    /**
     * Returns the job type this handler processes.
     *
     * @return the job type enum value
     */
    JobType handlesType();

    /**
     * Executes the job.
     *
     * <p>
     * <b>Thread Safety:</b> This method may be called concurrently by multiple worker threads or pods. Any worker may
     * process any job.
     *
     * @param jobId
     *            the database primary key from {@code jobs.id}
     * @param botId
     *            the bot the job acts for, {@code null} for aggregate jobs
     * @param payload
     *            deserialized job parameters (stored as JSONB), never {@code null}
     * @throws Exception
     *             any error during execution; triggers retry logic
     */
    void execute(Long jobId, UUID botId, Map<String, Object> payload) throws Exception;
}

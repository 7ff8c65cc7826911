package villagecompute.botfleet.observability;

import java.util.UUID;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

import villagecompute.botfleet.jobs.JobType;

/**
 * Standard MDC field names and helpers for structured job logs.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} - OpenTelemetry trace identifier</li>
 * <li>{@code span_id} - Current span identifier within the trace</li>
 * <li>{@code job_id} - Job primary key (only during job execution)</li>
 * <li>{@code job_type} - JobType name (only during job execution)</li>
 * <li>{@code bot_id} - Bot the current job acts for, when it has one</li>
 * </ul>
 *
 * <p>
 * <b>Usage in the dispatch loop:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setJobContext(job.id, job.jobType, job.botId);
 * try {
 *     handler.execute(...);
 * } finally {
 *     LoggingConfig.clearMDC();
 * }
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which is thread-local. Scheduler threads are pooled, so
 * every job execution must clear the MDC when it finishes.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    public static final String MDC_JOB_ID = "job_id";

    public static final String MDC_JOB_TYPE = "job_type";

    public static final String MDC_BOT_ID = "bot_id";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies trace_id and span_id from the current OpenTelemetry span. Empty strings when no span is active so the
     * JSON log schema stays stable.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    /**
     * Sets job_id, job_type and (when present) bot_id.
     *
     * @param jobId
     *            job primary key
     * @param jobType
     *            job type
     * @param botId
     *            bot the job acts for, may be null
     */
    public static void setJobContext(Long jobId, JobType jobType, UUID botId) {
        if (jobId != null) {
            MDC.put(MDC_JOB_ID, jobId.toString());
        }
        if (jobType != null) {
            MDC.put(MDC_JOB_TYPE, jobType.name());
        }
        setBotId(botId);
    }

    public static void setBotId(UUID botId) {
        if (botId != null) {
            MDC.put(MDC_BOT_ID, botId.toString());
        } else {
            MDC.remove(MDC_BOT_ID);
        }
    }

    /**
     * Clears every field this class manages.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_JOB_ID);
        MDC.remove(MDC_JOB_TYPE);
        MDC.remove(MDC_BOT_ID);
    }
}

package villagecompute.botfleet.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Initialized;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.botfleet.data.models.Job.JobStatus;
import villagecompute.botfleet.data.stores.JobStore;
import villagecompute.botfleet.services.GenerationTelemetryService;

import java.util.List;

/**
 * Registers the gauges of the bot fleet. Counters and timers are registered where they are incremented
 * ({@code JobQueueService}, {@code PostingScheduleService}, {@code GenerationTelemetryService}).
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Gauges:</b> {@code botfleet.jobs.depth{status}} - Jobs per lifecycle status</li>
 * <li><b>Gauges:</b> {@code botfleet.telemetry.buffered} - Entries held in the telemetry ring buffer</li>
 * <li><b>Counters:</b> {@code botfleet.jobs.processed{type,outcome}} - Dispatched jobs</li>
 * <li><b>Counters:</b> {@code botfleet.ai.calls{capability,provider,outcome}} - Capability router calls</li>
 * <li><b>Timers:</b> {@code botfleet.ai.call.duration{capability,provider}} - Provider call latency</li>
 * <li><b>Counters:</b> {@code botfleet.scheduler.enqueued} - Post jobs enqueued by the scheduler</li>
 * </ul>
 *
 * <p>
 * Metrics are exported in Prometheus format at {@code /q/metrics}.
 *
 * @see LoggingConfig for structured logging field definitions
 */
@ApplicationScoped
public class ObservabilityMetrics {

    private static final Logger LOG = Logger.getLogger(ObservabilityMetrics.class);

    @Inject
    MeterRegistry registry;

    @Inject
    JobStore jobStore;

    @Inject
    GenerationTelemetryService telemetryService;

    /**
     * Registers all gauges at application startup.
     */
    public void registerMetrics(@Observes @Initialized(ApplicationScoped.class) Object init) {
        LOG.info("Registering observability metrics");

        for (JobStatus status : JobStatus.values()) {
            Gauge.builder("botfleet.jobs.depth", this, m -> getJobDepth(status))
                    .description("Number of jobs in status " + status.name())
                    .tags(List.of(Tag.of("status", status.name()))).register(registry);
            LOG.debugf("Registered gauge: botfleet.jobs.depth{status=%s}", status.name());
        }

        Gauge.builder("botfleet.telemetry.buffered", telemetryService, t -> t.getEntries().size())
                .description("Telemetry entries currently buffered (bounded by botfleet.telemetry.capacity)")
                .register(registry);

        LOG.infof("Observability metrics registration complete. Access metrics at /q/metrics");
    }

    /**
     * Returns the number of jobs in the given status, or 0 when the query fails so a database hiccup does not break
     * the scrape.
     */
    double getJobDepth(JobStatus status) {
        try {
            return jobStore.countByStatus(status);
        } catch (Exception e) {
            LOG.warnf(e, "Failed to count %s jobs, returning 0", status);
            return 0.0;
        }
    }
}

package villagecompute.botfleet.services;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.google.common.collect.EvictingQueue;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import villagecompute.botfleet.api.types.ProviderStatsType;
import villagecompute.botfleet.api.types.TelemetryContextType;
import villagecompute.botfleet.api.types.TelemetryEntryType;
import villagecompute.botfleet.api.types.TelemetryStatsType;
import villagecompute.botfleet.config.CostTable;
import villagecompute.botfleet.exceptions.ProviderException;

/**
 * Records every capability router attempt in a bounded in-memory ring buffer.
 *
 * <p>
 * One instance is owned by the CDI container and handed to the router; tests construct their own instances, so no
 * state leaks between them. Each recorded attempt also produces:
 * <ul>
 * <li>a {@code generation_telemetry key=value ...} INFO log line</li>
 * <li>{@code botfleet.ai.calls{capability,provider,outcome}} and {@code botfleet.ai.call.duration} meters</li>
 * </ul>
 *
 * <p>
 * Cost comes from {@link CostTable} and is charged only on success.
 */
@ApplicationScoped
public class GenerationTelemetryService {

    private static final Logger LOG = Logger.getLogger(GenerationTelemetryService.class);

    public static final int DEFAULT_CAPACITY = 200;

    /** Entries returned in {@link TelemetryStatsType#recent()}. */
    public static final int RECENT_ENTRIES = 20;

    /** Error recorded when an image or video provider returns nothing. */
    public static final String NULL_RESULT_ERROR = "Provider returned null";

    private final EvictingQueue<TelemetryEntryType> entries;
    private final int capacity;
    private final MeterRegistry registry;
    private final CostTable costTable;

    Clock clock = Clock.systemUTC();

    @Inject
    public GenerationTelemetryService(@ConfigProperty(
            name = "botfleet.telemetry.capacity",
            defaultValue = "200") int capacity, MeterRegistry registry, CostTable costTable) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Telemetry capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = EvictingQueue.create(capacity);
        this.registry = registry;
        this.costTable = costTable;
    }

    /**
     * Runs one provider attempt and records its outcome.
     *
     * <p>
     * Exceptions are rethrown after recording; checked exceptions are wrapped in {@link ProviderException}. A null
     * result counts as failure for capabilities where absence means failure (image, video) and as success otherwise.
     *
     * @param context
     *            attribution tags
     * @param call
     *            the attempt
     * @return the attempt's result
     */
    public <T> T withTelemetry(TelemetryContextType context, ProviderCall<T> call) {
        long startNanos = System.nanoTime();
        T result;
        try {
            result = call.call();
        } catch (Exception e) {
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            record(context, elapsedMillis(startNanos), false, error);
            if (e instanceof RuntimeException) {
                throw (RuntimeException) e;
            }
            throw new ProviderException(context.provider() + " call failed: " + error, e);
        }

        if (result == null && context.capability().nullIsFailure()) {
            record(context, elapsedMillis(startNanos), false, NULL_RESULT_ERROR);
        } else {
            record(context, elapsedMillis(startNanos), true, null);
        }
        return result;
    }

    /**
     * Appends one entry, evicting the oldest once the buffer is full.
     */
    public TelemetryEntryType record(TelemetryContextType context, long durationMs, boolean success, String error) {
        double cost = success ? costTable.centsPerCall(context.model()) : 0.0;
        TelemetryEntryType entry = new TelemetryEntryType(clock.instant(), context.capability(), context.provider(),
                context.model(), context.tier(), durationMs, success, success ? null : error, cost,
                context.budgetEnforced());

        synchronized (entries) {
            entries.add(entry);
        }

        LOG.infof(
                "generation_telemetry capability=%s provider=%s model=%s tier=%s duration_ms=%d success=%s "
                        + "cost_cents=%.2f budget_enforced=%s error=\"%s\"",
                context.capability().label(), context.provider(), context.model(), context.tier(), durationMs, success,
                cost, context.budgetEnforced(), error != null && !success ? error : "");

        String outcome = success ? "success" : "failure";
        Counter.builder("botfleet.ai.calls").description("Capability router provider attempts")
                .tag("capability", context.capability().label()).tag("provider", context.provider())
                .tag("outcome", outcome).register(registry).increment();
        Timer.builder("botfleet.ai.call.duration").description("Provider attempt wall-clock duration")
                .tag("capability", context.capability().label()).tag("provider", context.provider())
                .register(registry).record(durationMs, TimeUnit.MILLISECONDS);
        return entry;
    }

    /**
     * Returns a copy of the buffer, oldest first.
     */
    public List<TelemetryEntryType> getEntries() {
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    /**
     * Aggregates the buffer: totals, average duration, cost, per-provider breakdown and the most recent entries.
     */
    public TelemetryStatsType getStats() {
        List<TelemetryEntryType> snapshot = getEntries();

        int successes = 0;
        long totalDuration = 0;
        double totalCost = 0;
        Map<String, long[]> providerTotals = new LinkedHashMap<>();
        for (TelemetryEntryType entry : snapshot) {
            if (entry.success()) {
                successes++;
            }
            totalDuration += entry.durationMs();
            totalCost += entry.estimatedCostCents();

            // calls, failures, total duration
            long[] totals = providerTotals.computeIfAbsent(entry.provider(), p -> new long[3]);
            totals[0]++;
            if (!entry.success()) {
                totals[1]++;
            }
            totals[2] += entry.durationMs();
        }

        Map<String, ProviderStatsType> byProvider = new LinkedHashMap<>();
        providerTotals.forEach((provider, totals) -> byProvider.put(provider,
                new ProviderStatsType((int) totals[0], (int) totals[1], Math.round((double) totals[2] / totals[0]))));

        int total = snapshot.size();
        long avgDuration = total == 0 ? 0 : Math.round((double) totalDuration / total);
        List<TelemetryEntryType> recent = new ArrayList<>(
                snapshot.subList(Math.max(0, total - RECENT_ENTRIES), total));
        return new TelemetryStatsType(total, successes, total - successes, avgDuration, totalCost, byProvider,
                recent);
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * Empties the buffer.
     */
    public void clear() {
        synchronized (entries) {
            entries.clear();
        }
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}

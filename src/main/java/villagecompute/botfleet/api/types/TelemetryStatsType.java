package villagecompute.botfleet.api.types;

import java.util.List;
import java.util.Map;

/**
 * Aggregate view over the telemetry ring buffer.
 *
 * @param totalCalls
 *            entries currently held
 * @param successCount
 *            successful entries
 * @param failureCount
 *            failed entries
 * @param avgDurationMs
 *            mean duration, rounded (0 when empty)
 * @param totalCostCents
 *            sum of estimated costs
 * @param byProvider
 *            breakdown keyed by provider id
 * @param recent
 *            most recent entries, newest last
 */
public record TelemetryStatsType(int totalCalls, int successCount, int failureCount, long avgDurationMs,
        double totalCostCents, Map<String, ProviderStatsType> byProvider, List<TelemetryEntryType> recent) {
}

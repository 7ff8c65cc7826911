package villagecompute.botfleet.api.types;

/**
 * Per-provider slice of telemetry stats.
 *
 * @param calls
 *            calls recorded
 * @param failures
 *            failed calls
 * @param avgDurationMs
 *            mean duration, rounded
 */
public record ProviderStatsType(int calls, int failures, long avgDurationMs) {
}

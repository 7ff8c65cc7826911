package villagecompute.botfleet.api.types;

import java.time.Instant;

/**
 * Immutable record of one router call.
 *
 * @param timestamp
 *            when the call finished
 * @param capability
 *            capability kind
 * @param provider
 *            provider id
 * @param model
 *            model id
 * @param tier
 *            effective tier
 * @param durationMs
 *            wall-clock duration
 * @param success
 *            whether the call produced a usable result
 * @param error
 *            error message on failure, null on success
 * @param estimatedCostCents
 *            cost from the cost table, 0 on failure
 * @param budgetEnforced
 *            whether budget enforcement fired
 */
public record TelemetryEntryType(Instant timestamp, Capability capability, String provider, String model, String tier,
        long durationMs, boolean success, String error, double estimatedCostCents, boolean budgetEnforced) {
}

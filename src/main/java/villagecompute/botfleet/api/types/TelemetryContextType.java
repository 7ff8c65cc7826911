package villagecompute.botfleet.api.types;

/**
 * Attribution tags for one provider attempt recorded by the telemetry service.
 *
 * @param capability
 *            capability kind
 * @param provider
 *            provider id (anthropic, fal, runway, kling, minimax)
 * @param model
 *            model id, used for cost lookup
 * @param tier
 *            effective tier after budget enforcement
 * @param budgetEnforced
 *            whether budget enforcement fired for the surrounding router call
 */
public record TelemetryContextType(Capability capability, String provider, String model, String tier,
        boolean budgetEnforced) {
}

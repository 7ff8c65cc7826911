package villagecompute.botfleet.api.types;

/**
 * Context after budget enforcement.
 *
 * @param context
 *            the context to route with (tier downgraded when enforcement fired)
 * @param enforced
 *            whether the budget was exceeded and the downgrade applied
 */
public record BudgetEnforcementType(ToolContextType context, boolean enforced) {
}

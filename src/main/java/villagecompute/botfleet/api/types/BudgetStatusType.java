package villagecompute.botfleet.api.types;

/**
 * Result of a budget check.
 *
 * @param exceeded
 *            whether today's spend reached the limit
 * @param percentUsed
 *            rounded spend percentage (0 when no limit is configured)
 */
public record BudgetStatusType(boolean exceeded, int percentUsed) {

    public static final BudgetStatusType UNLIMITED = new BudgetStatusType(false, 0);
}

package villagecompute.botfleet.api.types;

/**
 * Daily generation budget supplied by the caller. Read-only for the router; spend accounting happens elsewhere.
 *
 * @param dailyLimitCents
 *            daily cap in cents; null or non-positive means no limit
 * @param spentTodayCents
 *            spend so far today in cents
 */
public record BudgetType(Integer dailyLimitCents, int spentTodayCents) {

    public boolean hasLimit() {
        return dailyLimitCents != null && dailyLimitCents > 0;
    }
}

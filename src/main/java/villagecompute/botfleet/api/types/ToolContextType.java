package villagecompute.botfleet.api.types;

import villagecompute.botfleet.data.models.Bot;

/**
 * Caller-supplied routing input for the capability router. Built per call (typically from the bot record) and never
 * persisted.
 *
 * @param tier
 *            subscription tier; unknown values route like the cheapest tier
 * @param trustLevel
 *            0..1 modifier, 1 is fully trusted
 * @param budget
 *            optional daily budget
 * @param override
 *            provider override, {@link ProviderOverride#NONE} when routing normally
 */
public record ToolContextType(String tier, double trustLevel, BudgetType budget, ProviderOverride override) {

    public static final String CHEAPEST_TIER = "SPARK";

    public static final ToolContextType DEFAULT = new ToolContextType(CHEAPEST_TIER, 1.0, null, ProviderOverride.NONE);

    public ToolContextType {
        if (override == null) {
            override = ProviderOverride.NONE;
        }
    }

    /**
     * Context for a tier with full trust and no budget.
     */
    public static ToolContextType ofTier(String tier) {
        return new ToolContextType(tier, 1.0, null, ProviderOverride.NONE);
    }

    /**
     * Context derived from a bot's owner tier, trust level and daily budget.
     */
    public static ToolContextType forBot(Bot bot) {
        return new ToolContextType(bot.ownerTier, bot.trustLevel, new BudgetType(bot.dailyBudgetCents,
                bot.spentTodayCents), ProviderOverride.NONE);
    }

    public ToolContextType withTier(String newTier) {
        return new ToolContextType(newTier, trustLevel, budget, override);
    }

    public ToolContextType withOverride(ProviderOverride newOverride) {
        return new ToolContextType(tier, trustLevel, budget, newOverride);
    }
}

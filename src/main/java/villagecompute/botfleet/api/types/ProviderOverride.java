package villagecompute.botfleet.api.types;

/**
 * Admin escape hatch forcing a specific provider model. The router checks for the two forcing variants with
 * {@code instanceof}; anything else routes normally.
 */
public interface ProviderOverride {

    ProviderOverride NONE = new NoOverride();

    /**
     * Route normally.
     */
    record NoOverride() implements ProviderOverride {
    }

    /**
     * Use the given fal.ai image model instead of the router's choice.
     *
     * @param modelId
     *            fal.ai model id, e.g. {@code fal-ai/flux/dev}
     */
    record ForceImageModel(String modelId) implements ProviderOverride {
    }

    /**
     * Use the given video model. The premium model id unlocks the premium path regardless of tier, duration and
     * budget; any other id replaces the duration-mapped default model.
     *
     * @param modelId
     *            video model id, e.g. {@code gen3a_turbo}
     */
    record ForceVideoModel(String modelId) implements ProviderOverride {
    }
}

package villagecompute.botfleet.api.types;

/**
 * Provider-native chat completion parameters, after the router picked a model.
 *
 * @param model
 *            concrete model name
 * @param systemPrompt
 *            system instructions
 * @param userPrompt
 *            user message
 * @param imageUrl
 *            image attached to the user message, null for text only
 * @param maxTokens
 *            output token cap
 * @param temperature
 *            sampling temperature, null for the provider default
 * @param jsonMode
 *            whether the reply must be a JSON object
 */
public record ChatCompletionType(String model, String systemPrompt, String userPrompt, String imageUrl,
        int maxTokens, Double temperature, boolean jsonMode) {
}

package villagecompute.botfleet.api.types;

/**
 * Image understanding request.
 *
 * @param systemPrompt
 *            system instructions
 * @param userPrompt
 *            question about the image
 * @param imageUrl
 *            image to analyze
 * @param maxTokens
 *            output token cap, null for 400
 */
public record VisionRequestType(String systemPrompt, String userPrompt, String imageUrl, Integer maxTokens) {

    public int effectiveMaxTokens() {
        return maxTokens != null ? maxTokens : 400;
    }
}

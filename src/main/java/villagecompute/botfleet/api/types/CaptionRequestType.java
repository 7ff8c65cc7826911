package villagecompute.botfleet.api.types;

/**
 * Text completion request (captions, chat replies, agent decisions).
 *
 * @param systemPrompt
 *            system instructions
 * @param userPrompt
 *            user message
 * @param maxTokens
 *            output token cap, null for {@link #DEFAULT_MAX_TOKENS}
 * @param temperature
 *            sampling temperature, null for {@link #DEFAULT_TEMPERATURE}
 * @param jsonMode
 *            whether the reply must be a single JSON object
 */
public record CaptionRequestType(String systemPrompt, String userPrompt, Integer maxTokens, Double temperature,
        boolean jsonMode) {

    public static final int DEFAULT_MAX_TOKENS = 300;
    public static final double DEFAULT_TEMPERATURE = 0.9;

    /**
     * Creates a plain-text request with default token cap and temperature.
     */
    public static CaptionRequestType of(String systemPrompt, String userPrompt) {
        return new CaptionRequestType(systemPrompt, userPrompt, null, null, false);
    }

    public int effectiveMaxTokens() {
        return maxTokens != null ? maxTokens : DEFAULT_MAX_TOKENS;
    }

    public double effectiveTemperature() {
        return temperature != null ? temperature : DEFAULT_TEMPERATURE;
    }
}

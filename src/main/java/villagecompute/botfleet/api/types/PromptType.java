package villagecompute.botfleet.api.types;

/**
 * System and user prompt pair produced by a prompt composer.
 *
 * @param systemPrompt
 *            system instructions
 * @param userPrompt
 *            user message
 */
public record PromptType(String systemPrompt, String userPrompt) {
}

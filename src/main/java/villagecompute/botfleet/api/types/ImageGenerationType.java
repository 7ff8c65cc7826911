package villagecompute.botfleet.api.types;

/**
 * Provider-native image parameters.
 *
 * @param model
 *            provider model id
 * @param prompt
 *            image prompt
 * @param imageSize
 *            size preset
 * @param referenceImageUrl
 *            identity reference, null for the plain variant
 */
public record ImageGenerationType(String model, String prompt, String imageSize, String referenceImageUrl) {
}

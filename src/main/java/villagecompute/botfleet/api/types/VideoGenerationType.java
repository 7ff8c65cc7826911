package villagecompute.botfleet.api.types;

/**
 * Provider-native video parameters.
 *
 * @param model
 *            provider model id
 * @param prompt
 *            video prompt
 * @param durationSec
 *            requested duration
 * @param startFrameUrl
 *            start frame for image-to-video, may be null
 */
public record VideoGenerationType(String model, String prompt, int durationSec, String startFrameUrl) {
}

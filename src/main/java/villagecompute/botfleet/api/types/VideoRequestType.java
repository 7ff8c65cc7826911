package villagecompute.botfleet.api.types;

/**
 * Video generation request.
 *
 * @param prompt
 *            video prompt
 * @param durationSec
 *            requested length in seconds (6, 15 or 30 in practice)
 * @param startFrameUrl
 *            optional still used by image-to-video providers
 */
public record VideoRequestType(String prompt, int durationSec, String startFrameUrl) {

    public boolean hasStartFrame() {
        return startFrameUrl != null && !startFrameUrl.isBlank();
    }
}

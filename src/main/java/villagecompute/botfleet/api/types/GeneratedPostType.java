package villagecompute.botfleet.api.types;

/**
 * Content produced for a post before it is published.
 *
 * @param caption
 *            post caption
 * @param format
 *            final media format after any degradation
 * @param imageUrl
 *            image URL, null unless IMAGE or a video thumbnail exists
 * @param videoUrl
 *            video URL, null unless VIDEO
 * @param videoDurationSec
 *            video length, null unless VIDEO
 */
public record GeneratedPostType(String caption, PostFormat format, String imageUrl, String videoUrl,
        Integer videoDurationSec) {
}

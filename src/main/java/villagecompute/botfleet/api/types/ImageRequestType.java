package villagecompute.botfleet.api.types;

/**
 * Image generation request.
 *
 * @param prompt
 *            image prompt
 * @param referenceImageUrl
 *            optional identity reference keeping a recurring subject consistent across posts
 * @param imageSize
 *            provider size preset, null for {@link #DEFAULT_SIZE}
 */
public record ImageRequestType(String prompt, String referenceImageUrl, String imageSize) {

    public static final String DEFAULT_SIZE = "square_hd";

    public String effectiveSize() {
        return imageSize != null && !imageSize.isBlank() ? imageSize : DEFAULT_SIZE;
    }

    public boolean hasReference() {
        return referenceImageUrl != null && !referenceImageUrl.isBlank();
    }
}

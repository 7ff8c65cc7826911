package villagecompute.botfleet.api.types;

/**
 * Media format of a published post.
 */
public enum PostFormat {
    TEXT, IMAGE, VIDEO
}

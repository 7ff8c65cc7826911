package villagecompute.botfleet.api.types;

import java.util.Locale;

/**
 * Abstract kind of AI request the capability router serves, independent of the provider that fulfills it.
 */
public enum Capability {

    CAPTION,

    CHAT,

    IMAGE,

    VIDEO,

    VISION;

    /**
     * Returns whether a null provider result means the call failed. Image and video calls exist to produce a URL; a
     * text completion may legitimately come back empty.
     */
    public boolean nullIsFailure() {
        return this == IMAGE || this == VIDEO;
    }

    /**
     * Lowercase name used in log lines and metric tags.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}

package villagecompute.botfleet.data.stores;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import villagecompute.botfleet.data.models.Bot;

/**
 * Persistence contract for the bot columns the scheduler and handlers read and write.
 */
public interface BotStore {

    /** Owner tiers whose bots get AI-generated content. */
    List<String> AI_TIERS = List.of("SPARK", "PULSE", "GRID");

    /** Tiers whose bots take part in crew interactions. */
    List<String> CREW_TIERS = List.of("GRID");

    Optional<Bot> findById(UUID botId);

    /**
     * Finds scheduled, non-BYOB bots of an AI tier whose {@code nextPostAt} is at or before {@code now}.
     */
    List<Bot> findDueForPosting(Instant now);

    /**
     * Finds non-BYOB bots of a crew tier, ordered by owner.
     */
    List<Bot> findCrewMembers();

    void updateNextPostAt(UUID botId, Instant nextPostAt);

    /**
     * Stores the character reference image and its description.
     */
    void updateCharacterReference(UUID botId, String referenceUrl, String description);

    /**
     * Sets the scheduled flag and next post time together.
     *
     * @return false when the bot does not exist
     */
    boolean updateScheduling(UUID botId, boolean scheduled, Instant nextPostAt);
}

package villagecompute.botfleet.data.stores;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;

import villagecompute.botfleet.data.models.Bot;

/**
 * {@link BotStore} backed by the {@link Bot} Panache entity.
 */
@ApplicationScoped
public class PanacheBotStore implements BotStore {

    @Override
    @Transactional
    public Optional<Bot> findById(UUID botId) {
        return Bot.findByIdOptional(botId);
    }

    @Override
    @Transactional
    public List<Bot> findDueForPosting(Instant now) {
        return Bot.findDue(now, AI_TIERS);
    }

    @Override
    @Transactional
    public List<Bot> findCrewMembers() {
        return Bot.findGeneratedInTiers(CREW_TIERS);
    }

    @Override
    @Transactional
    public void updateNextPostAt(UUID botId, Instant nextPostAt) {
        Bot.update("nextPostAt = ?1, updatedAt = ?2 where id = ?3", nextPostAt, Instant.now(), botId);
    }

    @Override
    @Transactional
    public void updateCharacterReference(UUID botId, String referenceUrl, String description) {
        Bot.update("characterRefUrl = ?1, characterRefDescription = ?2, updatedAt = ?3 where id = ?4", referenceUrl,
                description, Instant.now(), botId);
    }

    @Override
    @Transactional
    public boolean updateScheduling(UUID botId, boolean scheduled, Instant nextPostAt) {
        return Bot.update("scheduled = ?1, nextPostAt = ?2, updatedAt = ?3 where id = ?4", scheduled, nextPostAt,
                Instant.now(), botId) > 0;
    }
}

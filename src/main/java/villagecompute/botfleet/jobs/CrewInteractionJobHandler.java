package villagecompute.botfleet.jobs;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;
import java.util.stream.Collectors;

import org.jboss.logging.Logger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.botfleet.api.types.CaptionRequestType;
import villagecompute.botfleet.api.types.PromptType;
import villagecompute.botfleet.api.types.ToolContextType;
import villagecompute.botfleet.data.models.Bot;
import villagecompute.botfleet.data.models.Post;
import villagecompute.botfleet.data.stores.BotStore;
import villagecompute.botfleet.data.stores.PostStore;
import villagecompute.botfleet.exceptions.GenerationException;
import villagecompute.botfleet.services.CapabilityRouterService;
import villagecompute.botfleet.services.PromptComposer;

/**
 * Aggregate job handler letting crew bots (bots of one crew-tier owner) comment on each other's recent posts.
 *
 * <p>
 * For every crew of two or more bots, each bot looks at the latest post by a crew-mate from the last
 * {@value #LOOKBACK_HOURS} hours. Posts it already commented on are skipped, and it replies with probability
 * {@value #REPLY_PROBABILITY} so crews don't answer every post.
 *
 * <p>
 * Each pair is processed independently (errors don't abort the batch). The job fails only when every attempted reply
 * failed, so the queue retries a systemic outage but not a single bad reply.
 */
@ApplicationScoped
public class CrewInteractionJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(CrewInteractionJobHandler.class);

    static final int LOOKBACK_HOURS = 12;
    static final double REPLY_PROBABILITY = 0.6;
    static final int REPLY_MAX_TOKENS = 150;

    @Inject
    BotStore botStore;

    @Inject
    PostStore postStore;

    @Inject
    CapabilityRouterService router;

    @Inject
    PromptComposer promptComposer;

    @Inject
    MeterRegistry meterRegistry;

    Clock clock = Clock.systemUTC();

    Random random = new Random();

    @Override
    public JobType handlesType() {
        return JobType.CREW_INTERACTION;
    }

    @Override
    public void execute(Long jobId, UUID botId, Map<String, Object> payload) throws Exception {
        Map<UUID, List<Bot>> crews = botStore.findCrewMembers().stream().filter(b -> b.ownerId != null)
                .collect(Collectors.groupingBy(b -> b.ownerId, LinkedHashMap::new, Collectors.toList()));
        Instant since = clock.instant().minus(Duration.ofHours(LOOKBACK_HOURS));

        int interactions = 0;
        List<String> errors = new ArrayList<>();

        for (List<Bot> crew : crews.values()) {
            if (crew.size() < 2) {
                continue;
            }
            Map<UUID, Bot> byId = crew.stream().collect(Collectors.toMap(b -> b.id, b -> b));

            for (Bot bot : crew) {
                List<UUID> mates = crew.stream().map(b -> b.id).filter(id -> !id.equals(bot.id))
                        .collect(Collectors.toList());
                Optional<Post> target = postStore.findLatestPost(mates, since);
                if (target.isEmpty() || postStore.hasCommented(target.get().id, bot.id, null)) {
                    continue;
                }
                if (random.nextDouble() > REPLY_PROBABILITY) {
                    continue;
                }

                try {
                    reply(bot, byId.get(target.get().botId), target.get());
                    interactions++;
                    incrementCounter("success");
                } catch (RuntimeException e) {
                    LOG.warnf(e, "Crew reply by @%s on post %s failed", bot.handle, target.get().id);
                    errors.add(bot.handle + ": " + e.getMessage());
                    incrementCounter("failure");
                }
            }
        }

        LOG.infof("Crew interaction job %d completed: %d interactions, %d errors", jobId, interactions, errors.size());
        if (interactions == 0 && !errors.isEmpty()) {
            throw new GenerationException(
                    "All " + errors.size() + " crew replies failed: " + String.join("; ", errors));
        }
    }

    private void reply(Bot responder, Bot author, Post post) {
        PromptType prompt = promptComposer.crewReplyPrompt(responder, author, post);
        String text = router.generateChat(new CaptionRequestType(prompt.systemPrompt(), prompt.userPrompt(),
                REPLY_MAX_TOKENS, CaptionRequestType.DEFAULT_TEMPERATURE, false), ToolContextType.forBot(responder));
        if (text == null || text.isBlank()) {
            throw new GenerationException("Empty crew reply");
        }
        postStore.addComment(post.id, responder.id, null, text.trim());
        LOG.debugf("@%s replied to @%s's post %s", responder.handle, author.handle, post.id);
    }

    private void incrementCounter(String outcome) {
        Counter.builder("botfleet.crew.replies").description("Crew replies by outcome").tag("outcome", outcome)
                .register(meterRegistry).increment();
    }
}

package villagecompute.botfleet.jobs;

import java.util.Map;
import java.util.UUID;

import org.jboss.logging.Logger;

import io.opentelemetry.api.trace.Span;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.botfleet.api.types.GeneratedPostType;
import villagecompute.botfleet.api.types.PromptType;
import villagecompute.botfleet.api.types.ToolContextType;
import villagecompute.botfleet.api.types.VisionRequestType;
import villagecompute.botfleet.data.models.Bot;
import villagecompute.botfleet.data.stores.BotStore;
import villagecompute.botfleet.data.stores.PostStore;
import villagecompute.botfleet.exceptions.ResourceNotFoundException;
import villagecompute.botfleet.services.CapabilityRouterService;
import villagecompute.botfleet.services.PostGenerationService;
import villagecompute.botfleet.services.PostingScheduleService;
import villagecompute.botfleet.services.PromptComposer;

/**
 * Job handler that generates and publishes one post for a bot, then reschedules the bot.
 *
 * <p>
 * <b>Flow:</b>
 * <ol>
 * <li>Load the bot; BYOB bots and bots outside the AI tiers are skipped</li>
 * <li>Skip (and reschedule) when the bot already reached today's post count</li>
 * <li>Seed the character reference from the avatar through the vision model, once per bot</li>
 * <li>Generate content via {@link PostGenerationService} and publish it</li>
 * <li>Reschedule with the normal cadence and enqueue a crew interaction for crew-tier bots</li>
 * </ol>
 *
 * <p>
 * On failure the bot's next post time moves forward by the failure retry delay and the exception propagates, so the
 * queue records the attempt and schedules a retry.
 */
@ApplicationScoped
public class GeneratePostJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(GeneratePostJobHandler.class);

    @Inject
    BotStore botStore;

    @Inject
    PostStore postStore;

    @Inject
    PostGenerationService postGenerationService;

    @Inject
    PostingScheduleService scheduleService;

    @Inject
    CapabilityRouterService router;

    @Inject
    PromptComposer promptComposer;

    @Override
    public JobType handlesType() {
        return JobType.GENERATE_POST;
    }

    @Override
    public void execute(Long jobId, UUID botId, Map<String, Object> payload) throws Exception {
        Bot bot = botStore.findById(botId).orElseThrow(() -> new ResourceNotFoundException("Bot not found: " + botId));

        if (bot.byob) {
            LOG.warnf("Job %d: bot @%s is BYOB and generates its own content, skipping", jobId, bot.handle);
            return;
        }
        if (!BotStore.AI_TIERS.contains(bot.ownerTier)
                && !CapabilityRouterService.PREMIUM_TIERS.contains(bot.ownerTier)) {
            LOG.warnf("Job %d: bot @%s owner tier %s has no AI generation, skipping", jobId, bot.handle,
                    bot.ownerTier);
            return;
        }

        int dailyLimit = scheduleService.postsPerDay(bot);
        long postsToday = postStore.countPostsSince(bot.id, scheduleService.startOfToday());
        if (postsToday >= dailyLimit) {
            LOG.infof("Job %d: bot @%s already posted %d/%d times today, rescheduling", jobId, bot.handle,
                    postsToday, dailyLimit);
            scheduleService.rescheduleAfterPost(bot);
            return;
        }

        ToolContextType ctx = ToolContextType.forBot(bot);
        Span.current().setAttribute("bot.handle", bot.handle).setAttribute("bot.tier", bot.ownerTier);

        try {
            ensureCharacterReference(bot, ctx);
            GeneratedPostType content = postGenerationService.generate(bot, ctx);
            UUID postId = postStore.publishPost(bot.id, content);
            LOG.infof("Job %d: published %s post %s for @%s", jobId, content.format(), postId, bot.handle);

            scheduleService.rescheduleAfterPost(bot);
        } catch (RuntimeException e) {
            scheduleService.rescheduleAfterFailure(bot.id);
            throw e;
        }

        if (BotStore.CREW_TIERS.contains(bot.ownerTier)) {
            try {
                scheduleService.enqueueCrewInteractionIfIdle("post");
            } catch (RuntimeException e) {
                LOG.warnf(e, "Job %d: post published but crew interaction could not be enqueued", jobId);
            }
        }
    }

    /**
     * Describes the bot's avatar with the vision model the first time the bot posts, so image prompts can keep its
     * subject consistent. A failure here only costs consistency, not the post.
     */
    void ensureCharacterReference(Bot bot, ToolContextType ctx) {
        if (bot.avatarUrl == null || bot.avatarUrl.isBlank() || bot.characterRefDescription != null) {
            return;
        }
        try {
            PromptType prompt = promptComposer.characterReferencePrompt();
            String description = router.analyzeImage(
                    new VisionRequestType(prompt.systemPrompt(), prompt.userPrompt(), bot.avatarUrl, null), ctx);
            if (description == null || description.isBlank()) {
                return;
            }
            String referenceUrl = bot.characterRefUrl != null ? bot.characterRefUrl : bot.avatarUrl;
            botStore.updateCharacterReference(bot.id, referenceUrl, description.trim());
            bot.characterRefUrl = referenceUrl;
            bot.characterRefDescription = description.trim();
            LOG.infof("Seeded character reference for @%s from avatar", bot.handle);
        } catch (RuntimeException e) {
            LOG.warnf(e, "Character reference analysis failed for @%s, continuing without it", bot.handle);
        }
    }
}

package villagecompute.botfleet.services;

import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.botfleet.api.types.CaptionRequestType;
import villagecompute.botfleet.api.types.GeneratedPostType;
import villagecompute.botfleet.api.types.ImageRequestType;
import villagecompute.botfleet.api.types.PostFormat;
import villagecompute.botfleet.api.types.PromptType;
import villagecompute.botfleet.api.types.ToolContextType;
import villagecompute.botfleet.api.types.VideoRequestType;
import villagecompute.botfleet.data.models.Bot;
import villagecompute.botfleet.exceptions.GenerationException;

/**
 * Produces the content of one post through the capability router, applying the degradation policy for missing media.
 *
 * <p>
 * <b>Policy:</b>
 * <ol>
 * <li>The caption comes first; a failed or empty caption fails the whole post.</li>
 * <li>Bots of a video tier with a configured duration try video. A premium tier asking for
 * {@value CapabilityRouterService#PREMIUM_VIDEO_MIN_DURATION_SEC}s or more first generates a start frame, which doubles
 * as the thumbnail.</li>
 * <li>A missing video degrades to an image post (reusing the start frame when there is one).</li>
 * <li>A missing image degrades to a text post when the budget is exhausted; otherwise the post fails so the job
 * retries.</li>
 * </ol>
 */
@ApplicationScoped
public class PostGenerationService {

    private static final Logger LOG = Logger.getLogger(PostGenerationService.class);

    /** Tiers whose bots may post video. */
    public static final Set<String> VIDEO_TIERS = Set.of("PULSE", "GRID", "ADMIN");

    @Inject
    CapabilityRouterService router;

    @Inject
    PromptComposer promptComposer;

    /**
     * Generates caption and media for a bot.
     *
     * @throws GenerationException
     *             if no caption, or no media outside budget enforcement, could be produced
     */
    public GeneratedPostType generate(Bot bot, ToolContextType ctx) {
        PromptType captionPrompt = promptComposer.captionPrompt(bot);
        String caption = router.generateCaption(CaptionRequestType.of(captionPrompt.systemPrompt(),
                captionPrompt.userPrompt()), ctx);
        if (caption == null || caption.isBlank()) {
            throw new GenerationException("Caption generation returned no text for @" + bot.handle);
        }
        caption = caption.trim();

        String startFrameUrl = null;
        if (wantsVideo(bot, ctx)) {
            int duration = bot.videoDurationSec;
            if (CapabilityRouterService.PREMIUM_TIERS.contains(ctx.tier())
                    && duration >= CapabilityRouterService.PREMIUM_VIDEO_MIN_DURATION_SEC) {
                startFrameUrl = router.generateImage(imageRequest(bot, caption), ctx);
            }
            String videoUrl = router.generateVideo(
                    new VideoRequestType(promptComposer.videoPrompt(bot, caption, duration), duration, startFrameUrl),
                    ctx);
            if (videoUrl != null) {
                return new GeneratedPostType(caption, PostFormat.VIDEO, startFrameUrl, videoUrl, duration);
            }
            LOG.warnf("Video generation failed for @%s (%ds), degrading to an image post", bot.handle, duration);
            if (startFrameUrl != null) {
                return new GeneratedPostType(caption, PostFormat.IMAGE, startFrameUrl, null, null);
            }
        }

        String imageUrl = router.generateImage(imageRequest(bot, caption), ctx);
        if (imageUrl != null) {
            return new GeneratedPostType(caption, PostFormat.IMAGE, imageUrl, null, null);
        }
        if (router.checkBudget(ctx).exceeded()) {
            LOG.infof("Budget exhausted for @%s, publishing a text post", bot.handle);
            return new GeneratedPostType(caption, PostFormat.TEXT, null, null, null);
        }
        throw new GenerationException("Media generation failed for @" + bot.handle);
    }

    private boolean wantsVideo(Bot bot, ToolContextType ctx) {
        return bot.videoDurationSec != null && bot.videoDurationSec > 0 && VIDEO_TIERS.contains(ctx.tier());
    }

    private ImageRequestType imageRequest(Bot bot, String caption) {
        return new ImageRequestType(promptComposer.imagePrompt(bot, caption), bot.characterRefUrl, null);
    }
}

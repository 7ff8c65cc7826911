package villagecompute.botfleet.services;

import java.util.List;
import java.util.Set;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.inject.Named;

import org.jboss.logging.Logger;

import villagecompute.botfleet.api.types.BudgetEnforcementType;
import villagecompute.botfleet.api.types.BudgetStatusType;
import villagecompute.botfleet.api.types.BudgetType;
import villagecompute.botfleet.api.types.Capability;
import villagecompute.botfleet.api.types.CaptionRequestType;
import villagecompute.botfleet.api.types.ChatCompletionType;
import villagecompute.botfleet.api.types.ImageGenerationType;
import villagecompute.botfleet.api.types.ImageRequestType;
import villagecompute.botfleet.api.types.ProviderOverride;
import villagecompute.botfleet.api.types.TelemetryContextType;
import villagecompute.botfleet.api.types.ToolContextType;
import villagecompute.botfleet.api.types.VideoGenerationType;
import villagecompute.botfleet.api.types.VideoRequestType;
import villagecompute.botfleet.api.types.VisionRequestType;
import villagecompute.botfleet.config.AiConfig;
import villagecompute.botfleet.integration.ai.ChatBackend;
import villagecompute.botfleet.integration.ai.FalClient;
import villagecompute.botfleet.integration.ai.ImageBackend;
import villagecompute.botfleet.integration.ai.KlingClient;
import villagecompute.botfleet.integration.ai.MinimaxClient;
import villagecompute.botfleet.integration.ai.RunwayClient;
import villagecompute.botfleet.integration.ai.VideoBackend;

/**
 * Routes abstract AI capability requests (caption, image, video, vision) to concrete providers.
 *
 * <p>
 * Job handlers call this service and never a provider directly. Routing inputs come from the caller's
 * {@link ToolContextType}: tier and trust pick the chat model, and an exhausted daily budget downgrades the tier to
 * {@value ToolContextType#CHEAPEST_TIER} (or skips image generation entirely). Every provider attempt runs inside
 * {@link GenerationTelemetryService#withTelemetry}.
 *
 * <p>
 * <b>Failure contract:</b>
 * <ul>
 * <li>caption, chat and vision propagate provider exceptions</li>
 * <li>image and video return {@code null} when nothing was produced; callers decide how to degrade</li>
 * </ul>
 *
 * <p>
 * <b>Video routing:</b> premium (Runway image-to-video) when eligible, then the duration-mapped fal.ai model, then the
 * direct fallbacks Kling and MiniMax in that order. The first URL wins.
 */
@ApplicationScoped
public class CapabilityRouterService {

    private static final Logger LOG = Logger.getLogger(CapabilityRouterService.class);

    /** Tiers that get the premium chat model and premium video path. */
    public static final Set<String> PREMIUM_TIERS = Set.of("GRID", "ADMIN");

    /** Minimum trust level for the premium chat model. */
    public static final double PREMIUM_TRUST_THRESHOLD = 0.5;

    /** Minimum requested duration for the premium video path. */
    public static final int PREMIUM_VIDEO_MIN_DURATION_SEC = 30;

    @Inject
    GenerationTelemetryService telemetry;

    @Inject
    AiConfig aiConfig;

    @Inject
    ChatBackend chatBackend;

    @Inject
    @Named(FalClient.PROVIDER_ID)
    ImageBackend imageBackend;

    @Inject
    @Named(FalClient.PROVIDER_ID)
    VideoBackend defaultVideoBackend;

    @Inject
    @Named(RunwayClient.PROVIDER_ID)
    VideoBackend premiumVideoBackend;

    @Inject
    @Named(KlingClient.PROVIDER_ID)
    VideoBackend klingBackend;

    @Inject
    @Named(MinimaxClient.PROVIDER_ID)
    VideoBackend minimaxBackend;

    /** Direct fallbacks in preference order. */
    List<VideoBackend> fallbackVideoBackends;

    @PostConstruct
    void init() {
        fallbackVideoBackends = List.of(klingBackend, minimaxBackend);
    }

    /**
     * Picks the chat model for a context: premium tiers with trust at or above the threshold get the premium model,
     * every other tier (unknown ones included) gets the standard model.
     */
    public String selectModel(ToolContextType ctx) {
        return isPremium(ctx) ? aiConfig.getPremiumModelName() : aiConfig.getStandardModelName();
    }

    /**
     * Checks the context's daily budget. Without a positive limit the budget is never exceeded.
     */
    public BudgetStatusType checkBudget(ToolContextType ctx) {
        BudgetType budget = ctx.budget();
        if (budget == null || !budget.hasLimit()) {
            return BudgetStatusType.UNLIMITED;
        }
        int limit = budget.dailyLimitCents();
        int spent = budget.spentTodayCents();
        int percentUsed = (int) Math.round((double) spent / limit * 100);
        return new BudgetStatusType(spent >= limit, percentUsed);
    }

    /**
     * Downgrades the context to the cheapest tier when its budget is exhausted.
     *
     * @return the (possibly new) context and whether enforcement fired
     */
    public BudgetEnforcementType enforceBudget(ToolContextType ctx) {
        BudgetStatusType status = checkBudget(ctx);
        if (!status.exceeded()) {
            return new BudgetEnforcementType(ctx, false);
        }
        LOG.warnf("Daily budget exceeded (%d%% used) for tier %s, downgrading to %s", status.percentUsed(), ctx.tier(),
                ToolContextType.CHEAPEST_TIER);
        return new BudgetEnforcementType(ctx.withTier(ToolContextType.CHEAPEST_TIER), true);
    }

    /**
     * Generates a caption or other text completion. Single provider, no fallback.
     *
     * @throws villagecompute.botfleet.exceptions.ProviderException
     *             if the chat provider fails
     */
    public String generateCaption(CaptionRequestType request, ToolContextType ctx) {
        return complete(Capability.CAPTION, request, ctx);
    }

    /**
     * Chat completion for agent decisions, comment replies and crew interactions. Routed exactly like captions.
     */
    public String generateChat(CaptionRequestType request, ToolContextType ctx) {
        return complete(Capability.CHAT, request, ctx);
    }

    /**
     * Generates an image, or returns null when the budget is exhausted (no call made) or the provider produced
     * nothing or failed.
     */
    public String generateImage(ImageRequestType request, ToolContextType ctx) {
        if (checkBudget(ctx).exceeded()) {
            LOG.warnf("Daily budget exceeded for tier %s, skipping image generation", ctx.tier());
            return null;
        }

        String model = request.hasReference() ? FalClient.REFERENCE_IMAGE_MODEL : FalClient.IMAGE_MODEL;
        ProviderOverride override = ctx.override();
        if (override instanceof ProviderOverride.ForceImageModel) {
            model = ((ProviderOverride.ForceImageModel) override).modelId();
            LOG.infof("Image model forced to %s", model);
        }

        ImageGenerationType params = new ImageGenerationType(model, request.prompt(), request.effectiveSize(),
                request.hasReference() ? request.referenceImageUrl() : null);
        TelemetryContextType tags = new TelemetryContextType(Capability.IMAGE, imageBackend.providerId(), model,
                ctx.tier(), false);
        try {
            return telemetry.withTelemetry(tags, () -> imageBackend.generateImage(params));
        } catch (RuntimeException e) {
            LOG.errorf(e, "Image generation failed on %s", model);
            return null;
        }
    }

    /**
     * Generates a video through the premium, default and fallback chain.
     *
     * @return video URL, or null when every path failed
     */
    public String generateVideo(VideoRequestType request, ToolContextType ctx) {
        BudgetEnforcementType enforcement = enforceBudget(ctx);
        ToolContextType effective = enforcement.context();
        boolean enforced = enforcement.enforced();
        ProviderOverride override = effective.override();

        String forcedModel = override instanceof ProviderOverride.ForceVideoModel
                ? ((ProviderOverride.ForceVideoModel) override).modelId()
                : null;
        boolean forcedPremium = forcedModel != null && forcedModel.equals(premiumVideoBackend.defaultModel());

        if (isPremiumVideoEligible(request, effective, enforced, forcedPremium)) {
            String url = attemptVideo(premiumVideoBackend, premiumVideoBackend.defaultModel(), request, effective,
                    enforced);
            if (url != null) {
                return url;
            }
            LOG.infof("Premium video failed, falling back to %s", defaultVideoBackend.providerId());
        }

        String defaultModel = forcedModel != null && !forcedPremium ? forcedModel
                : FalClient.videoModelForDuration(request.durationSec());
        if (defaultVideoBackend.isAvailable()) {
            String url = attemptVideo(defaultVideoBackend, defaultModel, request, effective, enforced);
            if (url != null) {
                return url;
            }
        } else {
            LOG.warnf("Default video backend %s is not configured", defaultVideoBackend.providerId());
        }

        for (VideoBackend fallback : fallbackVideoBackends) {
            if (!fallback.isAvailable()) {
                LOG.debugf("Skipping unconfigured video fallback %s", fallback.providerId());
                continue;
            }
            LOG.infof("Trying video fallback %s", fallback.providerId());
            String url = attemptVideo(fallback, fallback.defaultModel(), request, effective, enforced);
            if (url != null) {
                return url;
            }
        }

        LOG.errorf("All video providers failed (duration=%ds, tier=%s)", request.durationSec(), effective.tier());
        return null;
    }

    /**
     * Analyzes an image with the vision model. Never downgraded by tier or budget.
     *
     * @throws villagecompute.botfleet.exceptions.ProviderException
     *             if the provider fails
     */
    public String analyzeImage(VisionRequestType request, ToolContextType ctx) {
        String model = aiConfig.getVisionModelName();
        ChatCompletionType params = new ChatCompletionType(model, request.systemPrompt(), request.userPrompt(),
                request.imageUrl(), request.effectiveMaxTokens(), null, false);
        TelemetryContextType tags = new TelemetryContextType(Capability.VISION, chatBackend.providerId(), model,
                ctx.tier(), false);
        return telemetry.withTelemetry(tags, () -> chatBackend.complete(params));
    }

    private String complete(Capability capability, CaptionRequestType request, ToolContextType ctx) {
        BudgetEnforcementType enforcement = enforceBudget(ctx);
        String model = selectModel(enforcement.context());
        ChatCompletionType params = new ChatCompletionType(model, request.systemPrompt(), request.userPrompt(), null,
                request.effectiveMaxTokens(), request.effectiveTemperature(), request.jsonMode());
        TelemetryContextType tags = new TelemetryContextType(capability, chatBackend.providerId(), model,
                enforcement.context().tier(), enforcement.enforced());
        return telemetry.withTelemetry(tags, () -> chatBackend.complete(params));
    }

    private boolean isPremium(ToolContextType ctx) {
        return ctx.tier() != null && PREMIUM_TIERS.contains(ctx.tier())
                && ctx.trustLevel() >= PREMIUM_TRUST_THRESHOLD;
    }

    private boolean isPremiumVideoEligible(VideoRequestType request, ToolContextType ctx, boolean enforced,
            boolean forcedPremium) {
        boolean byPolicy = ctx.tier() != null && PREMIUM_TIERS.contains(ctx.tier())
                && request.durationSec() >= PREMIUM_VIDEO_MIN_DURATION_SEC && !enforced;
        return (byPolicy || forcedPremium) && request.hasStartFrame() && premiumVideoBackend.isAvailable();
    }

    private String attemptVideo(VideoBackend backend, String model, VideoRequestType request, ToolContextType ctx,
            boolean enforced) {
        VideoGenerationType params = new VideoGenerationType(model, request.prompt(), request.durationSec(),
                request.startFrameUrl());
        TelemetryContextType tags = new TelemetryContextType(Capability.VIDEO, backend.providerId(), model,
                ctx.tier(), enforced);
        try {
            return telemetry.withTelemetry(tags, () -> backend.generateVideo(params));
        } catch (RuntimeException e) {
            LOG.errorf(e, "Video attempt on %s (%s) failed", backend.providerId(), model);
            return null;
        }
    }
}

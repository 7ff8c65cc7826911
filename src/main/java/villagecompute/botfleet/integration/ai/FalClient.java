/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.botfleet.integration.ai;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Named;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;

import villagecompute.botfleet.api.types.ImageGenerationType;
import villagecompute.botfleet.api.types.VideoGenerationType;
import villagecompute.botfleet.exceptions.ProviderException;

/**
 * fal.ai queue API client: default image generation and the default (duration-mapped) video path.
 *
 * <p>
 * Requests go to {@code POST {base}/{model}}, which returns a {@code status_url} and {@code response_url}. The status
 * URL is polled until {@code COMPLETED}, then the result is read from the response URL.
 *
 * <p>
 * <b>Models:</b>
 * <ul>
 * <li>{@value #IMAGE_MODEL} - plain image generation</li>
 * <li>{@value #REFERENCE_IMAGE_MODEL} - identity-grounded generation through an IP-adapter</li>
 * <li>{@value #SHORT_VIDEO_MODEL} - videos of 6 seconds or less</li>
 * <li>{@value #LONG_VIDEO_MODEL} - longer videos</li>
 * </ul>
 */
@ApplicationScoped
@Named(FalClient.PROVIDER_ID)
public class FalClient extends AsyncProviderClient implements ImageBackend, VideoBackend {

    private static final Logger LOG = Logger.getLogger(FalClient.class);

    public static final String PROVIDER_ID = "fal";

    public static final String IMAGE_MODEL = "fal-ai/flux/dev";
    public static final String REFERENCE_IMAGE_MODEL = "fal-ai/flux-general";
    public static final String SHORT_VIDEO_MODEL = "fal-ai/kling-video/v2/master/text-to-video";
    public static final String LONG_VIDEO_MODEL = "fal-ai/minimax-video/video-01/text-to-video";

    static final String IP_ADAPTER_PATH = "XLabs-AI/flux-ip-adapter";
    static final double IP_ADAPTER_SCALE = 0.7;
    static final String VIDEO_ASPECT_RATIO = "9:16";

    @ConfigProperty(
            name = "ai.provider.fal.api-key")
    Optional<String> apiKey;

    @ConfigProperty(
            name = "ai.provider.fal.base-url",
            defaultValue = "https://queue.fal.run")
    String baseUrl;

    /**
     * Picks the default fal.ai video model for a duration.
     */
    public static String videoModelForDuration(int durationSec) {
        return durationSec <= 6 ? SHORT_VIDEO_MODEL : LONG_VIDEO_MODEL;
    }

    @Override
    public String providerId() {
        return PROVIDER_ID;
    }

    @Override
    public String defaultModel() {
        return SHORT_VIDEO_MODEL;
    }

    @Override
    public boolean isAvailable() {
        return apiKey.filter(k -> !k.isBlank()).isPresent();
    }

    @Override
    public String generateImage(ImageGenerationType params) {
        Map<String, Object> input = new HashMap<>();
        input.put("prompt", params.prompt());
        input.put("image_size", params.imageSize());
        input.put("num_images", 1);
        input.put("enable_safety_checker", true);

        if (params.referenceImageUrl() != null) {
            input.put("num_inference_steps", 28);
            input.put("guidance_scale", 3.5);
            input.put("ip_adapters", List.of(Map.of("path", IP_ADAPTER_PATH, "ip_adapter_image_url",
                    params.referenceImageUrl(), "scale", IP_ADAPTER_SCALE)));
        }

        JsonNode result = subscribe(params.model(), input);
        if (result == null) {
            return null;
        }
        JsonNode images = result.path("images");
        String url = images.isArray() && images.size() > 0 ? text(images.get(0), "url") : null;
        LOG.debugf("fal.ai image %s returned %s", params.model(), url != null ? "an image" : "no image");
        return url;
    }

    @Override
    public String generateVideo(VideoGenerationType params) {
        Map<String, Object> input = new HashMap<>();
        input.put("prompt", params.prompt());
        input.put("duration", params.durationSec() <= 6 ? "5" : "10");
        input.put("aspect_ratio", VIDEO_ASPECT_RATIO);

        JsonNode result = subscribe(params.model(), input);
        if (result == null) {
            return null;
        }
        String url = text(result.path("video"), "url");
        return url != null ? url : text(result, "video_url");
    }

    /**
     * Submits a request to the queue and waits for its result.
     *
     * @return the result document, or null if the request failed or timed out
     */
    JsonNode subscribe(String model, Map<String, Object> input) {
        if (!isAvailable()) {
            throw new ProviderException("fal.ai API key is not configured");
        }
        Map<String, String> headers = authHeaders();
        JsonNode submitted = postJson(baseUrl + "/" + model, headers, input);
        String requestId = text(submitted, "request_id");
        String statusUrl = text(submitted, "status_url");
        String responseUrl = text(submitted, "response_url");
        if (statusUrl == null || responseUrl == null) {
            throw new ProviderException("fal.ai did not return queue URLs for " + model);
        }
        LOG.debugf("fal.ai request %s queued for %s", requestId, model);

        Boolean completed = poll(requestId, attempt -> {
            Optional<JsonNode> status = getJson(statusUrl, headers);
            if (status.isEmpty()) {
                return PollResult.pending();
            }
            String state = text(status.get(), "status");
            if ("COMPLETED".equals(state)) {
                return PollResult.done(status.get().hasNonNull("error") ? Boolean.FALSE : Boolean.TRUE);
            }
            if ("FAILED".equals(state) || "ERROR".equals(state)) {
                LOG.warnf("fal.ai request %s failed: %s", requestId, status.get().path("error").asText(""));
                return PollResult.done(Boolean.FALSE);
            }
            return PollResult.pending();
        });
        if (!Boolean.TRUE.equals(completed)) {
            return null;
        }
        return getJson(responseUrl, headers).orElse(null);
    }

    private Map<String, String> authHeaders() {
        return Map.of("Authorization", "Key " + apiKey.orElse(""));
    }
}

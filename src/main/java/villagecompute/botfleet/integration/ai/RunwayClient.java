/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.botfleet.integration.ai;

import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Named;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;

import villagecompute.botfleet.api.types.VideoGenerationType;
import villagecompute.botfleet.exceptions.ProviderException;

/**
 * Runway image-to-video client, the premium video path.
 *
 * <p>
 * Runway animates a start frame; requests without one are rejected before any call is made. Durations are limited to
 * 5 or 10 seconds, so anything of 10 seconds or more is requested as 10.
 */
@ApplicationScoped
@Named(RunwayClient.PROVIDER_ID)
public class RunwayClient extends AsyncProviderClient implements VideoBackend {

    private static final Logger LOG = Logger.getLogger(RunwayClient.class);

    public static final String PROVIDER_ID = "runway";

    public static final String MODEL = "gen3a_turbo";

    static final String API_VERSION = "2024-11-06";
    static final String RATIO = "768:1280";

    @ConfigProperty(
            name = "ai.provider.runway.api-key")
    Optional<String> apiKey;

    @ConfigProperty(
            name = "ai.provider.runway.base-url",
            defaultValue = "https://api.dev.runwayml.com")
    String baseUrl;

    @Override
    public String providerId() {
        return PROVIDER_ID;
    }

    @Override
    public String defaultModel() {
        return MODEL;
    }

    @Override
    public boolean isAvailable() {
        return apiKey.filter(k -> !k.isBlank()).isPresent();
    }

    @Override
    public String generateVideo(VideoGenerationType params) {
        if (!isAvailable()) {
            return null;
        }
        if (params.startFrameUrl() == null || params.startFrameUrl().isBlank()) {
            throw new ProviderException("Runway image-to-video requires a start frame");
        }

        Map<String, String> headers = Map.of("Authorization", "Bearer " + apiKey.get(), "X-Runway-Version",
                API_VERSION);
        Map<String, Object> body = Map.of("model", params.model() != null ? params.model() : MODEL, "promptImage",
                params.startFrameUrl(), "promptText", params.prompt(), "duration", params.durationSec() >= 10 ? 10 : 5,
                "ratio", RATIO);

        JsonNode task = postJson(baseUrl + "/v1/image_to_video", headers, body);
        String taskId = text(task, "id");
        if (taskId == null) {
            throw new ProviderException("Runway did not return a task id");
        }
        LOG.debugf("Runway task %s created", taskId);

        return poll(taskId, attempt -> {
            Optional<JsonNode> status = getJson(baseUrl + "/v1/tasks/" + taskId, headers);
            if (status.isEmpty()) {
                return PollResult.pending();
            }
            String state = text(status.get(), "status");
            if ("SUCCEEDED".equals(state)) {
                JsonNode output = status.get().path("output");
                return PollResult.done(output.isArray() && output.size() > 0 ? output.get(0).asText() : null);
            }
            if ("FAILED".equals(state)) {
                LOG.warnf("Runway task %s failed: %s", taskId, text(status.get(), "failure"));
                return PollResult.done(null);
            }
            return PollResult.pending();
        });
    }
}

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

/**
 * MiniMax (Hailuo) text-to-video client, the second direct fallback.
 *
 * <p>
 * Three steps: create a task, poll it for a {@code file_id}, then resolve the file's download URL. Any step that does
 * not produce its value ends the attempt with {@code null}.
 */
@ApplicationScoped
@Named(MinimaxClient.PROVIDER_ID)
public class MinimaxClient extends AsyncProviderClient implements VideoBackend {

    private static final Logger LOG = Logger.getLogger(MinimaxClient.class);

    public static final String PROVIDER_ID = "minimax";

    public static final String MODEL = "MiniMax-Hailuo-2.3";

    static final String RESOLUTION = "768P";

    @ConfigProperty(
            name = "ai.provider.minimax.api-key")
    Optional<String> apiKey;

    @ConfigProperty(
            name = "ai.provider.minimax.base-url",
            defaultValue = "https://api.minimax.io")
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
        Map<String, String> headers = Map.of("Authorization", "Bearer " + apiKey.get());
        Map<String, Object> body = Map.of("model", MODEL, "prompt", params.prompt(), "duration",
                params.durationSec() <= 6 ? 6 : 10, "resolution", RESOLUTION);

        JsonNode created = postJson(baseUrl + "/v1/video_generation", headers, body);
        String taskId = text(created, "task_id");
        if (created.path("base_resp").path("status_code").asInt(-1) != 0 || taskId == null || taskId.isEmpty()) {
            LOG.warnf("MiniMax create task error: %s", created.path("base_resp").path("status_msg").asText(""));
            return null;
        }

        String fileId = poll(taskId, attempt -> {
            Optional<JsonNode> status = getJson(baseUrl + "/v1/query/video_generation?task_id=" + taskId, headers);
            if (status.isEmpty()) {
                return PollResult.pending();
            }
            String state = text(status.get(), "status");
            if ("Success".equals(state)) {
                return PollResult.done(text(status.get(), "file_id"));
            }
            if ("Failed".equals(state)) {
                LOG.warnf("MiniMax task %s failed: %s", taskId,
                        status.get().path("base_resp").path("status_msg").asText(""));
                return PollResult.done(null);
            }
            return PollResult.pending();
        });
        if (fileId == null) {
            return null;
        }

        String downloadUrl = getJson(baseUrl + "/v1/files/retrieve?file_id=" + fileId, headers)
                .map(file -> text(file.path("file"), "download_url")).orElse(null);
        if (downloadUrl == null) {
            LOG.warnf("MiniMax file %s has no download URL", fileId);
        }
        return downloadUrl;
    }
}

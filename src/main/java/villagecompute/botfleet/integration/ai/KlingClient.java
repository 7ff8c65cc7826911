/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.botfleet.integration.ai;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Named;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;

import villagecompute.botfleet.api.types.VideoGenerationType;
import villagecompute.botfleet.exceptions.ProviderException;

/**
 * Kling text-to-video client, the first direct fallback.
 *
 * <p>
 * Kling authenticates with a short-lived HS256 JWT signed with the account secret key ({@code iss} = access key). A
 * token is reused until it is within {@value #TOKEN_REFRESH_MARGIN_SECONDS} seconds of expiry.
 */
@ApplicationScoped
@Named(KlingClient.PROVIDER_ID)
public class KlingClient extends AsyncProviderClient implements VideoBackend {

    private static final Logger LOG = Logger.getLogger(KlingClient.class);

    public static final String PROVIDER_ID = "kling";

    public static final String MODEL = "kling-v2-master";

    static final long TOKEN_TTL_SECONDS = 1800;
    static final long TOKEN_REFRESH_MARGIN_SECONDS = 60;
    static final String NEGATIVE_PROMPT = "blurry, low quality, watermark, text overlay";
    static final String ASPECT_RATIO = "9:16";

    static final long TOKEN_NOT_BEFORE_SKEW_SECONDS = 5;

    @ConfigProperty(
            name = "ai.provider.kling.access-key")
    Optional<String> accessKey;

    @ConfigProperty(
            name = "ai.provider.kling.secret-key")
    Optional<String> secretKey;

    @ConfigProperty(
            name = "ai.provider.kling.base-url",
            defaultValue = "https://api.klingai.com")
    String baseUrl;

    Clock clock = Clock.systemUTC();

    private String cachedToken;
    private long cachedTokenExpiresAt;

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
        return accessKey.filter(k -> !k.isBlank()).isPresent() && secretKey.filter(k -> !k.isBlank()).isPresent();
    }

    @Override
    public String generateVideo(VideoGenerationType params) {
        if (!isAvailable()) {
            return null;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model_name", MODEL);
        body.put("prompt", params.prompt());
        body.put("negative_prompt", NEGATIVE_PROMPT);
        body.put("duration", params.durationSec() <= 6 ? "5" : "10");
        body.put("aspect_ratio", ASPECT_RATIO);
        body.put("mode", "std");

        JsonNode created = postJson(baseUrl + "/v1/videos/text2video", authHeaders(), body);
        String taskId = text(created.path("data"), "task_id");
        if (created.path("code").asInt(-1) != 0 || taskId == null) {
            LOG.warnf("Kling create task error: %s", text(created, "message"));
            return null;
        }

        return poll(taskId, attempt -> {
            Optional<JsonNode> status = getJson(baseUrl + "/v1/videos/text2video/" + taskId, authHeaders());
            if (status.isEmpty()) {
                return PollResult.pending();
            }
            JsonNode data = status.get().path("data");
            String state = text(data, "task_status");
            if ("succeed".equals(state)) {
                JsonNode videos = data.path("task_result").path("videos");
                String url = videos.isArray() && videos.size() > 0 ? text(videos.get(0), "url") : null;
                if (url == null) {
                    LOG.warnf("Kling task %s succeeded without a video URL", taskId);
                }
                return PollResult.done(url);
            }
            if ("failed".equals(state)) {
                LOG.warnf("Kling task %s failed: %s", taskId, text(data, "task_status_msg"));
                return PollResult.done(null);
            }
            return PollResult.pending();
        });
    }

    private Map<String, String> authHeaders() {
        return Map.of("Authorization", "Bearer " + token());
    }

    /**
     * Returns a valid bearer token, signing a new one when the cached token is missing or about to expire.
     *
     * @throws ProviderException
     *             if the secret key is too short for HS256
     */
    synchronized String token() {
        Instant now = clock.instant();
        if (cachedToken != null && cachedTokenExpiresAt > now.getEpochSecond() + TOKEN_REFRESH_MARGIN_SECONDS) {
            return cachedToken;
        }
        Instant expiresAt = now.plusSeconds(TOKEN_TTL_SECONDS);

        try {
            cachedToken = Jwts.builder().header().add("typ", "JWT").and().issuer(accessKey.orElseThrow())
                    .expiration(Date.from(expiresAt))
                    .notBefore(Date.from(now.minusSeconds(TOKEN_NOT_BEFORE_SKEW_SECONDS)))
                    .signWith(Keys.hmacShaKeyFor(secretKey.orElseThrow().getBytes(StandardCharsets.UTF_8)),
                            Jwts.SIG.HS256)
                    .compact();
        } catch (JwtException e) {
            throw new ProviderException("Failed to sign Kling API token", e);
        }
        cachedTokenExpiresAt = expiresAt.getEpochSecond();
        LOG.debugf("Signed new Kling token valid until %s", expiresAt);
        return cachedToken;
    }
}

/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.botfleet.integration.ai;

import villagecompute.botfleet.api.types.VideoGenerationType;

/**
 * Video generation backend.
 *
 * <p>
 * All video providers are asynchronous: they accept a task, then the backend polls for at most the configured maximum
 * wait. A task that fails or outlives the wait yields {@code null} rather than an exception.
 */
public interface VideoBackend {

    String providerId();

    /**
     * Model used when the caller does not pick one.
     */
    String defaultModel();

    /**
     * Returns whether credentials are configured. Unavailable backends are never attempted.
     */
    boolean isAvailable();

    /**
     * Generates one video.
     *
     * @return video URL, or null on task failure or timeout
     * @throws villagecompute.botfleet.exceptions.ProviderException
     *             if the provider rejects the request
     */
    String generateVideo(VideoGenerationType params);
}

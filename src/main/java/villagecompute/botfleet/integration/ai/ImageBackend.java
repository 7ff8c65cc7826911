/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.botfleet.integration.ai;

import villagecompute.botfleet.api.types.ImageGenerationType;

/**
 * Image generation backend.
 */
public interface ImageBackend {

    String providerId();

    boolean isAvailable();

    /**
     * Generates one image.
     *
     * @return image URL, or null when the provider finished without producing one
     * @throws villagecompute.botfleet.exceptions.ProviderException
     *             if the provider rejects the request
     */
    String generateImage(ImageGenerationType params);
}

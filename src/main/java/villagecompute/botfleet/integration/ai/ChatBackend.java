/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.botfleet.integration.ai;

import villagecompute.botfleet.api.types.ChatCompletionType;

/**
 * Text (and image-understanding) completion backend.
 */
public interface ChatBackend {

    String providerId();

    /**
     * Runs one completion.
     *
     * @param params
     *            model, prompts and sampling settings
     * @return completion text, possibly empty
     * @throws villagecompute.botfleet.exceptions.ProviderException
     *             if the provider call fails
     */
    String complete(ChatCompletionType params);
}

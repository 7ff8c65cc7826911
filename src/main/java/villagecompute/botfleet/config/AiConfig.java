/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.botfleet.config;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;

import io.quarkus.runtime.Startup;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * LangChain4j configuration for the Anthropic chat and vision models used by the capability router.
 *
 * <p>
 * Three model roles are configured:
 * <ul>
 * <li><b>premium</b> - captions for premium tiers with sufficient trust</li>
 * <li><b>standard</b> - everything else, and every budget-enforced call</li>
 * <li><b>vision</b> - image analysis, never downgraded</li>
 * </ul>
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code ai.provider.anthropic.api-key} - Anthropic API key (from ANTHROPIC_API_KEY env var)</li>
 * <li>{@code ai.model.premium.name} - premium model (default: claude-sonnet-4-20250514)</li>
 * <li>{@code ai.model.standard.name} - standard model (default: claude-3-5-haiku-20241022)</li>
 * <li>{@code ai.model.vision.name} - vision model (default: claude-sonnet-4-20250514)</li>
 * <li>{@code ai.model.timeout-seconds} - request timeout (default: 60)</li>
 * <li>{@code ai.model.max-retries} - retry attempts inside LangChain4j (default: 2)</li>
 * </ul>
 *
 * <p>
 * Token cap and temperature vary per request, so {@link ChatModel} instances are built on demand and cached per
 * {@code (model, maxTokens, temperature)} combination.
 */
@ApplicationScoped
@Startup
public class AiConfig {

    private static final Logger LOG = Logger.getLogger(AiConfig.class);

    @ConfigProperty(
            name = "ai.provider.anthropic.api-key")
    Optional<String> apiKey;

    @ConfigProperty(
            name = "ai.model.premium.name",
            defaultValue = "claude-sonnet-4-20250514")
    String premiumModelName;

    @ConfigProperty(
            name = "ai.model.standard.name",
            defaultValue = "claude-3-5-haiku-20241022")
    String standardModelName;

    @ConfigProperty(
            name = "ai.model.vision.name",
            defaultValue = "claude-sonnet-4-20250514")
    String visionModelName;

    @ConfigProperty(
            name = "ai.model.timeout-seconds",
            defaultValue = "60")
    int timeoutSeconds;

    @ConfigProperty(
            name = "ai.model.max-retries",
            defaultValue = "2")
    int maxRetries;

    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    /**
     * Fails startup when the Anthropic API key is missing; captions are the one capability with no fallback.
     *
     * @throws AiConfigurationException
     *             if the API key is not configured
     */
    @PostConstruct
    public void validateConfiguration() {
        if (apiKey == null || apiKey.map(String::trim).filter(k -> !k.isEmpty()).isEmpty()) {
            String errorMessage = "ANTHROPIC_API_KEY environment variable is not configured. "
                    + "Caption, chat and vision generation require a valid Anthropic API key. "
                    + "Please set the ANTHROPIC_API_KEY environment variable and restart the application.";
            LOG.fatal(errorMessage);
            throw new AiConfigurationException(errorMessage);
        }
        LOG.infof("LangChain4j configured with premium: %s, standard: %s, vision: %s", premiumModelName,
                standardModelName, visionModelName);
    }

    public String getPremiumModelName() {
        return premiumModelName;
    }

    public String getStandardModelName() {
        return standardModelName;
    }

    public String getVisionModelName() {
        return visionModelName;
    }

    /**
     * Returns a cached Anthropic {@link ChatModel} for the given settings.
     *
     * @param modelName
     *            Anthropic model name
     * @param maxTokens
     *            output token cap
     * @param temperature
     *            sampling temperature, null for the provider default
     * @return configured chat model
     */
    public ChatModel chatModel(String modelName, int maxTokens, Double temperature) {
        String key = modelName + "|" + maxTokens + "|" + temperature;
        return models.computeIfAbsent(key, k -> {
            LOG.debugf("Creating ChatModel: model=%s, maxTokens=%d, temperature=%s", modelName, maxTokens,
                    temperature);
            AnthropicChatModel.AnthropicChatModelBuilder builder = AnthropicChatModel.builder().apiKey(apiKey.get())
                    .modelName(modelName).maxTokens(maxTokens).timeout(Duration.ofSeconds(timeoutSeconds))
                    .maxRetries(maxRetries).logRequests(false).logResponses(false);
            if (temperature != null) {
                builder.temperature(temperature);
            }
            return builder.build();
        });
    }

    /**
     * Exception thrown when AI configuration is invalid or incomplete.
     */
    public static class AiConfigurationException extends RuntimeException {

        public AiConfigurationException(String message) {
            super(message);
        }
    }
}

/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.botfleet.integration.ai;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import villagecompute.botfleet.api.types.ChatCompletionType;
import villagecompute.botfleet.config.AiConfig;
import villagecompute.botfleet.exceptions.ProviderException;

/**
 * Anthropic Claude completions through LangChain4j.
 *
 * <p>
 * Images for vision requests are downloaded and sent inline as base64, since the Anthropic message API is fed image
 * data rather than links here.
 */
@ApplicationScoped
public class AnthropicChatBackend implements ChatBackend {

    private static final Logger LOG = Logger.getLogger(AnthropicChatBackend.class);

    public static final String PROVIDER_ID = "anthropic";

    static final String JSON_MODE_INSTRUCTION = "Respond with a single valid JSON object and nothing else.";

    private static final Duration IMAGE_FETCH_TIMEOUT = Duration.ofSeconds(20);

    @Inject
    AiConfig aiConfig;

    private final HttpClient httpClient = HttpClient.newBuilder().connectTimeout(IMAGE_FETCH_TIMEOUT)
            .followRedirects(HttpClient.Redirect.NORMAL).build();

    @Override
    public String providerId() {
        return PROVIDER_ID;
    }

    @Override
    public String complete(ChatCompletionType params) {
        ChatModel model = aiConfig.chatModel(params.model(), params.maxTokens(), params.temperature());
        List<ChatMessage> messages = buildMessages(params);
        try {
            ChatResponse response = model.chat(messages);
            String text = response.aiMessage() != null ? response.aiMessage().text() : null;
            LOG.debugf("Claude %s returned %d characters", params.model(), text != null ? text.length() : 0);
            return text;
        } catch (RuntimeException e) {
            throw new ProviderException("Anthropic completion failed for model " + params.model(), e);
        }
    }

    List<ChatMessage> buildMessages(ChatCompletionType params) {
        List<ChatMessage> messages = new ArrayList<>();
        String system = params.systemPrompt();
        if (params.jsonMode()) {
            system = system == null || system.isBlank() ? JSON_MODE_INSTRUCTION
                    : system + "\n\n" + JSON_MODE_INSTRUCTION;
        }
        if (system != null && !system.isBlank()) {
            messages.add(SystemMessage.from(system));
        }
        if (params.imageUrl() != null) {
            messages.add(UserMessage.from(TextContent.from(params.userPrompt()), fetchImage(params.imageUrl())));
        } else {
            messages.add(UserMessage.from(params.userPrompt()));
        }
        return messages;
    }

    private ImageContent fetchImage(String url) {
        try {
            HttpRequest request = HttpRequest.newBuilder().uri(URI.create(url)).timeout(IMAGE_FETCH_TIMEOUT).GET()
                    .build();
            HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() / 100 != 2) {
                throw new ProviderException("Image fetch returned status " + response.statusCode() + ": " + url);
            }
            String mimeType = response.headers().firstValue("Content-Type").map(v -> v.split(";")[0].trim())
                    .orElse("image/jpeg");
            return ImageContent.from(Base64.getEncoder().encodeToString(response.body()), mimeType);
        } catch (IOException e) {
            throw new ProviderException("Failed to fetch image for analysis: " + url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Interrupted fetching image for analysis: " + url, e);
        }
    }
}

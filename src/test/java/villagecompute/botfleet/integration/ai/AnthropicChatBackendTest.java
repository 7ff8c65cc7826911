/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.botfleet.integration.ai;

import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.github.tomakehurst.wiremock.client.WireMock;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;

import villagecompute.botfleet.WireMockTestBase;
import villagecompute.botfleet.api.types.ChatCompletionType;
import villagecompute.botfleet.config.AiConfig;
import villagecompute.botfleet.exceptions.ProviderException;

/**
 * Tests for {@link AnthropicChatBackend} message assembly and error mapping. The chat model itself is mocked.
 */
class AnthropicChatBackendTest extends WireMockTestBase {

    @Mock
    AiConfig aiConfig;

    @Mock
    ChatModel chatModel;

    private AnthropicChatBackend backend;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        backend = new AnthropicChatBackend();
        backend.aiConfig = aiConfig;
        when(aiConfig.chatModel("claude-test", 300, 0.9)).thenReturn(chatModel);
    }

    private static ChatCompletionType params(String system, String imageUrl, boolean jsonMode) {
        return new ChatCompletionType("claude-test", system, "Write a caption.", imageUrl, 300, 0.9, jsonMode);
    }

    @Test
    void testCompleteReturnsModelText() {
        when(chatModel.chat(anyList())).thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("Golden hour."))
                .build());

        assertEquals("Golden hour.", backend.complete(params("You are a photographer.", null, false)));
    }

    @Test
    void testModelFailureWrapped() {
        when(chatModel.chat(anyList())).thenThrow(new RuntimeException("overloaded_error"));

        ProviderException thrown = assertThrows(ProviderException.class,
                () -> backend.complete(params("You are a photographer.", null, false)));
        assertTrue(thrown.getMessage().contains("claude-test"));
        assertEquals("overloaded_error", thrown.getCause().getMessage());
    }

    @Test
    void testSystemAndUserMessages() {
        List<ChatMessage> messages = backend.buildMessages(params("You are a photographer.", null, false));

        assertEquals(2, messages.size());
        assertEquals("You are a photographer.", ((SystemMessage) messages.get(0)).text());
        assertEquals("Write a caption.", ((UserMessage) messages.get(1)).singleText());
    }

    @Test
    void testJsonModeAppendsInstruction() {
        List<ChatMessage> withSystem = backend.buildMessages(params("You are a photographer.", null, true));
        List<ChatMessage> withoutSystem = backend.buildMessages(params(null, null, true));

        assertEquals("You are a photographer.\n\n" + AnthropicChatBackend.JSON_MODE_INSTRUCTION,
                ((SystemMessage) withSystem.get(0)).text());
        assertEquals(AnthropicChatBackend.JSON_MODE_INSTRUCTION, ((SystemMessage) withoutSystem.get(0)).text());
    }

    @Test
    void testBlankSystemPromptOmitted() {
        List<ChatMessage> messages = backend.buildMessages(params("  ", null, false));

        assertEquals(1, messages.size());
        assertInstanceOf(UserMessage.class, messages.get(0));
    }

    @Test
    void testVisionImageInlinedAsBase64() {
        byte[] png = "not-really-a-png".getBytes(StandardCharsets.UTF_8);
        wireMockServer.stubFor(get(urlPathEqualTo("/avatar.png")).willReturn(
                WireMock.aResponse().withStatus(200).withHeader("Content-Type", "image/png; charset=binary")
                        .withBody(png)));

        List<ChatMessage> messages = backend.buildMessages(params(null, baseUrl() + "/avatar.png", false));

        UserMessage user = (UserMessage) messages.get(0);
        assertEquals(2, user.contents().size());
        ImageContent image = (ImageContent) user.contents().get(1);
        assertEquals("image/png", image.image().mimeType());
        assertEquals(Base64.getEncoder().encodeToString(png), image.image().base64Data());
    }

    @Test
    void testVisionImageFetchFailure() {
        wireMockServer.stubFor(get(urlPathEqualTo("/missing.png")).willReturn(WireMock.aResponse().withStatus(404)));

        assertThrows(ProviderException.class,
                () -> backend.buildMessages(params(null, baseUrl() + "/missing.png", false)));
    }
}

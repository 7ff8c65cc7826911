/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.botfleet.integration.ai;

import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import villagecompute.botfleet.WireMockTestBase;
import villagecompute.botfleet.api.types.VideoGenerationType;
import villagecompute.botfleet.exceptions.ProviderException;

/**
 * Tests for {@link RunwayClient} against a stubbed Runway API.
 */
class RunwayClientTest extends WireMockTestBase {

    private static final String START_FRAME = "https://cdn.example/frame.png";

    private RunwayClient client;

    @BeforeEach
    void setUp() {
        client = new RunwayClient();
        client.objectMapper = new ObjectMapper();
        client.pollInterval = Duration.ofMillis(10);
        client.maxWait = Duration.ofSeconds(2);
        client.apiKey = Optional.of("rw-test-key");
        client.baseUrl = baseUrl();
    }

    private static VideoGenerationType request(int durationSec, String startFrame) {
        return new VideoGenerationType(RunwayClient.MODEL, "slow pan across the harbor", durationSec, startFrame);
    }

    @Test
    void testGenerateVideo() {
        stubJson(post(urlPathEqualTo("/v1/image_to_video")), 200, "{\"id\":\"task-1\"}");
        stubJson(get(urlPathEqualTo("/v1/tasks/task-1")), 200, loadStubFile("wiremock/runway/task-succeeded.json"));

        String url = client.generateVideo(request(12, START_FRAME));

        assertEquals("https://dnznrvs05pmza.cloudfront.net/runway-output.mp4", url);
        wireMockServer.verify(postRequestedFor(urlPathEqualTo("/v1/image_to_video"))
                .withHeader("Authorization", equalTo("Bearer rw-test-key"))
                .withHeader("X-Runway-Version", equalTo(RunwayClient.API_VERSION))
                .withRequestBody(matchingJsonPath("$.promptImage", equalTo(START_FRAME)))
                .withRequestBody(matchingJsonPath("$.duration", equalTo("10")))
                .withRequestBody(matchingJsonPath("$.ratio", equalTo(RunwayClient.RATIO))));
        wireMockServer.verify(getRequestedFor(urlPathEqualTo("/v1/tasks/task-1"))
                .withHeader("X-Runway-Version", equalTo(RunwayClient.API_VERSION)));
    }

    @Test
    void testShortDurationRequestsFiveSeconds() {
        stubJson(post(urlPathEqualTo("/v1/image_to_video")), 200, "{\"id\":\"task-1\"}");
        stubJson(get(urlPathEqualTo("/v1/tasks/task-1")), 200, loadStubFile("wiremock/runway/task-succeeded.json"));

        client.generateVideo(request(8, START_FRAME));

        wireMockServer.verify(postRequestedFor(urlPathEqualTo("/v1/image_to_video"))
                .withRequestBody(matchingJsonPath("$.duration", equalTo("5"))));
    }

    @Test
    void testStartFrameRequired() {
        assertThrows(ProviderException.class, () -> client.generateVideo(request(5, null)));
        assertTrue(wireMockServer.getAllServeEvents().isEmpty());
    }

    @Test
    void testFailedTaskReturnsNull() {
        stubJson(post(urlPathEqualTo("/v1/image_to_video")), 200, "{\"id\":\"task-1\"}");
        stubJson(get(urlPathEqualTo("/v1/tasks/task-1")), 200,
                "{\"id\":\"task-1\",\"status\":\"FAILED\",\"failure\":\"content moderation\"}");

        assertNull(client.generateVideo(request(5, START_FRAME)));
    }

    @Test
    void testMissingTaskIdFails() {
        stubJson(post(urlPathEqualTo("/v1/image_to_video")), 200, "{}");

        assertThrows(ProviderException.class, () -> client.generateVideo(request(5, START_FRAME)));
    }

    @Test
    void testUnavailableWithoutKey() {
        client.apiKey = Optional.empty();

        assertNull(client.generateVideo(request(5, START_FRAME)));
        assertTrue(wireMockServer.getAllServeEvents().isEmpty());
    }
}

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
import static com.github.tomakehurst.wiremock.client.WireMock.notContaining;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.stubbing.Scenario;

import villagecompute.botfleet.WireMockTestBase;
import villagecompute.botfleet.api.types.ImageGenerationType;
import villagecompute.botfleet.api.types.VideoGenerationType;
import villagecompute.botfleet.exceptions.ProviderException;
import villagecompute.botfleet.exceptions.RateLimitException;

/**
 * Tests for {@link FalClient} against a stubbed fal.ai queue API.
 */
class FalClientTest extends WireMockTestBase {

    private static final String REQUEST_PATH = "/fal-ai/flux/requests/req-1";
    private static final String STATUS_PATH = REQUEST_PATH + "/status";

    private FalClient client;

    @BeforeEach
    void setUp() {
        client = new FalClient();
        client.objectMapper = new ObjectMapper();
        client.pollInterval = Duration.ofMillis(10);
        client.maxWait = Duration.ofSeconds(2);
        client.apiKey = Optional.of("fal-test-key");
        client.baseUrl = baseUrl();
    }

    private void stubSubmit(String model) {
        stubJson(post(urlPathEqualTo("/" + model)), 200, "{\"request_id\":\"req-1\",\"status_url\":\"" + baseUrl()
                + STATUS_PATH + "\",\"response_url\":\"" + baseUrl() + REQUEST_PATH + "\"}");
    }

    private static ImageGenerationType image(String model, String reference) {
        return new ImageGenerationType(model, "a lighthouse at dusk", "square_hd", reference);
    }

    @Test
    void testGenerateImage() {
        stubSubmit(FalClient.IMAGE_MODEL);
        stubJson(get(urlPathEqualTo(STATUS_PATH)), 200, "{\"status\":\"COMPLETED\"}");
        stubJson(get(urlPathEqualTo(REQUEST_PATH)), 200, loadStubFile("wiremock/fal/image-result.json"));

        String url = client.generateImage(image(FalClient.IMAGE_MODEL, null));

        assertEquals("https://v3.fal.media/files/lighthouse.png", url);
        wireMockServer.verify(postRequestedFor(urlPathEqualTo("/" + FalClient.IMAGE_MODEL))
                .withHeader("Authorization", equalTo("Key fal-test-key"))
                .withRequestBody(matchingJsonPath("$.prompt", equalTo("a lighthouse at dusk")))
                .withRequestBody(matchingJsonPath("$.image_size", equalTo("square_hd")))
                .withRequestBody(notContaining("ip_adapters")));
    }

    @Test
    void testReferenceImageUsesIpAdapter() {
        stubSubmit(FalClient.REFERENCE_IMAGE_MODEL);
        stubJson(get(urlPathEqualTo(STATUS_PATH)), 200, "{\"status\":\"COMPLETED\"}");
        stubJson(get(urlPathEqualTo(REQUEST_PATH)), 200, loadStubFile("wiremock/fal/image-result.json"));

        String url = client.generateImage(image(FalClient.REFERENCE_IMAGE_MODEL, "https://cdn.example/ref.png"));

        assertEquals("https://v3.fal.media/files/lighthouse.png", url);
        wireMockServer.verify(postRequestedFor(urlPathEqualTo("/" + FalClient.REFERENCE_IMAGE_MODEL))
                .withRequestBody(matchingJsonPath("$.ip_adapters[0].path", equalTo(FalClient.IP_ADAPTER_PATH)))
                .withRequestBody(matchingJsonPath("$.ip_adapters[0].ip_adapter_image_url",
                        equalTo("https://cdn.example/ref.png"))));
    }

    @Test
    void testPollsUntilCompleted() {
        stubSubmit(FalClient.IMAGE_MODEL);
        stubJson(get(urlPathEqualTo(STATUS_PATH)).inScenario("queue").whenScenarioStateIs(Scenario.STARTED)
                .willSetStateTo("unavailable"), 200, "{\"status\":\"IN_QUEUE\"}");
        stubJson(get(urlPathEqualTo(STATUS_PATH)).inScenario("queue").whenScenarioStateIs("unavailable")
                .willSetStateTo("running"), 503, "{\"detail\":\"try again\"}");
        stubJson(get(urlPathEqualTo(STATUS_PATH)).inScenario("queue").whenScenarioStateIs("running")
                .willSetStateTo("done"), 200, "{\"status\":\"IN_PROGRESS\"}");
        stubJson(get(urlPathEqualTo(STATUS_PATH)).inScenario("queue").whenScenarioStateIs("done"), 200,
                "{\"status\":\"COMPLETED\"}");
        stubJson(get(urlPathEqualTo(REQUEST_PATH)), 200, loadStubFile("wiremock/fal/image-result.json"));

        String url = client.generateImage(image(FalClient.IMAGE_MODEL, null));

        assertEquals("https://v3.fal.media/files/lighthouse.png", url);
        wireMockServer.verify(4, getRequestedFor(urlPathEqualTo(STATUS_PATH)));
    }

    @Test
    void testFailedRequestReturnsNull() {
        stubSubmit(FalClient.IMAGE_MODEL);
        stubJson(get(urlPathEqualTo(STATUS_PATH)), 200, "{\"status\":\"FAILED\",\"error\":\"nsfw\"}");

        assertNull(client.generateImage(image(FalClient.IMAGE_MODEL, null)));
        wireMockServer.verify(0, getRequestedFor(urlPathEqualTo(REQUEST_PATH)));
    }

    @Test
    void testTimeoutReturnsNull() {
        client.maxWait = Duration.ofMillis(100);
        stubSubmit(FalClient.IMAGE_MODEL);
        stubJson(get(urlPathEqualTo(STATUS_PATH)), 200, "{\"status\":\"IN_PROGRESS\"}");

        assertNull(client.generateImage(image(FalClient.IMAGE_MODEL, null)));
    }

    @Test
    void testRateLimitOnSubmit() {
        stubJson(post(urlPathEqualTo("/" + FalClient.IMAGE_MODEL)), 429, "{\"detail\":\"rate limited\"}");

        assertThrows(RateLimitException.class, () -> client.generateImage(image(FalClient.IMAGE_MODEL, null)));
    }

    @Test
    void testServerErrorOnSubmit() {
        stubJson(post(urlPathEqualTo("/" + FalClient.IMAGE_MODEL)), 500, "{\"detail\":\"boom\"}");

        ProviderException thrown = assertThrows(ProviderException.class,
                () -> client.generateImage(image(FalClient.IMAGE_MODEL, null)));
        assertTrue(thrown.getMessage().contains("500"));
    }

    @Test
    void testMissingKeyIsUnavailable() {
        client.apiKey = Optional.of(" ");

        assertFalse(client.isAvailable());
        assertThrows(ProviderException.class, () -> client.generateImage(image(FalClient.IMAGE_MODEL, null)));
        assertTrue(wireMockServer.getAllServeEvents().isEmpty());
    }

    @Test
    void testGenerateVideo() {
        stubSubmit(FalClient.LONG_VIDEO_MODEL);
        stubJson(get(urlPathEqualTo(STATUS_PATH)), 200, "{\"status\":\"COMPLETED\"}");
        stubJson(get(urlPathEqualTo(REQUEST_PATH)), 200,
                "{\"video\":{\"url\":\"https://v3.fal.media/files/clip.mp4\"}}");

        String url = client.generateVideo(
                new VideoGenerationType(FalClient.LONG_VIDEO_MODEL, "waves crashing", 8, null));

        assertEquals("https://v3.fal.media/files/clip.mp4", url);
        wireMockServer.verify(postRequestedFor(urlPathEqualTo("/" + FalClient.LONG_VIDEO_MODEL))
                .withRequestBody(matchingJsonPath("$.duration", equalTo("10")))
                .withRequestBody(matchingJsonPath("$.aspect_ratio", equalTo("9:16"))));
    }

    @Test
    void testVideoModelForDuration() {
        assertEquals(FalClient.SHORT_VIDEO_MODEL, FalClient.videoModelForDuration(5));
        assertEquals(FalClient.SHORT_VIDEO_MODEL, FalClient.videoModelForDuration(6));
        assertEquals(FalClient.LONG_VIDEO_MODEL, FalClient.videoModelForDuration(7));
    }
}

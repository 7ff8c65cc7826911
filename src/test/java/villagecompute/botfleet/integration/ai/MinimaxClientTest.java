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

import java.time.Duration;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import villagecompute.botfleet.WireMockTestBase;
import villagecompute.botfleet.api.types.VideoGenerationType;

class MinimaxClientTest extends WireMockTestBase {

    private MinimaxClient client;

    @BeforeEach
    void setUp() {
        client = new MinimaxClient();
        client.objectMapper = new ObjectMapper();
        client.pollInterval = Duration.ofMillis(10);
        client.maxWait = Duration.ofSeconds(2);
        client.apiKey = Optional.of("mm-test-key");
        client.baseUrl = baseUrl();
    }

    private void stubCreate() {
        stubJson(post(urlPathEqualTo("/v1/video_generation")), 200,
                "{\"task_id\":\"m-1\",\"base_resp\":{\"status_code\":0,\"status_msg\":\"success\"}}");
    }

    private static VideoGenerationType request(int durationSec) {
        return new VideoGenerationType(MinimaxClient.MODEL, "paper boats drifting", durationSec, null);
    }

    @Test
    void testCreatePollAndResolveDownload() {
        stubCreate();
        stubJson(get(urlPathEqualTo("/v1/query/video_generation")).withQueryParam("task_id", equalTo("m-1")), 200,
                "{\"task_id\":\"m-1\",\"status\":\"Success\",\"file_id\":\"f-1\"}");
        stubJson(get(urlPathEqualTo("/v1/files/retrieve")).withQueryParam("file_id", equalTo("f-1")), 200,
                loadStubFile("wiremock/minimax/file-retrieve.json"));

        String url = client.generateVideo(request(5));

        assertEquals("https://public-cdn-video.minimax.io/output.mp4", url);
        wireMockServer.verify(postRequestedFor(urlPathEqualTo("/v1/video_generation"))
                .withHeader("Authorization", equalTo("Bearer mm-test-key"))
                .withRequestBody(matchingJsonPath("$.model", equalTo(MinimaxClient.MODEL)))
                .withRequestBody(matchingJsonPath("$.duration", equalTo("6")))
                .withRequestBody(matchingJsonPath("$.resolution", equalTo("768P"))));
    }

    @Test
    void testLongDurationRequestsTenSeconds() {
        stubJson(post(urlPathEqualTo("/v1/video_generation")), 200,
                "{\"task_id\":\"\",\"base_resp\":{\"status_code\":0,\"status_msg\":\"success\"}}");

        assertNull(client.generateVideo(request(9)));
        wireMockServer.verify(postRequestedFor(urlPathEqualTo("/v1/video_generation"))
                .withRequestBody(matchingJsonPath("$.duration", equalTo("10"))));
    }

    @Test
    void testCreateErrorReturnsNull() {
        stubJson(post(urlPathEqualTo("/v1/video_generation")), 200,
                "{\"task_id\":\"\",\"base_resp\":{\"status_code\":1008,\"status_msg\":\"insufficient balance\"}}");

        assertNull(client.generateVideo(request(5)));
        wireMockServer.verify(0, getRequestedFor(urlPathEqualTo("/v1/query/video_generation")));
    }

    @Test
    void testFailedTaskSkipsFileLookup() {
        stubCreate();
        stubJson(get(urlPathEqualTo("/v1/query/video_generation")), 200,
                "{\"task_id\":\"m-1\",\"status\":\"Failed\",\"base_resp\":{\"status_code\":0,\"status_msg\":\"\"}}");

        assertNull(client.generateVideo(request(5)));
        wireMockServer.verify(0, getRequestedFor(urlPathEqualTo("/v1/files/retrieve")));
    }

    @Test
    void testMissingDownloadUrlReturnsNull() {
        stubCreate();
        stubJson(get(urlPathEqualTo("/v1/query/video_generation")), 200,
                "{\"task_id\":\"m-1\",\"status\":\"Success\",\"file_id\":\"f-1\"}");
        stubJson(get(urlPathEqualTo("/v1/files/retrieve")), 404, "{}");

        assertNull(client.generateVideo(request(5)));
    }
}

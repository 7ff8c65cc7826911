/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.botfleet.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class CostTableTest {

    @Mock
    AiConfig aiConfig;

    @Mock
    Config config;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(aiConfig.getPremiumModelName()).thenReturn("premium-model");
        when(aiConfig.getStandardModelName()).thenReturn("standard-model");
        when(aiConfig.getVisionModelName()).thenReturn("vision-model");
        when(config.getPropertyNames()).thenReturn(List.of());
    }

    @Test
    void testExplicitEntries() {
        CostTable table = new CostTable(Map.of("model-a", 2.5));

        assertEquals(2.5, table.centsPerCall("model-a"));
        assertEquals(CostTable.UNKNOWN_MODEL_CENTS, table.centsPerCall("model-b"));
        assertEquals(CostTable.UNKNOWN_MODEL_CENTS, table.centsPerCall(null));
    }

    @Test
    void testDefaultsIncludeMediaAndChatModels() {
        CostTable table = new CostTable(aiConfig, config);

        assertEquals(3.0, table.centsPerCall("fal-ai/flux/dev"));
        assertEquals(50.0, table.centsPerCall("gen3a_turbo"));
        assertEquals(1.5, table.centsPerCall("premium-model"));
        assertEquals(0.15, table.centsPerCall("standard-model"));
        assertEquals(1.5, table.centsPerCall("vision-model"));
    }

    @Test
    void testVisionSharingStandardModelKeepsStandardCost() {
        when(aiConfig.getVisionModelName()).thenReturn("standard-model");

        CostTable table = new CostTable(aiConfig, config);

        assertEquals(0.15, table.centsPerCall("standard-model"));
    }

    @Test
    void testConfiguredOverrides() {
        when(config.getPropertyNames()).thenReturn(List.of("botfleet.costs.flux.model", "botfleet.costs.flux.cents",
                "botfleet.costs.custom.model", "botfleet.costs.custom.cents", "botfleet.costs.broken.model",
                "botfleet.jobs.max-attempts"));
        when(config.getValue("botfleet.costs.flux.model", String.class)).thenReturn("fal-ai/flux/dev");
        when(config.getOptionalValue("botfleet.costs.flux.cents", Double.class)).thenReturn(Optional.of(2.0));
        when(config.getValue("botfleet.costs.custom.model", String.class)).thenReturn("acme/video-x");
        when(config.getOptionalValue("botfleet.costs.custom.cents", Double.class)).thenReturn(Optional.of(42.0));
        when(config.getValue("botfleet.costs.broken.model", String.class)).thenReturn("acme/broken");
        when(config.getOptionalValue("botfleet.costs.broken.cents", Double.class)).thenReturn(Optional.empty());

        CostTable table = new CostTable(aiConfig, config);

        assertEquals(2.0, table.centsPerCall("fal-ai/flux/dev"));
        assertEquals(42.0, table.centsPerCall("acme/video-x"));
        assertEquals(CostTable.UNKNOWN_MODEL_CENTS, table.centsPerCall("acme/broken"));
        assertEquals(4.0, table.centsPerCall("fal-ai/flux-general"));
    }
}

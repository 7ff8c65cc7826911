/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.botfleet.config;

import java.util.HashMap;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.Config;
import org.jboss.logging.Logger;

/**
 * Static model → cents-per-call table consumed read-only by the telemetry service.
 *
 * <p>
 * Built-in entries can be overridden or extended with {@code botfleet.costs.<alias>.model} /
 * {@code botfleet.costs.<alias>.cents} pairs (model ids contain slashes, so they cannot be property keys themselves).
 * Chat model costs are keyed by whatever names {@link AiConfig} resolves.
 */
@ApplicationScoped
public class CostTable {

    private static final Logger LOG = Logger.getLogger(CostTable.class);

    private static final String PREFIX = "botfleet.costs.";

    /** Cost charged for a model missing from the table. */
    public static final double UNKNOWN_MODEL_CENTS = 1.0;

    static final Map<String, Double> DEFAULT_MEDIA_COSTS = Map.of(
            "fal-ai/flux/dev", 3.0,
            "fal-ai/flux-general", 4.0,
            "fal-ai/kling-video/v2/master/text-to-video", 15.0,
            "fal-ai/minimax-video/video-01/text-to-video", 20.0,
            "gen3a_turbo", 50.0,
            "kling-v2-master", 15.0,
            "MiniMax-Hailuo-2.3", 20.0);

    private final Map<String, Double> centsPerCall;

    /**
     * CDI constructor: defaults for media models, premium/standard/vision chat costs, then configured overrides.
     */
    @Inject
    public CostTable(AiConfig aiConfig, Config config) {
        Map<String, Double> table = new HashMap<>(DEFAULT_MEDIA_COSTS);
        table.put(aiConfig.getStandardModelName(), 0.15);
        table.put(aiConfig.getPremiumModelName(), 1.5);
        table.putIfAbsent(aiConfig.getVisionModelName(), 1.5);
        applyOverrides(table, config);
        this.centsPerCall = Map.copyOf(table);
        LOG.infof("Cost table loaded with %d models", centsPerCall.size());
    }

    /**
     * Creates a table from explicit entries.
     */
    public CostTable(Map<String, Double> centsPerCall) {
        this.centsPerCall = Map.copyOf(centsPerCall);
    }

    /**
     * Returns the cost of one successful call, or {@link #UNKNOWN_MODEL_CENTS} for models not in the table.
     */
    public double centsPerCall(String model) {
        if (model == null) {
            return UNKNOWN_MODEL_CENTS;
        }
        return centsPerCall.getOrDefault(model, UNKNOWN_MODEL_CENTS);
    }

    private static void applyOverrides(Map<String, Double> table, Config config) {
        for (String name : config.getPropertyNames()) {
            if (!name.startsWith(PREFIX) || !name.endsWith(".model")) {
                continue;
            }
            String alias = name.substring(PREFIX.length(), name.length() - ".model".length());
            String model = config.getValue(name, String.class);
            config.getOptionalValue(PREFIX + alias + ".cents", Double.class).ifPresentOrElse(cents -> {
                table.put(model, cents);
                LOG.debugf("Cost override %s: %s = %.2f cents", alias, model, cents);
            }, () -> LOG.warnf("Cost override %s has a model but no cents value; ignored", alias));
        }
    }
}

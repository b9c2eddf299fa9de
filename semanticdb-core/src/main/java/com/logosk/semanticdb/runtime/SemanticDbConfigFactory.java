package com.logosk.semanticdb.runtime;

import com.logosk.semanticdb.coherence.CoherenceEngine;
import com.logosk.semanticdb.dreaming.DreamingEngine;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Map;

/**
 * Loads {@link SemanticDbConfig} outside of any container: system properties,
 * environment and {@code META-INF/microprofile-config.properties}, plus optional
 * in-memory overrides that win over all of them.
 */
public final class SemanticDbConfigFactory {

    private static final Logger LOG = Logger.getLogger(SemanticDbConfigFactory.class);
    private static final int OVERRIDE_ORDINAL = 500;

    private SemanticDbConfigFactory() {
    }

    public static SemanticDbConfig load() {
        return load(Map.of());
    }

    public static SemanticDbConfig load(Map<String, String> overrides) {
        SmallRyeConfigBuilder builder = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .withMapping(SemanticDbConfig.class);
        if (overrides != null && !overrides.isEmpty()) {
            builder.withSources(new PropertiesConfigSource(overrides, "semanticdb-overrides", OVERRIDE_ORDINAL));
        }
        SmallRyeConfig config = builder.build();
        SemanticDbConfig mapping = config.getConfigMapping(SemanticDbConfig.class);
        LOG.debugf("Loaded configuration for operator %s (%s)", mapping.operatorId(), mapping.protocol());
        return mapping;
    }

    public static CoherenceEngine.Settings coherenceSettings(SemanticDbConfig config) {
        SemanticDbConfig.Coherence c = config.coherence();
        return new CoherenceEngine.Settings(c.healthyThreshold(), c.warningThreshold(), c.crisisThreshold(),
                c.historyCap(), c.historyRetain(), c.cycleStepBudget(),
                Duration.ofMillis(c.cycleTimeBudgetMillis()), c.maxCycles());
    }

    public static DreamingEngine.Settings dreamingSettings(SemanticDbConfig config) {
        SemanticDbConfig.Dreaming d = config.dreaming();
        return new DreamingEngine.Settings(d.structuralHoleThreshold(), d.similarityThreshold(),
                d.pathCompletionThreshold(), d.defaultHopConfidence(), d.maxSuggestions());
    }
}

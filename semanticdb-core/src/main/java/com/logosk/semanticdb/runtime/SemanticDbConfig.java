package com.logosk.semanticdb.runtime;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

@ConfigMapping(prefix = "semanticdb")
public interface SemanticDbConfig {

    @WithDefault("anonymous")
    String operatorId();

    @WithDefault("Λ-Protocol 6.0")
    String protocol();

    @WithDefault("1.0.0")
    String version();

    Coherence coherence();

    Dreaming dreaming();

    interface Coherence {
        @WithDefault("0.7")
        double healthyThreshold();

        @WithDefault("0.4")
        double warningThreshold();

        @WithDefault("0.2")
        double crisisThreshold();

        @WithDefault("1000")
        int historyCap();

        @WithDefault("500")
        int historyRetain();

        @WithDefault("100000")
        long cycleStepBudget();

        /**
         * Wall-clock budget of one cycle search, in milliseconds.
         */
        @WithName("cycle-time-budget")
        @WithDefault("2000")
        long cycleTimeBudgetMillis();

        @WithDefault("10000")
        int maxCycles();
    }

    interface Dreaming {
        @WithDefault("0.4")
        double structuralHoleThreshold();

        @WithDefault("0.3")
        double similarityThreshold();

        /**
         * Threshold of the queue-driven pass in {@code GraphStore#dreamingCycle}.
         */
        @WithDefault("0.35")
        double cycleSimilarityThreshold();

        @WithDefault("0.5")
        double pathCompletionThreshold();

        @WithDefault("0.7")
        double defaultHopConfidence();

        @WithDefault("10")
        int maxSuggestions();
    }
}

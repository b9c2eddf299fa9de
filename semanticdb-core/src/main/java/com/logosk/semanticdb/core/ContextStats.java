package com.logosk.semanticdb.core;

import java.time.Instant;

/**
 * Aggregate statistics of one context id: when it was first seen, how many new edge
 * records it contributed and their running mean confidence.
 */
public final class ContextStats {

    private final String contextId;
    private final Instant createdAt;
    private long edgeCount;
    private double meanConfidence;

    ContextStats(String contextId, Instant createdAt) {
        this.contextId = contextId;
        this.createdAt = createdAt;
    }

    void record(double confidence) {
        edgeCount++;
        meanConfidence += (confidence - meanConfidence) / edgeCount;
    }

    public String getContextId() { return contextId; }
    public Instant getCreatedAt() { return createdAt; }
    public long getEdgeCount() { return edgeCount; }
    public double getMeanConfidence() { return meanConfidence; }
}

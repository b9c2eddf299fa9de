package com.logosk.semanticdb.core;

import com.logosk.semanticdb.exceptions.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class GraphStoreTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);
    private GraphStore store;

    @BeforeEach
    public void setUp() {
        store = new GraphStore(clock);
    }

    private EdgeRecord edge(String s, String t, String meaning, double confidence) {
        return EdgeRecord.builder().source(s).target(t).meaning(meaning).confidence(confidence).clock(clock).build();
    }

    @Test
    public void testAddNodeAssignsWeightId() {
        String weightId = store.addNode("love");
        assertTrue(weightId.matches("N_love_[0-9a-f]{8}"), weightId);
        assertEquals(weightId, store.getNode("love").orElseThrow().getWeightId());
        assertEquals("entity", store.getNode("love").orElseThrow().getType());

        assertEquals("W1", store.addNode("fear", Map.of("weight_id", "W1", "domain", "psyche")));
        assertEquals("psyche", store.getNode("fear").orElseThrow().getDomain());
    }

    @Test
    public void testReAddingNodeKeepsSlot() {
        store.addNode("A", Map.of("meaning", "first"));
        store.addEdge(edge("A", "B", "x", 0.8));
        store.addNode("A", Map.of("meaning", "second", "colour", "red"));

        assertEquals(2, store.nodeCount());
        NodeRecord a = store.getNode("A").orElseThrow();
        assertEquals("second", a.getMeaning());
        assertEquals("red", a.toAttributes().get("colour"));
        assertEquals(Set.of("B"), store.successors("A"));
    }

    @Test
    public void testRejectsInvalidInput() {
        assertThrows(ValidationException.class, () -> store.addNode(" "));
        assertThrows(ValidationException.class, () -> store.addEdge(null));
        assertThrows(ValidationException.class, () -> store.addEdge(edge("A", "B", "x", 0.8), ""));
    }

    @Test
    public void testAddEdgeCreatesEndpoints() {
        String id = store.addEdge(edge("A", "B", "x", 0.8));
        assertTrue(store.hasNode("A"));
        assertTrue(store.hasNode("B"));
        assertEquals(1, store.edgeCount());
        assertSame(store.getEdgeById(id).orElseThrow(), store.getEdge("A", "B", RelationKind.LAMBDA).orElseThrow());
        assertTrue(store.getEdge("A", "B", RelationKind.OMEGA).isEmpty());
        assertTrue(store.getEdge("B", "A", RelationKind.LAMBDA).isEmpty());
        assertTrue(store.hasEdgeEitherDirection("B", "A"));
        assertTrue(store.contextStats().containsKey(GraphStore.DEFAULT_CONTEXT));
    }

    @Test
    public void testSameMeaningMergesAcrossContexts() {
        String first = store.addEdge(edge("A", "B", "x", 0.8), "ctx1");
        String second = store.addEdge(edge("A", "B", "x", 0.8), "ctx2");

        assertEquals(first, second);
        assertEquals(1, store.edgeCount());
        EdgeRecord merged = store.getEdgeById(first).orElseThrow();
        assertTrue(merged.getConfidenceByContext().containsKey("ctx1"));
        assertTrue(merged.getConfidenceByContext().containsKey("ctx2"));
        assertEquals(2, merged.getActivationCount());
        assertEquals(1, store.contextStats().get("ctx1").getEdgeCount());
        assertEquals(0, store.contextStats().get("ctx2").getEdgeCount());
    }

    @Test
    public void testAutoMergeOffKeepsBothRecords() {
        store.addEdge(edge("A", "B", "x", 0.8), "c", false);
        store.addEdge(edge("A", "B", "x", 0.8), "c", false);
        assertEquals(2, store.edgeCount());
        assertEquals(2, store.edgesBetween("A", "B").size());
    }

    @Test
    public void testMeaningConflictMarksBothRecords() {
        String p = store.addEdge(edge("A", "B", "p", 0.8));
        String q = store.addEdge(edge("A", "B", "q", 0.7));

        assertEquals(2, store.edgeCount());
        assertEquals(Set.of(p, q), store.conflictZones());
    }

    @Test
    public void testWeakIncomingRecordDoesNotConflict() {
        store.addEdge(edge("A", "B", "p", 0.8));
        store.addEdge(edge("A", "B", "q", 0.5));
        assertTrue(store.conflictZones().isEmpty());

        EdgeRecord other = EdgeRecord.builder().source("A").target("B").type(RelationKind.OMEGA)
                .meaning("boundary").confidence(0.9).clock(clock).build();
        store.addEdge(other);
        assertTrue(store.conflictZones().isEmpty());
    }

    @Test
    public void testConflictZoneFollowsMergedRecord() {
        String p = store.addEdge(edge("A", "B", "p", 0.8));
        String q = store.addEdge(edge("A", "B", "q", 0.8));
        EdgeRecord again = edge("A", "B", "p", 0.8);
        String stored = store.addEdge(again);

        assertEquals(p, stored);
        assertEquals(Set.of(p, q), store.conflictZones());
        assertFalse(store.conflictZones().contains(again.getId()));
    }

    @Test
    public void testStoringSameRecordTwiceFails() {
        EdgeRecord r = edge("A", "B", "x", 0.8);
        String id = store.addEdge(r, "c1", false);
        store.addEdge(edge("A", "B", "y", 0.4), "c1", false);
        assertTrue(store.conflictZones().isEmpty());

        EdgeRecord stored = store.getEdgeById(id).orElseThrow();
        long activations = stored.getActivationCount();
        Map<String, Double> confidences = Map.copyOf(stored.getConfidenceByContext());
        long total = store.totalActivations();

        assertThrows(ValidationException.class, () -> store.addEdge(r, "c2", false));
        assertThrows(ValidationException.class, () -> store.addEdge(r, "c2", true));

        assertEquals(activations, stored.getActivationCount());
        assertEquals(confidences, stored.getConfidenceByContext());
        assertEquals(Set.of("c1"), store.contextStats().keySet());
        assertTrue(store.conflictZones().isEmpty());
        assertEquals(total, store.totalActivations());
        assertEquals(2, store.edgeCount());
        assertEquals(0, r.getActivationCount());
    }

    @Test
    public void testStoreHoldsItsOwnCopy() {
        EdgeRecord r = edge("A", "B", "x", 0.8);
        String id = store.addEdge(r);
        assertEquals(0, r.getActivationCount());

        r.activate("elsewhere");
        EdgeRecord stored = store.getEdgeById(id).orElseThrow();
        assertNotSame(r, stored);
        assertEquals(1, stored.getActivationCount());
        assertFalse(stored.getConfidenceByContext().containsKey("elsewhere"));

        store.addEdge(edge("A", "B", "q", 0.8));
        store.addEdge(edge("A", "B", "q", 0.8));
        assertEquals(2, store.edgesBetween("A", "B").size());
        assertEquals(List.of("x", "q"), store.edgesBetween("A", "B").stream().map(EdgeRecord::getMeaning).toList());
    }

    @Test
    public void testAdjacencyViews() {
        store.addEdge(edge("A", "B", "x", 0.8));
        store.addEdge(edge("A", "C", "y", 0.8));
        store.addEdge(edge("D", "A", "z", 0.8));

        assertEquals(Set.of("B", "C"), store.successors("A"));
        assertEquals(Set.of("D"), store.predecessors("A"));
        assertEquals(Set.of("B", "C", "D"), store.neighbors("A"));
        assertEquals(2, store.outgoingEdges("A").size());
        assertEquals(1, store.incomingEdges("A").size());
        assertTrue(store.successors("missing").isEmpty());
        assertEquals(List.of("A", "B", "C", "D"), store.nodeIds());
    }

    @Test
    public void testContextStatistics() {
        store.addEdge(edge("A", "B", "x", 0.8), "c");
        store.addEdge(edge("B", "C", "y", 0.8), "c");
        ContextStats stats = store.contextStats().get("c");
        assertEquals(2, stats.getEdgeCount());
        assertTrue(stats.getMeanConfidence() > 0.0 && stats.getMeanConfidence() <= 1.0);
        assertEquals(2, store.totalActivations());

        Map<String, Object> summary = store.statistics();
        assertEquals(3, summary.get("nodes"));
        assertEquals(2, summary.get("edges"));
        assertEquals(1, summary.get("contexts"));
        assertNull(summary.get("last_dreaming"));
    }

    @Test
    public void testSnapshotRoundTrip() {
        store.addNode("lonely", Map.of("domain", "psyche"));
        String ab = store.addEdge(edge("A", "B", "x", 0.8));
        String bc = store.addEdge(edge("B", "C", "y", 0.6), "c");

        GraphSnapshot snapshot = store.exportSnapshot();
        assertEquals(GraphStore.SNAPSHOT_VERSION, snapshot.metadata().get("version"));

        GraphStore restored = new GraphStore(clock);
        restored.importSnapshot(snapshot);
        assertEquals(store.nodeCount(), restored.nodeCount());
        assertEquals(store.edgeCount(), restored.edgeCount());
        assertTrue(restored.getEdgeById(ab).isPresent());
        assertTrue(restored.getEdgeById(bc).orElseThrow().getConfidenceByContext().containsKey("c"));
        assertEquals("psyche", restored.getNode("lonely").orElseThrow().getDomain());
        assertEquals(store.getNode("A").orElseThrow().getWeightId(), restored.getNode("A").orElseThrow().getWeightId());
        assertTrue(restored.contextStats().containsKey(GraphStore.RESTORED_CONTEXT));
    }

    @Test
    public void testImportReplacesContent() {
        store.addEdge(edge("X", "Y", "x", 0.8));
        store.importSnapshot(new GraphSnapshot(null, Map.of("Z", Map.of()), null));
        assertEquals(List.of("Z"), store.nodeIds());
        assertEquals(0, store.edgeCount());
        assertThrows(ValidationException.class, () -> store.importSnapshot(null));
    }

    @Test
    public void testDreamingCycleNeedsThreeNodes() {
        store.addEdge(edge("A", "B", "x", 0.8));
        assertTrue(store.dreamingCycle().isEmpty());
    }

    @Test
    public void testDreamingCycleProposesSharedNeighbourLink() {
        store.addEdge(edge("A", "B", "x", 0.8));
        store.addEdge(edge("C", "B", "x", 0.8));
        store.addEdge(edge("A", "D", "x", 0.8));
        store.addEdge(edge("C", "D", "x", 0.8));

        List<EdgeRecord> suggestions = store.dreamingCycle();
        assertEquals(1, suggestions.size());
        EdgeRecord s = suggestions.get(0);
        assertEquals("A", s.getSource());
        assertEquals("C", s.getTarget());
        assertEquals("hypothesis: shared neighbors (2)", s.getMeaning());
        assertTrue(s.isSuggested());
        assertEquals(0.1, s.getTension(), 1e-9);
        assertEquals(4, store.edgeCount());
        assertTrue(store.lastDreaming().isPresent());
        for (EdgeRecord r : suggestions) {
            assertFalse(store.hasEdgeEitherDirection(r.getSource(), r.getTarget()));
        }
    }

    @Test
    public void testClear() {
        store.addEdge(edge("A", "B", "p", 0.8));
        store.addEdge(edge("A", "B", "q", 0.8));
        store.clear();
        assertEquals(0, store.nodeCount());
        assertEquals(0, store.edgeCount());
        assertTrue(store.conflictZones().isEmpty());
        assertTrue(store.contextStats().isEmpty());
    }
}

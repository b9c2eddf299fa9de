package com.logosk.semanticdb.dreaming;

import com.logosk.semanticdb.core.EdgeRecord;
import com.logosk.semanticdb.core.EthicalStatus;
import com.logosk.semanticdb.core.GraphStore;
import com.logosk.semanticdb.exceptions.InvalidAcceptanceException;
import com.logosk.semanticdb.exceptions.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class DreamingEngineTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);
    private GraphStore store;
    private DreamingEngine engine;

    @BeforeEach
    public void setUp() {
        store = new GraphStore(clock);
        engine = new DreamingEngine(store);
    }

    private void link(String s, String t, double confidence) {
        store.addEdge(EdgeRecord.builder().source(s).target(t).meaning(s + "-" + t).confidence(confidence)
                .clock(clock).build());
    }

    @Test
    public void testStructuralHole() {
        link("H", "X", 0.8);
        link("H", "Y", 0.8);

        List<EdgeRecord> suggestions = engine.generateSuggestions();
        assertEquals(1, suggestions.size());
        EdgeRecord s = suggestions.get(0);
        assertEquals("X", s.getSource());
        assertEquals("Y", s.getTarget());
        assertEquals("hypothesis: structural hole via H", s.getMeaning());
        assertEquals(1.0, s.getConfidence(), 1e-9);
        assertEquals(0.1, s.getTension(), 1e-9);
        assertEquals(EdgeRecord.DREAMING_INTENTION, s.getIntention());
        assertEquals(EthicalStatus.DREAMING, s.getStatus());
        assertTrue(s.isSuggested());
        assertEquals(2, store.edgeCount());
    }

    @Test
    public void testNeighbourSimilarityFollowsStructuralHoles() {
        link("A", "C", 0.8);
        link("B", "C", 0.8);
        link("A", "D", 0.8);
        link("B", "D", 0.8);

        List<EdgeRecord> suggestions = engine.generateSuggestions();
        assertEquals(2, suggestions.size());
        assertEquals("hypothesis: structural hole via A", suggestions.get(0).getMeaning());
        assertEquals(Set.of("C", "D"), Set.of(suggestions.get(0).getSource(), suggestions.get(0).getTarget()));
        assertEquals("hypothesis: neighbor similarity (J=1.00)", suggestions.get(1).getMeaning());
        assertEquals(Set.of("A", "B"), Set.of(suggestions.get(1).getSource(), suggestions.get(1).getTarget()));
        assertEquals(0.05, suggestions.get(1).getTension(), 1e-9);
    }

    @Test
    public void testPathCompletion() {
        DreamingEngine strict = new DreamingEngine(store, clock, new DreamingEngine.Settings(0.4, 1.0, 0.5, 0.7, 10));
        link("A", "M", 0.9);
        link("M", "B", 0.9);

        List<EdgeRecord> suggestions = strict.generateSuggestions();
        assertEquals(1, suggestions.size());
        EdgeRecord s = suggestions.get(0);
        assertEquals("A", s.getSource());
        assertEquals("B", s.getTarget());
        assertEquals("hypothesis: path completion via M", s.getMeaning());
        double expected = (store.edgesBetween("A", "M").get(0).getConfidence()
                + store.edgesBetween("M", "B").get(0).getConfidence()) / 2.0;
        assertEquals(expected, s.getConfidence(), 1e-9);
    }

    @Test
    public void testWeakPathIsNotCompleted() {
        DreamingEngine strict = new DreamingEngine(store, clock, new DreamingEngine.Settings(0.4, 1.0, 0.5, 0.7, 10));
        link("A", "M", 0.3);
        link("M", "B", 0.3);
        assertTrue(strict.generateSuggestions().isEmpty());
    }

    @Test
    public void testNeverSuggestsConnectedPairs() {
        String[][] edges = {{"a", "b"}, {"a", "c"}, {"a", "d"}, {"b", "c"}, {"c", "e"}, {"d", "e"}, {"e", "f"},
                {"f", "a"}, {"b", "g"}, {"g", "d"}};
        for (String[] e : edges) {
            link(e[0], e[1], 0.8);
        }
        List<EdgeRecord> suggestions = engine.generateSuggestions(50);
        assertFalse(suggestions.isEmpty());
        Set<Set<String>> seen = new HashSet<>();
        for (EdgeRecord s : suggestions) {
            assertFalse(store.hasEdgeEitherDirection(s.getSource(), s.getTarget()), s.toString());
            assertNotEquals(s.getSource(), s.getTarget());
            assertTrue(seen.add(Set.of(s.getSource(), s.getTarget())), "duplicate pair " + s);
            assertTrue(s.getConfidence() >= 0.0 && s.getConfidence() <= 1.0);
        }
        assertEquals(10, store.edgeCount());
    }

    @Test
    public void testRespectsMaximum() {
        for (String leaf : List.of("a", "b", "c", "d", "e")) {
            link("hub", leaf, 0.8);
        }
        assertEquals(3, engine.generateSuggestions(3).size());
        assertTrue(engine.generateSuggestions(0).isEmpty());
    }

    @Test
    public void testAcceptSuggestion() {
        link("H", "X", 0.8);
        link("H", "Y", 0.8);
        EdgeRecord suggestion = engine.generateSuggestions().get(0);

        String id = engine.acceptSuggestion(suggestion);
        EdgeRecord stored = store.getEdgeById(id).orElseThrow();
        assertFalse(stored.isSuggested());
        assertEquals(EthicalStatus.ACTIVE, stored.getStatus());
        assertEquals("accepted hypothesis: structural hole via H", stored.getMeaning());
        assertTrue(stored.getConfidenceByContext().containsKey(DreamingEngine.ACCEPTED_CONTEXT));
        assertTrue(store.hasEdge("X", "Y"));
        assertEquals(3, store.edgeCount());

        assertTrue(suggestion.isSuggested());
        assertThrows(ValidationException.class, () -> engine.acceptSuggestion(suggestion));
        assertEquals(3, store.edgeCount());
    }

    @Test
    public void testAcceptRejectsOrdinaryRecords() {
        EdgeRecord plain = EdgeRecord.builder().source("A").target("B").clock(clock).build();
        assertThrows(InvalidAcceptanceException.class, () -> engine.acceptSuggestion(plain));
        assertThrows(InvalidAcceptanceException.class, () -> engine.acceptSuggestion(null));
        assertEquals(0, store.edgeCount());
    }

    @Test
    public void testStats() {
        link("H", "X", 0.8);
        DreamingStats waiting = engine.stats();
        assertEquals(DreamingStats.WAITING, waiting.status());
        assertNull(waiting.lastRun());

        link("H", "Y", 0.8);
        engine.generateSuggestions();
        DreamingStats ready = engine.stats();
        assertEquals(DreamingStats.READY, ready.status());
        assertEquals(1, ready.totalSuggestions());
        assertEquals(clock.instant(), ready.lastRun());
        assertEquals(3, ready.nodes());
        assertEquals(2, ready.edges());
        assertEquals("ready", ready.toMap().get("status"));
    }
}

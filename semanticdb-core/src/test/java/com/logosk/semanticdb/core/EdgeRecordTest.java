package com.logosk.semanticdb.core;

import com.logosk.semanticdb.exceptions.IncompatibleMergeException;
import com.logosk.semanticdb.exceptions.UnknownGestureException;
import com.logosk.semanticdb.exceptions.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class EdgeRecordTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    private EdgeRecord edge(String meaning, double confidence) {
        return EdgeRecord.builder().source("A").target("B").meaning(meaning).confidence(confidence).clock(clock).build();
    }

    @Test
    public void testDefaults() {
        EdgeRecord r = EdgeRecord.builder().source("A").target("B").clock(clock).build();
        assertEquals(RelationKind.LAMBDA, r.getType());
        assertEquals(0.7, r.getConfidence(), 1e-9);
        assertEquals(0.0, r.getTension(), 1e-9);
        assertEquals(0.7, r.getCoherenceContribution(), 1e-9);
        assertTrue(r.getId().matches("HW_[0-9a-f]{12}"));
        assertEquals(EthicalStatus.ACTIVE, r.getStatus());
        assertEquals(NOW.plus(Duration.ofDays(365)), r.getLifespan());
        assertEquals(Map.of(EdgeRecord.GENESIS_CONTEXT, 0.7), r.getConfidenceByContext());
        assertFalse(r.isSuggested());
    }

    @Test
    public void testRejectsBadInput() {
        assertThrows(ValidationException.class, () -> EdgeRecord.builder().source(" ").target("B").build());
        assertThrows(ValidationException.class, () -> EdgeRecord.builder().source("A").target(null).build());
        assertThrows(ValidationException.class, () -> edge("x", 1.2));
        assertThrows(ValidationException.class,
                () -> EdgeRecord.builder().source("A").target("B").tension(-0.1).build());
        assertThrows(ValidationException.class, () -> edge("x", 0.5).activate(""));
    }

    @Test
    public void testActivateNudgesAndFoldsContext() {
        EdgeRecord r = edge("x", 0.7);
        r.activate("ctx");
        assertEquals(1, r.getActivationCount());
        assertEquals(0.714, r.getConfidenceByContext().get("ctx"), 1e-9);
        assertEquals((0.7 + 0.714) / 2, r.getConfidence(), 1e-9);
    }

    @Test
    public void testActivationNeverPassesCeiling() {
        EdgeRecord r = edge("x", 0.94);
        for (int i = 0; i < 100; i++) {
            r.activate("ctx");
            assertTrue(r.getConfidence() <= 0.95);
            assertTrue(r.getConfidence() >= 0.0);
            assertTrue(r.getCoherenceContribution() >= 0.0 && r.getCoherenceContribution() <= 1.0);
        }
        assertEquals(100, r.getActivationCount());
    }

    @Test
    public void testContextTensionIsMonotonic() {
        EdgeRecord r = edge("x", 0.8);
        r.updateFromContext("c", 0.8, 0.9);
        r.updateFromContext("c", 0.8, 0.1);
        assertEquals(0.9, r.getTensionByContext().get("c"), 1e-9);
        assertEquals(0.9, r.getTension(), 1e-9);
        assertEquals(EthicalStatus.CONFLICTED, r.getStatus());
        assertEquals(2, r.getActivationCount());
    }

    @Test
    public void testConfidenceIsMeanOfContexts() {
        EdgeRecord r = edge("x", 0.6);
        r.updateFromContext("a", 0.9);
        r.updateFromContext("b", 0.3);
        double mean = r.getConfidenceByContext().values().stream().mapToDouble(Double::doubleValue).average().orElseThrow();
        assertEquals(mean, r.getConfidence(), 1e-9);
        double max = r.getTensionByContext().values().stream().mapToDouble(Double::doubleValue).max().orElseThrow();
        assertEquals(max, r.getTension(), 1e-9);
    }

    @Test
    public void testSplitScalesAndLinks() {
        EdgeRecord parent = edge("x", 0.7);
        EdgeRecord child = parent.split("weaker", RelationKind.SIGMA);

        assertEquals("variant: weaker", child.getMeaning());
        assertEquals("split from " + parent.getId(), child.getIntention());
        assertEquals(RelationKind.SIGMA, child.getType());
        assertEquals(0.56, child.getConfidence(), 1e-9);
        assertEquals(List.of(parent.getId()), child.getParentIds());
        assertEquals(List.of(child.getId()), parent.getChildIds());
        assertEquals(parent.getSource(), child.getSource());
        assertEquals(parent.getTarget(), child.getTarget());
    }

    @Test
    public void testMergeAveragesAndRecordsParents() {
        EdgeRecord p = edge("p", 0.8);
        EdgeRecord q = EdgeRecord.builder().source("A").target("B").meaning("q").confidence(0.6).tension(0.3)
                .clock(clock).build();
        q.updateFromContext("only_q", 0.6);

        EdgeRecord merged = p.mergeWith(q);
        assertEquals("Σ(p, q)", merged.getMeaning());
        assertEquals(List.of(p.getId(), q.getId()), merged.getParentIds());
        assertEquals(0.3, merged.getTension(), 1e-9);
        assertEquals(0.7, merged.getConfidenceByContext().get(EdgeRecord.GENESIS_CONTEXT), 1e-9);
        assertEquals(q.getConfidenceByContext().get("only_q") / 2, merged.getConfidenceByContext().get("only_q"), 1e-9);
    }

    @Test
    public void testMergeKeepsOnlyParentContexts() {
        Map<String, Object> left = edge("p", 0.8).toDocument();
        left.put("confidence_by_context", Map.of("a", 0.8));
        left.put("tension_by_context", Map.of("a", 0.1));
        Map<String, Object> right = edge("q", 0.6).toDocument();
        right.put("confidence_by_context", Map.of("b", 0.6));
        right.put("tension_by_context", Map.of("b", 0.2));

        EdgeRecord merged = EdgeRecord.fromDocument(left, clock).mergeWith(EdgeRecord.fromDocument(right, clock));
        assertEquals(Set.of("a", "b"), merged.getConfidenceByContext().keySet());
        assertEquals(Set.of("a", "b"), merged.getTensionByContext().keySet());
        assertEquals(0.35, merged.getConfidence(), 1e-9);
        assertEquals(0.2, merged.getTension(), 1e-9);
    }

    @Test
    public void testMergeRequiresSameKey() {
        EdgeRecord p = edge("p", 0.8);
        EdgeRecord other = EdgeRecord.builder().source("A").target("C").meaning("p").clock(clock).build();
        IncompatibleMergeException ex = assertThrows(IncompatibleMergeException.class, () -> p.mergeWith(other));
        assertEquals(p.getId(), ex.getLeftId());
        assertEquals(other.getId(), ex.getRightId());

        EdgeRecord otherType = EdgeRecord.builder().source("A").target("B").type(RelationKind.OMEGA).clock(clock).build();
        assertThrows(IncompatibleMergeException.class, () -> p.mergeWith(otherType));
    }

    @Test
    public void testSleepingAfterThirtyQuietDays() {
        Map<String, Object> doc = edge("x", 0.7).toDocument();
        doc.put("created_at", NOW.minus(Duration.ofDays(40)).toString());
        doc.put("activation_count", 0);
        EdgeRecord restored = EdgeRecord.fromDocument(doc, clock);
        assertEquals(EthicalStatus.SLEEPING, restored.getStatus());
    }

    @Test
    public void testShouldDecay() {
        Map<String, Object> doc = edge("x", 0.7).toDocument();
        doc.put("lifespan", NOW.minus(Duration.ofDays(1)).toString());
        doc.put("last_activated", NOW.minus(Duration.ofDays(100)).toString());
        doc.put("tension", 0.95);
        doc.put("tension_by_context", Map.of(EdgeRecord.GENESIS_CONTEXT, 0.95));
        assertTrue(EdgeRecord.fromDocument(doc, clock).shouldDecay());

        doc.put("tension_by_context", Map.of(EdgeRecord.GENESIS_CONTEXT, 0.5));
        assertFalse(EdgeRecord.fromDocument(doc, clock).shouldDecay());

        assertFalse(edge("x", 0.7).shouldDecay());
    }

    @Test
    public void testDocumentRoundTrip() {
        EdgeRecord r = EdgeRecord.builder().source("A").target("B").type(RelationKind.NABLA).meaning("m")
                .intention("why").confidence(0.9).clock(clock).build();
        r.updateFromContext("c1", 0.8, 0.2);
        EdgeRecord child = r.split("v");

        Map<String, Object> doc = r.toDocument();
        assertEquals("∇", doc.get("type"));
        assertEquals("active", doc.get("ethical_status"));

        EdgeRecord restored = EdgeRecord.fromDocument(doc, clock);
        assertEquals(r.getId(), restored.getId());
        assertEquals(RelationKind.NABLA, restored.getType());
        assertEquals(r.getConfidenceByContext(), restored.getConfidenceByContext());
        assertEquals(r.getTensionByContext(), restored.getTensionByContext());
        assertEquals(r.getConfidence(), restored.getConfidence(), 1e-9);
        assertEquals(r.getActivationCount(), restored.getActivationCount());
        assertEquals(List.of(child.getId()), restored.getChildIds());
        assertEquals(r.getCreatedAt(), restored.getCreatedAt());
    }

    @Test
    public void testFromDocumentRejectsUnknownKind() {
        Map<String, Object> doc = edge("x", 0.7).toDocument();
        doc.put("type", "?");
        assertThrows(UnknownGestureException.class, () -> EdgeRecord.fromDocument(doc, clock));

        doc.put("type", "Λ");
        doc.put("created_at", "not-a-date");
        assertThrows(ValidationException.class, () -> EdgeRecord.fromDocument(doc, clock));
    }

    @Test
    public void testHypothesisAcceptance() {
        EdgeRecord s = EdgeRecord.hypothesis("A", "C", "path completion via B", 0.8, 0.05, clock);
        assertTrue(s.isSuggested());
        assertEquals(EthicalStatus.DREAMING, s.getStatus());
        assertEquals("dreaming", s.getIntention());

        EdgeRecord accepted = s.asAccepted();
        assertEquals(s.getId(), accepted.getId());
        assertFalse(accepted.isSuggested());
        assertEquals(EthicalStatus.ACTIVE, accepted.getStatus());
        assertEquals("accepted hypothesis: path completion via B", accepted.getMeaning());

        assertTrue(s.isSuggested());
        assertEquals("hypothesis: path completion via B", s.getMeaning());
    }

    @Test
    public void testCopyIsDetached() {
        EdgeRecord original = edge("p", 0.8);
        original.updateFromContext("c1", 0.6);
        EdgeRecord copy = original.copy();
        assertNotSame(original, copy);
        assertEquals(original.toDocument(), copy.toDocument());

        copy.activate("c2");
        assertFalse(original.getConfidenceByContext().containsKey("c2"));
        assertEquals(1, original.getActivationCount());
        assertEquals(2, copy.getActivationCount());
    }
}

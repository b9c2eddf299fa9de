package com.logosk.semanticdb.core;

import com.logosk.semanticdb.exceptions.IncompatibleMergeException;
import com.logosk.semanticdb.exceptions.ValidationException;
import com.logosk.semanticdb.util.CommonUtils;
import lombok.Builder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A stateful, mergeable edge between two nodes. Besides its global confidence and
 * tension it remembers every context it was confirmed in, so the global values are
 * always derived: confidence is the mean of the per-context confidences and tension
 * the maximum of the per-context tensions.
 * <p>
 * Instances are mutated in place by {@link #activate(String)} and
 * {@link #updateFromContext(String, double, double)}; once inserted into a
 * {@link GraphStore} the store is their only long-lived owner.
 * </p>
 */
public class EdgeRecord {

    public static final String GENESIS_CONTEXT = "genesis";
    public static final double DEFAULT_CONFIDENCE = 0.7;
    public static final String HYPOTHESIS_PREFIX = "hypothesis: ";
    public static final String ACCEPTED_PREFIX = "accepted hypothesis: ";
    public static final String DREAMING_INTENTION = "dreaming";

    private static final double CONFIDENCE_CEILING = 0.95;
    private static final double HEBBIAN_GAIN = 1.02;
    private static final double SPLIT_FACTOR = 0.8;
    private static final double CONFLICT_TENSION = 0.8;
    private static final double DECAY_TENSION = 0.9;
    private static final Duration DECAY_INACTIVITY = Duration.ofDays(90);
    private static final Duration SLEEP_AFTER = Duration.ofDays(30);
    static final Duration DEFAULT_LIFESPAN = Duration.ofDays(365);

    private final Clock clock;
    private final String source;
    private final String target;
    private final RelationKind type;
    private String meaning;
    private String intention;

    private double confidence;
    private double tension;
    private double coherenceContribution;
    private final Map<String, Double> confidenceByContext = new LinkedHashMap<>();
    private final Map<String, Double> tensionByContext = new LinkedHashMap<>();

    private String id;
    private EthicalStatus status = EthicalStatus.ACTIVE;
    private Instant lifespan;
    private long activationCount;
    private Instant lastActivated;
    private Instant createdAt;
    private Instant updatedAt;
    private final List<String> parentIds = new ArrayList<>();
    private final List<String> childIds = new ArrayList<>();
    private boolean suggested;

    @Builder
    private EdgeRecord(String source, String target, RelationKind type, String meaning, String intention,
                       Double confidence, Double tension, Boolean suggested, Clock clock) {
        this.source = requireEndpoint(source, "source");
        this.target = requireEndpoint(target, "target");
        this.type = type != null ? type : RelationKind.LAMBDA;
        this.meaning = meaning != null ? meaning : "";
        this.intention = intention != null ? intention : "";
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.suggested = Boolean.TRUE.equals(suggested);

        this.id = CommonUtils.shortId("HW_", 12);
        this.createdAt = this.clock.instant();
        this.updatedAt = this.createdAt;
        this.lastActivated = this.createdAt;
        this.lifespan = this.createdAt.plus(DEFAULT_LIFESPAN);

        double initialConfidence = checkUnit(confidence != null ? confidence : DEFAULT_CONFIDENCE, "confidence");
        double initialTension = checkUnit(tension != null ? tension : 0.0, "tension");
        confidenceByContext.put(GENESIS_CONTEXT, initialConfidence);
        tensionByContext.put(GENESIS_CONTEXT, initialTension);
        recalculateMetrics();
    }

    /**
     * Builds an unconfirmed {@code LAMBDA} suggestion as produced by link prediction.
     * The record is never inserted by the factory itself.
     */
    public static EdgeRecord hypothesis(String source, String target, String description,
                                        double confidence, double tension, Clock clock) {
        return EdgeRecord.builder()
                .source(source)
                .target(target)
                .type(RelationKind.LAMBDA)
                .meaning(HYPOTHESIS_PREFIX + description)
                .intention(DREAMING_INTENTION)
                .confidence(CommonUtils.clamp01(confidence))
                .tension(tension)
                .suggested(true)
                .clock(clock)
                .build();
    }

    /**
     * Accepted form of a suggestion: a copy with the flag cleared and the
     * {@code hypothesis:} prefix rewritten to {@code accepted hypothesis:}. This record
     * is left untouched.
     */
    public EdgeRecord asAccepted() {
        EdgeRecord accepted = copy();
        accepted.markAccepted();
        return accepted;
    }

    private void markAccepted() {
        if (meaning.startsWith(HYPOTHESIS_PREFIX)) {
            meaning = ACCEPTED_PREFIX + meaning.substring(HYPOTHESIS_PREFIX.length());
        }
        setSuggested(false);
        updatedAt = clock.instant();
    }

    /**
     * Hebbian reinforcement: every activation nudges confidence up by 2% (never past 0.95)
     * and folds the nudged value into the context's running average.
     */
    public void activate(String contextId) {
        String ctx = requireContext(contextId);
        Instant now = clock.instant();
        activationCount++;
        lastActivated = now;
        if (confidence < CONFIDENCE_CEILING) {
            confidence = Math.min(CONFIDENCE_CEILING, confidence * HEBBIAN_GAIN);
        }
        Double previous = confidenceByContext.get(ctx);
        confidenceByContext.put(ctx, previous == null ? confidence : (previous + confidence) / 2.0);
        updatedAt = now;
        recalculateMetrics();
    }

    public void updateFromContext(String contextId, double newConfidence) {
        updateFromContext(contextId, newConfidence, 0.0);
    }

    /**
     * Folds an observation from one context into this record. Confidence is averaged into
     * the context entry; tension only ever grows per context and falls solely through an
     * explicit resolution outside this class.
     */
    public void updateFromContext(String contextId, double newConfidence, double newTension) {
        String ctx = requireContext(contextId);
        checkUnit(newConfidence, "confidence");
        checkUnit(newTension, "tension");

        double current = confidenceByContext.getOrDefault(ctx, newConfidence);
        confidenceByContext.put(ctx, (current + newConfidence) / 2.0);
        double currentTension = tensionByContext.getOrDefault(ctx, 0.0);
        tensionByContext.put(ctx, Math.max(currentTension, newTension));
        recalculateMetrics();
        activate(ctx);
    }

    /**
     * Creates a weaker variant of this record between the same endpoints. Lineage is
     * recorded on both sides.
     */
    public EdgeRecord split(String variantMeaning, RelationKind newType) {
        EdgeRecord child = EdgeRecord.builder()
                .source(source)
                .target(target)
                .type(newType != null ? newType : type)
                .meaning("variant: " + Objects.toString(variantMeaning, ""))
                .intention("split from " + id)
                .confidence(confidence * SPLIT_FACTOR)
                .tension(tension)
                .clock(clock)
                .build();
        confidenceByContext.forEach((ctx, value) -> child.confidenceByContext.put(ctx, value * SPLIT_FACTOR));
        child.recalculateMetrics();

        child.parentIds.add(id);
        childIds.add(child.id);
        updatedAt = clock.instant();
        return child;
    }

    public EdgeRecord split(String variantMeaning) {
        return split(variantMeaning, null);
    }

    /**
     * Synthesises a new record from this one and {@code other}. Context confidences are
     * averaged key by key, a context missing on one side counting as 0.
     *
     * @throws IncompatibleMergeException if source, target or type differ
     */
    public EdgeRecord mergeWith(EdgeRecord other) {
        if (!source.equals(other.source) || !target.equals(other.target) || type != other.type) {
            throw new IncompatibleMergeException(id, describeKey(), other.id, other.describeKey());
        }
        EdgeRecord merged = EdgeRecord.builder()
                .source(source)
                .target(target)
                .type(type)
                .meaning("Σ(" + meaning + ", " + other.meaning + ")")
                .confidence((confidence + other.confidence) / 2.0)
                .tension(Math.max(tension, other.tension))
                .clock(clock)
                .build();

        Set<String> contexts = new LinkedHashSet<>(confidenceByContext.keySet());
        contexts.addAll(other.confidenceByContext.keySet());
        for (String ctx : contexts) {
            double left = confidenceByContext.getOrDefault(ctx, 0.0);
            double right = other.confidenceByContext.getOrDefault(ctx, 0.0);
            merged.confidenceByContext.put(ctx, (left + right) / 2.0);
        }
        tensionByContext.forEach((ctx, value) -> merged.tensionByContext.merge(ctx, value, Math::max));
        other.tensionByContext.forEach((ctx, value) -> merged.tensionByContext.merge(ctx, value, Math::max));
        // the builder seeds genesis; keep it only if a parent carries it
        if (!contexts.contains(GENESIS_CONTEXT)) {
            merged.confidenceByContext.remove(GENESIS_CONTEXT);
        }
        if (!tensionByContext.containsKey(GENESIS_CONTEXT) && !other.tensionByContext.containsKey(GENESIS_CONTEXT)) {
            merged.tensionByContext.remove(GENESIS_CONTEXT);
        }
        merged.recalculateMetrics();

        merged.parentIds.add(id);
        merged.parentIds.add(other.id);
        return merged;
    }

    /**
     * Advisory only: nothing removes a record automatically.
     */
    public boolean shouldDecay() {
        Instant now = clock.instant();
        boolean lifespanExpired = now.isAfter(lifespan);
        boolean inactive = !lastActivated.plus(DECAY_INACTIVITY).isAfter(now);
        return lifespanExpired && inactive && tension > DECAY_TENSION;
    }

    private void recalculateMetrics() {
        if (!confidenceByContext.isEmpty()) {
            confidence = confidenceByContext.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        }
        if (!tensionByContext.isEmpty()) {
            tension = tensionByContext.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        }
        confidence = CommonUtils.clamp01(confidence);
        tension = CommonUtils.clamp01(tension);
        coherenceContribution = confidence * (1.0 - tension);

        if (suggested) {
            status = EthicalStatus.DREAMING;
        } else if (tension > CONFLICT_TENSION) {
            status = EthicalStatus.CONFLICTED;
        } else if (activationCount == 0 && createdAt.plus(SLEEP_AFTER).isBefore(clock.instant())) {
            status = EthicalStatus.SLEEPING;
        } else {
            status = EthicalStatus.ACTIVE;
        }
    }

    // --- serialisation ---

    /**
     * Full field set as a plain map, timestamps in ISO-8601 and the relation kind as its symbol.
     */
    public Map<String, Object> toDocument() {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("source", source);
        doc.put("target", target);
        doc.put("type", type.symbol());
        doc.put("meaning", meaning);
        doc.put("intention", intention);
        doc.put("confidence", confidence);
        doc.put("tension", tension);
        doc.put("coherence_contribution", coherenceContribution);
        doc.put("confidence_by_context", new LinkedHashMap<>(confidenceByContext));
        doc.put("tension_by_context", new LinkedHashMap<>(tensionByContext));
        doc.put("weight_id", id);
        doc.put("ethical_status", status.label());
        doc.put("lifespan", lifespan.toString());
        doc.put("activation_count", activationCount);
        doc.put("last_activated", lastActivated != null ? lastActivated.toString() : null);
        doc.put("created_at", createdAt.toString());
        doc.put("updated_at", updatedAt.toString());
        doc.put("parent_ids", new ArrayList<>(parentIds));
        doc.put("child_ids", new ArrayList<>(childIds));
        doc.put("suggested", suggested);
        return doc;
    }

    /**
     * Detached copy with the same id, contexts, counters and lineage.
     */
    public EdgeRecord copy() {
        return fromDocument(toDocument(), clock);
    }

    public static EdgeRecord fromDocument(Map<String, ?> doc) {
        return fromDocument(doc, Clock.systemUTC());
    }

    /**
     * Restores a record written by {@link #toDocument()}, including its id, contexts,
     * counters and lineage.
     *
     * @throws ValidationException if a required field is missing or malformed
     */
    public static EdgeRecord fromDocument(Map<String, ?> doc, Clock clock) {
        if (doc == null) {
            throw new ValidationException("Edge document must not be null");
        }
        try {
            EdgeRecord rec = EdgeRecord.builder()
                    .source(asString(doc.get("source")))
                    .target(asString(doc.get("target")))
                    .type(doc.get("type") != null ? RelationKind.fromSymbol(asString(doc.get("type"))) : null)
                    .meaning(asString(doc.get("meaning")))
                    .intention(asString(doc.get("intention")))
                    .confidence(asDouble(doc.get("confidence"), DEFAULT_CONFIDENCE))
                    .tension(asDouble(doc.get("tension"), 0.0))
                    .suggested(Boolean.TRUE.equals(doc.get("suggested")))
                    .clock(clock)
                    .build();

            String storedId = asString(doc.get("weight_id"));
            if (storedId != null && !storedId.isBlank()) {
                rec.id = storedId;
            }
            Map<String, Double> confidences = asDoubleMap(doc.get("confidence_by_context"));
            if (!confidences.isEmpty()) {
                rec.confidenceByContext.clear();
                rec.confidenceByContext.putAll(confidences);
            }
            Map<String, Double> tensions = asDoubleMap(doc.get("tension_by_context"));
            if (!tensions.isEmpty()) {
                rec.tensionByContext.clear();
                rec.tensionByContext.putAll(tensions);
            }
            rec.activationCount = doc.get("activation_count") instanceof Number n ? n.longValue() : 0L;
            rec.createdAt = asInstant(doc.get("created_at"), rec.createdAt);
            rec.updatedAt = asInstant(doc.get("updated_at"), rec.createdAt);
            rec.lastActivated = asInstant(doc.get("last_activated"), rec.createdAt);
            rec.lifespan = asInstant(doc.get("lifespan"), rec.createdAt.plus(DEFAULT_LIFESPAN));
            rec.parentIds.addAll(asStringList(doc.get("parent_ids")));
            rec.childIds.addAll(asStringList(doc.get("child_ids")));
            rec.recalculateMetrics();
            return rec;
        } catch (DateTimeParseException | ClassCastException e) {
            throw new ValidationException("Malformed edge document: " + e.getMessage(), e);
        }
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    private static double asDouble(Object value, double fallback) {
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            throw new ValidationException("Not a number: " + value, e);
        }
    }

    private static Map<String, Double> asDoubleMap(Object value) {
        Map<String, Double> out = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            map.forEach((k, v) -> out.put(String.valueOf(k), checkUnit(asDouble(v, 0.0), "context value")));
        }
        return out;
    }

    private static List<String> asStringList(Object value) {
        List<String> out = new ArrayList<>();
        if (value instanceof List<?> list) {
            list.forEach(item -> out.add(String.valueOf(item)));
        }
        return out;
    }

    private static Instant asInstant(Object value, Instant fallback) {
        return value == null ? fallback : Instant.parse(value.toString());
    }

    private static String requireEndpoint(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Edge " + field + " must be a non-blank node id");
        }
        return value;
    }

    private static String requireContext(String contextId) {
        if (contextId == null || contextId.isBlank()) {
            throw new ValidationException("Context id must not be blank");
        }
        return contextId;
    }

    private static double checkUnit(double value, String field) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ValidationException(String.format(Locale.ROOT, "%s must lie in [0,1], was %s", field, value));
        }
        return value;
    }

    private String describeKey() {
        return source + "→" + target + ":" + type.symbol();
    }

    // --- accessors ---

    public String getId() { return id; }
    public String getSource() { return source; }
    public String getTarget() { return target; }
    public RelationKind getType() { return type; }
    public String getMeaning() { return meaning; }
    void setMeaning(String meaning) {
        this.meaning = meaning != null ? meaning : "";
        this.updatedAt = clock.instant();
    }
    public String getIntention() { return intention; }
    public double getConfidence() { return confidence; }
    public double getTension() { return tension; }
    public double getCoherenceContribution() { return coherenceContribution; }
    public Map<String, Double> getConfidenceByContext() { return Collections.unmodifiableMap(confidenceByContext); }
    public Map<String, Double> getTensionByContext() { return Collections.unmodifiableMap(tensionByContext); }
    public EthicalStatus getStatus() { return status; }
    public Instant getLifespan() { return lifespan; }
    public long getActivationCount() { return activationCount; }
    public Instant getLastActivated() { return lastActivated; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public List<String> getParentIds() { return Collections.unmodifiableList(parentIds); }
    public List<String> getChildIds() { return Collections.unmodifiableList(childIds); }
    public boolean isSuggested() { return suggested; }
    void setSuggested(boolean suggested) {
        this.suggested = suggested;
        recalculateMetrics();
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "<EdgeRecord %s [%s] conf=%.2f ten=%.2f>",
                describeKey(), id, confidence, tension);
    }
}

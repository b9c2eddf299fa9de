package com.logosk.semanticdb.runtime;

import com.logosk.semanticdb.coherence.CoherenceEngine;
import com.logosk.semanticdb.coherence.CoherenceReport;
import com.logosk.semanticdb.coherence.Diagnosis;
import com.logosk.semanticdb.core.EdgeRecord;
import com.logosk.semanticdb.core.GraphSnapshot;
import com.logosk.semanticdb.core.GraphStore;
import com.logosk.semanticdb.core.RelationKind;
import com.logosk.semanticdb.dreaming.DreamingEngine;
import com.logosk.semanticdb.exceptions.ValidationException;
import com.logosk.semanticdb.query.RqlEngine;
import com.logosk.semanticdb.query.RqlResult;
import com.logosk.semanticdb.spi.Dialogue;
import com.logosk.semanticdb.spi.DocumentMirror;
import com.logosk.semanticdb.spi.ExportDocument;
import com.logosk.semanticdb.spi.OntologicalEvent;
import com.logosk.semanticdb.spi.SemanticStore;
import com.logosk.semanticdb.spi.WitnessRecord;
import com.logosk.semanticdb.spi.WitnessService;
import com.logosk.semanticdb.storage.Sha3WitnessService;
import com.logosk.semanticdb.storage.YamlDocumentMirror;
import com.logosk.semanticdb.util.CommonUtils;
import com.logosk.semanticdb.util.ExceptionLoggingUtils;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Entry point that wires one graph with its engines and external collaborators.
 * <p>
 * The graph and the engines are single-threaded; this class serialises access through
 * a read/write lock. Mutations (nodes, edges, accepted suggestions, imports and gesture
 * records) take the write lock, everything else the read lock.
 * </p>
 */
public class SemanticDatabase {

    private static final Logger LOG = Logger.getLogger(SemanticDatabase.class);

    private final SemanticDbConfig config;
    private final Clock clock;
    private final GraphStore graph;
    private final CoherenceEngine coherence;
    private final DreamingEngine dreaming;
    private final RqlEngine rql;
    private final SemanticStore store;
    private final DocumentMirror mirror;
    private final WitnessService witness;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong dialogues = new AtomicLong();

    /**
     * Builds a database with configuration from the default sources, the YAML mirror and
     * the SHA3 witness.
     */
    public static SemanticDatabase create(SemanticStore store) {
        return new SemanticDatabase(SemanticDbConfigFactory.load(), store, new YamlDocumentMirror(),
                new Sha3WitnessService(), Clock.systemUTC());
    }

    public SemanticDatabase(SemanticDbConfig config, SemanticStore store, DocumentMirror mirror,
                            WitnessService witness, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.store = Objects.requireNonNull(store, "store");
        this.mirror = Objects.requireNonNull(mirror, "mirror");
        this.witness = Objects.requireNonNull(witness, "witness");
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.graph = new GraphStore(this.clock, config.dreaming().cycleSimilarityThreshold());
        this.coherence = new CoherenceEngine(graph, this.clock, SemanticDbConfigFactory.coherenceSettings(config));
        this.dreaming = new DreamingEngine(graph, this.clock, SemanticDbConfigFactory.dreamingSettings(config));
        this.rql = new RqlEngine(graph, coherence);
        LOG.infof("SemanticDB ready for operator %s (%s)", config.operatorId(), config.protocol());
    }

    // --- graph mutation ---

    public String addNode(String id, Map<String, ?> attributes) {
        return write(() -> graph.addNode(id, attributes));
    }

    public String addEdge(EdgeRecord record) {
        return addEdge(record, GraphStore.DEFAULT_CONTEXT);
    }

    /**
     * Inserts the record and persists whichever record now carries it (the incoming one
     * or the existing record it merged into).
     */
    public String addEdge(EdgeRecord record, String contextId) {
        return write(() -> persist(graph.addEdge(record, contextId, true)));
    }

    public String acceptSuggestion(EdgeRecord suggestion) {
        return write(() -> persist(dreaming.acceptSuggestion(suggestion)));
    }

    private String persist(String storedId) {
        graph.getEdgeById(storedId).ifPresent(store::storeEdgeRecord);
        return storedId;
    }

    /**
     * Detached copy of the first record of the given kind on the pair. Changing the copy
     * has no effect on the graph; go through {@link #addEdge} for that.
     */
    public Optional<EdgeRecord> getEdge(String source, String target, RelationKind type) {
        return read(() -> graph.getEdge(source, target, type).map(EdgeRecord::copy));
    }

    // --- gestures and dialogues ---

    public OntologicalEvent recordGesture(String symbol, List<String> operands, String result) {
        return recordGesture(symbol, operands, result, List.of());
    }

    /**
     * Stores an event describing a gesture that was just applied to the graph.
     * Significance is {@code min(1, |Δcoherence|·0.5 + entities·0.1 + blindSpots·0.2)}
     * where the entities are the operands that exist as nodes.
     *
     * @throws com.logosk.semanticdb.exceptions.UnknownGestureException for an unknown symbol
     */
    public OntologicalEvent recordGesture(String symbol, List<String> operands, String result, List<String> blindSpots) {
        RelationKind gesture = RelationKind.fromSymbol(symbol);
        List<String> ops = operands != null ? List.copyOf(operands) : List.of();
        List<String> spots = blindSpots != null ? List.copyOf(blindSpots) : List.of();

        return write(() -> {
            double before = coherence.currentCoherence();
            double after = coherence.calculateGlobalCoherence().global();
            List<String> affected = new ArrayList<>();
            ops.stream().filter(graph::hasNode).forEach(affected::add);

            double significance = Math.min(1.0,
                    Math.abs(after - before) * 0.5 + affected.size() * 0.1 + spots.size() * 0.2);
            Map<String, Object> ethics = new LinkedHashMap<>();
            ethics.put("creator", config.operatorId());
            ethics.put("protocol", config.protocol());
            ethics.put("timestamp", clock.instant().toString());

            OntologicalEvent event = OntologicalEvent.builder()
                    .id(gesture.name() + "_" + CommonUtils.shortId("", 12))
                    .timestamp(clock.instant())
                    .gesture(gesture.symbol())
                    .operatorId(config.operatorId())
                    .operands(ops)
                    .result(result)
                    .affectedEntities(affected)
                    .blindSpots(spots)
                    .coherenceBefore(before)
                    .coherenceAfter(after)
                    .tensionLevel(meanTension())
                    .significance(significance)
                    .ethicsMetadata(ethics)
                    .weightId(CommonUtils.shortId("HW_", 12))
                    .build();
            store.storeEvent(event);
            LOG.debugf("Recorded %s gesture %s (significance %.2f)", gesture.symbol(), event.getId(), significance);
            return event;
        });
    }

    private double meanTension() {
        return graph.allEdges().stream().mapToDouble(EdgeRecord::getTension).average().orElse(0.0);
    }

    public Dialogue startDialogue(String context, List<String> participants) {
        if (context == null || context.isBlank()) {
            throw new ValidationException("Dialogue context must not be blank");
        }
        Dialogue dialogue = Dialogue.builder()
                .id(CommonUtils.shortId("DLG_", 12))
                .context(context)
                .participants(participants != null ? new ArrayList<>(participants) : new ArrayList<>())
                .startedAt(clock.instant())
                .build();
        store.storeDialogue(dialogue);
        dialogues.incrementAndGet();
        return dialogue;
    }

    // --- reads ---

    public RqlResult queryRql(String text) {
        return read(() -> rql.run(text));
    }

    public List<EdgeRecord> dreamingSession() {
        return dreamingSession(config.dreaming().maxSuggestions());
    }

    public List<EdgeRecord> dreamingSession(int maxSuggestions) {
        return read(() -> dreaming.generateSuggestions(maxSuggestions));
    }

    public Diagnosis diagnose() {
        return read(coherence::diagnose);
    }

    public CoherenceReport coherenceReport() {
        return read(coherence::calculateGlobalCoherence);
    }

    /**
     * Counters of the graph, the coherence engine and the dreaming engine in one map.
     */
    public Map<String, Object> statistics() {
        return read(() -> {
            Map<String, Object> stats = new LinkedHashMap<>(graph.statistics());
            stats.put("coherence", coherence.currentCoherence());
            stats.put("tension_level", meanTension());
            stats.put("active_dialogues", dialogues.get());
            stats.put("dreaming", dreaming.stats().toMap());
            stats.put("operator_id", config.operatorId());
            stats.put("protocol", config.protocol());
            return stats;
        });
    }

    // --- export / import ---

    public record ExportReceipt(Path path, ExportDocument document, WitnessRecord witness) {
    }

    /**
     * Writes the current graph with the caller's cycle summary through the document
     * mirror, witnesses the document and stores the witness. I/O failures propagate.
     */
    public ExportReceipt exportCycle(Map<String, Object> cycleSummary, Path path) throws IOException {
        lock.readLock().lock();
        try {
            ExportDocument document = buildDocument(cycleSummary);
            try {
                mirror.write(document, path);
            } catch (IOException e) {
                ExceptionLoggingUtils.logWarn(LOG, e, "Could not mirror cycle export to %s", path);
                throw e;
            }
            Object cycleId = document.getCycleSummary().getOrDefault("cycle_id", "unknown");
            WitnessRecord record = witness.createWitness("cycle_" + cycleId, document, List.of(config.operatorId()));
            store.storeWitness(record);
            LOG.infof("Exported cycle %s to %s", cycleId, path);
            return new ExportReceipt(path, document, record);
        } finally {
            lock.readLock().unlock();
        }
    }

    private ExportDocument buildDocument(Map<String, Object> cycleSummary) {
        GraphSnapshot snapshot = graph.exportSnapshot();
        Set<String> zones = new LinkedHashSet<>(graph.conflictZones());
        return ExportDocument.builder()
                .metadata(ExportDocument.Metadata.builder()
                        .protocol(config.protocol())
                        .version(config.version())
                        .operatorId(config.operatorId())
                        .timestamp(Instant.now(clock).toString())
                        .build())
                .cycleSummary(cycleSummary != null ? new LinkedHashMap<>(cycleSummary) : new LinkedHashMap<>())
                .ontologicalContext(ExportDocument.OntologicalContext.builder()
                        .nodes(new LinkedHashMap<>(snapshot.nodes()))
                        .edges(new ArrayList<>(snapshot.edges()))
                        .conflictZones(new ArrayList<>(zones))
                        .coherence(coherence.calculateGlobalCoherence().global())
                        .build())
                .build();
    }

    /**
     * Replaces the graph with the content of a mirrored document. Edges are replayed
     * through the regular insertion rules.
     */
    public GraphSnapshot importDocument(Path path) throws IOException {
        ExportDocument document = mirror.read(path);
        ExportDocument.OntologicalContext context = document.getOntologicalContext();
        if (context == null) {
            throw new ValidationException("Document " + path + " has no ontological_context block");
        }
        GraphSnapshot snapshot = new GraphSnapshot(Map.of("source", path.toString()), context.getNodes(), context.getEdges());
        return write(() -> {
            graph.importSnapshot(snapshot);
            return graph.exportSnapshot();
        });
    }

    private <T> T read(Supplier<T> action) {
        return locked(lock.readLock(), action);
    }

    private <T> T write(Supplier<T> action) {
        return locked(lock.writeLock(), action);
    }

    private static <T> T locked(Lock l, Supplier<T> action) {
        l.lock();
        try {
            return action.get();
        } finally {
            l.unlock();
        }
    }
}

package com.logosk.semanticdb.core;

import com.logosk.semanticdb.exceptions.ValidationException;
import com.logosk.semanticdb.util.CommonUtils;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Directed multi-graph of {@link EdgeRecord}s.
 * <p>
 * Nodes and records live in two arenas addressed by integer handle. Node ids and
 * record ids both resolve to handles, per-node adjacency lists hold record handles and
 * every ordered (source, target) pair owns a slot list of the records between them, so
 * lookups by endpoint and by id land on the same instance.
 * </p>
 * Not thread-safe; see {@code SemanticDatabase} for the locking wrapper.
 */
public class GraphStore {

    private static final Logger LOG = Logger.getLogger(GraphStore.class);

    public static final String DEFAULT_CONTEXT = "global";
    public static final String RESTORED_CONTEXT = "restored_from_document";
    public static final String SNAPSHOT_VERSION = "2.0";
    public static final double DEFAULT_CYCLE_SIMILARITY_THRESHOLD = 0.35;
    private static final double CONFLICT_CONFIDENCE = 0.5;
    private static final double SHARED_NEIGHBOR_TENSION = 0.1;
    private static final int MIN_NODES_FOR_DREAMING = 3;

    private final Clock clock;
    private final double cycleSimilarityThreshold;

    // node arena
    private final List<NodeRecord> nodes = new ArrayList<>();
    private final Map<String, Integer> nodeHandles = new LinkedHashMap<>();
    private final List<List<Integer>> outgoing = new ArrayList<>();
    private final List<List<Integer>> incoming = new ArrayList<>();

    // record arena
    private final List<EdgeRecord> records = new ArrayList<>();
    private final Map<String, Integer> recordHandles = new HashMap<>();
    private final Map<PairKey, List<Integer>> slots = new HashMap<>();

    private final Map<String, ContextStats> contexts = new LinkedHashMap<>();
    private final Set<String> conflictZones = new LinkedHashSet<>();
    private final PriorityQueue<QueuedPair> dreamingQueue = new PriorityQueue<>(QueuedPair.ORDER);
    private long queueSequence;
    private long totalActivations;
    private Instant lastDreaming;

    public GraphStore() {
        this(Clock.systemUTC(), DEFAULT_CYCLE_SIMILARITY_THRESHOLD);
    }

    public GraphStore(Clock clock) {
        this(clock, DEFAULT_CYCLE_SIMILARITY_THRESHOLD);
    }

    public GraphStore(Clock clock, double cycleSimilarityThreshold) {
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.cycleSimilarityThreshold = cycleSimilarityThreshold;
    }

    // --- nodes ---

    public String addNode(String id) {
        return addNode(id, Map.of());
    }

    /**
     * Adds or replaces a node. Missing well-known attributes get their defaults; a
     * repeated id overwrites the attributes but keeps the arena slot.
     *
     * @return the node's weight-id
     */
    public String addNode(String id, Map<String, ?> attributes) {
        requireNodeId(id);
        Instant now = clock.instant();
        NodeRecord node = new NodeRecord();
        node.setId(id);
        node.setCreatedAt(now);
        node.setLifespan(now.plus(EdgeRecord.DEFAULT_LIFESPAN));
        node.applyAttributes(attributes);
        if (node.getWeightId() == null || node.getWeightId().isBlank()) {
            node.setWeightId(CommonUtils.shortId("N_" + id + "_", 8));
        }

        Integer handle = nodeHandles.get(id);
        if (handle == null) {
            nodeHandles.put(id, nodes.size());
            nodes.add(node);
            outgoing.add(new ArrayList<>());
            incoming.add(new ArrayList<>());
            LOG.debugf("Node %s added as %s", id, node.getWeightId());
        } else {
            nodes.set(handle, node);
            LOG.debugf("Node %s attributes replaced", id);
        }
        return node.getWeightId();
    }

    public Optional<NodeRecord> getNode(String id) {
        Integer handle = id == null ? null : nodeHandles.get(id);
        return handle == null ? Optional.empty() : Optional.of(nodes.get(handle));
    }

    public boolean hasNode(String id) {
        return id != null && nodeHandles.containsKey(id);
    }

    // --- edges ---

    public String addEdge(EdgeRecord record) {
        return addEdge(record, DEFAULT_CONTEXT, true);
    }

    public String addEdge(EdgeRecord record, String contextId) {
        return addEdge(record, contextId, true);
    }

    /**
     * Inserts a copy of the record; the caller's instance is never held or changed.
     * Conflict detection runs first over every record of the same type on the
     * (source, target) pair; only then is an exact (type, meaning) match merged into.
     * A record whose id is already stored is rejected before anything changes, whatever
     * {@code autoMerge} says.
     *
     * @return the id of the record that now carries the information, which is the
     *         existing record's id when the incoming one was merged
     */
    public String addEdge(EdgeRecord record, String contextId, boolean autoMerge) {
        if (record == null) {
            throw new ValidationException("Edge record must not be null");
        }
        requireNodeId(record.getSource());
        requireNodeId(record.getTarget());
        if (contextId == null || contextId.isBlank()) {
            throw new ValidationException("Context id must not be blank");
        }
        if (recordHandles.containsKey(record.getId())) {
            throw new ValidationException("Edge record " + record.getId() + " is already stored");
        }
        record = record.copy();

        String u = record.getSource();
        String v = record.getTarget();
        if (!hasNode(u)) {
            addNode(u, Map.of("type", "entity"));
        }
        if (!hasNode(v)) {
            addNode(v, Map.of("type", "entity"));
        }

        List<EdgeRecord> sameType = new ArrayList<>();
        for (EdgeRecord existing : edgesBetween(u, v)) {
            if (existing.getType() == record.getType()) {
                sameType.add(existing);
            }
        }

        for (EdgeRecord existing : sameType) {
            if (!existing.getMeaning().equals(record.getMeaning()) && record.getConfidence() > CONFLICT_CONFIDENCE) {
                conflictZones.add(existing.getId());
                conflictZones.add(record.getId());
                LOG.warnf("Meaning conflict on %s→%s [%s]: '%s' vs '%s'", u, v, record.getType().symbol(),
                        existing.getMeaning(), record.getMeaning());
            }
        }

        contexts.computeIfAbsent(contextId, ctx -> new ContextStats(ctx, clock.instant()));
        record.updateFromContext(contextId, record.getConfidence());

        if (autoMerge) {
            for (EdgeRecord existing : sameType) {
                if (existing.getMeaning().equals(record.getMeaning())) {
                    existing.updateFromContext(contextId, record.getConfidence());
                    if (record.getMeaning().length() > existing.getMeaning().length()) {
                        existing.setMeaning(record.getMeaning());
                    }
                    if (conflictZones.remove(record.getId())) {
                        conflictZones.add(existing.getId());
                    }
                    LOG.debugf("Merged %s into %s under context %s", record.getId(), existing.getId(), contextId);
                    return existing.getId();
                }
            }
        }

        int handle = records.size();
        records.add(record);
        recordHandles.put(record.getId(), handle);
        int uh = nodeHandles.get(u);
        int vh = nodeHandles.get(v);
        outgoing.get(uh).add(handle);
        incoming.get(vh).add(handle);
        slots.computeIfAbsent(new PairKey(uh, vh), k -> new ArrayList<>()).add(handle);

        double priority = record.getConfidence() * (1.0 - record.getTension());
        dreamingQueue.add(new QueuedPair(priority, queueSequence++, u, v));
        totalActivations++;
        contexts.get(contextId).record(record.getConfidence());
        LOG.debugf("Stored %s", record);
        return record.getId();
    }

    /**
     * First record of the given kind on the ordered pair, in insertion order.
     */
    public Optional<EdgeRecord> getEdge(String source, String target, RelationKind type) {
        RelationKind kind = type != null ? type : RelationKind.LAMBDA;
        return edgesBetween(source, target).stream().filter(r -> r.getType() == kind).findFirst();
    }

    public Optional<EdgeRecord> getEdgeById(String id) {
        Integer handle = id == null ? null : recordHandles.get(id);
        return handle == null ? Optional.empty() : Optional.of(records.get(handle));
    }

    public List<EdgeRecord> edgesBetween(String source, String target) {
        Integer uh = source == null ? null : nodeHandles.get(source);
        Integer vh = target == null ? null : nodeHandles.get(target);
        if (uh == null || vh == null) {
            return List.of();
        }
        List<Integer> slot = slots.get(new PairKey(uh, vh));
        if (slot == null) {
            return List.of();
        }
        List<EdgeRecord> out = new ArrayList<>(slot.size());
        slot.forEach(h -> out.add(records.get(h)));
        return out;
    }

    public List<EdgeRecord> outgoingEdges(String id) {
        return resolve(id, outgoing);
    }

    public List<EdgeRecord> incomingEdges(String id) {
        return resolve(id, incoming);
    }

    private List<EdgeRecord> resolve(String id, List<List<Integer>> adjacency) {
        Integer handle = id == null ? null : nodeHandles.get(id);
        if (handle == null) {
            return List.of();
        }
        List<EdgeRecord> out = new ArrayList<>();
        adjacency.get(handle).forEach(h -> out.add(records.get(h)));
        return out;
    }

    public Set<String> successors(String id) {
        Set<String> out = new LinkedHashSet<>();
        outgoingEdges(id).forEach(r -> out.add(r.getTarget()));
        return out;
    }

    public Set<String> predecessors(String id) {
        Set<String> out = new LinkedHashSet<>();
        incomingEdges(id).forEach(r -> out.add(r.getSource()));
        return out;
    }

    /**
     * Predecessors and successors together.
     */
    public Set<String> neighbors(String id) {
        Set<String> out = new LinkedHashSet<>(predecessors(id));
        out.addAll(successors(id));
        return out;
    }

    public boolean hasEdge(String source, String target) {
        return !edgesBetween(source, target).isEmpty();
    }

    public boolean hasEdgeEitherDirection(String a, String b) {
        return hasEdge(a, b) || hasEdge(b, a);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return records.size();
    }

    public List<String> nodeIds() {
        return List.copyOf(nodeHandles.keySet());
    }

    public List<EdgeRecord> allEdges() {
        return Collections.unmodifiableList(new ArrayList<>(records));
    }

    public Set<String> conflictZones() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(conflictZones));
    }

    public Map<String, ContextStats> contextStats() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(contexts));
    }

    public long totalActivations() {
        return totalActivations;
    }

    public Optional<Instant> lastDreaming() {
        return Optional.ofNullable(lastDreaming);
    }

    public GraphTopology topology() {
        return new GraphTopology(this);
    }

    public Clock clock() {
        return clock;
    }

    // --- link prediction over the insertion queue ---

    public List<EdgeRecord> dreamingCycle() {
        return dreamingCycle(10);
    }

    /**
     * Walks the insertion queue in priority order and, for each queued pair (u, v),
     * proposes u→x for neighbours x of v that u is not yet linked to and whose
     * neighbourhood overlaps u's enough.
     */
    public List<EdgeRecord> dreamingCycle(int maxSuggestions) {
        List<EdgeRecord> suggestions = new ArrayList<>();
        if (nodeCount() < MIN_NODES_FOR_DREAMING || maxSuggestions <= 0) {
            return suggestions;
        }
        GraphTopology topology = topology();
        PriorityQueue<QueuedPair> queue = new PriorityQueue<>(dreamingQueue);
        Set<List<String>> processedAnchors = new HashSet<>();
        Set<Set<String>> processedPairs = new HashSet<>();

        while (!queue.isEmpty() && suggestions.size() < maxSuggestions) {
            QueuedPair anchor = queue.poll();
            if (!processedAnchors.add(List.of(anchor.source(), anchor.target()))) {
                continue;
            }
            String u = anchor.source();
            for (String x : neighbors(anchor.target())) {
                if (suggestions.size() >= maxSuggestions) {
                    break;
                }
                if (x.equals(u) || hasEdgeEitherDirection(u, x) || !processedPairs.add(Set.of(u, x))) {
                    continue;
                }
                double similarity = topology.jaccard(u, x);
                if (similarity > cycleSimilarityThreshold) {
                    int shared = topology.sharedNeighbors(u, x).size();
                    suggestions.add(EdgeRecord.hypothesis(u, x, "shared neighbors (" + shared + ")",
                            similarity, SHARED_NEIGHBOR_TENSION, clock));
                }
            }
        }
        lastDreaming = clock.instant();
        LOG.infof("Graph dreaming cycle produced %d suggestion(s)", suggestions.size());
        return suggestions;
    }

    // --- snapshot ---

    public GraphSnapshot exportSnapshot() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("version", SNAPSHOT_VERSION);
        metadata.put("exported_at", clock.instant().toString());
        metadata.put("node_count", nodeCount());
        metadata.put("edge_count", edgeCount());

        Map<String, Map<String, Object>> nodeDocs = new LinkedHashMap<>();
        nodeHandles.forEach((id, handle) -> nodeDocs.put(id, nodes.get(handle).toAttributes()));
        List<Map<String, Object>> edgeDocs = new ArrayList<>();
        records.forEach(r -> edgeDocs.add(r.toDocument()));
        return new GraphSnapshot(metadata, nodeDocs, edgeDocs);
    }

    /**
     * Replaces the whole graph with the snapshot's content. Every edge goes through
     * {@link #addEdge(EdgeRecord, String, boolean)}, so merge and conflict rules apply to
     * restored data as well.
     */
    public void importSnapshot(GraphSnapshot snapshot) {
        if (snapshot == null) {
            throw new ValidationException("Snapshot must not be null");
        }
        clear();
        snapshot.nodes().forEach(this::addNode);
        for (Map<String, Object> doc : snapshot.edges()) {
            addEdge(EdgeRecord.fromDocument(doc, clock), RESTORED_CONTEXT, true);
        }
        LOG.infof("Imported %d node(s) and %d record(s)", nodeCount(), edgeCount());
    }

    public void clear() {
        nodes.clear();
        nodeHandles.clear();
        outgoing.clear();
        incoming.clear();
        records.clear();
        recordHandles.clear();
        slots.clear();
        contexts.clear();
        conflictZones.clear();
        dreamingQueue.clear();
        queueSequence = 0;
        totalActivations = 0;
        lastDreaming = null;
        LOG.info("Graph cleared");
    }

    /**
     * Counters in the shape reported by {@code SemanticDatabase#statistics()}.
     */
    public Map<String, Object> statistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("nodes", nodeCount());
        stats.put("edges", edgeCount());
        stats.put("contexts", contexts.size());
        stats.put("conflict_zones", conflictZones.size());
        stats.put("total_activations", totalActivations);
        stats.put("last_dreaming", lastDreaming != null ? lastDreaming.toString() : null);
        return stats;
    }

    private static void requireNodeId(String id) {
        if (id == null || id.isBlank()) {
            throw new ValidationException("Node id must not be blank");
        }
    }

    private record PairKey(int source, int target) {
    }

    private record QueuedPair(double priority, long sequence, String source, String target) {
        static final Comparator<QueuedPair> ORDER = Comparator
                .comparingDouble(QueuedPair::priority).reversed()
                .thenComparingLong(QueuedPair::sequence);
    }
}

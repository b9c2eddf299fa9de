package com.logosk.semanticdb.core;

import com.google.common.collect.Sets;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Read-only structural measures over a {@link GraphStore}, shared by the coherence and
 * dreaming engines.
 */
public final class GraphTopology {

    private final GraphStore store;

    GraphTopology(GraphStore store) {
        this.store = store;
    }

    /**
     * Jaccard index of the two nodes' neighbourhoods (predecessors and successors).
     * Two empty neighbourhoods score 0.
     */
    public double jaccard(String a, String b) {
        Set<String> na = store.neighbors(a);
        Set<String> nb = store.neighbors(b);
        int union = Sets.union(na, nb).size();
        if (union == 0) {
            return 0.0;
        }
        return (double) Sets.intersection(na, nb).size() / union;
    }

    public Set<String> sharedNeighbors(String a, String b) {
        return Sets.intersection(store.neighbors(a), store.neighbors(b)).immutableCopy();
    }

    /**
     * Distinct ordered endpoint pairs (self loops excluded) over n(n-1). Parallel records
     * between the same pair count once.
     */
    public double density() {
        int n = store.nodeCount();
        if (n < 2) {
            return 0.0;
        }
        Set<List<String>> pairs = new HashSet<>();
        for (EdgeRecord r : store.allEdges()) {
            if (!r.getSource().equals(r.getTarget())) {
                pairs.add(List.of(r.getSource(), r.getTarget()));
            }
        }
        return (double) pairs.size() / ((double) n * (n - 1));
    }

    /**
     * Number of weakly connected components, computed with union-find over the
     * undirected view.
     */
    public int weakComponentCount() {
        List<String> ids = store.nodeIds();
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            index.put(ids.get(i), i);
        }
        int[] parent = new int[ids.size()];
        for (int i = 0; i < parent.length; i++) {
            parent[i] = i;
        }
        int components = ids.size();
        for (EdgeRecord r : store.allEdges()) {
            int a = find(parent, index.get(r.getSource()));
            int b = find(parent, index.get(r.getTarget()));
            if (a != b) {
                parent[a] = b;
                components--;
            }
        }
        return components;
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    public int isolatedCount() {
        int isolated = 0;
        for (String id : store.nodeIds()) {
            if (store.outgoingEdges(id).isEmpty() && store.incomingEdges(id).isEmpty()) {
                isolated++;
            }
        }
        return isolated;
    }

    /**
     * Highest confidence among the records on the ordered pair, empty when there is none.
     */
    public OptionalDouble strongestConfidence(String source, String target) {
        return store.edgesBetween(source, target).stream().mapToDouble(EdgeRecord::getConfidence).max();
    }
}

package com.logosk.semanticdb.coherence;

import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Enumerates the simple cycles of a directed graph given as an adjacency map.
 * <p>
 * Each cycle is reported once, rotated so that it starts at its lowest-ranked node
 * (rank being the iteration order of the adjacency map). The search is depth-first with
 * an on-path set and stops early when any of the step, time or cycle-count budgets runs
 * out; in that case the cycles found so far are returned with {@code complete == false}.
 * </p>
 */
public class CycleEnumerator {

    private static final Logger LOG = Logger.getLogger(CycleEnumerator.class);

    private final long stepBudget;
    private final Duration timeBudget;
    private final int maxCycles;

    public CycleEnumerator(long stepBudget, Duration timeBudget, int maxCycles) {
        if (stepBudget <= 0 || maxCycles <= 0) {
            throw new IllegalArgumentException("Cycle budgets must be positive");
        }
        this.stepBudget = stepBudget;
        this.timeBudget = timeBudget != null ? timeBudget : Duration.ofSeconds(2);
        this.maxCycles = maxCycles;
    }

    public record Result(List<List<String>> cycles, boolean complete) {
    }

    public Result enumerate(Map<String, ? extends Collection<String>> adjacency) {
        List<String> order = new ArrayList<>(adjacency.keySet());
        Map<String, Integer> rank = new HashMap<>();
        for (int i = 0; i < order.size(); i++) {
            rank.put(order.get(i), i);
        }

        List<List<String>> cycles = new ArrayList<>();
        long deadline = System.nanoTime() + timeBudget.toNanos();
        long steps = 0;

        for (int i = 0; i < order.size(); i++) {
            String start = order.get(i);
            Deque<Iterator<String>> stack = new ArrayDeque<>();
            List<String> path = new ArrayList<>();
            Set<String> onPath = new HashSet<>();
            stack.push(adjacency.get(start).iterator());
            path.add(start);
            onPath.add(start);

            while (!stack.isEmpty()) {
                Iterator<String> it = stack.peek();
                if (!it.hasNext()) {
                    stack.pop();
                    onPath.remove(path.remove(path.size() - 1));
                    continue;
                }
                String next = it.next();
                steps++;
                if (steps > stepBudget || System.nanoTime() > deadline) {
                    LOG.debugf("Cycle search stopped after %d steps with %d cycle(s)", steps, cycles.size());
                    return new Result(cycles, false);
                }
                Integer nextRank = rank.get(next);
                if (nextRank == null || nextRank < i) {
                    continue;
                }
                if (next.equals(start)) {
                    cycles.add(List.copyOf(path));
                    if (cycles.size() >= maxCycles) {
                        LOG.debugf("Cycle search stopped at the limit of %d cycle(s)", maxCycles);
                        return new Result(cycles, false);
                    }
                } else if (!onPath.contains(next)) {
                    Collection<String> successors = adjacency.get(next);
                    stack.push(successors != null ? successors.iterator() : List.<String>of().iterator());
                    path.add(next);
                    onPath.add(next);
                }
            }
        }
        return new Result(cycles, true);
    }
}

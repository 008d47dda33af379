package com.vidnyan.playscan.domain.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reachability and dominance over the control-flow edges of a graph under construction.
 * Dominators use the iterative data-flow formulation; nodes unreachable from the entry
 * dominate nothing and are dominated by nothing but themselves.
 */
class ControlFlowAnalysis {

    private final List<String> order = new ArrayList<>();
    private final Map<String, Integer> index = new HashMap<>();
    private final List<List<Integer>> successors = new ArrayList<>();
    private final List<List<Integer>> predecessors = new ArrayList<>();
    private final Map<Integer, BitSet> reachCache = new HashMap<>();
    private BitSet[] dominators;
    private BitSet fromEntry;

    ControlFlowAnalysis(List<PdgNode> nodes, List<PdgEdge> edges, String entryId) {
        for (PdgNode node : nodes) {
            if (node.kind().isControlFlow()) {
                index.put(node.id(), order.size());
                order.add(node.id());
                successors.add(new ArrayList<>());
                predecessors.add(new ArrayList<>());
            }
        }
        for (PdgEdge edge : edges) {
            Integer from = index.get(edge.sourceId());
            Integer to = index.get(edge.targetId());
            if (edge.type().isControlFlow() && from != null && to != null) {
                successors.get(from).add(to);
                predecessors.get(to).add(from);
            }
        }
        computeDominators(index.get(entryId));
    }

    /**
     * Whether a path of at least one edge leads from one node to the other.
     */
    boolean reaches(String fromId, String toId) {
        Integer from = index.get(fromId);
        Integer to = index.get(toId);
        if (from == null || to == null) {
            return false;
        }
        return reachCache.computeIfAbsent(from, this::forwardReach).get(to);
    }

    /**
     * Whether every path from the entry to {@code toId} passes through {@code fromId}.
     */
    boolean dominates(String fromId, String toId) {
        Integer from = index.get(fromId);
        Integer to = index.get(toId);
        if (from == null || to == null || !fromEntry.get(to)) {
            return false;
        }
        return dominators[to].get(from);
    }

    private BitSet forwardReach(int start) {
        BitSet seen = new BitSet(order.size());
        Deque<Integer> stack = new ArrayDeque<>(successors.get(start));
        while (!stack.isEmpty()) {
            int current = stack.pop();
            if (!seen.get(current)) {
                seen.set(current);
                stack.addAll(successors.get(current));
            }
        }
        return seen;
    }

    private void computeDominators(Integer entry) {
        int n = order.size();
        dominators = new BitSet[n];
        fromEntry = new BitSet(n);
        if (entry == null) {
            for (int i = 0; i < n; i++) {
                dominators[i] = new BitSet(n);
                dominators[i].set(i);
            }
            return;
        }
        fromEntry.or(forwardReach(entry));
        fromEntry.set(entry);

        for (int i = 0; i < n; i++) {
            dominators[i] = new BitSet(n);
            if (i == entry || !fromEntry.get(i)) {
                dominators[i].set(i);
            } else {
                dominators[i].or(fromEntry);
            }
        }

        boolean changed = true;
        while (changed) {
            changed = false;
            for (int i = 0; i < n; i++) {
                if (i == entry || !fromEntry.get(i)) {
                    continue;
                }
                BitSet updated = null;
                for (int p : predecessors.get(i)) {
                    if (!fromEntry.get(p)) {
                        continue;
                    }
                    if (updated == null) {
                        updated = (BitSet) dominators[p].clone();
                    } else {
                        updated.and(dominators[p]);
                    }
                }
                if (updated == null) {
                    updated = new BitSet(n);
                }
                updated.set(i);
                if (!updated.equals(dominators[i])) {
                    dominators[i] = updated;
                    changed = true;
                }
            }
        }
    }
}

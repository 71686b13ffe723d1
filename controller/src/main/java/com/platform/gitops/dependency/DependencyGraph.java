package com.platform.gitops.dependency;

import com.platform.gitops.model.Kustomization;
import com.platform.gitops.model.UnitKey;
import com.platform.gitops.reconciliation.KustomizationStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * The dependsOn graph of all stored units, with the cycles it contains.
 * Recomputed only when the store's spec revision moves.
 */
@Slf4j
@Component
public class DependencyGraph {
    
    private final KustomizationStore store;
    private volatile Snapshot snapshot = new Snapshot(-1L, Map.of());
    
    private record Snapshot(long revision, Map<UnitKey, List<UnitKey>> cycles) {
    }
    
    public DependencyGraph(KustomizationStore store) {
        this.store = store;
    }
    
    /**
     * The cycle {@code key} takes part in, as a closed path starting and ending at {@code key}.
     */
    public Optional<List<UnitKey>> findCycle(UnitKey key) {
        return Optional.ofNullable(current().cycles().get(key));
    }
    
    private Snapshot current() {
        long revision = store.specRevision();
        Snapshot cached = snapshot;
        if (cached.revision() == revision) {
            return cached;
        }
        synchronized (this) {
            if (snapshot.revision() != revision) {
                snapshot = new Snapshot(revision, detectCycles(edges()));
                if (!snapshot.cycles().isEmpty()) {
                    log.warn("Dependency cycles detected at spec revision {}: {}", revision, snapshot.cycles().keySet());
                }
            }
            return snapshot;
        }
    }
    
    private Map<UnitKey, List<UnitKey>> edges() {
        Map<UnitKey, List<UnitKey>> edges = new TreeMap<>();
        for (Kustomization unit : store.findAll()) {
            edges.put(unit.getKey(), unit.getDependencyKeys());
        }
        return edges;
    }
    
    /**
     * Strongly connected components of the edges (Tarjan). Every unit in a component with more
     * than one member, or with an edge to itself, is mapped to the shortest closed path through
     * it. Edges to unknown units are ignored.
     */
    static Map<UnitKey, List<UnitKey>> detectCycles(Map<UnitKey, List<UnitKey>> edges) {
        Components components = new Components(edges);
        for (UnitKey node : edges.keySet()) {
            if (!components.index.containsKey(node)) {
                components.connect(node);
            }
        }
        Map<UnitKey, List<UnitKey>> cycles = new HashMap<>();
        for (Set<UnitKey> component : components.found) {
            UnitKey first = component.iterator().next();
            if (component.size() == 1 && !successors(first, edges).contains(first)) {
                continue;
            }
            for (UnitKey member : component) {
                cycles.put(member, closedPath(member, component, edges));
            }
        }
        return cycles;
    }
    
    private static List<UnitKey> successors(UnitKey node, Map<UnitKey, List<UnitKey>> edges) {
        List<UnitKey> known = new ArrayList<>();
        for (UnitKey next : edges.getOrDefault(node, List.of())) {
            if (edges.containsKey(next)) {
                known.add(next);
            }
        }
        return known;
    }
    
    /**
     * Breadth-first search inside one component from {@code node} back to itself.
     */
    private static List<UnitKey> closedPath(UnitKey node, Set<UnitKey> component, Map<UnitKey, List<UnitKey>> edges) {
        Map<UnitKey, UnitKey> parent = new HashMap<>();
        Set<UnitKey> seen = new HashSet<>(List.of(node));
        Deque<UnitKey> queue = new ArrayDeque<>(List.of(node));
        while (!queue.isEmpty()) {
            UnitKey current = queue.poll();
            for (UnitKey next : successors(current, edges)) {
                if (next.equals(node)) {
                    List<UnitKey> path = new ArrayList<>();
                    for (UnitKey step = current; step != null; step = parent.get(step)) {
                        path.add(0, step);
                    }
                    path.add(node);
                    return path;
                }
                if (component.contains(next) && seen.add(next)) {
                    parent.put(next, current);
                    queue.add(next);
                }
            }
        }
        throw new IllegalStateException("no closed path through " + node);
    }
    
    private static final class Components {
        private final Map<UnitKey, List<UnitKey>> edges;
        private final Map<UnitKey, Integer> index = new HashMap<>();
        private final Map<UnitKey, Integer> lowLink = new HashMap<>();
        private final Deque<UnitKey> stack = new ArrayDeque<>();
        private final Set<UnitKey> onStack = new HashSet<>();
        private final List<Set<UnitKey>> found = new ArrayList<>();
        
        private Components(Map<UnitKey, List<UnitKey>> edges) {
            this.edges = edges;
        }
        
        private void connect(UnitKey node) {
            index.put(node, index.size());
            lowLink.put(node, index.get(node));
            stack.push(node);
            onStack.add(node);
            for (UnitKey next : successors(node, edges)) {
                if (!index.containsKey(next)) {
                    connect(next);
                    lowLink.put(node, Math.min(lowLink.get(node), lowLink.get(next)));
                } else if (onStack.contains(next)) {
                    lowLink.put(node, Math.min(lowLink.get(node), index.get(next)));
                }
            }
            if (lowLink.get(node).equals(index.get(node))) {
                Set<UnitKey> component = new LinkedHashSet<>();
                UnitKey member;
                do {
                    member = stack.pop();
                    onStack.remove(member);
                    component.add(member);
                } while (!member.equals(node));
                found.add(component);
            }
        }
    }
}

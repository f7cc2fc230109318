package com.dnagraph.core.graph;

import com.dnagraph.core.model.Decision;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable identity-keyed view of all decisions loaded in one invocation.
 * <p>
 * Only forward edges ({@code depends_on}) are stored on the nodes; reverse edges
 * are derived on demand. Iteration order is ID ascending.
 */
public final class DecisionGraph {

    private final Map<String, Decision> nodes;

    DecisionGraph(Map<String, Decision> nodes) {
        this.nodes = Collections.unmodifiableMap(new TreeMap<>(nodes));
    }

    /**
     * Builds a graph directly from decisions, rejecting duplicate IDs.
     */
    public static DecisionGraph of(Collection<Decision> decisions) {
        var map = new TreeMap<String, Decision>();
        for (Decision d : decisions) {
            Decision previous = map.putIfAbsent(d.id(), d);
            if (previous != null) {
                throw new IdCollisionException(d.id(), previous.scope(), d.scope());
            }
        }
        return new DecisionGraph(map);
    }

    public static DecisionGraph empty() {
        return new DecisionGraph(Map.of());
    }

    public Map<String, Decision> nodes() {
        return nodes;
    }

    public Set<String> ids() {
        return nodes.keySet();
    }

    public Collection<Decision> decisions() {
        return nodes.values();
    }

    public int size() {
        return nodes.size();
    }

    public boolean contains(String id) {
        return id != null && nodes.containsKey(id);
    }

    public Optional<Decision> find(String id) {
        return Optional.ofNullable(id == null ? null : nodes.get(id));
    }

    /**
     * @throws DecisionNotFoundException if the ID is not in the graph
     */
    public Decision require(String id) {
        return find(id).orElseThrow(() -> new DecisionNotFoundException(id));
    }

    /**
     * Decisions whose {@code depends_on} contains the given ID, in ID order.
     * Linear scan over all nodes.
     */
    public List<String> getDependents(String id) {
        var dependents = new ArrayList<String>();
        for (var entry : nodes.entrySet()) {
            if (entry.getValue().dependsOn().contains(id)) {
                dependents.add(entry.getKey());
            }
        }
        return dependents;
    }

    /**
     * Flat dependency IDs of a node. Normalisation of the historical reference
     * shapes happens at load time, so this is the node's own list.
     */
    public List<String> getDepsList(Decision node) {
        return node == null ? List.of() : node.dependsOn();
    }

    /**
     * Dependencies of a node that exist in the graph. Dangling references are
     * reported by the validator and skipped by graph traversals. Duplicates collapse.
     */
    public List<String> resolvedDeps(String id) {
        Decision node = nodes.get(id);
        if (node == null) return List.of();
        return node.dependsOn().stream().filter(nodes::containsKey).distinct().toList();
    }
}

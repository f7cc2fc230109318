package com.dnagraph.core.validation;

import com.dnagraph.core.graph.DecisionGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cycle searches over the forward-edge ({@code depends_on}) graph.
 * All traversals use explicit work stacks.
 */
public final class CycleDetector {

    private enum Color { WHITE, GRAY, BLACK }

    private CycleDetector() {}

    /**
     * Three-colour depth-first search from every unvisited node in ID order.
     * <p>
     * A back-edge to an in-progress node yields the cycle as the path from where
     * that node reappears back to itself, e.g. {@code [A, B, C, A]}. At most one
     * cycle is reported per root; the rest of that root's traversal is abandoned.
     */
    public static List<List<String>> findCycles(DecisionGraph graph) {
        var color = new HashMap<String, Color>();
        for (String id : graph.ids()) {
            color.put(id, Color.WHITE);
        }
        var cycles = new ArrayList<List<String>>();

        for (String root : graph.ids()) {
            if (color.get(root) != Color.WHITE) continue;

            // Each frame is a node plus the index of the next dependency to examine.
            Deque<Frame> stack = new ArrayDeque<>();
            List<String> path = new ArrayList<>();
            stack.push(new Frame(root, graph.resolvedDeps(root)));
            path.add(root);
            color.put(root, Color.GRAY);

            while (!stack.isEmpty()) {
                Frame top = stack.peek();
                if (top.next >= top.deps.size()) {
                    color.put(top.node, Color.BLACK);
                    stack.pop();
                    path.remove(path.size() - 1);
                    continue;
                }
                String dep = top.deps.get(top.next++);
                Color c = color.get(dep);
                if (c == Color.GRAY) {
                    var cycle = new ArrayList<>(path.subList(path.indexOf(dep), path.size()));
                    cycle.add(dep);
                    cycles.add(cycle);
                    // abandon this root; everything still on the stack is settled
                    for (String onPath : path) {
                        color.put(onPath, Color.BLACK);
                    }
                    stack.clear();
                    path.clear();
                } else if (c == Color.WHITE) {
                    color.put(dep, Color.GRAY);
                    stack.push(new Frame(dep, graph.resolvedDeps(dep)));
                    path.add(dep);
                }
            }
        }
        return cycles;
    }

    /**
     * Whether {@code target} is reachable from {@code start} following the given adjacency.
     * Used to test a proposed edge {@code target -> start}: reachability means the
     * edge would close a cycle.
     */
    public static boolean reaches(Map<String, Set<String>> adjacency, String start, String target) {
        Set<String> visited = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (current.equals(target)) {
                return true;
            }
            if (!visited.add(current)) continue;
            for (String next : adjacency.getOrDefault(current, Set.of())) {
                if (!visited.contains(next)) {
                    stack.push(next);
                }
            }
        }
        return false;
    }

    /**
     * Adjacency of the existing graph restricted to resolvable edges, optionally
     * leaving out one node's outgoing edges.
     */
    public static Map<String, Set<String>> adjacency(DecisionGraph graph, String excludeOutgoingOf) {
        var adj = new HashMap<String, Set<String>>();
        for (String id : graph.ids()) {
            if (id.equals(excludeOutgoingOf)) continue;
            adj.put(id, new HashSet<>(graph.resolvedDeps(id)));
        }
        return adj;
    }

    private static final class Frame {
        final String node;
        final List<String> deps;
        int next;

        Frame(String node, List<String> deps) {
            this.node = node;
            this.deps = deps;
        }
    }
}

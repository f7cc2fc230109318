package com.dnagraph.core.frontier;

import com.dnagraph.core.graph.DecisionGraph;
import com.dnagraph.core.model.Decision;
import com.dnagraph.core.model.DecisionLevel;
import com.dnagraph.core.model.DecisionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes the decision frontier: which suggested decisions can be committed now,
 * which are blocked and by what chain, how each level is doing, and which nodes
 * carry the most downstream weight.
 */
@Service
public class FrontierAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(FrontierAnalyzer.class);

    public static final int DEFAULT_TOP = 10;

    private static final int UNKNOWN_LEVEL_RANK = 99;

    public FrontierReport analyze(DecisionGraph graph, int topN) {
        Map<String, Set<String>> downstream = transitiveDownstream(graph);

        var committable = new ArrayList<FrontierEntry>();
        var blocked = new ArrayList<FrontierEntry>();

        for (Decision n : graph.decisions()) {
            if (!n.isIn(DecisionState.SUGGESTED)) continue;

            List<String> uncommitted = graph.resolvedDeps(n.id()).stream()
                    .filter(dep -> !graph.require(dep).isCommitted())
                    .toList();
            Set<String> reach = downstream.get(n.id());
            List<String> reachIds = new ArrayList<>(new TreeSet<>(reach));

            if (uncommitted.isEmpty()) {
                committable.add(new FrontierEntry(n.id(), n.titleOrEmpty(), n.level(), n.stakes(),
                        n.scope().value(), reach.size(), reachIds, null, null));
            } else {
                blocked.add(new FrontierEntry(n.id(), n.titleOrEmpty(), n.level(), n.stakes(),
                        n.scope().value(), reach.size(), reachIds, uncommitted, criticalPath(graph, n.id())));
            }
        }

        committable.sort(Comparator.comparingInt((FrontierEntry e) -> -e.downstreamWeight())
                .thenComparingInt(e -> e.level() != null ? e.level() : UNKNOWN_LEVEL_RANK)
                .thenComparing(FrontierEntry::id));
        blocked.sort(Comparator.comparingInt((FrontierEntry e) -> e.criticalPath().size())
                .thenComparingInt(e -> -e.downstreamWeight())
                .thenComparing(FrontierEntry::id));

        List<LevelGap> gaps = levelGaps(graph);
        List<WeightedNode> highWeight = highWeight(graph, downstream, topN);

        int suggested = (int) graph.decisions().stream().filter(d -> d.isIn(DecisionState.SUGGESTED)).count();
        var summary = new FrontierReport.Summary(graph.size(), suggested, committable.size(), blocked.size(),
                (int) gaps.stream().filter(LevelGap::isFlagged).count());

        log.debug("Frontier: {} committable, {} blocked of {} suggested", committable.size(), blocked.size(), suggested);
        return new FrontierReport(List.copyOf(committable), List.copyOf(blocked), gaps, highWeight, summary, topN);
    }

    /**
     * For every node, the set of nodes that transitively depend on it.
     * <p>
     * Each breadth-first walk over the dependents graph reuses closures already
     * computed: reaching a memoised node adds its closure wholesale instead of
     * expanding it again. Nodes are processed in reverse ID order so leaves tend to
     * be settled before their ancestors.
     */
    public Map<String, Set<String>> transitiveDownstream(DecisionGraph graph) {
        var reverse = new HashMap<String, Set<String>>();
        for (Decision n : graph.decisions()) {
            for (String dep : graph.resolvedDeps(n.id())) {
                reverse.computeIfAbsent(dep, k -> new TreeSet<>()).add(n.id());
            }
        }

        var memo = new HashMap<String, Set<String>>();
        var ids = new ArrayList<>(graph.ids());
        for (int i = ids.size() - 1; i >= 0; i--) {
            String nid = ids.get(i);
            var closure = new HashSet<String>();
            Deque<String> queue = new ArrayDeque<>(reverse.getOrDefault(nid, Set.of()));
            while (!queue.isEmpty()) {
                String current = queue.poll();
                if (!closure.add(current)) continue;
                Set<String> known = memo.get(current);
                if (known != null) {
                    closure.addAll(known);
                    continue;
                }
                for (String next : reverse.getOrDefault(current, Set.of())) {
                    if (!closure.contains(next)) queue.add(next);
                }
            }
            memo.put(nid, closure);
        }
        return memo;
    }

    /**
     * The chain of uncommitted upstream decisions that must be resolved, in order,
     * before {@code targetId} can be committed: from the deepest unresolved ancestor
     * down to (excluding) the target.
     */
    public List<String> criticalPath(DecisionGraph graph, String targetId) {
        Set<String> visited = new HashSet<>(List.of(targetId));
        Map<String, Integer> depth = new LinkedHashMap<>();
        Map<String, String> parent = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>(List.of(targetId));
        depth.put(targetId, 0);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String dep : graph.resolvedDeps(current)) {
                if (visited.contains(dep) || graph.require(dep).isCommitted()) continue;
                visited.add(dep);
                depth.put(dep, depth.get(current) + 1);
                parent.put(dep, current);
                queue.add(dep);
            }
        }

        if (parent.isEmpty()) {
            return graph.resolvedDeps(targetId).stream()
                    .filter(dep -> !graph.require(dep).isCommitted())
                    .toList();
        }

        // first node discovered at the greatest depth
        String deepest = null;
        int maxDepth = -1;
        for (var entry : depth.entrySet()) {
            if (parent.containsKey(entry.getKey()) && entry.getValue() > maxDepth) {
                deepest = entry.getKey();
                maxDepth = entry.getValue();
            }
        }

        var path = new ArrayList<String>();
        String current = deepest;
        while (current != null && !current.equals(targetId)) {
            path.add(current);
            current = parent.get(current);
        }
        return path;
    }

    private List<LevelGap> levelGaps(DecisionGraph graph) {
        var gaps = new ArrayList<LevelGap>();
        for (DecisionLevel level : DecisionLevel.values()) {
            int committed = 0;
            int suggested = 0;
            int superseded = 0;
            for (Decision n : graph.decisions()) {
                if (n.level() == null || n.level() != level.rank()) continue;
                if (n.isIn(DecisionState.COMMITTED)) committed++;
                else if (n.isIn(DecisionState.SUGGESTED)) suggested++;
                else if (n.isIn(DecisionState.SUPERSEDED)) superseded++;
            }
            int total = committed + suggested + superseded;
            var flags = new ArrayList<String>();
            if (suggested > committed) flags.add(LevelGap.MORE_SUGGESTED);
            if (committed == 0 && total > 0) flags.add(LevelGap.NONE_COMMITTED);
            gaps.add(new LevelGap(level.rank(), level.displayName(), committed, suggested, superseded, total,
                    List.copyOf(flags)));
        }
        return List.copyOf(gaps);
    }

    private List<WeightedNode> highWeight(DecisionGraph graph, Map<String, Set<String>> downstream, int topN) {
        return graph.decisions().stream()
                .map(n -> new WeightedNode(n.id(), n.titleOrEmpty(), n.level(), n.stateOrUnknown(), n.stakes(),
                        n.scope().value(), downstream.get(n.id()).size(), graph.getDependents(n.id())))
                .sorted(Comparator.comparingInt((WeightedNode w) -> -w.downstreamWeight())
                        .thenComparing(WeightedNode::id))
                .limit(Math.max(0, topN))
                .toList();
    }
}

package com.dnagraph.core.cascade;

import com.dnagraph.core.graph.DecisionGraph;
import com.dnagraph.core.graph.DecisionNotFoundException;
import com.dnagraph.core.model.Decision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes propagation cascades as breadth-first waves.
 * <p>
 * Wave 1 holds the direct neighbours of the start node in the requested direction;
 * wave k+1 holds the unvisited neighbours of wave k. Each node is reported once,
 * in the earliest wave that reaches it, and expansion stops at the first empty wave.
 */
@Service
public class CascadeEngine {

    private static final Logger log = LoggerFactory.getLogger(CascadeEngine.class);

    /**
     * @throws DecisionNotFoundException if the start node is not in the graph
     */
    public CascadeResult cascade(DecisionGraph graph, String startId, CascadeDirection direction) {
        graph.require(startId);

        Set<String> visited = new HashSet<>();
        visited.add(startId);
        Set<String> current = new TreeSet<>(List.of(startId));
        var waves = new ArrayList<CascadeWave>();
        int waveNumber = 0;

        while (!current.isEmpty()) {
            waveNumber++;
            var effects = new ArrayList<CascadeEffect>();
            var next = new TreeSet<String>();

            for (String nid : current) {
                Decision via = graph.require(nid);
                for (String neighbour : neighbours(graph, nid, direction)) {
                    if (!visited.add(neighbour)) continue;
                    Decision affected = graph.require(neighbour);
                    effects.add(new CascadeEffect(
                            neighbour,
                            affected.stateOrUnknown(),
                            nid,
                            direction == CascadeDirection.DOWNSTREAM
                                    ? "depends on " + nid
                                    : nid + " depends on this",
                            via.scope() != affected.scope()));
                    next.add(neighbour);
                }
            }

            if (effects.isEmpty()) break;
            waves.add(new CascadeWave(waveNumber, List.copyOf(effects)));
            current = next;
        }

        int total = waves.stream().mapToInt(w -> w.effects().size()).sum();
        int unique = (int) waves.stream().flatMap(w -> w.effects().stream()).map(CascadeEffect::node).distinct().count();
        log.debug("Cascade {} from {}: {} waves, {} nodes", direction.value(), startId, waves.size(), unique);

        return new CascadeResult(startId, direction, List.copyOf(waves),
                new CascadeResult.Summary(total, unique, waves.size()));
    }

    private List<String> neighbours(DecisionGraph graph, String nid, CascadeDirection direction) {
        if (direction == CascadeDirection.DOWNSTREAM) {
            return graph.getDependents(nid);
        }
        return new ArrayList<>(new TreeSet<>(graph.resolvedDeps(nid)));
    }
}

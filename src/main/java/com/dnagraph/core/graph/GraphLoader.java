package com.dnagraph.core.graph;

import com.dnagraph.core.model.Decision;
import com.dnagraph.core.model.DecisionRecord;
import com.dnagraph.core.model.DependencyRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link DecisionGraph} from the records of both partitions.
 * <p>
 * The constitution partition is loaded first, each partition in ID order. Order has
 * no effect on the result other than which scope a collision message names first.
 */
@Component
public class GraphLoader {

    private static final Logger log = LoggerFactory.getLogger(GraphLoader.class);

    /**
     * @param constitution records from the upstream partition
     * @param project      records from the project partition
     * @return the loaded graph
     * @throws IdCollisionException if an ID occurs more than once across both partitions
     */
    public DecisionGraph load(List<DecisionRecord> constitution, List<DecisionRecord> project) {
        var nodes = new LinkedHashMap<String, Decision>();
        loadPartition(constitution, nodes);
        loadPartition(project, nodes);
        log.debug("Loaded {} decisions ({} constitution records, {} project records)",
                nodes.size(), constitution.size(), project.size());
        return new DecisionGraph(nodes);
    }

    private void loadPartition(List<DecisionRecord> records, Map<String, Decision> nodes) {
        var withIds = new ArrayList<DecisionRecord>();
        for (var record : records) {
            if (idOf(record) == null) {
                log.warn("Skipping record without id: {}", record.path());
                continue;
            }
            withIds.add(record);
        }
        withIds.sort(Comparator.comparing(GraphLoader::idOf));

        for (var record : withIds) {
            Decision decision = toDecision(record);
            Decision existing = nodes.get(decision.id());
            if (existing != null) {
                throw new IdCollisionException(decision.id(), existing.scope(), decision.scope());
            }
            nodes.put(decision.id(), decision);
        }
    }

    /**
     * Converts a raw record to a node, normalising its dependency list.
     */
    public static Decision toDecision(DecisionRecord record) {
        Map<String, Object> f = record.fields();
        Object rawLevel = f.get("level");
        return new Decision(
                idOf(record),
                text(f.get("title")),
                text(f.get("date")),
                parseLevel(rawLevel),
                text(rawLevel),
                text(f.get("state")),
                text(f.get("stakes")),
                DependencyRef.normalize(f.get("depends_on")),
                record.scope(),
                record.path(),
                record.body()
        );
    }

    /**
     * Only a YAML integer is a level. A quoted {@code "2"} stays raw and is reported as invalid.
     */
    static Integer parseLevel(Object raw) {
        if (raw instanceof Integer i) return i;
        if (raw instanceof Long l && l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) return l.intValue();
        return null;
    }

    private static String idOf(DecisionRecord record) {
        Object id = record.fields() == null ? null : record.fields().get("id");
        return id == null || id.toString().isBlank() ? null : id.toString().trim();
    }

    private static String text(Object value) {
        if (value == null) return null;
        String s = value.toString();
        return s.isEmpty() ? null : s;
    }
}

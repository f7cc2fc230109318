package com.dnagraph.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One entry of a decision's {@code depends_on} list as written in frontmatter.
 * <p>
 * Two historical shapes exist: a bare ID ({@code - DEC-001}) and a structured
 * reference ({@code - id: DEC-001} with extra keys). Only the ID takes part in
 * graph algorithms; {@link #normalize(Object)} flattens a raw list once at load time.
 */
public interface DependencyRef {

    String id();

    /** Bare ID entry. */
    record Plain(String id) implements DependencyRef {}

    /** Structured entry; attributes other than {@code id} are carried but unused. */
    record Structured(String id, Map<String, Object> attributes) implements DependencyRef {}

    /**
     * Parses one raw list element. Returns empty for shapes that carry no usable ID.
     */
    static Optional<DependencyRef> parse(Object raw) {
        if (raw instanceof String s) {
            return s.isBlank() ? Optional.empty() : Optional.of(new Plain(s.trim()));
        }
        if (raw instanceof Map<?, ?> map) {
            Object id = map.get("id");
            if (id == null || id.toString().isBlank()) {
                return Optional.empty();
            }
            var attributes = new LinkedHashMap<String, Object>();
            map.forEach((k, v) -> {
                if (!"id".equals(k)) attributes.put(String.valueOf(k), v);
            });
            return Optional.of(new Structured(id.toString().trim(), attributes));
        }
        return Optional.empty();
    }

    /**
     * Flattens a raw {@code depends_on} value to dependency IDs, preserving order.
     */
    static List<String> normalize(Object rawList) {
        var ids = new ArrayList<String>();
        if (rawList instanceof List<?> list) {
            for (Object entry : list) {
                parse(entry).ifPresent(ref -> ids.add(ref.id()));
            }
        }
        return ids;
    }
}

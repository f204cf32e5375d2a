package com.consensushub.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lookup of decision types that contradict each other, e.g. scale-up and
 * scale-down. Loaded from configuration so new antonym pairs need no code
 * change. A pair opposes if either side lists the other.
 */
public class OpposingTypesTable {

    private final Map<String, Set<String>> opposites;

    public OpposingTypesTable(Map<String, ? extends Iterable<String>> table) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        table.forEach((type, others) -> {
            Set<String> set = new LinkedHashSet<>();
            others.forEach(set::add);
            copy.put(type, Collections.unmodifiableSet(set));
        });
        this.opposites = Collections.unmodifiableMap(copy);
    }

    public static OpposingTypesTable defaults() {
        Map<String, List<String>> table = new LinkedHashMap<>();
        table.put("scale-up", List.of("scale-down", "reduce-resources"));
        table.put("scale-down", List.of("scale-up", "increase-capacity"));
        table.put("increase-security", List.of("reduce-restrictions"));
        table.put("optimize-speed", List.of("optimize-security"));
        return new OpposingTypesTable(table);
    }

    public boolean opposes(String type1, String type2) {
        return listed(type1, type2) || listed(type2, type1);
    }

    public Map<String, Set<String>> asMap() {
        return opposites;
    }

    private boolean listed(String type, String other) {
        Set<String> set = opposites.get(type);
        return set != null && set.contains(other);
    }
}

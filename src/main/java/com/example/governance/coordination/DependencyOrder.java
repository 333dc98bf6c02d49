package com.example.governance.coordination;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Orders items so that every item comes after the items it depends on. Among items whose
 * dependencies are satisfied, list order wins, so a list that already respects its edges is
 * returned unchanged.
 */
final class DependencyOrder {

    private DependencyOrder() {
    }

    /**
     * @param kind used in error messages ("phase", "action")
     * @throws CoordinationException on a dependency to an unknown id or a cycle
     */
    static <T> List<T> sort(List<T> items,
                            Function<T, String> idOf,
                            Function<T, Collection<String>> dependenciesOf,
                            String kind) {
        Map<String, T> byId = new LinkedHashMap<>();
        for (T item : items) {
            if (byId.putIfAbsent(idOf.apply(item), item) != null) {
                throw new CoordinationException("duplicate " + kind + " id: " + idOf.apply(item));
            }
        }
        for (T item : items) {
            for (String dep : dependenciesOf.apply(item)) {
                if (!byId.containsKey(dep)) {
                    throw new CoordinationException(kind + " " + idOf.apply(item) + " depends on unknown " + kind + " " + dep);
                }
            }
        }

        List<T> ordered = new ArrayList<>(items.size());
        Set<String> placed = new HashSet<>();
        while (ordered.size() < items.size()) {
            T next = null;
            for (T item : items) {
                String id = idOf.apply(item);
                if (!placed.contains(id) && placed.containsAll(dependenciesOf.apply(item))) {
                    next = item;
                    break;
                }
            }
            if (next == null) {
                List<String> stuck = items.stream().map(idOf).filter(id -> !placed.contains(id)).toList();
                throw new CoordinationException(kind + " dependency cycle among " + stuck);
            }
            ordered.add(next);
            placed.add(idOf.apply(next));
        }
        return ordered;
    }

    /** Flattens the plan's dependency edges into phase id to prerequisite ids. */
    static Map<String, List<String>> phaseEdges(RecoveryPlan plan) {
        Map<String, List<String>> edges = new LinkedHashMap<>();
        for (PhaseDependency d : plan.dependencies()) {
            edges.computeIfAbsent(d.phaseId(), k -> new ArrayList<>()).addAll(d.dependsOn());
        }
        return edges;
    }
}

package com.e2eq.hooks.authz;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Precomputed closure of a model's relation inheritance: for each relation, the set
 * of relations whose holders also satisfy it (the relation itself included).
 * Built once per model write so permission checks never walk the graph.
 */
public final class RelationClosure {

    private final Map<String, Set<String>> satisfying;

    private RelationClosure(Map<String, Set<String>> satisfying) {
        this.satisfying = satisfying;
    }

    /**
     * @param relations relation name to the relations that imply it; must be acyclic
     */
    public static RelationClosure compute(Map<String, List<String>> relations) {
        Map<String, Set<String>> closure = new HashMap<>();
        if (relations != null) {
            for (String relation : relations.keySet()) {
                closure.put(relation, Collections.unmodifiableSet(walk(relations, relation)));
            }
        }
        return new RelationClosure(Collections.unmodifiableMap(closure));
    }

    private static Set<String> walk(Map<String, List<String>> relations, String target) {
        Set<String> result = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        result.add(target);
        queue.add(target);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            List<String> impliers = relations.get(current);
            if (impliers == null) {
                continue;
            }
            for (String implier : impliers) {
                if (result.add(implier)) {
                    queue.add(implier);
                }
            }
        }
        return result;
    }

    /**
     * Relations that satisfy {@code relation}. Unknown relations are satisfied only by themselves.
     */
    public Set<String> satisfying(String relation) {
        Set<String> s = satisfying.get(relation);
        return s != null ? s : Set.of(relation);
    }

    public boolean implies(String held, String required) {
        return satisfying(required).contains(held);
    }
}

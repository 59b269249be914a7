package io.github.yok.sqlbackup.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.Validate;

/**
 * Resolves a deterministic parent-first table order from foreign key dependencies.
 *
 * <h2>Purpose</h2>
 *
 * <p>
 * A dump must create and fill referenced tables before the tables that reference them so that it
 * can be replayed top to bottom. This class orders tables by the dependency graph collected during
 * schema introspection.
 * </p>
 *
 * <h2>Algorithm</h2>
 *
 * <p>
 * A directed graph is built where an edge {@code parent -> child} exists if {@code child} has a
 * foreign key referencing {@code parent}. Kahn's topological sort is then applied.
 * </p>
 *
 * <h2>Determinism</h2>
 *
 * <p>
 * When several tables are eligible at the same time, they are emitted in catalog order (their
 * position in the input list), so the same catalog always yields the same dump.
 * </p>
 *
 * <h2>Rules / limitations</h2>
 *
 * <ul>
 * <li>Parents not contained in {@code tables} are ignored.</li>
 * <li>Self-referencing foreign keys are ignored.</li>
 * <li>Multiple foreign keys from the same child to the same parent are treated as one edge.</li>
 * <li>Table names are compared case-insensitively; for duplicates the first occurrence wins.</li>
 * <li>If a cycle exists, the acyclic portion is sorted first, then the tables left in or behind
 * the cycle are appended in catalog order and a warning is logged.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class TableDependencyResolver {

    /**
     * Prevents instantiation.
     */
    private TableDependencyResolver() {
        throw new AssertionError("TableDependencyResolver must not be instantiated.");
    }

    /**
     * Resolves a parent-first order for the given tables.
     *
     * @param tables table names in catalog order; may be {@code null} or empty (returns empty
     *        list)
     * @param parentsByChild referenced table names keyed by referencing table name; tables without
     *        foreign keys may be absent
     * @return original table names in parent-first order
     * @throws IllegalArgumentException if {@code tables} contains {@code null}/blank names
     */
    public static List<String> resolveOrder(List<String> tables,
            Map<String, ? extends Collection<String>> parentsByChild) {

        if (tables == null || tables.isEmpty()) {
            return new ArrayList<>();
        }
        for (String t : tables) {
            Validate.notBlank(t, "tables must not contain null/blank names.");
        }

        // Step 1: Case-insensitive normalization (first occurrence wins), remembering positions.
        Map<String, String> normalizedMap = new LinkedHashMap<>();
        for (String t : tables) {
            String lower = t.toLowerCase(Locale.ROOT);
            if (normalizedMap.containsKey(lower)) {
                log.warn("Duplicate table name detected (case-insensitive): '{}' and '{}'. "
                        + "Using the first occurrence.", normalizedMap.get(lower), t);
                continue;
            }
            normalizedMap.put(lower, t);
        }
        Map<String, Integer> position = new HashMap<>();
        for (String lower : normalizedMap.keySet()) {
            position.put(lower, position.size());
        }

        // Step 2: Build edges parent -> child.
        Map<String, Set<String>> edges = new HashMap<>();
        Map<String, Integer> inDegree = new HashMap<>();
        for (String lower : normalizedMap.keySet()) {
            edges.put(lower, new LinkedHashSet<>());
            inDegree.put(lower, 0);
        }
        if (parentsByChild != null) {
            for (Map.Entry<String, ? extends Collection<String>> entry : parentsByChild
                    .entrySet()) {
                String childLower = entry.getKey().toLowerCase(Locale.ROOT);
                if (!normalizedMap.containsKey(childLower) || entry.getValue() == null) {
                    continue;
                }
                for (String parent : entry.getValue()) {
                    addEdge(parent, childLower, normalizedMap, edges, inDegree);
                }
            }
        }

        // Step 3: Kahn's topological sort with catalog-order tie-break.
        PriorityQueue<String> queue = new PriorityQueue<>(Comparator.comparing(position::get));
        for (String lower : normalizedMap.keySet()) {
            if (inDegree.get(lower) == 0) {
                queue.offer(lower);
            }
        }
        List<String> sorted = new ArrayList<>(normalizedMap.size());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            sorted.add(current);
            for (String child : edges.get(current)) {
                int newDegree = inDegree.merge(child, -1, Integer::sum);
                if (newDegree == 0) {
                    queue.offer(child);
                }
            }
        }

        // Step 4: Append tables blocked by a cycle in catalog order.
        if (sorted.size() < normalizedMap.size()) {
            Set<String> sortedSet = new LinkedHashSet<>(sorted);
            List<String> cyclic = normalizedMap.keySet().stream()
                    .filter(lower -> !sortedSet.contains(lower)).collect(Collectors.toList());
            log.warn("Circular foreign key reference detected for tables: {}. "
                    + "These tables will be appended in catalog order.",
                    cyclic.stream().map(normalizedMap::get).collect(Collectors.toList()));
            sorted.addAll(cyclic);
        }

        List<String> result = sorted.stream().map(normalizedMap::get).collect(Collectors.toList());
        log.info("Resolved table order (parent-first): {}", result);
        return result;
    }

    private static void addEdge(String parent, String childLower, Map<String, String> normalizedMap,
            Map<String, Set<String>> edges, Map<String, Integer> inDegree) {
        if (parent == null) {
            return;
        }
        String parentLower = parent.toLowerCase(Locale.ROOT);
        if (!normalizedMap.containsKey(parentLower) || parentLower.equals(childLower)) {
            return;
        }
        if (edges.get(parentLower).add(childLower)) {
            inDegree.merge(childLower, 1, Integer::sum);
            log.debug("FK dependency detected: parent='{}' -> child='{}'",
                    normalizedMap.get(parentLower), normalizedMap.get(childLower));
        }
    }
}

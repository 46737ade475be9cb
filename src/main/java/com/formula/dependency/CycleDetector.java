package com.formula.dependency;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Finds circular dependencies in a {@code field id -> dependencies} map.
 * <p>
 * Depth-first search with the active path tracked; an edge back to a node on the
 * path closes a cycle. Start nodes and edges are visited in sorted order so the
 * result does not depend on the caller's map ordering. The caller's map is only read.
 */
public class CycleDetector {

    private static final Logger log = LoggerFactory.getLogger(CycleDetector.class);

    /**
     * Detect cycles.
     *
     * @param dependencies Dependencies of every field in the schema
     * @return Cycle result
     */
    public CycleResult detect(Map<String, ? extends Collection<String>> dependencies) {
        Objects.requireNonNull(dependencies, "dependencies cannot be null");

        Map<String, List<String>> graph = new TreeMap<>();
        for (Map.Entry<String, ? extends Collection<String>> entry : dependencies.entrySet()) {
            Collection<String> edges = entry.getValue() == null ? List.of() : entry.getValue();
            graph.put(entry.getKey(), new ArrayList<>(new TreeSet<>(edges)));
        }

        Search search = new Search(graph);
        for (String start : graph.keySet()) {
            if (!search.finished.contains(start)) {
                search.visit(start);
            }
        }

        List<Cycle> cycles = new ArrayList<>();
        for (List<String> members : search.found) {
            cycles.add(new Cycle(members));
        }
        cycles.sort(Comparator.comparing(Cycle::path));

        if (!cycles.isEmpty()) {
            log.debug("Detected {} dependency cycle(s) across {} fields, first: {}",
                    cycles.size(), graph.size(), cycles.get(0).path());
        }
        return CycleResult.of(cycles, graph.size());
    }

    private static final class Search {

        private final Map<String, List<String>> graph;
        private final Set<String> finished = new HashSet<>();
        private final List<String> path = new ArrayList<>();
        private final Map<String, Integer> onPath = new HashMap<>();
        private final Set<List<String>> found = new LinkedHashSet<>();

        private Search(Map<String, List<String>> graph) {
            this.graph = graph;
        }

        /**
         * Iterative depth-first search from {@code start}; long dependency chains do not
         * grow the call stack.
         */
        private void visit(String start) {
            Deque<Iterator<String>> pending = new ArrayDeque<>();
            push(start, pending);

            while (!pending.isEmpty()) {
                Iterator<String> edges = pending.peek();
                if (!edges.hasNext()) {
                    pending.pop();
                    String node = path.remove(path.size() - 1);
                    onPath.remove(node);
                    finished.add(node);
                    continue;
                }
                String next = edges.next();
                Integer index = onPath.get(next);
                if (index != null) {
                    found.add(rotate(path.subList(index, path.size())));
                } else if (!finished.contains(next) && graph.containsKey(next)) {
                    push(next, pending);
                }
            }
        }

        private void push(String node, Deque<Iterator<String>> pending) {
            onPath.put(node, path.size());
            path.add(node);
            pending.push(graph.getOrDefault(node, List.of()).iterator());
        }

        private static List<String> rotate(List<String> cycle) {
            List<String> rotated = new ArrayList<>(cycle);
            int smallest = rotated.indexOf(Collections.min(rotated));
            Collections.rotate(rotated, -smallest);
            return List.copyOf(rotated);
        }
    }
}

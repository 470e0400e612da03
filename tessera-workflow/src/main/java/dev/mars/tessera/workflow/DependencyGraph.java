/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.tessera.workflow;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Index-based dependency graph over the steps of a workflow.
 * <p>
 * Nodes are stored in declaration order and addressed by index; edges run from a
 * prerequisite to its dependent. References to names that are not nodes are ignored here;
 * {@link WorkflowDefinition#validate()} reports them. A self reference is kept as a one-node
 * cycle.
 * All traversals seed and scan nodes in declaration order so results are deterministic.
 */
public class DependencyGraph {

    private final String[] names;
    private final Map<String, Integer> indexByName;
    private final List<List<Integer>> prerequisites;
    private final List<List<Integer>> dependents;

    /**
     * @param stepNames    node names in declaration order; duplicates keep their first position
     * @param dependencies map of dependent step to the steps it requires
     */
    public DependencyGraph(List<String> stepNames, Map<String, ? extends Collection<String>> dependencies) {
        List<String> unique = new ArrayList<>(new LinkedHashSet<>(stepNames));
        this.names = unique.toArray(new String[0]);
        this.indexByName = new HashMap<>();
        this.prerequisites = new ArrayList<>(names.length);
        this.dependents = new ArrayList<>(names.length);
        for (int i = 0; i < names.length; i++) {
            indexByName.put(names[i], i);
            prerequisites.add(new ArrayList<>());
            dependents.add(new ArrayList<>());
        }
        if (dependencies == null) {
            return;
        }
        for (int to = 0; to < names.length; to++) {
            Collection<String> required = dependencies.get(names[to]);
            if (required == null) {
                continue;
            }
            for (String prerequisite : required) {
                Integer from = indexByName.get(prerequisite);
                if (from == null || prerequisites.get(to).contains(from)) {
                    continue;
                }
                prerequisites.get(to).add(from);
                dependents.get(from).add(to);
            }
        }
    }

    public int size() {
        return names.length;
    }

    public boolean contains(String name) {
        return indexByName.containsKey(name);
    }

    public List<String> getPrerequisites(String name) {
        return namesOf(prerequisites, name);
    }

    public List<String> getDependents(String name) {
        return namesOf(dependents, name);
    }

    /**
     * Kahn's algorithm with the ready queue seeded in declaration order.
     *
     * @return every node ordered so prerequisites precede dependents, or empty if the graph has a cycle
     */
    public Optional<List<String>> topologicalOrder() {
        int[] inDegree = inDegrees();
        Deque<Integer> queue = new ArrayDeque<>();
        for (int i = 0; i < names.length; i++) {
            if (inDegree[i] == 0) {
                queue.addLast(i);
            }
        }
        List<String> order = new ArrayList<>(names.length);
        while (!queue.isEmpty()) {
            int current = queue.removeFirst();
            order.add(names[current]);
            for (int dependent : dependents.get(current)) {
                if (--inDegree[dependent] == 0) {
                    queue.addLast(dependent);
                }
            }
        }
        if (order.size() != names.length) {
            return Optional.empty();
        }
        return Optional.of(Collections.unmodifiableList(order));
    }

    /**
     * Decomposes the graph into frontiers: each batch holds the nodes whose prerequisites all
     * lie in earlier batches.
     *
     * @return the batches, or empty if the graph has a cycle
     */
    public Optional<List<List<String>>> parallelBatches() {
        int[] inDegree = inDegrees();
        boolean[] placed = new boolean[names.length];
        int placedCount = 0;
        List<List<String>> batches = new ArrayList<>();
        while (placedCount < names.length) {
            List<Integer> batch = new ArrayList<>();
            for (int i = 0; i < names.length; i++) {
                if (!placed[i] && inDegree[i] == 0) {
                    batch.add(i);
                }
            }
            if (batch.isEmpty()) {
                return Optional.empty();
            }
            List<String> batchNames = new ArrayList<>(batch.size());
            for (int node : batch) {
                placed[node] = true;
                placedCount++;
                batchNames.add(names[node]);
            }
            for (int node : batch) {
                for (int dependent : dependents.get(node)) {
                    inDegree[dependent]--;
                }
            }
            batches.add(Collections.unmodifiableList(batchNames));
        }
        return Optional.of(Collections.unmodifiableList(batches));
    }

    /**
     * Depth-first search tracking the current path.
     *
     * @return the first cycle found as a path whose first and last element are the same node,
     *         or an empty list if the graph is acyclic
     */
    public List<String> findCycle() {
        // 0 = unvisited, 1 = on current path, 2 = finished
        int[] state = new int[names.length];
        int[] nextEdge = new int[names.length];
        Deque<Integer> path = new ArrayDeque<>();
        for (int start = 0; start < names.length; start++) {
            if (state[start] != 0) {
                continue;
            }
            state[start] = 1;
            path.addLast(start);
            while (!path.isEmpty()) {
                int node = path.peekLast();
                List<Integer> edges = dependents.get(node);
                if (nextEdge[node] == edges.size()) {
                    path.removeLast();
                    state[node] = 2;
                    continue;
                }
                int next = edges.get(nextEdge[node]++);
                if (state[next] == 1) {
                    return cycleFrom(next, path);
                }
                if (state[next] == 0) {
                    state[next] = 1;
                    path.addLast(next);
                }
            }
        }
        return List.of();
    }

    private List<String> cycleFrom(int node, Deque<Integer> path) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (int onPath : path) {
            if (onPath == node) {
                inCycle = true;
            }
            if (inCycle) {
                cycle.add(names[onPath]);
            }
        }
        cycle.add(names[node]);
        return cycle;
    }

    /**
     * Nodes not in {@code completed} whose prerequisites are all in {@code completed}.
     */
    public List<String> readyNodes(Set<String> completed) {
        List<String> ready = new ArrayList<>();
        for (int i = 0; i < names.length; i++) {
            if (!completed.contains(names[i]) && allCompleted(prerequisites.get(i), completed)) {
                ready.add(names[i]);
            }
        }
        return ready;
    }

    /**
     * Dependents of {@code current} not yet completed whose other prerequisites are all in
     * {@code completed}. With a {@code null} current node, returns the uncompleted roots.
     */
    public List<String> nextNodes(String current, Set<String> completed) {
        List<String> next = new ArrayList<>();
        if (current == null) {
            for (int i = 0; i < names.length; i++) {
                if (prerequisites.get(i).isEmpty() && !completed.contains(names[i])) {
                    next.add(names[i]);
                }
            }
            return next;
        }
        Integer index = indexByName.get(current);
        if (index == null) {
            return next;
        }
        for (int dependent : dependents.get(index)) {
            if (completed.contains(names[dependent])) {
                continue;
            }
            boolean ready = true;
            for (int prerequisite : prerequisites.get(dependent)) {
                if (prerequisite != index && !completed.contains(names[prerequisite])) {
                    ready = false;
                    break;
                }
            }
            if (ready) {
                next.add(names[dependent]);
            }
        }
        return next;
    }

    private boolean allCompleted(List<Integer> nodes, Set<String> completed) {
        for (int node : nodes) {
            if (!completed.contains(names[node])) {
                return false;
            }
        }
        return true;
    }

    private int[] inDegrees() {
        int[] inDegree = new int[names.length];
        for (int i = 0; i < names.length; i++) {
            inDegree[i] = prerequisites.get(i).size();
        }
        return inDegree;
    }

    private List<String> namesOf(List<List<Integer>> adjacency, String name) {
        Integer index = indexByName.get(name);
        if (index == null) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (int node : adjacency.get(index)) {
            result.add(names[node]);
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public String toString() {
        return "DependencyGraph{" +
               "nodes=" + List.of(names) +
               '}';
    }
}

package com.herzen.tracker.graph;

import com.herzen.tracker.domain.DomainModels.Dependency;
import com.herzen.tracker.domain.DomainModels.DependencyType;
import com.herzen.tracker.domain.DomainModels.Task;

import java.util.*;

public class GraphModels {

    /**
     * Immutable snapshot of one project's template graph: its tasks, the explicit edges
     * leaving them and the tree links between them.
     */
    public record ProjectGraph(String projectId,
                               Map<String, Task> tasks,
                               Map<String, List<Dependency>> outgoing) {

        public static ProjectGraph of(String projectId, List<Task> tasks, List<Dependency> edges) {
            Map<String, Task> byId = new LinkedHashMap<>();
            tasks.forEach(t -> byId.put(t.id(), t));
            Map<String, List<Dependency>> out = new HashMap<>();
            for (Dependency d : edges) {
                out.computeIfAbsent(d.taskId(), k -> new ArrayList<>()).add(d);
            }
            out.replaceAll((k, v) -> List.copyOf(v));
            return new ProjectGraph(projectId, Collections.unmodifiableMap(byId), Map.copyOf(out));
        }

        public boolean contains(String taskId) {
            return tasks.containsKey(taskId);
        }

        public List<String> targets(String taskId, DependencyType type) {
            return outgoing.getOrDefault(taskId, List.of()).stream()
                    .filter(d -> d.type() == type)
                    .map(Dependency::dependsOnId)
                    .distinct()
                    .toList();
        }

        /**
         * Tree parent first, then explicit PARENT_CHILD targets.
         */
        public List<String> parentsOf(String taskId) {
            List<String> parents = new ArrayList<>();
            Task task = tasks.get(taskId);
            if (task != null && task.parentId() != null) {
                parents.add(task.parentId());
            }
            targets(taskId, DependencyType.PARENT_CHILD).stream()
                    .filter(p -> !parents.contains(p))
                    .forEach(parents::add);
            return parents;
        }

        /**
         * Out-neighbours in the blocking subgraph: BLOCKS targets plus parents.
         */
        public List<String> blockingSuccessors(String taskId) {
            LinkedHashSet<String> next = new LinkedHashSet<>(targets(taskId, DependencyType.BLOCKS));
            next.addAll(parentsOf(taskId));
            return List.copyOf(next);
        }

        /**
         * Number of tree links between the task and the project root.
         */
        public int depth(String taskId) {
            int depth = 0;
            Set<String> seen = new HashSet<>();
            Task current = tasks.get(taskId);
            while (current != null && current.parentId() != null && seen.add(current.id())) {
                depth++;
                current = tasks.get(current.parentId());
            }
            return depth;
        }
    }
}

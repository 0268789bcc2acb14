package com.herzen.tracker.graph;

import com.herzen.tracker.graph.GraphModels.ProjectGraph;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Keeps the blocking subgraph (BLOCKS, PARENT_CHILD and tree links) acyclic.
 *
 * <p>{@link #wouldCreateCycle} sits on the insertion path and only walks the neighbourhood of the
 * candidate target. {@link #detectCycles} is the full Tarjan pass used by integrity audits.
 */
@Component
public class CycleGuard {
    private final TaskGraphStore graphStore;

    public CycleGuard(TaskGraphStore graphStore) {
        this.graphStore = graphStore;
    }

    public boolean wouldCreateCycle(String sourceId, String targetId) {
        return findClosingPath(sourceId, targetId).isPresent();
    }

    /**
     * Path {@code source -> target -> ... -> source} that the edge {@code source -> target} would
     * close, if any. Breadth-first from the target over existing blocking edges, with a visited
     * set so that an already corrupted graph still terminates.
     */
    public Optional<List<String>> findClosingPath(String sourceId, String targetId) {
        if (sourceId.equals(targetId)) {
            return Optional.of(List.of(sourceId, targetId));
        }

        Map<String, String> reachedFrom = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(targetId);
        reachedFrom.put(targetId, null);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : graphStore.blockingSuccessors(current)) {
                if (reachedFrom.containsKey(next)) continue;
                reachedFrom.put(next, current);
                if (next.equals(sourceId)) {
                    return Optional.of(tracePath(sourceId, reachedFrom));
                }
                queue.add(next);
            }
        }
        return Optional.empty();
    }

    /**
     * True when {@code ancestorId} sits above {@code taskId} through tree or PARENT_CHILD links.
     * A BLOCKS edge from a task onto such an ancestor can never be satisfied: the ancestor only
     * closes after all of its descendants have.
     */
    public boolean isAncestor(String ancestorId, String taskId) {
        return ancestorIdsOf(taskId).contains(ancestorId);
    }

    /**
     * Checks a new PARENT_CHILD edge {@code childId -> parentId}. Once it exists, the parent and
     * everything above it become ancestors of the child's whole subtree, so any BLOCKS edge from
     * that subtree onto one of them turns into an unsatisfiable wait. Returns
     * {@code [waiting, ancestor, waiting]} for the first such edge.
     */
    public Optional<List<String>> findAncestorDeadlock(String childId, String parentId) {
        Set<String> above = new HashSet<>(ancestorIdsOf(parentId));
        above.add(parentId);

        Set<String> subtree = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(List.of(childId));
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!subtree.add(current)) continue;
            for (String blockerId : graphStore.blockerIdsOf(current)) {
                if (above.contains(blockerId)) {
                    return Optional.of(List.of(current, blockerId, current));
                }
            }
            graphStore.childrenOf(current).forEach(child -> queue.add(child.id()));
        }
        return Optional.empty();
    }

    private Set<String> ancestorIdsOf(String taskId) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(graphStore.parentIdsOf(taskId));
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (seen.add(current)) {
                queue.addAll(graphStore.parentIdsOf(current));
            }
        }
        return seen;
    }

    /**
     * Every strongly connected component of size &gt; 1 in the project's blocking subgraph.
     * Members of each component are sorted, components are ordered by their first member.
     */
    public List<List<String>> detectCycles(String projectId) {
        return stronglyConnected(graphStore.readProjectGraph(projectId));
    }

    List<List<String>> stronglyConnected(ProjectGraph graph) {
        Tarjan tarjan = new Tarjan(graph);
        for (String node : new TreeSet<>(graph.tasks().keySet())) {
            if (!tarjan.index.containsKey(node)) {
                tarjan.run(node);
            }
        }
        tarjan.components.sort(Comparator.comparing(c -> c.get(0)));
        return List.copyOf(tarjan.components);
    }

    private static List<String> tracePath(String sourceId, Map<String, String> reachedFrom) {
        LinkedList<String> path = new LinkedList<>();
        for (String node = sourceId; node != null; node = reachedFrom.get(node)) {
            path.addFirst(node);
        }
        path.addFirst(sourceId);
        return List.copyOf(path);
    }

    /**
     * Iterative Tarjan: an explicit frame stack replaces recursion so deep curricula cannot
     * overflow the thread stack.
     */
    private static final class Tarjan {
        private final ProjectGraph graph;
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new HashSet<>();
        private final List<List<String>> components = new ArrayList<>();
        private int counter;

        private Tarjan(ProjectGraph graph) {
            this.graph = graph;
        }

        private record Frame(String node, Iterator<String> successors) {}

        private void run(String root) {
            Deque<Frame> frames = new ArrayDeque<>();
            frames.push(visit(root));

            while (!frames.isEmpty()) {
                Frame frame = frames.peek();
                if (frame.successors().hasNext()) {
                    String next = frame.successors().next();
                    if (!index.containsKey(next)) {
                        frames.push(visit(next));
                    } else if (onStack.contains(next)) {
                        lowLink.merge(frame.node(), index.get(next), Math::min);
                    }
                    continue;
                }

                frames.pop();
                String node = frame.node();
                if (!frames.isEmpty()) {
                    lowLink.merge(frames.peek().node(), lowLink.get(node), Math::min);
                }
                if (lowLink.get(node).equals(index.get(node))) {
                    List<String> component = new ArrayList<>();
                    String member;
                    do {
                        member = stack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(node));
                    if (component.size() > 1) {
                        Collections.sort(component);
                        components.add(List.copyOf(component));
                    }
                }
            }
        }

        private Frame visit(String node) {
            index.put(node, counter);
            lowLink.put(node, counter);
            counter++;
            stack.push(node);
            onStack.add(node);
            List<String> successors = graph.contains(node) ? graph.blockingSuccessors(node) : List.of();
            return new Frame(node, successors.iterator());
        }
    }
}

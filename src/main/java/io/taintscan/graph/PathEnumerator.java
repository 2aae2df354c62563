package io.taintscan.graph;

import io.taintscan.model.CycleTruncation;
import io.taintscan.model.TaintPath;

import java.util.*;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Enumerates every path from a path root to a given sink.
 * <p>
 * Traversal is depth-first, roots in declaration order and edges in declaration order, so the
 * sequence is reproducible. Properties of the sequence:
 * <ul>
 *   <li>Lazy and restartable: each call to {@code iterator()} starts a fresh traversal.</li>
 *   <li>A node occurs at most once per path. A back-edge to a node already on the path is not
 *       followed; it is recorded as a {@link CycleTruncation} on the paths through its owner.</li>
 *   <li>Crossing a {@link BranchCondition#NEVER} edge stops the search on that branch and yields
 *       exactly one dead path, completed with the shortest continuation to the sink.</li>
 *   <li>Branches that cannot reach the sink in the raw graph are pruned.</li>
 * </ul>
 */
public class PathEnumerator {

    private final TaintGraph graph;

    public PathEnumerator(TaintGraph graph) {
        this.graph = graph;
    }

    /**
     * Returns the paths ending at the given sink.
     *
     * @throws IllegalArgumentException if the id is unknown or not a sink
     */
    public Iterable<TaintPath> enumeratePaths(String sinkId) {
        Node sink = graph.requireNode(sinkId);
        if (!sink.isSink()) {
            throw new IllegalArgumentException("Node " + sinkId + " is not a sink (kind " + sink.kind() + ")");
        }

        Set<String> reaching = graph.nodesReaching(sinkId);
        List<Node> roots = graph.pathRoots().stream()
                .filter(root -> reaching.contains(root.id()))
                .toList();

        return () -> new PathIterator(sink, reaching, roots);
    }

    /**
     * Returns the paths ending at the given sink as a sequential stream.
     */
    public Stream<TaintPath> stream(String sinkId) {
        return StreamSupport.stream(enumeratePaths(sinkId).spliterator(), false);
    }

    /**
     * One node on the current DFS path and the index of the next outgoing edge to try.
     */
    private static final class Frame {
        private final Node node;
        private final List<CycleTruncation> truncations;
        private int edgeIndex;

        private Frame(Node node, List<CycleTruncation> truncations) {
            this.node = node;
            this.truncations = truncations;
        }
    }

    private final class PathIterator implements Iterator<TaintPath> {

        private final Node sink;
        private final Set<String> reaching;
        private final List<Node> roots;

        private int nextRoot;
        private boolean rootRegistered;
        private final Deque<Frame> stack = new ArrayDeque<>();
        private final List<Node> pathNodes = new ArrayList<>();
        private final List<BranchCondition> pathConditions = new ArrayList<>();
        private final Set<String> onPath = new HashSet<>();
        private TaintPath pending;

        private PathIterator(Node sink, Set<String> reaching, List<Node> roots) {
            this.sink = sink;
            this.reaching = reaching;
            this.roots = roots;
        }

        @Override
        public boolean hasNext() {
            if (pending == null) {
                pending = advance();
            }
            return pending != null;
        }

        @Override
        public TaintPath next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            TaintPath result = pending;
            pending = null;
            return result;
        }

        private TaintPath advance() {
            while (true) {
                if (stack.isEmpty()) {
                    if (nextRoot >= roots.size()) {
                        return null;
                    }
                    Node root = roots.get(nextRoot++);
                    rootRegistered = graph.isRegistered(root.id());
                    push(root, null);
                    continue;
                }

                Frame top = stack.peek();
                List<Edge> out = graph.outgoing(top.node.id());
                if (top.edgeIndex >= out.size()) {
                    pop();
                    continue;
                }

                Edge edge = out.get(top.edgeIndex++);
                String target = edge.to();
                if (!reaching.contains(target) || onPath.contains(target)) {
                    continue;
                }

                if (target.equals(sink.id())) {
                    return emit(List.of(sink), List.of(edge.condition()));
                }

                if (!edge.condition().isTraversable()) {
                    TaintPath dead = completeDeadBranch(edge);
                    if (dead != null) {
                        return dead;
                    }
                    continue;
                }

                push(graph.requireNode(target), edge.condition());
            }
        }

        private void push(Node node, BranchCondition incoming) {
            if (incoming != null) {
                pathConditions.add(incoming);
            }
            pathNodes.add(node);
            onPath.add(node.id());

            Set<CycleTruncation> truncations = new LinkedHashSet<>();
            for (Edge edge : graph.outgoing(node.id())) {
                if (onPath.contains(edge.to()) && reaching.contains(edge.to())) {
                    truncations.add(new CycleTruncation(node.id(), edge.to()));
                }
            }
            stack.push(new Frame(node, List.copyOf(truncations)));
        }

        private void pop() {
            Frame frame = stack.pop();
            pathNodes.remove(pathNodes.size() - 1);
            onPath.remove(frame.node.id());
            if (!stack.isEmpty()) {
                pathConditions.remove(pathConditions.size() - 1);
            }
        }

        /**
         * Builds a path from the current DFS prefix followed by the given tail.
         */
        private TaintPath emit(List<Node> tailNodes, List<BranchCondition> tailConditions) {
            List<Node> nodes = new ArrayList<>(pathNodes);
            nodes.addAll(tailNodes);
            List<BranchCondition> conditions = new ArrayList<>(pathConditions);
            conditions.addAll(tailConditions);

            List<CycleTruncation> truncations = new ArrayList<>();
            Iterator<Frame> rootFirst = stack.descendingIterator();
            while (rootFirst.hasNext()) {
                truncations.addAll(rootFirst.next().truncations);
            }
            return new TaintPath(nodes, conditions, rootRegistered, truncations);
        }

        /**
         * Finds the shortest continuation from the target of a never-taken edge to the sink,
         * avoiding nodes already on the prefix, and emits it as a single dead path.
         *
         * @return the dead path, or null if the sink cannot be reached without revisiting the prefix
         */
        private TaintPath completeDeadBranch(Edge neverEdge) {
            String start = neverEdge.to();
            Map<String, Edge> parent = new HashMap<>();
            Set<String> visited = new HashSet<>();
            Deque<String> queue = new ArrayDeque<>();
            visited.add(start);
            queue.add(start);

            while (!queue.isEmpty()) {
                String current = queue.poll();
                for (Edge edge : graph.outgoing(current)) {
                    String next = edge.to();
                    if (!reaching.contains(next) || onPath.contains(next) || !visited.add(next)) {
                        continue;
                    }
                    parent.put(next, edge);
                    if (next.equals(sink.id())) {
                        return emitDeadBranch(neverEdge, parent);
                    }
                    queue.add(next);
                }
            }
            return null;
        }

        private TaintPath emitDeadBranch(Edge neverEdge, Map<String, Edge> parent) {
            LinkedList<Node> tailNodes = new LinkedList<>();
            LinkedList<BranchCondition> tailConditions = new LinkedList<>();

            String current = sink.id();
            while (!current.equals(neverEdge.to())) {
                Edge via = parent.get(current);
                tailNodes.addFirst(graph.requireNode(current));
                tailConditions.addFirst(via.condition());
                current = via.from();
            }
            tailNodes.addFirst(graph.requireNode(neverEdge.to()));
            tailConditions.addFirst(neverEdge.condition());

            return emit(tailNodes, tailConditions);
        }
    }
}

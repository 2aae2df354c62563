package io.taintscan.graph;

import java.util.*;

/**
 * The program under analysis: nodes, directed edges and the set of registered entry points.
 * <p>
 * Immutable once built, so any number of threads may enumerate and classify paths over it
 * without locking. Node and edge iteration follow declaration order, which is what makes
 * enumeration results reproducible across runs.
 */
public class TaintGraph {

    private final String name;
    private final Map<String, Node> nodes;
    private final List<Edge> edges;
    private final Map<String, List<Edge>> outgoing;
    private final Map<String, List<Edge>> incoming;
    private final Set<String> registeredEntryPoints;
    private final List<Node> pathRoots;

    private TaintGraph(
            String name,
            Map<String, Node> nodes,
            List<Edge> edges,
            Set<String> registeredEntryPoints
    ) {
        this.name = name;
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = List.copyOf(edges);
        this.registeredEntryPoints = Collections.unmodifiableSet(new LinkedHashSet<>(registeredEntryPoints));

        Map<String, List<Edge>> out = new HashMap<>();
        Map<String, List<Edge>> in = new HashMap<>();
        for (Edge edge : this.edges) {
            out.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge);
            in.computeIfAbsent(edge.to(), k -> new ArrayList<>()).add(edge);
        }
        this.outgoing = deepCopyListMap(out);
        this.incoming = deepCopyListMap(in);
        this.pathRoots = findPathRoots();
    }

    private static Map<String, List<Edge>> deepCopyListMap(Map<String, List<Edge>> map) {
        Map<String, List<Edge>> copy = new HashMap<>();
        map.forEach((key, value) -> copy.put(key, List.copyOf(value)));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the graph's name, or null if none was declared.
     */
    public String name() {
        return name;
    }

    /**
     * Returns the node with the given id, or empty if not found.
     */
    public Optional<Node> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    /**
     * Returns the node with the given id.
     *
     * @throws IllegalArgumentException if no such node exists
     */
    public Node requireNode(String id) {
        Node node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node: " + id);
        }
        return node;
    }

    /**
     * Returns all nodes in declaration order.
     */
    public Collection<Node> nodes() {
        return nodes.values();
    }

    /**
     * Returns all edges in declaration order.
     */
    public List<Edge> edges() {
        return edges;
    }

    /**
     * Returns the edges leaving the given node, in declaration order.
     */
    public List<Edge> outgoing(String nodeId) {
        return outgoing.getOrDefault(nodeId, List.of());
    }

    /**
     * Returns the edges entering the given node, in declaration order.
     */
    public List<Edge> incoming(String nodeId) {
        return incoming.getOrDefault(nodeId, List.of());
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    /**
     * Returns true if the node is an entry point wired to the outside world.
     */
    public boolean isRegistered(String nodeId) {
        return registeredEntryPoints.contains(nodeId);
    }

    public Set<String> registeredEntryPoints() {
        return registeredEntryPoints;
    }

    /**
     * Returns all entry-point nodes (registered or not) in declaration order.
     */
    public List<Node> entryPoints() {
        return nodes.values().stream()
                .filter(Node::isEntryPoint)
                .toList();
    }

    /**
     * Returns all sink nodes in declaration order.
     */
    public List<Node> sinks() {
        return nodes.values().stream()
                .filter(Node::isSink)
                .toList();
    }

    /**
     * Returns true if the node has at least one incoming edge from a different node.
     */
    public boolean hasForeignCaller(String nodeId) {
        return incoming(nodeId).stream().anyMatch(edge -> !edge.isSelfLoop());
    }

    /**
     * Returns sinks that no other node has an edge into. Such sinks are out of scope:
     * no path can ever reach them.
     */
    public List<Node> orphanedSinks() {
        return sinks().stream()
                .filter(sink -> !hasForeignCaller(sink.id()))
                .toList();
    }

    /**
     * Returns sinks that are reachable, in the raw graph, from at least one other node.
     */
    public List<Node> inScopeSinks() {
        return sinks().stream()
                .filter(sink -> hasForeignCaller(sink.id()))
                .toList();
    }

    /**
     * Returns the nodes where path enumeration starts, in declaration order: every entry
     * point, plus code that is defined but never wired to anything. Unwired code is a non-sink
     * node with no caller, or the first declared node of a call cycle that nothing outside the
     * cycle calls. Such roots are never registered.
     */
    public List<Node> pathRoots() {
        return pathRoots;
    }

    private List<Node> findPathRoots() {
        Set<String> rootIds = new HashSet<>();
        for (Node node : nodes.values()) {
            if (node.isEntryPoint() || (!node.isSink() && !hasForeignCaller(node.id()))) {
                rootIds.add(node.id());
            }
        }
        for (List<String> component : cycles()) {
            Set<String> members = new HashSet<>(component);
            boolean calledFromOutside = component.stream()
                    .flatMap(id -> incoming(id).stream())
                    .anyMatch(edge -> !members.contains(edge.from()));
            boolean hasRoot = component.stream().anyMatch(rootIds::contains);
            if (calledFromOutside || hasRoot) {
                continue;
            }
            component.stream()
                    .filter(id -> !nodes.get(id).isSink())
                    .findFirst()
                    .ifPresent(rootIds::add);
        }
        return nodes.values().stream()
                .filter(node -> rootIds.contains(node.id()))
                .toList();
    }

    /**
     * Returns the strongly connected components with more than one node, each listed in
     * declaration order. Iterative Tarjan, so deep call chains cannot overflow the stack.
     */
    private List<List<String>> cycles() {
        Map<String, Integer> index = new HashMap<>();
        Map<String, Integer> lowLink = new HashMap<>();
        Deque<String> sccStack = new ArrayDeque<>();
        Set<String> onSccStack = new HashSet<>();
        List<Set<String>> components = new ArrayList<>();

        for (String start : nodes.keySet()) {
            if (index.containsKey(start)) {
                continue;
            }
            Deque<String> callStack = new ArrayDeque<>();
            Map<String, Integer> edgeCursor = new HashMap<>();
            visit(start, index, lowLink, sccStack, onSccStack);
            callStack.push(start);

            while (!callStack.isEmpty()) {
                String current = callStack.peek();
                List<Edge> out = outgoing(current);
                int cursor = edgeCursor.getOrDefault(current, 0);
                if (cursor < out.size()) {
                    edgeCursor.put(current, cursor + 1);
                    String next = out.get(cursor).to();
                    if (!index.containsKey(next)) {
                        visit(next, index, lowLink, sccStack, onSccStack);
                        callStack.push(next);
                    } else if (onSccStack.contains(next)) {
                        lowLink.put(current, Math.min(lowLink.get(current), index.get(next)));
                    }
                    continue;
                }

                callStack.pop();
                if (!callStack.isEmpty()) {
                    String caller = callStack.peek();
                    lowLink.put(caller, Math.min(lowLink.get(caller), lowLink.get(current)));
                }
                if (lowLink.get(current).equals(index.get(current))) {
                    Set<String> component = new HashSet<>();
                    String member;
                    do {
                        member = sccStack.pop();
                        onSccStack.remove(member);
                        component.add(member);
                    } while (!member.equals(current));
                    if (component.size() > 1) {
                        components.add(component);
                    }
                }
            }
        }

        List<List<String>> ordered = new ArrayList<>();
        for (Set<String> component : components) {
            ordered.add(nodes.keySet().stream().filter(component::contains).toList());
        }
        return ordered;
    }

    private static void visit(String id, Map<String, Integer> index, Map<String, Integer> lowLink,
                              Deque<String> sccStack, Set<String> onSccStack) {
        int next = index.size();
        index.put(id, next);
        lowLink.put(id, next);
        sccStack.push(id);
        onSccStack.add(id);
    }

    /**
     * Returns the ids of every node from which the target is reachable (ignoring branch
     * conditions), including the target itself.
     */
    public Set<String> nodesReaching(String targetId) {
        Set<String> reaching = new HashSet<>();
        Deque<String> workQueue = new ArrayDeque<>();
        reaching.add(targetId);
        workQueue.add(targetId);

        while (!workQueue.isEmpty()) {
            String current = workQueue.poll();
            for (Edge edge : incoming(current)) {
                if (reaching.add(edge.from())) {
                    workQueue.add(edge.from());
                }
            }
        }
        return reaching;
    }

    /**
     * Builder for constructing a TaintGraph. Structural checks happen as elements are added,
     * so nodes must be added before the edges and registrations that reference them.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private final Map<String, Node> nodes = new LinkedHashMap<>();
        private final Set<Edge> edges = new LinkedHashSet<>();
        private final Set<String> registered = new LinkedHashSet<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * Adds a node.
         *
         * @throws DuplicateNodeException if a node with the same id was already added
         */
        public Builder addNode(Node node) {
            if (nodes.putIfAbsent(node.id(), node) != null) {
                throw new DuplicateNodeException(node.id());
            }
            return this;
        }

        /**
         * Adds a directed edge. Self-loops and back-edges are allowed; an identical edge
         * added twice is kept once.
         *
         * @throws DanglingEdgeException if either endpoint is unknown
         */
        public Builder addEdge(String from, String to, BranchCondition condition) {
            return addEdge(new Edge(from, to, condition));
        }

        public Builder addEdge(String from, String to) {
            return addEdge(from, to, BranchCondition.ALWAYS);
        }

        public Builder addEdge(Edge edge) {
            if (!nodes.containsKey(edge.from())) {
                throw new DanglingEdgeException(edge, edge.from());
            }
            if (!nodes.containsKey(edge.to())) {
                throw new DanglingEdgeException(edge, edge.to());
            }
            edges.add(edge);
            return this;
        }

        /**
         * Marks an entry point as registered with the hosting server.
         *
         * @throws UnknownEntryPointException if the id is unknown or not an entry point
         */
        public Builder markEntryRegistered(String id) {
            Node node = nodes.get(id);
            if (node == null) {
                throw new UnknownEntryPointException(id, "no such node");
            }
            if (!node.isEntryPoint()) {
                throw new UnknownEntryPointException(id, "node kind is " + node.kind());
            }
            registered.add(id);
            return this;
        }

        public TaintGraph build() {
            return new TaintGraph(name, nodes, new ArrayList<>(edges), registered);
        }
    }
}

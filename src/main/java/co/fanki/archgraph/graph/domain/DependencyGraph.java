package co.fanki.archgraph.graph.domain;

import co.fanki.archgraph.shared.Preconditions;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable snapshot of an accumulated, unfiltered dependency graph.
 *
 * <p>Language-agnostic: nodes are ids with a kind, a language tag and
 * optional package provenance; edges carry the number of raw import
 * occurrences they collapse. The graph is node-closed, and both nodes
 * (by id) and edges (by source, then target) are kept sorted, so equal
 * inputs always produce equal snapshots.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DependencyGraph {

    /**
     * A node of the graph.
     *
     * @param id the unique node id
     * @param kind internal or external
     * @param language the language tag fixed at first observation
     * @param metadata package provenance, null when unknown
     */
    public record GraphNode(String id, NodeKind kind, String language,
            PackageMetadata metadata) {

        /** Checks whether this node belongs to the repository. */
        public boolean isInternal() {
            return kind == NodeKind.INTERNAL;
        }
    }

    /**
     * A weighted, directed edge.
     *
     * @param source the importing node id
     * @param target the imported node id
     * @param weight the number of raw import occurrences, at least 1
     */
    public record GraphEdge(String source, String target, int weight) {

        /** Validates the weight. */
        public GraphEdge {
            Preconditions.requirePositive(weight, "Edge weight must be >= 1");
        }
    }

    private static final Comparator<GraphEdge> EDGE_ORDER = Comparator
            .comparing(GraphEdge::source)
            .thenComparing(GraphEdge::target);

    private final Map<String, GraphNode> nodes;

    private final List<GraphEdge> edges;

    DependencyGraph(final Collection<GraphNode> theNodes,
            final Collection<GraphEdge> theEdges) {
        final Map<String, GraphNode> sorted = new TreeMap<>();
        for (final GraphNode node : theNodes) {
            Preconditions.require(sorted.put(node.id(), node) == null,
                    "Duplicate node id: " + node.id());
        }
        for (final GraphEdge edge : theEdges) {
            Preconditions.require(sorted.containsKey(edge.source())
                    && sorted.containsKey(edge.target()),
                    "Dangling edge: " + edge);
        }
        this.nodes = Collections.unmodifiableMap(sorted);
        this.edges = theEdges.stream().sorted(EDGE_ORDER).toList();
    }

    /**
     * Returns an empty graph.
     *
     * @return the empty graph
     */
    public static DependencyGraph empty() {
        return new DependencyGraph(List.of(), List.of());
    }

    /**
     * Returns all nodes sorted by id.
     *
     * @return the nodes
     */
    public Collection<GraphNode> nodes() {
        return nodes.values();
    }

    /**
     * Returns a node by id.
     *
     * @param id the node id
     * @return the node, or null if absent
     */
    public GraphNode node(final String id) {
        return nodes.get(id);
    }

    /**
     * Returns all edges sorted by source, then target.
     *
     * @return the edges
     */
    public List<GraphEdge> edges() {
        return edges;
    }

    /**
     * Returns the weight of the edge between two nodes.
     *
     * @param source the source id
     * @param target the target id
     * @return the weight, 0 if there is no such edge
     */
    int weight(final String source, final String target) {
        for (final GraphEdge edge : edges) {
            if (edge.source().equals(source) && edge.target().equals(target)) {
                return edge.weight();
            }
        }
        return 0;
    }

    /**
     * Returns the number of nodes.
     *
     * @return the node count
     */
    public int nodeCount() {
        return nodes.size();
    }

    /**
     * Returns the number of edges.
     *
     * @return the edge count
     */
    public int edgeCount() {
        return edges.size();
    }

}

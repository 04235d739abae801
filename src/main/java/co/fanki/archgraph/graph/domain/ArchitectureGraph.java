package co.fanki.archgraph.graph.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The filtered graph document returned to callers.
 *
 * @param nodes the nodes, sorted by id
 * @param edges the edges, sorted by source then target
 * @param stats the summary counts
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ArchitectureGraph(List<Node> nodes, List<Edge> edges,
        Stats stats) {

    /** Copies the lists. */
    public ArchitectureGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    /**
     * A node of the document.
     *
     * @param id the node id
     * @param label the display label
     * @param type internal or external
     * @param language the language tag
     * @param metadata the package provenance, omitted when unknown
     */
    public record Node(
            String id,
            String label,
            NodeKind type,
            String language,
            @JsonInclude(JsonInclude.Include.NON_NULL)
            PackageMetadata metadata) {}

    /**
     * An edge of the document.
     *
     * @param source the source id
     * @param target the target id
     * @param weight the import occurrence count
     */
    public record Edge(String source, String target, int weight) {}

    /**
     * Summary counts.
     *
     * @param nodeCount the number of nodes
     * @param edgeCount the number of edges
     * @param internalNodes the number of internal nodes
     * @param externalNodes the number of external nodes
     */
    public record Stats(
            @JsonProperty("node_count") int nodeCount,
            @JsonProperty("edge_count") int edgeCount,
            @JsonProperty("internal_nodes") int internalNodes,
            @JsonProperty("external_nodes") int externalNodes) {}

}

package co.fanki.archgraph.graph.domain;

import co.fanki.archgraph.graph.domain.DependencyGraph.GraphEdge;
import co.fanki.archgraph.graph.domain.DependencyGraph.GraphNode;
import co.fanki.archgraph.shared.Preconditions;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges per-file import results into one dependency graph.
 *
 * <p>Edge weights are summed, so the totals do not depend on the order
 * files are merged in. Node attributes are first-writer-wins: the first
 * observation of an id fixes its language tag and provenance. The
 * internal marker only ever grows: an id seen once as internal stays
 * internal.</p>
 *
 * <p>Mutators are synchronized, so extraction may run in parallel as
 * long as results are merged through a single accumulator.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GraphAccumulator {

    /** Attributes fixed at first observation. */
    private record NodeInfo(String language, PackageMetadata metadata) {}

    /** Identity of an edge. */
    private record EdgeKey(String source, String target) {}

    private final Map<String, NodeInfo> nodes = new LinkedHashMap<>();

    private final Set<String> internalNodes = new HashSet<>();

    private final Map<EdgeKey, Integer> weights = new HashMap<>();

    /**
     * Merges the imports of one file.
     *
     * <p>The importing node is internal. Every target occurrence adds one
     * to its edge weight, repeated imports of the same target included.</p>
     *
     * @param imports the file's imports
     */
    public synchronized void add(final FileImports imports) {
        Preconditions.requireNonNull(imports, "Imports are required");

        observe(imports.sourceId(), imports.language(), null, true);

        for (final ImportTarget target : imports.targets()) {
            observe(target.id(), target.language(), target.metadata(),
                    target.internal());
            weights.merge(new EdgeKey(imports.sourceId(), target.id()), 1,
                    Integer::sum);
        }
    }

    /**
     * Freezes the accumulated state into an immutable graph.
     *
     * @return the snapshot
     */
    public synchronized DependencyGraph snapshot() {
        final List<GraphNode> graphNodes = new ArrayList<>(nodes.size());
        for (final Map.Entry<String, NodeInfo> entry : nodes.entrySet()) {
            final String id = entry.getKey();
            graphNodes.add(new GraphNode(id,
                    internalNodes.contains(id)
                            ? NodeKind.INTERNAL : NodeKind.EXTERNAL,
                    entry.getValue().language(),
                    entry.getValue().metadata()));
        }

        final List<GraphEdge> graphEdges = new ArrayList<>(weights.size());
        for (final Map.Entry<EdgeKey, Integer> entry : weights.entrySet()) {
            graphEdges.add(new GraphEdge(entry.getKey().source(),
                    entry.getKey().target(), entry.getValue()));
        }

        return new DependencyGraph(graphNodes, graphEdges);
    }

    private void observe(final String id, final String language,
            final PackageMetadata metadata, final boolean internal) {
        nodes.putIfAbsent(id, new NodeInfo(language, metadata));
        if (internal) {
            internalNodes.add(id);
        }
    }

}

package co.fanki.archgraph.graph.domain;

import co.fanki.archgraph.graph.domain.DependencyGraph.GraphEdge;
import co.fanki.archgraph.graph.domain.DependencyGraph.GraphNode;
import co.fanki.archgraph.shared.Preconditions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reduces a dependency graph to a size suitable for rendering.
 *
 * <p>Three stages run in order:</p>
 * <ol>
 *   <li><b>Language:</b> nodes whose tag the selected language does not
 *       accept are dropped.</li>
 *   <li><b>Weight:</b> edges below the minimum weight, or touching a
 *       dropped node, are dropped.</li>
 *   <li><b>Node cap:</b> nodes are ranked by degree over the surviving
 *       edges, internal and external separately. Up to half the cap is
 *       spent on internal nodes, never fewer than
 *       {@value #MIN_INTERNAL_NODES} when that many exist, and external
 *       nodes fill what is left. Edges are then restricted to kept
 *       nodes.</li>
 * </ol>
 *
 * <p>Degree ties are broken by id, so the result is deterministic.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class GraphFilter {

    /** Internal nodes always kept (when available) under a node cap. */
    public static final int MIN_INTERNAL_NODES = 10;

    private GraphFilter() {
    }

    /**
     * Applies the criteria to a graph.
     *
     * @param graph the unfiltered graph
     * @param criteria the filtering criteria
     * @return the filtered document
     */
    public static ArchitectureGraph apply(final DependencyGraph graph,
            final GraphFilterCriteria criteria) {
        Preconditions.requireNonNull(graph, "Graph is required");
        Preconditions.requireNonNull(criteria, "Criteria are required");

        // 1) Language
        final Optional<Language> language = criteria.selectedLanguage();
        final Set<String> kept = new HashSet<>();
        for (final GraphNode node : graph.nodes()) {
            if (language.isEmpty() || language.get().acceptsTag(
                    node.language())) {
                kept.add(node.id());
            }
        }

        // 2) Edge weight
        List<GraphEdge> edges = new ArrayList<>();
        for (final GraphEdge edge : graph.edges()) {
            if (edge.weight() >= criteria.minWeight()
                    && kept.contains(edge.source())
                    && kept.contains(edge.target())) {
                edges.add(edge);
            }
        }

        // 3) Node cap
        if (criteria.isCapped()) {
            final Set<String> capped = capNodes(graph, kept, edges,
                    criteria.nodeCap());
            kept.retainAll(capped);
            edges = edges.stream()
                    .filter(e -> kept.contains(e.source())
                            && kept.contains(e.target()))
                    .toList();
        }

        return toDocument(graph, kept, edges);
    }

    private static Set<String> capNodes(final DependencyGraph graph,
            final Set<String> candidates, final List<GraphEdge> edges,
            final int cap) {
        final Map<String, Integer> degree = new HashMap<>();
        for (final GraphEdge edge : edges) {
            degree.merge(edge.source(), 1, Integer::sum);
            degree.merge(edge.target(), 1, Integer::sum);
        }

        final List<String> internals = new ArrayList<>();
        final List<String> externals = new ArrayList<>();
        for (final String id : candidates) {
            if (graph.node(id).isInternal()) {
                internals.add(id);
            } else {
                externals.add(id);
            }
        }

        final Comparator<String> byDegree = Comparator
                .<String>comparingInt(id -> degree.getOrDefault(id, 0))
                .reversed()
                .thenComparing(Comparator.naturalOrder());
        internals.sort(byDegree);
        externals.sort(byDegree);

        final int internalBudget = Math.min(internals.size(),
                Math.max(MIN_INTERNAL_NODES, cap / 2));
        final int externalBudget = Math.min(externals.size(),
                Math.max(0, cap - internalBudget));

        final Set<String> result = new HashSet<>(
                internals.subList(0, internalBudget));
        result.addAll(externals.subList(0, externalBudget));
        return result;
    }

    private static ArchitectureGraph toDocument(final DependencyGraph graph,
            final Set<String> kept, final List<GraphEdge> edges) {
        final List<ArchitectureGraph.Node> nodes = new ArrayList<>();
        int internalCount = 0;
        for (final GraphNode node : graph.nodes()) {
            if (!kept.contains(node.id())) {
                continue;
            }
            if (node.isInternal()) {
                internalCount++;
            }
            nodes.add(new ArchitectureGraph.Node(node.id(), node.id(),
                    node.kind(), node.language(), node.metadata()));
        }

        final List<ArchitectureGraph.Edge> documentEdges = edges.stream()
                .map(e -> new ArchitectureGraph.Edge(e.source(), e.target(),
                        e.weight()))
                .toList();

        return new ArchitectureGraph(nodes, documentEdges,
                new ArchitectureGraph.Stats(nodes.size(), documentEdges.size(),
                        internalCount, nodes.size() - internalCount));
    }

}

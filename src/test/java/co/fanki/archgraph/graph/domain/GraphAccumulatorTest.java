package co.fanki.archgraph.graph.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link GraphAccumulator}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class GraphAccumulatorTest {

    @Test
    void whenAdding_givenRepeatedImports_shouldCollapseIntoWeightedEdge() {
        final GraphAccumulator accumulator = new GraphAccumulator();

        accumulator.add(new FileImports("src/a", "js", List.of(
                ImportTarget.external("react", "npm"),
                ImportTarget.external("react", "npm"))));
        accumulator.add(new FileImports("src/a", "js", List.of(
                ImportTarget.external("react", "npm"))));

        final DependencyGraph graph = accumulator.snapshot();
        assertEquals(2, graph.nodeCount());
        assertEquals(1, graph.edgeCount());
        assertEquals(3, graph.weight("src/a", "react"));
    }

    @Test
    void whenAdding_givenExternalTargetLaterSeenAsSource_shouldBecomeInternal() {
        final GraphAccumulator accumulator = new GraphAccumulator();

        accumulator.add(new FileImports("pkg.a", "python", List.of(
                ImportTarget.external("pkg.b", "python"))));
        accumulator.add(new FileImports("pkg.b", "python", List.of()));

        assertTrue(accumulator.snapshot().node("pkg.b").isInternal());
    }

    @Test
    void whenAdding_givenInternalMarkFirst_shouldStayInternal() {
        final GraphAccumulator accumulator = new GraphAccumulator();

        accumulator.add(new FileImports("main", "go", List.of(
                ImportTarget.internal("util", "go"))));
        accumulator.add(new FileImports("other", "go", List.of(
                ImportTarget.external("util", "go"))));

        assertEquals(NodeKind.INTERNAL,
                accumulator.snapshot().node("util").kind());
    }

    @Test
    void whenAdding_givenConflictingAttributes_shouldKeepFirstWriter() {
        final GraphAccumulator accumulator = new GraphAccumulator();

        accumulator.add(new FileImports("a", "js", List.of(
                ImportTarget.external("react", "npm"))));
        accumulator.add(new FileImports("b", "js", List.of(
                ImportTarget.externalPackage("react", "npm",
                        PackageMetadata.npm("react", "^18.2.0")))));

        final DependencyGraph.GraphNode react =
                accumulator.snapshot().node("react");
        assertEquals("npm", react.language());
        assertNull(react.metadata());
    }

    @Test
    void whenSnapshotting_givenAnyInput_shouldHaveNoDanglingEdges() {
        final GraphAccumulator accumulator = new GraphAccumulator();
        accumulator.add(new FileImports("a", "ruby", List.of(
                ImportTarget.external("json", "ruby"),
                ImportTarget.internal("lib/b", "ruby"))));

        final DependencyGraph graph = accumulator.snapshot();

        for (final DependencyGraph.GraphEdge edge : graph.edges()) {
            assertTrue(graph.node(edge.source()) != null);
            assertTrue(graph.node(edge.target()) != null);
        }
        assertEquals(3, graph.nodeCount());
    }

}

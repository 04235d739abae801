package co.fanki.archgraph.graph.application;

import co.fanki.archgraph.graph.domain.ArchitectureGraph;
import co.fanki.archgraph.graph.domain.ArchitectureGraphBuilder;
import co.fanki.archgraph.graph.domain.BuildFailure;
import co.fanki.archgraph.graph.domain.GraphBuildException;
import co.fanki.archgraph.graph.domain.NodeKind;
import co.fanki.archgraph.graph.domain.SourceFileSampler;
import co.fanki.archgraph.repository.domain.Checkout;
import co.fanki.archgraph.repository.domain.CommitResolver;
import co.fanki.archgraph.repository.domain.RepositoryCoordinates;
import co.fanki.archgraph.repository.domain.RepositoryMaterializer;
import co.fanki.archgraph.shared.DomainException;
import co.fanki.archgraph.shared.LruCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer tests for {@link ArchitectureGraphController}.
 *
 * <p>Status mapping is checked against a mocked service; the document
 * shape is checked end to end with mocked repository ports.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ArchitectureGraphControllerTest {

    @TempDir
    Path workspace;

    private ArchitectureGraphService graphService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        graphService = createMock(ArchitectureGraphService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(
                new ArchitectureGraphController(graphService)).build();
    }

    @Test
    void whenRequestingGraph_givenAllParameters_shouldBindThemToRequest()
            throws Exception {
        final ArchitectureGraph graph = new ArchitectureGraph(
                List.of(new ArchitectureGraph.Node("main", "main",
                        NodeKind.INTERNAL, "go", null)),
                List.of(),
                new ArchitectureGraph.Stats(1, 0, 1, 0));
        expect(graphService.analyze("acme", "app",
                new GraphRequest(500, "go", 3, 50))).andReturn(graph);
        replay(graphService);

        mockMvc.perform(get("/api/repo/acme/app/arch-graph")
                        .param("max_files", "500")
                        .param("lang", "go")
                        .param("min_weight", "3")
                        .param("node_cap", "50"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nodes[0].id").value("main"))
                .andExpect(jsonPath("$.stats.node_count").value(1));

        verify(graphService);
    }

    @Test
    void whenRequestingGraph_givenUnknownLanguage_shouldReturnBadRequest()
            throws Exception {
        expect(graphService.analyze("acme", "web",
                new GraphRequest(null, "cobol", null, null)))
                .andThrow(new DomainException("Unknown language selector: cobol",
                        "INVALID_LANGUAGE"));
        replay(graphService);

        mockMvc.perform(get("/api/repo/acme/web/arch-graph")
                        .param("lang", "cobol"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_LANGUAGE"));

        verify(graphService);
    }

    @Test
    void whenRequestingGraph_givenMissingRepository_shouldReturnNotFound()
            throws Exception {
        expectFailure("gone", BuildFailure.NOT_FOUND);

        mockMvc.perform(get("/api/repo/acme/gone/arch-graph"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));

        verify(graphService);
    }

    @Test
    void whenRequestingGraph_givenUpstreamTimeout_shouldReturnGatewayTimeout()
            throws Exception {
        expectFailure("slow", BuildFailure.UPSTREAM_TIMEOUT);

        mockMvc.perform(get("/api/repo/acme/slow/arch-graph"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.errorCode").value("UPSTREAM_TIMEOUT"));

        verify(graphService);
    }

    @Test
    void whenRequestingGraph_givenCloneFailure_shouldReturnBadGateway()
            throws Exception {
        expectFailure("broken", BuildFailure.CLONE_FAILURE);

        mockMvc.perform(get("/api/repo/acme/broken/arch-graph"))
                .andExpect(status().isBadGateway());

        verify(graphService);
    }

    @Test
    void whenRequestingGraph_givenInternalError_shouldReturnServerError()
            throws Exception {
        expectFailure("odd", BuildFailure.INTERNAL_ERROR);

        mockMvc.perform(get("/api/repo/acme/odd/arch-graph"))
                .andExpect(status().isInternalServerError());

        verify(graphService);
    }

    @Test
    void whenRequestingGraph_givenJavaScriptRepository_shouldRenderDocument()
            throws Exception {
        final Path checkout = Files.createDirectories(workspace.resolve("web"));
        Files.writeString(checkout.resolve("package.json"),
                "{\"dependencies\": {\"react\": \"^18.2.0\"}}");
        Files.createDirectories(checkout.resolve("src"));
        Files.writeString(checkout.resolve("src/index.js"),
                "import React from 'react'\nimport {f} from './utils'\n");
        Files.writeString(checkout.resolve("src/utils.js"), "");

        final RepositoryCoordinates web = RepositoryCoordinates.of("acme", "web");
        final CommitResolver commitResolver = createMock(CommitResolver.class);
        final RepositoryMaterializer materializer =
                createMock(RepositoryMaterializer.class);
        expect(commitResolver.resolveDefaultBranch(web)).andReturn("abc123");
        expect(materializer.materialize(web))
                .andReturn(Checkout.temporary(checkout));
        replay(commitResolver, materializer);

        final MockMvc endToEnd = MockMvcBuilders.standaloneSetup(
                new ArchitectureGraphController(new ArchitectureGraphService(
                        commitResolver, materializer,
                        new ArchitectureGraphBuilder(new SourceFileSampler()),
                        new LruCache<>(4)))).build();

        endToEnd.perform(get("/api/repo/acme/web/arch-graph")
                        .param("min_weight", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stats.node_count").value(3))
                .andExpect(jsonPath("$.stats.internal_nodes").value(2))
                .andExpect(jsonPath("$.stats.external_nodes").value(1))
                .andExpect(jsonPath("$.stats.edge_count").value(2))
                .andExpect(jsonPath("$.nodes[0].id").value("react"))
                .andExpect(jsonPath("$.nodes[0].type").value("external"))
                .andExpect(jsonPath("$.nodes[0].language").value("npm"))
                .andExpect(jsonPath("$.nodes[0].metadata.version")
                        .value("^18.2.0"))
                .andExpect(jsonPath("$.nodes[1].id").value("src/index"))
                .andExpect(jsonPath("$.nodes[1].type").value("internal"))
                .andExpect(jsonPath("$.nodes[1].metadata").doesNotExist());

        verify(commitResolver, materializer);
        assertFalse(Files.exists(checkout));
    }

    private void expectFailure(final String name, final BuildFailure failure) {
        expect(graphService.analyze("acme", name, new GraphRequest(null, "all",
                null, null)))
                .andThrow(new GraphBuildException(failure, "acme/" + name
                        + " failed"));
        replay(graphService);
    }

}

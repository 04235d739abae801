package co.fanki.archgraph.graph.application;

import co.fanki.archgraph.graph.domain.ArchitectureGraph;
import co.fanki.archgraph.graph.domain.GraphBuildException;
import co.fanki.archgraph.shared.DomainException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller exposing the architecture graph of a repository.
 *
 * <p>Each build failure kind answers with its own status: 404 for a
 * missing repository, 502 for a failed clone, 504 for a timeout and 500
 * for anything unexpected. Invalid parameters answer 400.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/repo")
@Tag(name = "Architecture Graph",
        description = "Import dependency graph of a repository")
public class ArchitectureGraphController {

    private static final Logger LOG = LoggerFactory.getLogger(
            ArchitectureGraphController.class);

    private final ArchitectureGraphService graphService;

    /**
     * Creates a new ArchitectureGraphController.
     *
     * @param theGraphService the architecture graph service
     */
    public ArchitectureGraphController(
            final ArchitectureGraphService theGraphService) {
        this.graphService = theGraphService;
    }

    /**
     * Returns the architecture graph of a repository.
     *
     * @param owner the repository owner
     * @param name the repository name
     * @param maxFiles the global file cap
     * @param lang the language selector
     * @param minWeight the minimum edge weight
     * @param nodeCap the node cap, 0 for none
     * @return the graph document or an error body
     */
    @GetMapping("/{owner}/{name}/arch-graph")
    @Operation(summary = "Build the architecture graph",
            description = "Clones the default branch shallowly, extracts"
                    + " imports for Python, JS/TS, Go, Java, C#, PHP and"
                    + " Ruby, and returns a size-bounded dependency graph."
                    + " Results are cached per commit.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Graph built"),
            @ApiResponse(responseCode = "400", description = "Invalid parameters"),
            @ApiResponse(responseCode = "404", description = "Repository not found"),
            @ApiResponse(responseCode = "502", description = "Clone failed"),
            @ApiResponse(responseCode = "504", description = "Upstream timeout")
    })
    public ResponseEntity<?> architectureGraph(
            @PathVariable("owner") final String owner,
            @PathVariable("name") final String name,
            @RequestParam(name = "max_files", required = false)
            final Integer maxFiles,
            @RequestParam(name = "lang", defaultValue = "all")
            final String lang,
            @RequestParam(name = "min_weight", required = false)
            final Integer minWeight,
            @RequestParam(name = "node_cap", required = false)
            final Integer nodeCap) {

        LOG.info("Architecture graph request: {}/{} (lang {})", owner, name,
                lang);

        try {
            final ArchitectureGraph graph = graphService.analyze(owner, name,
                    new GraphRequest(maxFiles, lang, minWeight, nodeCap));
            return ResponseEntity.ok(graph);
        } catch (final GraphBuildException e) {
            LOG.warn("Architecture graph failed for {}/{}: {}", owner, name,
                    e.getMessage());
            return ResponseEntity.status(e.failure().httpStatus()).body(
                    error(e.getMessage(), e.getErrorCode()));
        } catch (final DomainException e) {
            return ResponseEntity.badRequest().body(
                    error(e.getMessage(), e.getErrorCode()));
        } catch (final IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(
                    error(e.getMessage(), "INVALID_ARGUMENT"));
        }
    }

    private static Map<String, String> error(final String message,
            final String errorCode) {
        return Map.of("error", message == null ? "" : message,
                "errorCode", errorCode);
    }

}

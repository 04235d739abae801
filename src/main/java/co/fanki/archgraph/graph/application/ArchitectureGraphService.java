package co.fanki.archgraph.graph.application;

import co.fanki.archgraph.graph.domain.ArchitectureGraph;
import co.fanki.archgraph.graph.domain.ArchitectureGraphBuilder;
import co.fanki.archgraph.graph.domain.BuildFailure;
import co.fanki.archgraph.graph.domain.DependencyGraph;
import co.fanki.archgraph.graph.domain.GraphBuildException;
import co.fanki.archgraph.graph.domain.GraphCacheKey;
import co.fanki.archgraph.graph.domain.GraphFilter;
import co.fanki.archgraph.graph.domain.GraphFilterCriteria;
import co.fanki.archgraph.repository.domain.Checkout;
import co.fanki.archgraph.repository.domain.CommitResolver;
import co.fanki.archgraph.repository.domain.RepositoryCoordinates;
import co.fanki.archgraph.repository.domain.RepositoryMaterializer;
import co.fanki.archgraph.shared.BoundedCache;
import co.fanki.archgraph.shared.DomainException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Produces architecture graphs for hosted repositories.
 *
 * <p>Flow:</p>
 * <ol>
 *   <li>Resolve the default-branch commit</li>
 *   <li>Look up the cache by repository, commit and file cap</li>
 *   <li>On a miss, clone shallowly, build the unfiltered graph, cache it
 *       and remove the checkout</li>
 *   <li>Filter the graph for this request</li>
 * </ol>
 *
 * <p>The cache holds unfiltered snapshots, so requests that differ only
 * in language, weight or cap share one build.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class ArchitectureGraphService {

    private static final Logger LOG = LoggerFactory.getLogger(
            ArchitectureGraphService.class);

    private final CommitResolver commitResolver;
    private final RepositoryMaterializer materializer;
    private final ArchitectureGraphBuilder builder;
    private final BoundedCache<GraphCacheKey, DependencyGraph> cache;

    /**
     * Creates a new ArchitectureGraphService.
     *
     * @param theCommitResolver the default-branch commit resolver
     * @param theMaterializer the checkout materializer
     * @param theBuilder the graph builder
     * @param theCache the result cache
     */
    public ArchitectureGraphService(
            final CommitResolver theCommitResolver,
            final RepositoryMaterializer theMaterializer,
            final ArchitectureGraphBuilder theBuilder,
            final BoundedCache<GraphCacheKey, DependencyGraph> theCache) {
        this.commitResolver = theCommitResolver;
        this.materializer = theMaterializer;
        this.builder = theBuilder;
        this.cache = theCache;
    }

    /**
     * Returns the filtered architecture graph of a repository.
     *
     * @param owner the repository owner
     * @param name the repository name
     * @param request the request parameters
     * @return the graph document
     * @throws IllegalArgumentException if owner or name are invalid
     * @throws DomainException if the language selector is unknown
     * @throws GraphBuildException if the build fails
     */
    public ArchitectureGraph analyze(final String owner, final String name,
            final GraphRequest request) {
        final RepositoryCoordinates coordinates =
                RepositoryCoordinates.of(owner, name);
        final GraphRequest effective = request == null
                ? GraphRequest.defaults() : request;
        final GraphFilterCriteria criteria = effective.criteria();

        final DependencyGraph graph = dependencyGraph(coordinates,
                effective.effectiveMaxFiles());
        return GraphFilter.apply(graph, criteria);
    }

    /**
     * Returns the unfiltered graph of a repository, from the cache when
     * the default branch has not moved.
     *
     * @param coordinates the repository
     * @param maxFiles the effective file cap
     * @return the unfiltered graph
     * @throws GraphBuildException if the build fails
     */
    public DependencyGraph dependencyGraph(
            final RepositoryCoordinates coordinates, final int maxFiles) {
        final String commit = commitResolver.resolveDefaultBranch(coordinates);
        if (commit == null || commit.isBlank()) {
            throw new GraphBuildException(BuildFailure.INTERNAL_ERROR,
                    "No commit resolved for the default branch of "
                            + coordinates);
        }
        final GraphCacheKey key = new GraphCacheKey(coordinates.fullName(),
                commit, maxFiles);

        final Optional<DependencyGraph> cached = cachedGraph(key);
        if (cached.isPresent()) {
            LOG.info("Cache hit for {}", key);
            return cached.get();
        }

        LOG.info("Cache miss for {}, building", key);
        final DependencyGraph graph = build(coordinates, maxFiles);
        cache.put(key, graph);
        return graph;
    }

    private Optional<DependencyGraph> cachedGraph(final GraphCacheKey key) {
        try {
            return cache.get(key);
        } catch (final RuntimeException e) {
            LOG.warn("Cache read failed for {}, rebuilding: {}", key,
                    e.getMessage());
            return Optional.empty();
        }
    }

    private DependencyGraph build(final RepositoryCoordinates coordinates,
            final int maxFiles) {
        try (Checkout checkout = materializer.materialize(coordinates)) {
            return builder.build(checkout.root(), maxFiles);
        } catch (final GraphBuildException e) {
            throw e;
        } catch (final RuntimeException e) {
            LOG.error("Failed to build architecture graph for {}",
                    coordinates, e);
            throw new GraphBuildException(BuildFailure.INTERNAL_ERROR,
                    "Failed to build architecture graph: " + e.getMessage(),
                    e);
        }
    }

}

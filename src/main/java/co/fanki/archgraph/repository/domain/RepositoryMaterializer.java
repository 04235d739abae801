package co.fanki.archgraph.repository.domain;

import co.fanki.archgraph.graph.domain.GraphBuildException;

/**
 * Produces a local, shallow checkout of a repository's default branch.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@FunctionalInterface
public interface RepositoryMaterializer {

    /**
     * Materializes the repository into a fresh directory owned by the
     * caller. Closing the returned checkout removes the directory.
     *
     * @param coordinates the repository to check out
     * @return the checkout, never null
     * @throws GraphBuildException with NOT_FOUND, UPSTREAM_TIMEOUT or
     *         CLONE_FAILURE when the clone cannot complete
     */
    Checkout materialize(RepositoryCoordinates coordinates);

}

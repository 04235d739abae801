package co.fanki.archgraph.repository.domain;

import co.fanki.archgraph.graph.domain.GraphBuildException;

/**
 * Resolves the commit currently at the tip of a repository's default
 * branch.
 *
 * <p>Resolution always happens before the result cache is consulted, so
 * a new commit always produces a new cache key.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@FunctionalInterface
public interface CommitResolver {

    /**
     * Resolves the default-branch head commit.
     *
     * @param coordinates the repository to resolve
     * @return the full commit SHA, never null
     * @throws GraphBuildException with NOT_FOUND, UPSTREAM_TIMEOUT or
     *         CLONE_FAILURE when the remote cannot answer
     */
    String resolveDefaultBranch(RepositoryCoordinates coordinates);

}

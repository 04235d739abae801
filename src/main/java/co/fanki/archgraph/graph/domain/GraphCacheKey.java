package co.fanki.archgraph.graph.domain;

import co.fanki.archgraph.shared.Preconditions;
import co.fanki.archgraph.shared.ValueObject;

/**
 * Identity of a cached build: the repository, the commit it was built
 * from and the file cap it was sampled with.
 *
 * <p>A new commit always yields a new key, so a cached graph is never
 * updated in place.</p>
 *
 * @param repository the {@code owner/name} of the repository
 * @param commitSha the resolved default-branch commit
 * @param maxFiles the effective (clamped) file cap
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GraphCacheKey(String repository, String commitSha,
        int maxFiles) implements ValueObject {

    private static final long serialVersionUID = 1L;

    /** Validates the components. */
    public GraphCacheKey {
        Preconditions.requireNonBlank(repository, "Repository is required");
        Preconditions.requireNonBlank(commitSha, "Commit SHA is required");
        Preconditions.requirePositive(maxFiles, "File cap must be positive");
    }

}

package co.fanki.archgraph.repository.application;

import co.fanki.archgraph.graph.domain.BuildFailure;
import co.fanki.archgraph.graph.domain.GraphBuildException;
import co.fanki.archgraph.repository.domain.CommitResolver;
import co.fanki.archgraph.repository.domain.RepositoryCoordinates;
import co.fanki.archgraph.shared.Preconditions;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Ref;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * {@link CommitResolver} that asks the remote for its {@code HEAD} with
 * a JGit ls-remote, without cloning anything.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class JGitCommitResolver implements CommitResolver {

    private static final Logger LOG = LoggerFactory.getLogger(
            JGitCommitResolver.class);

    private final String baseUrl;

    private final int timeoutSeconds;

    /**
     * Creates a new JGitCommitResolver.
     *
     * @param theBaseUrl the hosting base URL
     * @param theTimeoutSeconds the transport timeout in seconds
     */
    public JGitCommitResolver(
            @Value("${archgraph.git.base-url:https://github.com}")
            final String theBaseUrl,
            @Value("${archgraph.git.resolve-timeout-seconds:8}")
            final int theTimeoutSeconds) {
        this.baseUrl = Preconditions.requireNonBlank(theBaseUrl,
                "Base URL is required");
        this.timeoutSeconds = Preconditions.requirePositive(theTimeoutSeconds,
                "Resolve timeout must be positive");
    }

    /** {@inheritDoc} */
    @Override
    public String resolveDefaultBranch(
            final RepositoryCoordinates coordinates) {
        Preconditions.requireNonNull(coordinates, "Coordinates are required");
        final String url = coordinates.cloneUrl(baseUrl);

        final Map<String, Ref> refs;
        try {
            refs = Git.lsRemoteRepository()
                    .setRemote(url)
                    .setTimeout(timeoutSeconds)
                    .callAsMap();
        } catch (final GitAPIException | RuntimeException e) {
            final BuildFailure failure = GitFailures.classify(e);
            LOG.warn("Failed to resolve default branch of {} ({}): {}",
                    coordinates, failure, e.getMessage());
            throw new GraphBuildException(failure,
                    "Failed to resolve default branch of " + coordinates
                            + ": " + e.getMessage(), e);
        }

        final Ref head = refs.get(Constants.HEAD);
        final ObjectId commit = head == null ? null : head.getObjectId();
        if (commit == null) {
            throw new GraphBuildException(BuildFailure.NOT_FOUND,
                    "Default branch not found for " + coordinates);
        }

        LOG.debug("Resolved {} default branch to {}", coordinates,
                commit.name());
        return commit.name();
    }

}

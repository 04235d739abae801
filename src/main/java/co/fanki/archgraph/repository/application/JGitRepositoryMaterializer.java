package co.fanki.archgraph.repository.application;

import co.fanki.archgraph.graph.domain.BuildFailure;
import co.fanki.archgraph.graph.domain.GraphBuildException;
import co.fanki.archgraph.repository.domain.Checkout;
import co.fanki.archgraph.repository.domain.RepositoryCoordinates;
import co.fanki.archgraph.repository.domain.RepositoryMaterializer;
import co.fanki.archgraph.shared.Preconditions;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * {@link RepositoryMaterializer} that performs a depth-1 JGit clone of
 * the default branch into a fresh temporary directory.
 *
 * <p>The clone timeout bounds both each socket operation and the whole
 * clone; running past it is reported as an upstream timeout. A clone that
 * fails removes its directory before the failure is reported.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class JGitRepositoryMaterializer implements RepositoryMaterializer {

    private static final Logger LOG = LoggerFactory.getLogger(
            JGitRepositoryMaterializer.class);

    private static final String DIRECTORY_PREFIX = "arch_";

    private final String baseUrl;

    private final int timeoutSeconds;

    private final String cloneBasePath;

    private final Clock clock;

    /**
     * Creates a new JGitRepositoryMaterializer.
     *
     * @param theBaseUrl the hosting base URL
     * @param theTimeoutSeconds the clone timeout in seconds
     * @param theCloneBasePath the parent directory of checkouts, blank for
     *        the system temporary directory
     */
    @Autowired
    public JGitRepositoryMaterializer(
            @Value("${archgraph.git.base-url:https://github.com}")
            final String theBaseUrl,
            @Value("${archgraph.git.clone-timeout-seconds:120}")
            final int theTimeoutSeconds,
            @Value("${archgraph.git.clone-base-path:}")
            final String theCloneBasePath) {
        this(theBaseUrl, theTimeoutSeconds, theCloneBasePath,
                Clock.systemUTC());
    }

    /**
     * Creates a new JGitRepositoryMaterializer reading time from a clock.
     *
     * @param theBaseUrl the hosting base URL
     * @param theTimeoutSeconds the clone timeout in seconds
     * @param theCloneBasePath the parent directory of checkouts
     * @param theClock the clock the clone deadline is measured with
     */
    JGitRepositoryMaterializer(final String theBaseUrl,
            final int theTimeoutSeconds, final String theCloneBasePath,
            final Clock theClock) {
        this.baseUrl = Preconditions.requireNonBlank(theBaseUrl,
                "Base URL is required");
        this.timeoutSeconds = Preconditions.requirePositive(theTimeoutSeconds,
                "Clone timeout must be positive");
        this.cloneBasePath = theCloneBasePath;
        this.clock = Preconditions.requireNonNull(theClock,
                "Clock is required");
    }

    /** {@inheritDoc} */
    @Override
    public Checkout materialize(final RepositoryCoordinates coordinates) {
        Preconditions.requireNonNull(coordinates, "Coordinates are required");

        final Path cloneDir = createCloneDir();
        final String url = coordinates.cloneUrl(baseUrl);
        LOG.info("Cloning {} (depth 1) to {}", url, cloneDir);

        final CloneDeadline deadline = new CloneDeadline(clock,
                Duration.ofSeconds(timeoutSeconds));
        try {
            Git.cloneRepository()
                    .setURI(url)
                    .setDirectory(cloneDir.toFile())
                    .setDepth(1)
                    .setCloneAllBranches(false)
                    .setTimeout(timeoutSeconds)
                    .setProgressMonitor(deadline)
                    .call()
                    .close();
        } catch (final GitAPIException | RuntimeException e) {
            Checkout.delete(cloneDir);
            final BuildFailure failure = deadline.expired()
                    ? BuildFailure.UPSTREAM_TIMEOUT
                    : GitFailures.classify(e);
            LOG.warn("Clone of {} failed ({}): {}", url, failure,
                    e.getMessage());
            throw new GraphBuildException(failure,
                    "git clone failed for " + coordinates + ": "
                            + e.getMessage(), e);
        }

        LOG.info("Clone completed to {}", cloneDir);
        return Checkout.temporary(cloneDir);
    }

    private Path createCloneDir() {
        try {
            if (cloneBasePath == null || cloneBasePath.isBlank()) {
                return Files.createTempDirectory(DIRECTORY_PREFIX);
            }
            final Path base = Path.of(cloneBasePath);
            Files.createDirectories(base);
            return Files.createTempDirectory(base, DIRECTORY_PREFIX);
        } catch (final IOException e) {
            throw new GraphBuildException(BuildFailure.INTERNAL_ERROR,
                    "Failed to create clone directory: " + e.getMessage(), e);
        }
    }

}

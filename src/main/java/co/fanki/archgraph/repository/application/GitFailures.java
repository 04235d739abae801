package co.fanki.archgraph.repository.application;

import co.fanki.archgraph.graph.domain.BuildFailure;
import org.eclipse.jgit.api.errors.InvalidRemoteException;
import org.eclipse.jgit.errors.NoRemoteRepositoryException;

import java.io.InterruptedIOException;
import java.util.Locale;

/**
 * Classifies JGit failures into {@link BuildFailure} kinds.
 *
 * <p>Timeouts are recognized by an {@link InterruptedIOException} (which
 * includes socket timeouts) anywhere in the cause chain, or by the
 * transport message. Missing repositories are recognized by the JGit
 * exception type, or by the authentication challenge hosting services
 * answer for repositories that do not exist. Everything else is a clone
 * failure.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class GitFailures {

    private GitFailures() {
    }

    /**
     * Classifies a failure.
     *
     * @param failure the JGit exception
     * @return the failure kind
     */
    static BuildFailure classify(final Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof InterruptedIOException) {
                return BuildFailure.UPSTREAM_TIMEOUT;
            }
            if (t instanceof InvalidRemoteException
                    || t instanceof NoRemoteRepositoryException) {
                return BuildFailure.NOT_FOUND;
            }
            final String message = t.getMessage() == null
                    ? "" : t.getMessage().toLowerCase(Locale.ROOT);
            if (message.contains("timed out") || message.contains("timeout")) {
                return BuildFailure.UPSTREAM_TIMEOUT;
            }
            if (message.contains("not found")
                    || message.contains("authentication is required")
                    || message.contains("not authorized")) {
                return BuildFailure.NOT_FOUND;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return BuildFailure.CLONE_FAILURE;
    }

}

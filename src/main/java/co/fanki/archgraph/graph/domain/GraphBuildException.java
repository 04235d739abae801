package co.fanki.archgraph.graph.domain;

import co.fanki.archgraph.shared.DomainException;
import co.fanki.archgraph.shared.Preconditions;

/**
 * Fatal failure of an architecture graph build.
 *
 * <p>The error code is always the name of the {@link BuildFailure}, so
 * callers can tell a missing repository from a timeout without parsing
 * the message.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class GraphBuildException extends DomainException {

    private static final long serialVersionUID = 1L;

    private final BuildFailure failure;

    /**
     * Creates a new build exception.
     *
     * @param theFailure the failure kind
     * @param message the error message
     */
    public GraphBuildException(final BuildFailure theFailure,
            final String message) {
        super(message, Preconditions.requireNonNull(theFailure,
                "Failure kind is required").name());
        this.failure = theFailure;
    }

    /**
     * Creates a new build exception with a cause.
     *
     * @param theFailure the failure kind
     * @param message the error message
     * @param cause the underlying cause
     */
    public GraphBuildException(final BuildFailure theFailure,
            final String message, final Throwable cause) {
        super(message, Preconditions.requireNonNull(theFailure,
                "Failure kind is required").name(), cause);
        this.failure = theFailure;
    }

    /**
     * Returns the failure kind.
     *
     * @return the failure
     */
    public BuildFailure failure() {
        return failure;
    }

}

package co.fanki.archgraph.graph.domain;

/**
 * The distinct conditions under which a graph build is abandoned.
 *
 * <p>Per-file read problems are not listed here: they are recovered
 * inside the build and only reduce the number of edges.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum BuildFailure {

    /** The repository or its default branch does not exist. */
    NOT_FOUND(404),

    /** A network operation exceeded its timeout. */
    UPSTREAM_TIMEOUT(504),

    /** Cloning or talking to the remote failed for another reason. */
    CLONE_FAILURE(502),

    /** Anything unexpected. */
    INTERNAL_ERROR(500);

    private final int httpStatus;

    BuildFailure(final int theHttpStatus) {
        this.httpStatus = theHttpStatus;
    }

    /**
     * Returns the HTTP status reported for this failure.
     *
     * @return the status code
     */
    public int httpStatus() {
        return httpStatus;
    }

}

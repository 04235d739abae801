package co.fanki.archgraph.graph.domain;

import co.fanki.archgraph.shared.Preconditions;

/**
 * One raw import occurrence, resolved to the node it points at.
 *
 * @param id the canonical target node id
 * @param internal whether the resolver classified the target as
 *        repository-internal
 * @param language the language tag to record if the target is new
 * @param metadata package provenance, null when unknown
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ImportTarget(String id, boolean internal, String language,
        PackageMetadata metadata) {

    /** Validates the components. */
    public ImportTarget {
        Preconditions.requireNonBlank(id, "Import target id is required");
        Preconditions.requireNonBlank(language,
                "Import target language is required");
    }

    /**
     * Creates a target known to be inside the repository.
     *
     * @param id the node id
     * @param language the language tag
     * @return the target
     */
    public static ImportTarget internal(final String id,
            final String language) {
        return new ImportTarget(id, true, language, null);
    }

    /**
     * Creates a target not known to be inside the repository.
     *
     * <p>Such a target may still end up internal when some sampled file
     * produces the same id.</p>
     *
     * @param id the node id
     * @param language the language tag
     * @return the target
     */
    public static ImportTarget external(final String id,
            final String language) {
        return new ImportTarget(id, false, language, null);
    }

    /**
     * Creates an external package target carrying provenance.
     *
     * @param id the node id
     * @param language the language tag
     * @param metadata the provenance, may be null
     * @return the target
     */
    public static ImportTarget externalPackage(final String id,
            final String language, final PackageMetadata metadata) {
        return new ImportTarget(id, false, language, metadata);
    }

}

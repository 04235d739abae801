package co.fanki.archgraph.graph.application;

import co.fanki.archgraph.graph.domain.GraphFilterCriteria;
import co.fanki.archgraph.graph.domain.SourceFileSampler;

/**
 * Parameters of an architecture graph request.
 *
 * @param maxFiles the requested global file cap, null for the default;
 *        clamped to [100, 10000]
 * @param lang the language selector, null for all languages
 * @param minWeight the minimum edge weight, null for the default
 * @param nodeCap the node cap, null for the default
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record GraphRequest(Integer maxFiles, String lang, Integer minWeight,
        Integer nodeCap) {

    /** Default global file cap. */
    public static final int DEFAULT_MAX_FILES = 3000;

    /**
     * Returns a request using every default.
     *
     * @return the default request
     */
    public static GraphRequest defaults() {
        return new GraphRequest(null, null, null, null);
    }

    /**
     * Returns the effective file cap.
     *
     * @return the clamped cap
     */
    public int effectiveMaxFiles() {
        return SourceFileSampler.clampFileCap(
                maxFiles == null ? DEFAULT_MAX_FILES : maxFiles);
    }

    /**
     * Returns the filtering criteria.
     *
     * @return the criteria
     * @throws co.fanki.archgraph.shared.DomainException if the language
     *         selector is unknown
     */
    public GraphFilterCriteria criteria() {
        return GraphFilterCriteria.of(lang, minWeight, nodeCap);
    }

}
